package com.linkvault.sync.service;

import com.linkvault.sync.model.ConnectionFailure;
import java.util.List;

public record SyncAllResult(List<SyncResult> results, List<ConnectionFailure> failures) {

    public SyncAllResult {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }
}
