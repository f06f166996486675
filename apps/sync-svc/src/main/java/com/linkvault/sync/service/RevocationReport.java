package com.linkvault.sync.service;

import com.linkvault.sync.model.ConnectionFailure;
import java.util.List;

/**
 * @param successCount connections actually revoked by this call; already-revoked ones are not counted
 */
public record RevocationReport(int successCount, List<ConnectionFailure> failures) {

    public RevocationReport {
        failures = List.copyOf(failures);
    }
}
