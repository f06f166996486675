package com.linkvault.sync.connection;

import java.util.List;
import java.util.Objects;

/**
 * What a successful link exchange reveals about the new connection. {@code accountMasks} come from the link
 * widget metadata and are optional; they tighten duplicate detection when present.
 */
public record InstitutionInfo(
        String itemId,
        String institutionId,
        String institutionName,
        List<String> accountMasks
) {
    public InstitutionInfo {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId must be provided");
        }
        institutionId = institutionId == null || institutionId.isBlank() ? "unknown" : institutionId;
        institutionName = institutionName == null || institutionName.isBlank() ? "Unknown Institution" : institutionName;
        accountMasks = accountMasks == null ? List.of() : accountMasks.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(mask -> !mask.isEmpty())
                .sorted()
                .distinct()
                .toList();
    }

    /**
     * Institution plus the linked account masks. Without masks the item id stands in, so relinking the same item
     * is still detected.
     */
    public String fingerprint() {
        String accounts = accountMasks.isEmpty() ? "item=" + itemId : String.join(",", accountMasks);
        return institutionId + "|" + accounts;
    }
}
