package com.shetka.model;

import java.util.List;
import java.util.Objects;

/**
 * Validated write model for an upsert keyed by {@code publicNo}.
 * Built by {@link OrderUpsertRequest#toInput()}; required fields are non-blank and trimmed,
 * services are trimmed with blank entries removed.
 */
public record OrderInput(
    String publicNo,
    Long ownerTgId,
    String ownerPhone,
    String item,
    List<String> services,
    String status,
    Integer price,
    String comment
) {
    public OrderInput {
        requireText(publicNo, "publicNo");
        requireText(item, "item");
        requireText(status, "status");
        services = List.copyOf(Objects.requireNonNull(services, "services"));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
