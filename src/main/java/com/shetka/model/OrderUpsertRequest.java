package com.shetka.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shetka.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw admin upsert body. Every field is optional here; {@link #toInput()} does the
 * single validation pass.
 */
public record OrderUpsertRequest(
    @JsonProperty("public_no") String publicNo,
    @JsonProperty("owner_tg_id") Long ownerTgId,
    @JsonProperty("owner_phone") String ownerPhone,
    @JsonProperty("item") String item,
    @JsonProperty("services") List<String> services,
    @JsonProperty("status") String status,
    @JsonProperty("price") Integer price,
    @JsonProperty("comment") String comment
) {

    /**
     * Normalizes the body into an {@link OrderInput}.
     *
     * @throws ValidationException listing every required field that is missing or blank
     */
    public OrderInput toInput() {
        String normalizedPublicNo = trimToNull(publicNo);
        String normalizedItem = trimToNull(item);
        String normalizedStatus = trimToNull(status);

        List<String> missing = new ArrayList<>();
        if (normalizedPublicNo == null) missing.add("public_no");
        if (normalizedItem == null) missing.add("item");
        if (normalizedStatus == null) missing.add("status");
        if (!missing.isEmpty()) {
            throw new ValidationException(missing);
        }

        return new OrderInput(
                normalizedPublicNo,
                ownerTgId,
                ownerPhone,
                normalizedItem,
                normalizeServices(services),
                normalizedStatus,
                price,
                comment
        );
    }

    static List<String> normalizeServices(List<String> services) {
        if (services == null) return List.of();
        List<String> result = new ArrayList<>(services.size());
        for (String service : services) {
            String trimmed = trimToNull(service);
            if (trimmed != null) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
