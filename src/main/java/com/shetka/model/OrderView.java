package com.shetka.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Order as returned to the WebApp user.
 */
public record OrderView(
    @JsonProperty("public_no") String publicNo,
    @JsonProperty("item") String item,
    @JsonProperty("services") List<String> services,
    @JsonProperty("status") String status,
    @JsonProperty("price") Integer price,
    @JsonProperty("comment") String comment,
    @JsonProperty("created_at") OffsetDateTime createdAt,
    @JsonProperty("updated_at") OffsetDateTime updatedAt
) {

    public static OrderView from(Order order) {
        return new OrderView(
                order.publicNo(),
                order.item(),
                order.services(),
                order.status(),
                order.price(),
                order.comment(),
                order.createdAt(),
                order.updatedAt()
        );
    }
}
