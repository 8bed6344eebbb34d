package com.shetka.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Order row as stored in the orders table.
 */
public record Order(
    long id,
    String publicNo,
    Long ownerTgId,
    String ownerPhone,
    String item,
    List<String> services,
    String status,
    Integer price,
    String comment,
    boolean closed,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
