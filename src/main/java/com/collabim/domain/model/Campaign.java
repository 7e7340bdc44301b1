package com.collabim.domain.model;

public record Campaign(
        long id,
        long ownerId,
        String name
) {
}
