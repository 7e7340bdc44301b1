package com.collabim.domain.dto;

public record ChatStatsDto(
        long active,
        long archived,
        long blocked,
        long total,
        long unreadMessages
) {
}
