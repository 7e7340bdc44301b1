package com.collabim.domain.dto;

import java.time.LocalDateTime;

public record ReadReceiptDto(
        Long messageId,
        Long readBy,
        LocalDateTime readAt
) {
}
