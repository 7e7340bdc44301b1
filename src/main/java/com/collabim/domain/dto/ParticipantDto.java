package com.collabim.domain.dto;

import com.collabim.domain.enums.UserRole;

public record ParticipantDto(
        Long id,
        String displayName,
        String label,
        UserRole role,
        boolean online
) {
}
