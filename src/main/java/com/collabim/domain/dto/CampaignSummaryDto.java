package com.collabim.domain.dto;

public record CampaignSummaryDto(
        Long id,
        String name
) {
}
