package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.NotBlank;

public record JournalRequest(
        @NotBlank String text,
        String skillId,
        String missionId,
        boolean reflection
) {}
