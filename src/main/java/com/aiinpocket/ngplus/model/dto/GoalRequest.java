package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public record GoalRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 1000) String description,
        @NotBlank String goalType,
        @Positive long targetValue,
        String skillId,
        Instant deadline,
        List<Long> milestones
) {}
