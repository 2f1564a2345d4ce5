package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.NotBlank;

public record CadenceRequest(
        @NotBlank String cadence,
        Integer customIntervalDays
) {}
