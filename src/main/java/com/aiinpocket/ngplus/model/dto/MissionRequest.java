package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record MissionRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 1000) String note,
        int difficulty,
        int energy,
        @NotNull List<String> skillIds
) {}
