package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record RewardRequest(
        @NotBlank @Size(max = 200) String title,
        @PositiveOrZero long priceCoins,
        @Size(max = 1000) String note
) {}
