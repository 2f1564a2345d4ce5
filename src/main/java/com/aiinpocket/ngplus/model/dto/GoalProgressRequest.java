package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.PositiveOrZero;

public record GoalProgressRequest(@PositiveOrZero long value) {}
