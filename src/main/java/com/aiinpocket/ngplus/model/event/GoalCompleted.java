package com.aiinpocket.ngplus.model.event;

import java.time.Instant;

public record GoalCompleted(
        String goalId,
        String title,
        long targetValue,
        Instant occurredAt
) implements GameEvent {}
