package com.aiinpocket.ngplus.model.event;

import java.time.Instant;

public record GoalMilestoneReached(
        String goalId,
        String title,
        long milestone,
        Instant occurredAt
) implements GameEvent {}
