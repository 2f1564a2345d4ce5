package com.aiinpocket.ngplus.model.event;

import java.time.Instant;

public record PlayerLeveledUp(
        int oldLevel,
        int newLevel,
        Instant occurredAt
) implements GameEvent {}
