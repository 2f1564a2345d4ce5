package com.aiinpocket.ngplus.model.event;

import com.aiinpocket.ngplus.model.enums.UnlockType;

import java.time.Instant;

public record CapsuleUnlocked(
        String capsuleId,
        String title,
        UnlockType unlockType,
        Instant occurredAt
) implements GameEvent {}
