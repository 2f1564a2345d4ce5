package com.aiinpocket.ngplus.model.event;

import java.time.Instant;

public record SkillLeveledUp(
        String skillId,
        String skillName,
        int oldLevel,
        int newLevel,
        Instant occurredAt
) implements GameEvent {}
