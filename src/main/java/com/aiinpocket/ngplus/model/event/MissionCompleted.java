package com.aiinpocket.ngplus.model.event;

import java.time.Instant;
import java.util.List;

public record MissionCompleted(
        String completionId,
        String missionId,
        List<String> skillIds,
        boolean cycleBonus,
        boolean reflectionToken,
        Instant occurredAt
) implements GameEvent {}
