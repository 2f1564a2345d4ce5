package com.aiinpocket.ngplus.model.event;

import java.time.Instant;

public record RewardRedeemed(
        String redemptionId,
        String rewardId,
        String title,
        long coinsSpent,
        Instant occurredAt
) implements GameEvent {}
