package com.aiinpocket.ngplus.model.event;

import java.time.Instant;

/**
 * 由 {@code CapsuleDateTickJob} 定期發布的日期事件。
 */
public record DateTick(Instant occurredAt) implements GameEvent {}
