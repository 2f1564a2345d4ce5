package com.aiinpocket.ngplus.model.event;

import java.time.Instant;

/**
 * 透過 Spring 事件匯流排發布的引擎事件共同介面。
 */
public interface GameEvent {

    Instant occurredAt();
}
