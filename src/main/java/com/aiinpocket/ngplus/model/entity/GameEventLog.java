package com.aiinpocket.ngplus.model.entity;

import com.aiinpocket.ngplus.model.enums.GameEventType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 提供呈現層的引擎事件動態（升級、獎勵、解鎖）。
 */
@Entity
@Table(name = "game_event_log", indexes = {
        @Index(name = "idx_event_seen", columnList = "seen")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private GameEventType eventType;

    @Column(name = "event_data", length = 500)
    private String eventData;

    @Column(nullable = false)
    @Builder.Default
    private boolean seen = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
