package com.aiinpocket.ngplus.model.entity;

import com.aiinpocket.ngplus.model.enums.CycleCadence;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * 玩家正在培養的成長領域（例如「寫作」、「有氧」）。
 * 週期欄位由 {@code CycleManager} 維護，等級與經驗值只透過 {@code ProgressionCalculator} 變動。
 */
@Entity
@Table(name = "skill", indexes = {
        @Index(name = "idx_skill_archived", columnList = "archived")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Skill implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 500)
    private String description;

    @Column(nullable = false)
    @Builder.Default
    private int level = 1;

    @Column(nullable = false)
    @Builder.Default
    private long xp = 0L;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private CycleCadence cadence = CycleCadence.WEEKLY;

    /** CUSTOM 週期的天數 */
    @Column(name = "custom_interval_days", nullable = false)
    @Builder.Default
    private int customIntervalDays = 3;

    /** 目前週期區間，半開區間 [cycleStart, cycleEnd) */
    @Column(name = "cycle_start")
    private Instant cycleStart;

    @Column(name = "cycle_end")
    private Instant cycleEnd;

    /** 本週期目標任務，未就緒時為 null */
    @Column(name = "target_mission_id", length = 36)
    private String targetMissionId;

    @Column(name = "hit_target_this_cycle", nullable = false)
    @Builder.Default
    private boolean hitTargetThisCycle = false;

    /** 專注模式下每級門檻加倍 */
    @Column(nullable = false)
    @Builder.Default
    private boolean focus = false;

    @Column(nullable = false)
    @Builder.Default
    private boolean archived = false;

    /** 連續無目標週期中第一個週期的開始時間 */
    @Column(name = "not_ready_since")
    private Instant notReadySince;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    @JsonIgnore
    @Builder.Default
    private boolean persisted = false;

    @Override
    @JsonIgnore
    public boolean isNew() {
        return !persisted;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        this.persisted = true;
    }
}
