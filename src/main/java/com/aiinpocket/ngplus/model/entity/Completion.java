package com.aiinpocket.ngplus.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 任務完成紀錄（只增不改），包含完整獎勵明細。
 * 反思代幣上限與週期計分皆從這些紀錄重新計算，不依賴計數器。
 */
@Entity
@Table(name = "completion", indexes = {
        @Index(name = "idx_completion_mission", columnList = "mission_id"),
        @Index(name = "idx_completion_time", columnList = "completed_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Completion implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(name = "mission_id", nullable = false, length = 36)
    private String missionId;

    /** 完成當下的任務難度 */
    @Column(nullable = false)
    private int difficulty;

    @Column(name = "completed_at", nullable = false, updatable = false)
    private Instant completedAt;

    @Column(name = "base_player_xp", nullable = false)
    private long basePlayerXp;

    @Column(name = "cycle_player_xp", nullable = false)
    private long cyclePlayerXp;

    @Column(nullable = false)
    private long coins;

    @Column(name = "reflection_token", nullable = false)
    private boolean reflectionToken;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "completion_skill_award",
            joinColumns = @JoinColumn(name = "completion_id"),
            uniqueConstraints = @UniqueConstraint(name = "uk_award_cycle_credit", columnNames = {"cycle_credit_key"}),
            indexes = @Index(name = "idx_award_skill_cycle", columnList = "skill_id, cycle_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<SkillAward> awards = new ArrayList<>();

    @Transient
    @JsonIgnore
    @Builder.Default
    private boolean persisted = false;

    public long totalPlayerXp() {
        return basePlayerXp + cyclePlayerXp;
    }

    @Override
    @JsonIgnore
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        this.persisted = true;
    }
}
