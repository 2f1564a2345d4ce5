package com.aiinpocket.ngplus.model.entity;

import com.aiinpocket.ngplus.model.enums.GoalStatus;
import com.aiinpocket.ngplus.model.enums.GoalType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 長期目標，可設定里程碑並連結技能。
 * 一旦 COMPLETED，即使數值下降也維持完成狀態。
 */
@Entity
@Table(name = "goal", indexes = {
        @Index(name = "idx_goal_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Goal implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "goal_type", nullable = false, length = 20)
    private GoalType goalType;

    @Column(name = "target_value", nullable = false)
    private long targetValue;

    @Column(name = "current_value", nullable = false)
    @Builder.Default
    private long currentValue = 0L;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private GoalStatus status = GoalStatus.ACTIVE;

    /** SKILL_LEVEL 必填；MISSION_COUNT 與 STREAK 填入時只計算該技能 */
    @Column(name = "skill_id", length = 36)
    private String skillId;

    /** 遞增排列，介於 0 與目標值之間（不含兩端） */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "goal_milestone", joinColumns = @JoinColumn(name = "goal_id"))
    @OrderColumn(name = "position")
    @Column(name = "milestone_value", nullable = false)
    @Builder.Default
    private List<Long> milestones = new ArrayList<>();

    private Instant deadline;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Transient
    @JsonIgnore
    @Builder.Default
    private boolean persisted = false;

    public double progressPercentage() {
        if (targetValue <= 0) {
            return 0.0;
        }
        return Math.min(100.0, currentValue * 100.0 / targetValue);
    }

    /** 尚未達成的最小里程碑，沒有則為 null */
    public Long nextMilestone() {
        return milestones.stream().filter(m -> currentValue < m).findFirst().orElse(null);
    }

    public boolean isOverdue(Instant now) {
        return status == GoalStatus.ACTIVE && deadline != null && now.isAfter(deadline);
    }

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
