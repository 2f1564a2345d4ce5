package com.aiinpocket.ngplus.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * 每天至少完成一次的連續天數，可針對單一技能或整體（{@code skillId == null}）。
 * 日期以玩家的每日起始時間對齊，每日 04:00 起算時 01:00 的完成算前一天。
 */
@Entity
@Table(name = "streak", indexes = {
        @Index(name = "idx_streak_skill", columnList = "skill_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Streak implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    /** 整體連續紀錄為 null */
    @Column(name = "skill_id", length = 36)
    private String skillId;

    @Column(name = "current_streak", nullable = false)
    @Builder.Default
    private int currentStreak = 0;

    @Column(name = "longest_streak", nullable = false)
    @Builder.Default
    private int longestStreak = 0;

    @Column(name = "last_completion_date")
    private LocalDate lastCompletionDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    @JsonIgnore
    @Builder.Default
    private boolean persisted = false;

    /**
     * 記錄 {@code day} 的一次完成。
     *
     * @return 延續（同日或隔日）時為 true，中斷後從 1 重新起算時為 false
     */
    public boolean record(LocalDate day) {
        if (lastCompletionDate == null) {
            currentStreak = 1;
            longestStreak = Math.max(longestStreak, 1);
            lastCompletionDate = day;
            return true;
        }
        long gap = ChronoUnit.DAYS.between(lastCompletionDate, day);
        if (gap <= 0) {
            // 同一天，或較舊的完成延遲到達
            return true;
        }
        if (gap == 1) {
            currentStreak++;
            longestStreak = Math.max(longestStreak, currentStreak);
            lastCompletionDate = day;
            return true;
        }
        currentStreak = 1;
        lastCompletionDate = day;
        return false;
    }

    /** 今天或昨天有完成 */
    public boolean isActive(LocalDate today) {
        return lastCompletionDate != null && ChronoUnit.DAYS.between(lastCompletionDate, today) <= 1;
    }

    /** 截至 {@code today} 的連續天數，錯過一整天即為 0 */
    public int effectiveStreak(LocalDate today) {
        return isActive(today) ? currentStreak : 0;
    }

    /** 1 = 明天前安全，0 = 今天必須完成，-1 = 已中斷 */
    public int daysUntilBroken(LocalDate today) {
        if (lastCompletionDate == null) {
            return 0;
        }
        long since = ChronoUnit.DAYS.between(lastCompletionDate, today);
        if (since <= 0) {
            return 1;
        }
        return since == 1 ? 0 : -1;
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
