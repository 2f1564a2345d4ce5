package com.aiinpocket.ngplus.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * 唯一的玩家角色。
 * 首次啟動時建立，等級、經驗值與金幣只透過任務完成與兌換變動。
 */
@Entity
@Table(name = "player")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Player implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    /** 自選稱號，例如「數位工匠」 */
    @Column(name = "class_name", nullable = false, length = 100)
    private String className;

    @Column(name = "class_description", length = 500)
    private String classDescription;

    /** 玩家等級（從 1 開始） */
    @Column(nullable = false)
    @Builder.Default
    private int level = 1;

    /** 距下一級的經驗值，升級時保留餘數 */
    @Column(nullable = false)
    @Builder.Default
    private long xp = 0L;

    /** 金幣餘額，只有兌換會減少 */
    @Column(nullable = false)
    @Builder.Default
    private long coins = 0L;

    /** 每日起始小時（0-23），用於每日上限與週期對齊 */
    @Column(name = "day_start_hour", nullable = false)
    @Builder.Default
    private int dayStartHour = 0;

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
