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
 * 玩家完成後可獲得經驗值與金幣的任務。
 * 一旦有完成紀錄參照此任務，難度、體力與技能指派即凍結。
 */
@Entity
@Table(name = "mission", indexes = {
        @Index(name = "idx_mission_archived", columnList = "archived")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Mission implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 1000)
    private String note;

    /** 1-5 */
    @Column(nullable = false)
    private int difficulty;

    /** 1-5 */
    @Column(nullable = false)
    private int energy;

    /** 一到兩個技能 id，第一個為主要技能 */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mission_skill", joinColumns = @JoinColumn(name = "mission_id"))
    @OrderColumn(name = "position")
    @Column(name = "skill_id", nullable = false, length = 36)
    @Builder.Default
    private List<String> skillIds = new ArrayList<>();

    @Column(nullable = false)
    @Builder.Default
    private boolean archived = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

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
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        this.persisted = true;
    }
}
