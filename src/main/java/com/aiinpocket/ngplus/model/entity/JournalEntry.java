package com.aiinpocket.ngplus.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * 日誌或反思內容。引擎只在意時間戳與關聯。
 */
@Entity
@Table(name = "journal_entry", indexes = {
        @Index(name = "idx_journal_time", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JournalEntry implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(nullable = false, columnDefinition = "TEXT")
    private String text;

    @Column(name = "skill_id", length = 36)
    private String skillId;

    @Column(name = "mission_id", length = 36)
    private String missionId;

    /** 回應反思代幣所寫 */
    @Column(nullable = false)
    @Builder.Default
    private boolean reflection = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "edited_at")
    private Instant editedAt;

    @Transient
    @JsonIgnore
    @Builder.Default
    private boolean persisted = false;

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
