package com.aiinpocket.ngplus.model.entity;

import com.aiinpocket.ngplus.model.enums.UnlockType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * 寫給未來自己的信，達成解鎖條件後開啟。
 * 內容照原樣儲存，加密由客戶端處理，{@code encrypted} 只是標記。
 */
@Entity
@Table(name = "time_capsule", indexes = {
        @Index(name = "idx_capsule_unlocked", columnList = "unlocked_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimeCapsule implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String body;

    @Column(nullable = false)
    @Builder.Default
    private boolean encrypted = false;

    @Column(name = "passphrase_hint", length = 200)
    private String passphraseHint;

    @Enumerated(EnumType.STRING)
    @Column(name = "unlock_type", nullable = false, length = 20)
    private UnlockType unlockType;

    /** JSON，例如 {"skillId":"...","level":10} */
    @Column(name = "unlock_params", nullable = false, length = 500)
    private String unlockParams;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "unlocked_at")
    private Instant unlockedAt;

    @Column(name = "archived_to_journal_entry_id", length = 36)
    private String archivedToJournalEntryId;

    @Transient
    @JsonIgnore
    @Builder.Default
    private boolean persisted = false;

    public boolean isUnlocked() {
        return unlockedAt != null;
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
