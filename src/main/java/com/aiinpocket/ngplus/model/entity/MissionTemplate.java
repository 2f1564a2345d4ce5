package com.aiinpocket.ngplus.model.entity;

import com.aiinpocket.ngplus.model.enums.TemplateCategory;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 使用者自訂的任務模板。內建模板定義在 {@code BuiltinTemplates}，不存入資料庫。
 */
@Entity
@Table(name = "mission_template")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MissionTemplate implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TemplateCategory category = TemplateCategory.CUSTOM;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mission_template_entry", joinColumns = @JoinColumn(name = "template_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<TemplateMission> missions = new ArrayList<>();

    @Column(name = "times_used", nullable = false)
    @Builder.Default
    private int timesUsed = 0;

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
