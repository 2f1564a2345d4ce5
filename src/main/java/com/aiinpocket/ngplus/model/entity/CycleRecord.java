package com.aiinpocket.ngplus.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * 已結算的技能週期，於輪替時寫入，作為導航命中率歷史。
 */
@Entity
@Table(name = "cycle_record", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"cycle_id"})
}, indexes = {
        @Index(name = "idx_cycle_record_skill", columnList = "skill_id, cycle_start")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CycleRecord implements Persistable<String> {

    @Id
    @Column(length = 36)
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Column(name = "skill_id", nullable = false, length = 36)
    private String skillId;

    @Column(name = "cycle_id", nullable = false, length = 80)
    private String cycleId;

    @Column(name = "cycle_start", nullable = false)
    private Instant cycleStart;

    @Column(name = "cycle_end", nullable = false)
    private Instant cycleEnd;

    @Column(name = "target_mission_id", length = 36)
    private String targetMissionId;

    /** 週期開啟時是否有目標 */
    @Column(nullable = false)
    private boolean ready;

    @Column(name = "target_hit", nullable = false)
    private boolean targetHit;

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
