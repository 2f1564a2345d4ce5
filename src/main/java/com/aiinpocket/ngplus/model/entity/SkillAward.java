package com.aiinpocket.ngplus.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * 單次完成在各技能上的獎勵明細。
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SkillAward {

    @Column(name = "skill_id", nullable = false, length = 36)
    private String skillId;

    /** 完成當下所在週期：skillId + ":" + cycleStart（ISO-8601） */
    @Column(name = "cycle_id", nullable = false, length = 80)
    private String cycleId;

    @Column(name = "base_skill_xp", nullable = false)
    private long baseSkillXp;

    @Column(name = "cycle_skill_xp", nullable = false)
    private long cycleSkillXp;

    @Column(name = "cycle_award", nullable = false)
    private boolean cycleAward;

    /**
     * 有 {@link #cycleAward} 時為 missionId|skillId|cycleId，否則為 null。
     * 具唯一性，同一組合的第二次週期獎勵會在提交時失敗。
     */
    @Column(name = "cycle_credit_key", length = 160)
    private String cycleCreditKey;

    public static String creditKey(String missionId, String skillId, String cycleId) {
        return missionId + "|" + skillId + "|" + cycleId;
    }
}
