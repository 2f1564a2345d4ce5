package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.model.dto.SkillMetrics;
import com.aiinpocket.ngplus.model.dto.SkillMetrics.Consistency;
import com.aiinpocket.ngplus.model.dto.SkillMetrics.Variety;
import com.aiinpocket.ngplus.model.entity.CycleRecord;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.repository.CompletionRepository;
import com.aiinpocket.ngplus.repository.CycleRecordRepository;
import com.aiinpocket.ngplus.repository.MissionRepository;
import com.aiinpocket.ngplus.service.progression.CycleManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 單一技能的多樣性與穩定度指標。
 */
@Service
@RequiredArgsConstructor
public class SkillMetricsService {

    static final int CONSISTENCY_LOOKBACK = 6;

    private final SkillService skillService;
    private final MissionRepository missionRepo;
    private final CompletionRepository completionRepo;
    private final CycleRecordRepository cycleRecordRepo;

    @Transactional(readOnly = true)
    public SkillMetrics metrics(String skillId) {
        Skill skill = skillService.get(skillId);
        return new SkillMetrics(skill.getId(), variety(skill), consistency(skill));
    }

    /** 所屬任務少於兩個時為 null；各任務完成次數的熵除以 log2(任務數) */
    Variety variety(Skill skill) {
        String cycleId = CycleManager.cycleId(skill);
        List<Mission> assigned = missionRepo.findAssignedToSkill(skill.getId());
        if (cycleId == null || assigned.size() < 2) {
            return null;
        }
        Set<String> assignedIds = assigned.stream().map(Mission::getId).collect(Collectors.toSet());
        List<Long> counts = completionRepo.countPerMissionInCycle(skill.getId(), cycleId).stream()
                .filter(row -> assignedIds.contains((String) row[0]))
                .map(row -> ((Number) row[1]).longValue())
                .filter(count -> count > 0)
                .toList();
        long total = counts.stream().mapToLong(Long::longValue).sum();
        if (total == 0) {
            return new Variety(0.0, "none", 0, assigned.size(), 0);
        }

        double entropy = 0.0;
        for (long count : counts) {
            double p = (double) count / total;
            entropy -= p * log2(p);
        }
        double score = entropy / log2(assigned.size());
        String rating = score >= 0.7 ? "good" : score >= 0.4 ? "fair" : "low";
        return new Variety(score, rating, counts.size(), assigned.size(), total);
    }

    /**
     * 最近已結算且有目標的週期命中率。沒有這類歷史時，
     * 只看目前有目標的週期；從未有過目標的技能為 null。
     */
    Consistency consistency(Skill skill) {
        List<CycleRecord> history = cycleRecordRepo.findBySkillIdOrderByCycleStartDesc(skill.getId()).stream()
                .filter(CycleRecord::isReady)
                .limit(CONSISTENCY_LOOKBACK)
                .toList();
        if (history.isEmpty()) {
            if (skill.getTargetMissionId() == null) {
                return null;
            }
            return skill.isHitTargetThisCycle()
                    ? new Consistency(1.0, "excellent", 1, 1)
                    : new Consistency(0.0, "needs work", 0, 1);
        }
        int hits = (int) history.stream().filter(CycleRecord::isTargetHit).count();
        double score = (double) hits / history.size();
        String rating = score >= 0.75 ? "excellent" : score >= 0.5 ? "good" : score >= 0.25 ? "needs work" : "poor";
        return new Consistency(score, rating, hits, history.size());
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }
}
