package com.aiinpocket.ngplus.service.progression;

import com.aiinpocket.ngplus.config.ProgressionProperties;
import com.aiinpocket.ngplus.model.entity.CycleRecord;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.model.enums.CycleState;
import com.aiinpocket.ngplus.repository.CompletionRepository;
import com.aiinpocket.ngplus.repository.CycleRecordRepository;
import com.aiinpocket.ngplus.repository.MissionRepository;
import com.aiinpocket.ngplus.repository.SkillRepository;
import com.aiinpocket.ngplus.service.PlayerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * 技能週期狀態機。
 *
 * <p>負責 cycleStart/cycleEnd、目標任務、hitTargetThisCycle 與 notReadySince。
 * 只在輪替時判斷是否就緒，週期中途任務減少不會撤銷已抽出的目標。
 * 時間、技能狀態、任務集合與亂數狀態相同時，輪替結果必定相同。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CycleManager {

    private final SkillRepository skillRepo;
    private final MissionRepository missionRepo;
    private final CycleRecordRepository cycleRecordRepo;
    private final CompletionRepository completionRepo;
    private final PlayerService playerService;
    private final ProgressionProperties props;
    private final Clock clock;
    private final RandomGenerator random;

    public static CycleState state(Skill skill, Instant now) {
        if (skill.getCycleEnd() == null || !now.isBefore(skill.getCycleEnd())) {
            return CycleState.AWAITING_ROLLOVER;
        }
        return skill.getTargetMissionId() == null ? CycleState.NOT_READY : CycleState.ACTIVE;
    }

    /** 技能目前週期的識別碼，首次輪替前為 null */
    public static String cycleId(Skill skill) {
        return skill.getCycleStart() == null ? null : cycleId(skill.getId(), skill.getCycleStart());
    }

    public static String cycleId(String skillId, Instant cycleStart) {
        return skillId + ":" + cycleStart;
    }

    /**
     * 輪替所有未封存且週期已結束的技能。
     *
     * @return 輪替的技能數
     */
    @Transactional
    public int rolloverDueSkills() {
        return rolloverDueSkills(clock.instant());
    }

    @Transactional
    public int rolloverDueSkills(Instant now) {
        int dayStartHour = playerService.currentPlayer().getDayStartHour();
        int rolled = 0;
        for (Skill skill : skillRepo.findByArchivedFalseOrderByCreatedAtAsc()) {
            if (rollover(skill, now, dayStartHour)) {
                rolled++;
            }
        }
        if (rolled > 0) {
            log.info("[週期] 輪替 {} 個技能 (時間 {})", rolled, now);
        }
        return rolled;
    }

    /**
     * 結算已結束的週期（若有），並開啟包含 {@code now} 的新區間。
     * 目前週期尚未結束時不做任何事。
     *
     * @return 開啟新週期時為 true
     */
    @Transactional
    public boolean rollover(Skill skill, Instant now, int dayStartHour) {
        if (skill.isArchived() || state(skill, now) != CycleState.AWAITING_ROLLOVER) {
            return false;
        }
        Instant previousEnd = skill.getCycleEnd();
        if (skill.getCycleStart() != null) {
            closeCycle(skill);
        }

        CycleWindow window = TimeAlignment.cycleWindow(skill.getCadence(), skill.getCustomIntervalDays(),
                now, previousEnd, zone(), dayStartHour);
        skill.setCycleStart(window.start());
        skill.setCycleEnd(window.end());
        skill.setHitTargetThisCycle(false);

        List<Mission> assigned = missionRepo.findAssignedToSkill(skill.getId());
        if (assigned.size() >= props.cycle().readinessThreshold()) {
            Mission target = assigned.get(random.nextInt(assigned.size()));
            skill.setTargetMissionId(target.getId());
            skill.setNotReadySince(null);
            log.info("[週期] 技能 {} ({}) 週期 {} 啟動，從 {} 個任務抽出目標",
                    skill.getName(), skill.getId(), window.start(), assigned.size());
        } else {
            skill.setTargetMissionId(null);
            if (skill.getNotReadySince() == null) {
                skill.setNotReadySince(window.start());
            }
            log.info("[週期] 技能 {} ({}) 週期 {} 未就緒 (任務 {} / {})",
                    skill.getName(), skill.getId(), window.start(), assigned.size(),
                    props.cycle().readinessThreshold());
        }
        skillRepo.save(skill);
        return true;
    }

    /** 開啟新建技能的第一個週期 */
    @Transactional
    public void startFirstCycle(Skill skill) {
        rollover(skill, clock.instant(), playerService.currentPlayer().getDayStartHour());
    }

    /**
     * 完成紀錄中已有此 (任務, 技能, 週期) 的週期獎勵時為 true。
     * 唯讀且冪等。
     */
    @Transactional(readOnly = true)
    public boolean alreadyCreditedThisCycle(String missionId, String skillId, String cycleId) {
        return completionRepo.existsCycleAward(missionId, skillId, cycleId);
    }

    // ===== 內部方法 =====

    private void closeCycle(Skill skill) {
        String cycleId = cycleId(skill);
        if (cycleRecordRepo.existsByCycleId(cycleId)) {
            return;
        }
        cycleRecordRepo.save(CycleRecord.builder()
                .skillId(skill.getId())
                .cycleId(cycleId)
                .cycleStart(skill.getCycleStart())
                .cycleEnd(skill.getCycleEnd())
                .targetMissionId(skill.getTargetMissionId())
                .ready(skill.getTargetMissionId() != null)
                .targetHit(skill.isHitTargetThisCycle())
                .build());
        log.debug("[週期] 結算 {} (ready={}, hit={})", cycleId,
                skill.getTargetMissionId() != null, skill.isHitTargetThisCycle());
    }

    private ZoneId zone() {
        return clock.getZone();
    }
}
