package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.config.ProgressionProperties;
import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.model.dto.CadenceRequest;
import com.aiinpocket.ngplus.model.dto.LevelUpResult;
import com.aiinpocket.ngplus.model.dto.SkillRequest;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.model.enums.CycleCadence;
import com.aiinpocket.ngplus.model.event.SkillLeveledUp;
import com.aiinpocket.ngplus.repository.SkillRepository;
import com.aiinpocket.ngplus.service.progression.CompletionLockService;
import com.aiinpocket.ngplus.service.progression.CycleManager;
import com.aiinpocket.ngplus.service.progression.ProgressionCalculator;
import com.aiinpocket.ngplus.service.progression.TimeAlignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class SkillService {

    private final SkillRepository skillRepo;
    private final CycleManager cycleManager;
    private final CompletionLockService lockService;
    private final ProgressionProperties props;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Skill> listActive() {
        return skillRepo.findByArchivedFalseOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public Skill get(String skillId) {
        return skillRepo.findById(skillId).orElseThrow(() -> NotFoundException.skill(skillId));
    }

    /**
     * 建立技能並立即開啟第一個週期。
     * 新技能沒有任務，第一個週期必定為 NOT_READY。
     */
    @Transactional
    public Skill createSkill(SkillRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new InvalidInputException("Skill name is required");
        }
        CycleCadence cadence = request.cadence() == null ? CycleCadence.WEEKLY : CycleCadence.parse(request.cadence());
        int interval = request.customIntervalDays() != null
                ? request.customIntervalDays()
                : props.cycle().defaultCustomIntervalDays();
        TimeAlignment.requireInterval(interval);

        Skill skill = skillRepo.save(Skill.builder()
                .name(request.name().trim())
                .description(request.description())
                .cadence(cadence)
                .customIntervalDays(interval)
                .createdAt(clock.instant())
                .build());
        cycleManager.startFirstCycle(skill);
        log.info("[技能] 建立 {} ({})，週期 {}", skill.getName(), skill.getId(), cadence);
        return skill;
    }

    @Transactional
    public Skill updateSkill(String skillId, SkillRequest request) {
        Skill skill = get(skillId);
        if (request.name() != null && !request.name().isBlank()) {
            skill.setName(request.name().trim());
        }
        if (request.description() != null) {
            skill.setDescription(request.description());
        }
        return skillRepo.save(skill);
    }

    /**
     * 切換專注模式，並以零獎勵依新門檻重新結算等級。
     * 因此關閉專注可能當場升級。
     */
    public Skill toggleFocus(String skillId) {
        return lockService.executeWithLock("focus toggle of " + skillId, () -> applyFocusToggle(skillId));
    }

    private Skill applyFocusToggle(String skillId) {
        Skill skill = get(skillId);
        skill.setFocus(!skill.isFocus());
        LevelUpResult result = ProgressionCalculator.resolveLevelUps(skill.getLevel(), skill.getXp(), skill.isFocus());
        skill.setLevel(result.newLevel());
        skill.setXp(result.currentXp());
        skillRepo.save(skill);
        log.info("[技能] 專注 {}: {}", skill.isFocus() ? "開啟" : "關閉", skill.getName());
        if (result.leveledUp()) {
            eventPublisher.publishEvent(new SkillLeveledUp(skill.getId(), skill.getName(),
                    result.oldLevel(), result.newLevel(), clock.instant()));
        }
        return skill;
    }

    /**
     * 儲存新的週期設定。進行中的週期維持原區間，下次輪替才套用。
     */
    @Transactional
    public Skill setCadence(String skillId, CadenceRequest request) {
        Skill skill = get(skillId);
        CycleCadence cadence = CycleCadence.parse(request.cadence());
        if (cadence == CycleCadence.CUSTOM) {
            int interval = request.customIntervalDays() != null
                    ? request.customIntervalDays()
                    : skill.getCustomIntervalDays();
            TimeAlignment.requireInterval(interval);
            skill.setCustomIntervalDays(interval);
        }
        skill.setCadence(cadence);
        log.info("[技能] {} 週期改為 {}，於 {} 後生效", skill.getName(), cadence, skill.getCycleEnd());
        return skillRepo.save(skill);
    }

    /** 封存的技能停止輪替且不獲得獎勵；取消封存時開啟新週期 */
    public Skill setArchived(String skillId, boolean archived) {
        return lockService.executeWithLock("archive of skill " + skillId, () -> applyArchived(skillId, archived));
    }

    private Skill applyArchived(String skillId, boolean archived) {
        Skill skill = get(skillId);
        if (skill.isArchived() == archived) {
            return skill;
        }
        skill.setArchived(archived);
        if (archived) {
            skill.setFocus(false);
        }
        skillRepo.save(skill);
        if (!archived) {
            cycleManager.startFirstCycle(skill);
        }
        log.info("[技能] {} {}", skill.getName(), archived ? "已封存" : "已還原");
        return skill;
    }

    /** 與排程走同一條路徑，手動輪替不會在週期邊界與任務完成競爭 */
    public int rolloverNow() {
        return lockService.executeWithLock("manual rollover", cycleManager::rolloverDueSkills);
    }
}
