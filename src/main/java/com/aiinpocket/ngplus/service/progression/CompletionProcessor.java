package com.aiinpocket.ngplus.service.progression;

import com.aiinpocket.ngplus.exception.MissionArchivedException;
import com.aiinpocket.ngplus.exception.MissionNotFoundException;
import com.aiinpocket.ngplus.model.dto.CompletionResult;
import com.aiinpocket.ngplus.model.dto.CompletionResult.SkillAwardResult;
import com.aiinpocket.ngplus.model.dto.LevelUpResult;
import com.aiinpocket.ngplus.model.entity.Completion;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.Player;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.model.entity.SkillAward;
import com.aiinpocket.ngplus.model.enums.CycleState;
import com.aiinpocket.ngplus.model.event.MissionCompleted;
import com.aiinpocket.ngplus.model.event.PlayerLeveledUp;
import com.aiinpocket.ngplus.model.event.SkillLeveledUp;
import com.aiinpocket.ngplus.repository.CompletionRepository;
import com.aiinpocket.ngplus.repository.MissionRepository;
import com.aiinpocket.ngplus.repository.PlayerRepository;
import com.aiinpocket.ngplus.repository.SkillRepository;
import com.aiinpocket.ngplus.service.PlayerService;
import com.aiinpocket.ngplus.service.progression.ProgressionCalculator.Award;
import com.aiinpocket.ngplus.service.progression.ReflectionTokenPolicy.SkillCycle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 將任務完成換算為經驗值、金幣、週期計分，以及可能的反思代幣。
 *
 * <p>流程（全部在同一個加鎖交易內）：
 * <ol>
 *   <li>輪替所有已結束週期的技能</li>
 *   <li>發放玩家基礎經驗值與金幣</li>
 *   <li>每個關聯技能：基礎技能經驗值；若任務是該技能尚未命中的目標，
 *       且 (任務, 技能, 週期) 尚無獎勵紀錄，另加週期獎勵</li>
 *   <li>結算升級、決定反思代幣、寫入完成紀錄</li>
 *   <li>發布 {@link MissionCompleted}、{@link SkillLeveledUp}、{@link PlayerLeveledUp}</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompletionProcessor {

    private final MissionRepository missionRepo;
    private final SkillRepository skillRepo;
    private final PlayerRepository playerRepo;
    private final CompletionRepository completionRepo;
    private final PlayerService playerService;
    private final CycleManager cycleManager;
    private final ReflectionTokenPolicy reflectionPolicy;
    private final CompletionLockService lockService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public CompletionResult completeMission(String missionId) {
        return lockService.executeWithLock("completion of " + missionId, () -> process(missionId));
    }

    private CompletionResult process(String missionId) {
        Mission mission = missionRepo.findById(missionId)
                .orElseThrow(() -> new MissionNotFoundException(missionId));
        if (mission.isArchived()) {
            throw new MissionArchivedException(missionId);
        }

        Instant now = clock.instant();
        cycleManager.rolloverDueSkills(now);
        Player player = playerService.currentPlayer();

        int difficulty = mission.getDifficulty();
        Award base = ProgressionCalculator.baseReward(difficulty);
        Award bonus = ProgressionCalculator.cycleBonus(difficulty);

        long cyclePlayerXp = 0;
        List<SkillAward> awards = new ArrayList<>();
        List<SkillAwardResult> skillResults = new ArrayList<>();
        List<SkillLeveledUp> skillEvents = new ArrayList<>();
        List<SkillCycle> skillCycles = new ArrayList<>();

        for (String skillId : mission.getSkillIds()) {
            Optional<Skill> found = skillRepo.findById(skillId);
            if (found.isEmpty() || found.get().isArchived()) {
                log.debug("[任務完成] 技能 {} 已封存或不存在，跳過 (任務 {})", skillId, missionId);
                continue;
            }
            Skill skill = found.get();
            String cycleId = CycleManager.cycleId(skill);

            boolean cycleAward = CycleManager.state(skill, now) == CycleState.ACTIVE
                    && missionId.equals(skill.getTargetMissionId())
                    && !skill.isHitTargetThisCycle()
                    && !cycleManager.alreadyCreditedThisCycle(missionId, skillId, cycleId);

            long cycleSkillXp = 0;
            if (cycleAward) {
                cycleSkillXp = bonus.skillXp();
                cyclePlayerXp += bonus.playerXp();
                skill.setHitTargetThisCycle(true);
                log.info("[任務完成] 命中週期目標: 技能 {} 任務 {} (+{} 技能 XP)",
                        skill.getName(), missionId, cycleSkillXp);
            }

            long skillXp = base.skillXp() + cycleSkillXp;
            LevelUpResult levelUp = ProgressionCalculator.applyXp(skill.getLevel(), skill.getXp(), skillXp, skill.isFocus());
            skill.setLevel(levelUp.newLevel());
            skill.setXp(levelUp.currentXp());
            skillRepo.save(skill);

            if (levelUp.leveledUp()) {
                log.info("[任務完成] 技能 {} 升級: Lv.{} → Lv.{}",
                        skill.getName(), levelUp.oldLevel(), levelUp.newLevel());
                skillEvents.add(new SkillLeveledUp(skill.getId(), skill.getName(),
                        levelUp.oldLevel(), levelUp.newLevel(), now));
            }

            awards.add(SkillAward.builder()
                    .skillId(skillId)
                    .cycleId(cycleId)
                    .baseSkillXp(base.skillXp())
                    .cycleSkillXp(cycleSkillXp)
                    .cycleAward(cycleAward)
                    .cycleCreditKey(cycleAward ? SkillAward.creditKey(missionId, skillId, cycleId) : null)
                    .build());
            skillResults.add(new SkillAwardResult(skillId, skill.getName(), skillXp, cycleAward, levelUp));
            skillCycles.add(new SkillCycle(skillId, cycleId));
        }

        long playerXp = base.playerXp() + cyclePlayerXp;
        LevelUpResult playerLevelUp = ProgressionCalculator.applyXp(player.getLevel(), player.getXp(), playerXp, false);
        player.setLevel(playerLevelUp.newLevel());
        player.setXp(playerLevelUp.currentXp());
        player.setCoins(player.getCoins() + base.coins());
        playerRepo.save(player);

        Optional<String> prompt = reflectionPolicy.draw(now, clock.getZone(), player.getDayStartHour(), skillCycles);

        Completion completion = completionRepo.saveAndFlush(Completion.builder()
                .missionId(missionId)
                .difficulty(difficulty)
                .completedAt(now)
                .basePlayerXp(base.playerXp())
                .cyclePlayerXp(cyclePlayerXp)
                .coins(base.coins())
                .reflectionToken(prompt.isPresent())
                .awards(awards)
                .build());

        log.info("[任務完成] {} 完成: +{} XP, +{} 金幣, 週期獎勵={}, 反思代幣={}",
                mission.getTitle(), playerXp, base.coins(), cyclePlayerXp > 0, prompt.isPresent());

        CompletionResult result = new CompletionResult(
                completion.getId(), missionId, now, playerXp, base.coins(),
                prompt.isPresent(), prompt.orElse(null), playerLevelUp, skillResults);

        eventPublisher.publishEvent(new MissionCompleted(completion.getId(), missionId,
                List.copyOf(mission.getSkillIds()), result.anyCycleBonus(), prompt.isPresent(), now));
        skillEvents.forEach(eventPublisher::publishEvent);
        if (playerLevelUp.leveledUp()) {
            log.info("[任務完成] 玩家升級: Lv.{} → Lv.{}", playerLevelUp.oldLevel(), playerLevelUp.newLevel());
            eventPublisher.publishEvent(new PlayerLeveledUp(playerLevelUp.oldLevel(), playerLevelUp.newLevel(), now));
        }
        return result;
    }
}
