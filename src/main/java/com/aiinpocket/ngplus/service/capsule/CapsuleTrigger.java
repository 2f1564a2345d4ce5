package com.aiinpocket.ngplus.service.capsule;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.model.entity.TimeCapsule;
import com.aiinpocket.ngplus.model.enums.UnlockType;
import com.aiinpocket.ngplus.model.event.CapsuleUnlocked;
import com.aiinpocket.ngplus.model.event.DateTick;
import com.aiinpocket.ngplus.model.event.MissionCompleted;
import com.aiinpocket.ngplus.model.event.PlayerLeveledUp;
import com.aiinpocket.ngplus.model.event.SkillLeveledUp;
import com.aiinpocket.ngplus.repository.CompletionRepository;
import com.aiinpocket.ngplus.repository.PlayerRepository;
import com.aiinpocket.ngplus.repository.SkillRepository;
import com.aiinpocket.ngplus.repository.TimeCapsuleRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 判斷時光膠囊的解鎖條件。本身不保存狀態，唯一寫入的欄位是
 * {@code unlockedAt}，且每個膠囊只寫一次。
 *
 * <p>事件觸發時只看事件內容。{@link DateTick} 另外會拿目前狀態檢查所有
 * 鎖定中的膠囊，涵蓋匯入的膠囊以及撰寫當下
 * 就已達成的條件。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapsuleTrigger {

    private final TimeCapsuleRepository capsuleRepo;
    private final PlayerRepository playerRepo;
    private final SkillRepository skillRepo;
    private final CompletionRepository completionRepo;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @EventListener
    @Transactional
    public void onDateTick(DateTick tick) {
        int unlocked = 0;
        for (TimeCapsule capsule : capsuleRepo.findByUnlockedAtIsNull()) {
            Optional<CapsuleCondition> condition = conditionOf(capsule);
            if (condition.isPresent() && metByCurrentState(capsule, condition.get(), tick.occurredAt())) {
                unlock(capsule, tick.occurredAt());
                unlocked++;
            }
        }
        log.debug("[時光膠囊] 日期檢查 {} 解鎖 {}", tick.occurredAt(), unlocked);
    }

    @EventListener
    public void onMissionCompleted(MissionCompleted event) {
        evaluate(UnlockType.MISSION_COMPLETION, event.occurredAt(),
                c -> event.missionId().equals(c.missionId()));
    }

    @EventListener
    public void onSkillLeveledUp(SkillLeveledUp event) {
        evaluate(UnlockType.SKILL_LEVEL, event.occurredAt(),
                c -> event.skillId().equals(c.skillId()) && event.newLevel() >= c.level());
    }

    @EventListener
    public void onPlayerLeveledUp(PlayerLeveledUp event) {
        evaluate(UnlockType.PLAYER_LEVEL, event.occurredAt(), c -> event.newLevel() >= c.level());
    }

    // ===== 內部方法 =====

    private void evaluate(UnlockType type, Instant at, Predicate<CapsuleCondition> matches) {
        for (TimeCapsule capsule : capsuleRepo.findByUnlockedAtIsNullAndUnlockType(type)) {
            conditionOf(capsule)
                    .filter(matches)
                    .ifPresent(c -> unlock(capsule, at));
        }
    }

    private boolean metByCurrentState(TimeCapsule capsule, CapsuleCondition condition, Instant now) {
        return switch (capsule.getUnlockType()) {
            case DATE -> !now.isBefore(condition.unlockAt(clock.getZone()));
            case MISSION_COMPLETION -> completionRepo.existsByMissionIdAndCompletedAtAfter(
                    condition.missionId(), capsule.getCreatedAt());
            case SKILL_LEVEL -> skillRepo.findById(condition.skillId())
                    .map(skill -> skill.getLevel() >= condition.level())
                    .orElse(false);
            case PLAYER_LEVEL -> playerRepo.findFirstByOrderByCreatedAtAsc()
                    .map(player -> player.getLevel() >= condition.level())
                    .orElse(false);
        };
    }

    private void unlock(TimeCapsule capsule, Instant at) {
        if (capsule.isUnlocked()) {
            return;
        }
        capsule.setUnlockedAt(at);
        capsuleRepo.save(capsule);
        log.info("[時光膠囊] 「{}」({}) 已解鎖，條件 {}", capsule.getTitle(), capsule.getId(), capsule.getUnlockType());
        eventPublisher.publishEvent(new CapsuleUnlocked(capsule.getId(), capsule.getTitle(), capsule.getUnlockType(), at));
    }

    private Optional<CapsuleCondition> conditionOf(TimeCapsule capsule) {
        try {
            return Optional.of(CapsuleCondition.parse(capsule.getUnlockType(), capsule.getUnlockParams(), objectMapper));
        } catch (InvalidInputException e) {
            log.warn("[時光膠囊] 膠囊 {} 解鎖參數無效，維持鎖定: {}", capsule.getId(), e.getMessage());
            return Optional.empty();
        }
    }
}
