package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.exception.StateViolationException;
import com.aiinpocket.ngplus.model.dto.GoalProgress;
import com.aiinpocket.ngplus.model.dto.GoalRequest;
import com.aiinpocket.ngplus.model.entity.Goal;
import com.aiinpocket.ngplus.model.enums.GoalStatus;
import com.aiinpocket.ngplus.model.enums.GoalType;
import com.aiinpocket.ngplus.model.event.DateTick;
import com.aiinpocket.ngplus.model.event.GoalCompleted;
import com.aiinpocket.ngplus.model.event.GoalMilestoneReached;
import com.aiinpocket.ngplus.model.event.MissionCompleted;
import com.aiinpocket.ngplus.model.event.RewardRedeemed;
import com.aiinpocket.ngplus.model.event.SkillLeveledUp;
import com.aiinpocket.ngplus.repository.CompletionRepository;
import com.aiinpocket.ngplus.repository.GoalRepository;
import com.aiinpocket.ngplus.repository.SkillRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * 長期目標。CUSTOM 目標由手動回報進度，其他類型在任務完成、兌換、升級與日期事件後
 * 從引擎狀態重新計算。
 *
 * <p>計算方式：
 * <ul>
 *   <li>MISSION_COUNT：目標建立後的完成次數，連結技能或整體</li>
 *   <li>SKILL_LEVEL / PLAYER_LEVEL：目前等級</li>
 *   <li>COIN_TARGET：目前金幣餘額</li>
 *   <li>STREAK：目前連續天數，連結技能或整體</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GoalService {

    private final GoalRepository goalRepo;
    private final SkillRepository skillRepo;
    private final CompletionRepository completionRepo;
    private final PlayerService playerService;
    private final StreakService streakService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Goal> list(GoalStatus status) {
        return status == null
                ? goalRepo.findAllByOrderByCreatedAtAsc()
                : goalRepo.findByStatusOrderByCreatedAtAsc(status);
    }

    @Transactional(readOnly = true)
    public Goal get(String goalId) {
        return goalRepo.findById(goalId).orElseThrow(() -> NotFoundException.goal(goalId));
    }

    /** 建立目標並立即計算，建立時已達成的目標會直接完成 */
    @Transactional
    public GoalProgress createGoal(GoalRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new InvalidInputException("Goal title is required");
        }
        GoalType type = GoalType.parse(request.goalType());
        if (request.targetValue() < 1) {
            throw new InvalidInputException("Goal target must be at least 1, got " + request.targetValue());
        }
        String skillId = request.skillId() == null || request.skillId().isBlank() ? null : request.skillId();
        if (type == GoalType.SKILL_LEVEL && skillId == null) {
            throw new InvalidInputException("A skill level goal needs a skill");
        }
        if (skillId != null && !skillRepo.existsById(skillId)) {
            throw NotFoundException.skill(skillId);
        }

        Instant now = clock.instant();
        Goal goal = goalRepo.save(Goal.builder()
                .title(request.title().trim())
                .description(request.description())
                .goalType(type)
                .targetValue(request.targetValue())
                .skillId(skillId)
                .deadline(request.deadline())
                .milestones(validateMilestones(request.milestones(), request.targetValue()))
                .createdAt(now)
                .build());
        log.info("[目標] 建立「{}」({} → {})", goal.getTitle(), type, goal.getTargetValue());

        if (type == GoalType.CUSTOM) {
            return new GoalProgress(goal, false, null, goal.progressPercentage());
        }
        return apply(goal, measure(goal, now), now);
    }

    /**
     * 設定 CUSTOM 目標的進度。
     *
     * @throws StateViolationException 非 CUSTOM 目標或目標已非進行中
     */
    @Transactional
    public GoalProgress updateProgress(String goalId, long value) {
        Goal goal = get(goalId);
        if (goal.getGoalType() != GoalType.CUSTOM) {
            throw new StateViolationException("Progress of a " + goal.getGoalType() + " goal is measured, not set");
        }
        if (goal.getStatus() != GoalStatus.ACTIVE) {
            throw new StateViolationException("Goal is " + goal.getStatus() + ": " + goal.getTitle());
        }
        if (value < 0) {
            throw new InvalidInputException("Progress must not be negative, got " + value);
        }
        return apply(goal, value, clock.instant());
    }

    @Transactional
    public Goal archive(String goalId) {
        Goal goal = get(goalId);
        goal.setStatus(GoalStatus.ARCHIVED);
        log.info("[目標] 封存「{}」", goal.getTitle());
        return goalRepo.save(goal);
    }

    /** 重新計算所有進行中的目標，回傳數值有變動者 */
    @Transactional
    public List<GoalProgress> refreshActive() {
        return refreshActive(clock.instant());
    }

    // ===== 事件監聽 =====

    @EventListener
    @Order(StreakService.LISTENER_ORDER + 10)
    public void onMissionCompleted(MissionCompleted event) {
        refreshActive(event.occurredAt());
    }

    @EventListener
    public void onRewardRedeemed(RewardRedeemed event) {
        refreshActive(event.occurredAt());
    }

    @EventListener
    public void onSkillLeveledUp(SkillLeveledUp event) {
        refreshActive(event.occurredAt());
    }

    @EventListener
    @Transactional
    public void onDateTick(DateTick tick) {
        refreshActive(tick.occurredAt());
    }

    // ===== 內部方法 =====

    private List<GoalProgress> refreshActive(Instant now) {
        List<GoalProgress> changed = new ArrayList<>();
        for (Goal goal : goalRepo.findByStatusOrderByCreatedAtAsc(GoalStatus.ACTIVE)) {
            if (goal.getGoalType() == GoalType.CUSTOM) {
                continue;
            }
            long value = measure(goal, now);
            if (value != goal.getCurrentValue()) {
                changed.add(apply(goal, value, now));
            }
        }
        return changed;
    }

    private long measure(Goal goal, Instant now) {
        return switch (goal.getGoalType()) {
            case MISSION_COUNT -> goal.getSkillId() == null
                    ? completionRepo.countByCompletedAtGreaterThanEqual(goal.getCreatedAt())
                    : completionRepo.countForSkillSince(goal.getSkillId(), goal.getCreatedAt());
            case SKILL_LEVEL -> skillRepo.findById(goal.getSkillId())
                    .map(skill -> (long) skill.getLevel())
                    .orElse(goal.getCurrentValue());
            case PLAYER_LEVEL -> playerService.currentPlayer().getLevel();
            case COIN_TARGET -> playerService.currentPlayer().getCoins();
            case STREAK -> streakService.currentStreak(goal.getSkillId(), now);
            case CUSTOM -> goal.getCurrentValue();
        };
    }

    private GoalProgress apply(Goal goal, long value, Instant now) {
        long old = goal.getCurrentValue();
        goal.setCurrentValue(value);

        Long milestoneHit = null;
        for (Long milestone : goal.getMilestones()) {
            if (old < milestone && milestone <= value) {
                milestoneHit = milestone;
            }
        }

        boolean justCompleted = false;
        if (goal.getStatus() == GoalStatus.ACTIVE && value >= goal.getTargetValue()) {
            goal.setStatus(GoalStatus.COMPLETED);
            goal.setCompletedAt(now);
            justCompleted = true;
        }
        goalRepo.save(goal);

        if (milestoneHit != null) {
            log.info("[目標] 「{}」達成里程碑 {}", goal.getTitle(), milestoneHit);
            eventPublisher.publishEvent(new GoalMilestoneReached(goal.getId(), goal.getTitle(), milestoneHit, now));
        }
        if (justCompleted) {
            log.info("[目標] 「{}」完成 {}/{}", goal.getTitle(), value, goal.getTargetValue());
            eventPublisher.publishEvent(new GoalCompleted(goal.getId(), goal.getTitle(), goal.getTargetValue(), now));
        }
        return new GoalProgress(goal, justCompleted, milestoneHit, goal.progressPercentage());
    }

    private static List<Long> validateMilestones(List<Long> requested, long target) {
        if (requested == null) {
            return new ArrayList<>();
        }
        TreeSet<Long> sorted = new TreeSet<>();
        for (Long milestone : requested) {
            if (milestone == null || milestone <= 0 || milestone >= target) {
                throw new InvalidInputException(String.format(
                        "Milestones must lie strictly between 0 and the target %d, got %s", target, milestone));
            }
            sorted.add(milestone);
        }
        return new ArrayList<>(sorted);
    }
}
