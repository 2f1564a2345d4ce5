package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.model.entity.GameEventLog;
import com.aiinpocket.ngplus.model.enums.GameEventType;
import com.aiinpocket.ngplus.model.event.CapsuleUnlocked;
import com.aiinpocket.ngplus.model.event.GoalCompleted;
import com.aiinpocket.ngplus.model.event.GoalMilestoneReached;
import com.aiinpocket.ngplus.model.event.MissionCompleted;
import com.aiinpocket.ngplus.model.event.PlayerLeveledUp;
import com.aiinpocket.ngplus.model.event.RewardRedeemed;
import com.aiinpocket.ngplus.model.event.SkillLeveledUp;
import com.aiinpocket.ngplus.repository.GameEventLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 將引擎事件寫入呈現層動態。監聽器在發布者的交易內執行，
 * 完成被回滾時不會留下動態紀錄。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameEventService {

    private final GameEventLogRepository eventRepo;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public List<GameEventLog> unseen() {
        return eventRepo.findBySeenFalseOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<GameEventLog> recent() {
        return eventRepo.findTop100ByOrderByCreatedAtDesc();
    }

    @Transactional
    public int markAllSeen() {
        return eventRepo.markAllSeen();
    }

    // ===== 事件監聽 =====

    @EventListener
    public void onMissionCompleted(MissionCompleted event) {
        if (event.cycleBonus()) {
            record(GameEventType.CYCLE_BONUS, event.occurredAt(), payload("missionId", event.missionId(),
                    "completionId", event.completionId()));
        }
        if (event.reflectionToken()) {
            record(GameEventType.REFLECTION_TOKEN, event.occurredAt(), payload("missionId", event.missionId(),
                    "completionId", event.completionId()));
        }
    }

    @EventListener
    public void onSkillLeveledUp(SkillLeveledUp event) {
        record(GameEventType.SKILL_LEVEL_UP, event.occurredAt(), payload("skillId", event.skillId(),
                "skillName", event.skillName(), "oldLevel", event.oldLevel(), "newLevel", event.newLevel()));
    }

    @EventListener
    public void onPlayerLeveledUp(PlayerLeveledUp event) {
        record(GameEventType.PLAYER_LEVEL_UP, event.occurredAt(), payload(
                "oldLevel", event.oldLevel(), "newLevel", event.newLevel()));
    }

    @EventListener
    public void onCapsuleUnlocked(CapsuleUnlocked event) {
        record(GameEventType.CAPSULE_UNLOCKED, event.occurredAt(), payload("capsuleId", event.capsuleId(),
                "title", event.title(), "unlockType", event.unlockType().name()));
    }

    @EventListener
    public void onRewardRedeemed(RewardRedeemed event) {
        record(GameEventType.REWARD_REDEEMED, event.occurredAt(), payload("rewardId", event.rewardId(),
                "title", event.title(), "coinsSpent", event.coinsSpent()));
    }

    @EventListener
    public void onGoalMilestone(GoalMilestoneReached event) {
        record(GameEventType.GOAL_MILESTONE, event.occurredAt(), payload("goalId", event.goalId(),
                "title", event.title(), "milestone", event.milestone()));
    }

    @EventListener
    public void onGoalCompleted(GoalCompleted event) {
        record(GameEventType.GOAL_COMPLETED, event.occurredAt(), payload("goalId", event.goalId(),
                "title", event.title(), "targetValue", event.targetValue()));
    }

    // ===== 內部方法 =====

    private void record(GameEventType type, Instant at, Map<String, Object> data) {
        eventRepo.save(GameEventLog.builder()
                .eventType(type)
                .eventData(toJson(data))
                .createdAt(at)
                .build());
        log.debug("[遊戲事件] 記錄 {} {}", type, data);
    }

    private String toJson(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise event payload " + data, e);
        }
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
