package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.model.dto.StreakStatus;
import com.aiinpocket.ngplus.model.dto.StreakStatus.SkillStreak;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.model.entity.Streak;
import com.aiinpocket.ngplus.model.event.MissionCompleted;
import com.aiinpocket.ngplus.repository.SkillRepository;
import com.aiinpocket.ngplus.repository.StreakRepository;
import com.aiinpocket.ngplus.service.progression.TimeAlignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 技能與整體的連續天數，由任務完成驅動。
 * 在完成交易內執行，早於目標讀取連續天數。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreakService {

    public static final int LISTENER_ORDER = 10;

    private final StreakRepository streakRepo;
    private final SkillRepository skillRepo;
    private final PlayerService playerService;
    private final Clock clock;

    @EventListener
    @Order(LISTENER_ORDER)
    public void onMissionCompleted(MissionCompleted event) {
        LocalDate day = alignedDay(event.occurredAt());
        for (String skillId : event.skillIds()) {
            skillRepo.findById(skillId)
                    .filter(skill -> !skill.isArchived())
                    .ifPresent(skill -> record(streakRepo.findFirstBySkillId(skillId)
                            .orElseGet(() -> newStreak(skillId)), day, skill.getName()));
        }
        record(streakRepo.findFirstBySkillIdIsNull().orElseGet(() -> newStreak(null)), day, "overall");
    }

    @Transactional(readOnly = true)
    public StreakStatus status() {
        LocalDate today = alignedDay(clock.instant());
        Streak overall = streakRepo.findFirstBySkillIdIsNull().orElse(null);
        Map<String, Skill> skills = skillRepo.findByArchivedFalseOrderByCreatedAtAsc().stream()
                .collect(Collectors.toMap(Skill::getId, Function.identity()));

        List<SkillStreak> perSkill = new ArrayList<>();
        int active = 0;
        int atRisk = 0;
        for (Streak streak : streakRepo.findBySkillIdIsNotNullOrderByCreatedAtAsc()) {
            Skill skill = skills.get(streak.getSkillId());
            if (skill == null) {
                continue;
            }
            boolean isActive = streak.isActive(today);
            int daysLeft = streak.daysUntilBroken(today);
            if (isActive) {
                active++;
            }
            if (daysLeft == 0) {
                atRisk++;
            }
            perSkill.add(new SkillStreak(skill.getId(), skill.getName(), streak.effectiveStreak(today),
                    streak.getLongestStreak(), streak.getLastCompletionDate(), isActive, daysLeft));
        }

        return new StreakStatus(today,
                overall != null && overall.isActive(today),
                overall == null ? 0 : overall.effectiveStreak(today),
                overall == null ? 0 : overall.getLongestStreak(),
                active, atRisk, perSkill);
    }

    /** 技能的連續天數，{@code skillId} 為 null 時為整體；錯過一天即為 0 */
    @Transactional(readOnly = true)
    public int currentStreak(String skillId, Instant at) {
        LocalDate today = alignedDay(at);
        return (skillId == null ? streakRepo.findFirstBySkillIdIsNull() : streakRepo.findFirstBySkillId(skillId))
                .map(streak -> streak.effectiveStreak(today))
                .orElse(0);
    }

    // ===== 內部方法 =====

    private LocalDate alignedDay(Instant at) {
        return TimeAlignment.alignedDate(at, clock.getZone(), playerService.currentPlayer().getDayStartHour());
    }

    private Streak newStreak(String skillId) {
        return Streak.builder().skillId(skillId).createdAt(clock.instant()).build();
    }

    private void record(Streak streak, LocalDate day, String label) {
        int before = streak.getCurrentStreak();
        boolean kept = streak.record(day);
        streakRepo.save(streak);
        if (!kept) {
            log.info("[連續紀錄] {} 連續天數於 {} 重新起算", label, day);
        } else if (streak.getCurrentStreak() > before && streak.getCurrentStreak() > 1
                && streak.getCurrentStreak() == streak.getLongestStreak()) {
            log.info("[連續紀錄] {} 連續 {} 天，刷新最佳紀錄", label, streak.getCurrentStreak());
        }
    }
}
