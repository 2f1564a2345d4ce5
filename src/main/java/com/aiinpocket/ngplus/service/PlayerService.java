package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.config.ProgressionProperties;
import com.aiinpocket.ngplus.exception.StateViolationException;
import com.aiinpocket.ngplus.model.dto.PlayerProfile;
import com.aiinpocket.ngplus.model.dto.PlayerProfile.SkillSummary;
import com.aiinpocket.ngplus.model.dto.PlayerSettingsRequest;
import com.aiinpocket.ngplus.model.entity.Player;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.repository.GameEventLogRepository;
import com.aiinpocket.ngplus.repository.MissionRepository;
import com.aiinpocket.ngplus.repository.PlayerRepository;
import com.aiinpocket.ngplus.repository.SkillRepository;
import com.aiinpocket.ngplus.service.progression.CycleManager;
import com.aiinpocket.ngplus.service.progression.ProgressionCalculator;
import com.aiinpocket.ngplus.service.progression.TimeAlignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 唯一玩家的存取入口。引擎一律透過此處載入玩家，不持有全域實例。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlayerService {

    private static final String DEFAULT_NAME = "Adventurer";
    private static final String DEFAULT_CLASS = "Wanderer";

    private final PlayerRepository playerRepo;
    private final SkillRepository skillRepo;
    private final MissionRepository missionRepo;
    private final GameEventLogRepository eventRepo;
    private final ProgressionProperties props;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Player currentPlayer() {
        return playerRepo.findFirstByOrderByCreatedAtAsc()
                .orElseThrow(() -> new StateViolationException("No player has been created yet"));
    }

    /** 首次啟動時建立玩家，否則回傳既有玩家 */
    @Transactional
    public Player ensurePlayer() {
        return playerRepo.findFirstByOrderByCreatedAtAsc().orElseGet(() -> {
            Player player = playerRepo.save(Player.builder()
                    .displayName(DEFAULT_NAME)
                    .className(DEFAULT_CLASS)
                    .dayStartHour(props.defaultDayStartHour())
                    .createdAt(clock.instant())
                    .build());
            log.info("[玩家] 建立玩家 {} (每日起始 {}:00)", player.getId(), player.getDayStartHour());
            return player;
        });
    }

    /**
     * 更新顯示設定。新的每日起始小時立即套用於每日上限，
     * 週期區間則從下次輪替開始套用。
     */
    @Transactional
    public Player updateSettings(PlayerSettingsRequest request) {
        Player player = currentPlayer();
        if (request.displayName() != null && !request.displayName().isBlank()) {
            player.setDisplayName(request.displayName().trim());
        }
        if (request.className() != null && !request.className().isBlank()) {
            player.setClassName(request.className().trim());
        }
        if (request.classDescription() != null) {
            player.setClassDescription(request.classDescription());
        }
        if (request.dayStartHour() != null) {
            TimeAlignment.requireHour(request.dayStartHour());
            player.setDayStartHour(request.dayStartHour());
        }
        return playerRepo.save(player);
    }

    @Transactional(readOnly = true)
    public PlayerProfile profile() {
        Player player = currentPlayer();
        Instant now = clock.instant();

        long threshold = ProgressionCalculator.xpThreshold(player.getLevel());
        double pct = threshold > 0 ? Math.min(100.0, (player.getXp() * 100.0) / threshold) : 0.0;

        List<SkillSummary> skills = skillRepo.findByArchivedFalseOrderByCreatedAtAsc().stream()
                .map(skill -> toSummary(skill, now))
                .toList();

        return new PlayerProfile(
                player.getDisplayName(),
                player.getClassName(),
                player.getClassDescription(),
                player.getLevel(),
                player.getXp(),
                threshold - player.getXp(),
                Math.round(pct * 10.0) / 10.0,
                player.getCoins(),
                player.getDayStartHour(),
                skills,
                eventRepo.countBySeenFalse()
        );
    }

    private SkillSummary toSummary(Skill skill, Instant now) {
        long threshold = ProgressionCalculator.effectiveThreshold(skill.getLevel(), skill.isFocus());
        return new SkillSummary(
                skill.getId(),
                skill.getName(),
                skill.getLevel(),
                skill.getXp(),
                threshold - skill.getXp(),
                skill.isFocus(),
                skill.getCadence().name(),
                CycleManager.state(skill, now).name(),
                skill.getCycleStart(),
                skill.getCycleEnd(),
                skill.getTargetMissionId(),
                props.cycle().revealTarget(),
                skill.isHitTargetThisCycle(),
                (int) missionRepo.countAssignedToSkill(skill.getId())
        );
    }
}
