package com.aiinpocket.ngplus.service.navigator;

import com.aiinpocket.ngplus.config.ProgressionProperties;
import com.aiinpocket.ngplus.model.entity.Player;
import com.aiinpocket.ngplus.repository.CompletionRepository;
import com.aiinpocket.ngplus.repository.CycleRecordRepository;
import com.aiinpocket.ngplus.repository.JournalEntryRepository;
import com.aiinpocket.ngplus.repository.MissionRepository;
import com.aiinpocket.ngplus.repository.PlayerRepository;
import com.aiinpocket.ngplus.repository.RedemptionRepository;
import com.aiinpocket.ngplus.repository.RewardRepository;
import com.aiinpocket.ngplus.repository.SkillRepository;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.CompletionView;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.CycleView;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.RewardView;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.SkillView;
import com.aiinpocket.ngplus.service.progression.CycleManager;
import com.aiinpocket.ngplus.model.entity.Redemption;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 將偵測器需要的狀態複製成 {@link NavigatorSnapshot}。
 */
@Component
@RequiredArgsConstructor
public class NavigatorSnapshotLoader {

    private final PlayerRepository playerRepo;
    private final SkillRepository skillRepo;
    private final MissionRepository missionRepo;
    private final CycleRecordRepository cycleRecordRepo;
    private final CompletionRepository completionRepo;
    private final JournalEntryRepository journalRepo;
    private final RewardRepository rewardRepo;
    private final RedemptionRepository redemptionRepo;
    private final ProgressionProperties props;
    private final Clock clock;

    @Transactional(readOnly = true)
    public NavigatorSnapshot load() {
        Instant now = clock.instant();
        ProgressionProperties.NavigatorParams params = props.navigator();

        Player player = playerRepo.findFirstByOrderByCreatedAtAsc().orElse(null);

        List<SkillView> skills = skillRepo.findByArchivedFalseOrderByCreatedAtAsc().stream()
                .map(s -> new SkillView(s.getId(), s.getName(), s.getLevel(), s.isFocus(), s.getCadence(),
                        s.getCustomIntervalDays(), CycleManager.state(s, now), s.getNotReadySince(),
                        (int) missionRepo.countAssignedToSkill(s.getId()), s.getCreatedAt()))
                .toList();
        Set<String> activeIds = skills.stream().map(SkillView::id).collect(Collectors.toSet());

        List<CycleView> cycles = cycleRecordRepo.findAllByOrderByCycleStartAsc().stream()
                .filter(r -> activeIds.contains(r.getSkillId()))
                .map(r -> new CycleView(r.getSkillId(), r.getCycleStart(), r.getCycleEnd(), r.isReady(), r.isTargetHit()))
                .toList();

        Instant completionCutoff = now.minus(Duration.ofDays(params.difficultyLookbackDays()));
        List<CompletionView> completions = completionRepo
                .findByCompletedAtGreaterThanEqualOrderByCompletedAtDesc(completionCutoff,
                        PageRequest.of(0, params.difficultySampleSize()))
                .stream()
                .map(c -> new CompletionView(c.getMissionId(), c.getDifficulty(), c.getCompletedAt()))
                .toList();

        Map<String, Instant> lastCompletion = toInstantMap(completionRepo.findLastCompletionPerSkill());

        Map<String, Instant> lastJournal = new HashMap<>();
        Instant lastUnlinked = null;
        for (Object[] row : journalRepo.findLastActivityPerSkill()) {
            if (row[0] == null) {
                lastUnlinked = (Instant) row[1];
            } else {
                lastJournal.put((String) row[0], (Instant) row[1]);
            }
        }

        List<RewardView> rewards = rewardRepo.findByArchivedFalseOrderByPriceCoinsAsc().stream()
                .map(r -> new RewardView(r.getId(), r.getTitle(), r.getPriceCoins()))
                .toList();
        Instant lastRedemption = redemptionRepo.findFirstByOrderByRedeemedAtDesc()
                .map(Redemption::getRedeemedAt)
                .orElse(null);

        return new NavigatorSnapshot(
                now,
                params,
                props.cycle().readinessThreshold(),
                player != null ? player.getLevel() : 1,
                player != null ? player.getCoins() : 0L,
                skills,
                cycles,
                completions,
                Map.copyOf(lastCompletion),
                Map.copyOf(lastJournal),
                lastUnlinked,
                rewards,
                lastRedemption);
    }

    private static Map<String, Instant> toInstantMap(List<Object[]> rows) {
        Map<String, Instant> map = new HashMap<>();
        for (Object[] row : rows) {
            map.put((String) row[0], (Instant) row[1]);
        }
        return map;
    }
}
