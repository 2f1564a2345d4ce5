package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.model.dto.GameSnapshot;
import com.aiinpocket.ngplus.model.dto.GameSnapshot.*;
import com.aiinpocket.ngplus.model.dto.TemplateRequest;
import com.aiinpocket.ngplus.model.entity.*;
import com.aiinpocket.ngplus.model.enums.CycleCadence;
import com.aiinpocket.ngplus.model.enums.GoalStatus;
import com.aiinpocket.ngplus.model.enums.GoalType;
import com.aiinpocket.ngplus.model.enums.TemplateCategory;
import com.aiinpocket.ngplus.model.enums.UnlockType;
import com.aiinpocket.ngplus.repository.*;
import com.aiinpocket.ngplus.service.navigator.NavigatorService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 以帶版本的 {@link GameSnapshot} 完整匯出、匯入遊戲狀態。
 *
 * <p>匯入可整體取代（預設）或合併：合併時保留既有資料，
 * 只新增 id 不存在的資料。id 原樣保留，完成紀錄仍指向原任務，
 * 技能也保有原本的週期區間與目標。匯入時不執行輪替。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotService {

    private final PlayerRepository playerRepo;
    private final SkillRepository skillRepo;
    private final MissionRepository missionRepo;
    private final CompletionRepository completionRepo;
    private final CycleRecordRepository cycleRecordRepo;
    private final RewardRepository rewardRepo;
    private final RedemptionRepository redemptionRepo;
    private final JournalEntryRepository journalRepo;
    private final TimeCapsuleRepository capsuleRepo;
    private final StreakRepository streakRepo;
    private final GoalRepository goalRepo;
    private final MissionTemplateRepository templateRepo;
    private final NavigatorService navigatorService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public GameSnapshot exportSnapshot() {
        Player p = playerRepo.findFirstByOrderByCreatedAtAsc()
                .orElseThrow(() -> new InvalidInputException("Nothing to export: no player exists"));

        GameSnapshot snapshot = new GameSnapshot(
                GameSnapshot.CURRENT_VERSION,
                clock.instant(),
                new PlayerData(p.getId(), p.getDisplayName(), p.getClassName(), p.getClassDescription(),
                        p.getLevel(), p.getXp(), p.getCoins(), p.getDayStartHour(), p.getCreatedAt()),
                skillRepo.findAllByOrderByCreatedAtAsc().stream().map(s -> new SkillData(
                        s.getId(), s.getName(), s.getDescription(), s.getLevel(), s.getXp(),
                        s.getCadence().name(), s.getCustomIntervalDays(), s.getCycleStart(), s.getCycleEnd(),
                        s.getTargetMissionId(), s.isHitTargetThisCycle(), s.isFocus(), s.isArchived(),
                        s.getNotReadySince(), s.getCreatedAt())).toList(),
                missionRepo.findAllByOrderByCreatedAtAsc().stream().map(m -> new MissionData(
                        m.getId(), m.getTitle(), m.getNote(), m.getDifficulty(), m.getEnergy(),
                        List.copyOf(m.getSkillIds()), m.isArchived(), m.getCreatedAt(), m.getUpdatedAt())).toList(),
                completionRepo.findAllByOrderByCompletedAtAsc().stream().map(c -> new CompletionData(
                        c.getId(), c.getMissionId(), c.getDifficulty(), c.getCompletedAt(),
                        c.getBasePlayerXp(), c.getCyclePlayerXp(), c.getCoins(), c.isReflectionToken(),
                        c.getAwards().stream().map(a -> new AwardData(a.getSkillId(), a.getCycleId(),
                                a.getBaseSkillXp(), a.getCycleSkillXp(), a.isCycleAward())).toList())).toList(),
                cycleRecordRepo.findAllByOrderByCycleStartAsc().stream().map(r -> new CycleRecordData(
                        r.getId(), r.getSkillId(), r.getCycleId(), r.getCycleStart(), r.getCycleEnd(),
                        r.getTargetMissionId(), r.isReady(), r.isTargetHit())).toList(),
                rewardRepo.findAllByOrderByCreatedAtAsc().stream().map(r -> new RewardData(
                        r.getId(), r.getTitle(), r.getPriceCoins(), r.getNote(), r.isArchived(),
                        r.getTimesRedeemed(), r.getCreatedAt())).toList(),
                redemptionRepo.findAllByOrderByRedeemedAtDesc().stream().map(r -> new RedemptionData(
                        r.getId(), r.getRewardId(), r.getCoinsSpent(), r.getRedeemedAt(), r.getNote())).toList(),
                journalRepo.findAllByOrderByCreatedAtDesc().stream().map(j -> new JournalData(
                        j.getId(), j.getText(), j.getSkillId(), j.getMissionId(), j.isReflection(),
                        j.getCreatedAt(), j.getEditedAt())).toList(),
                capsuleRepo.findAllByOrderByCreatedAtAsc().stream().map(c -> new CapsuleData(
                        c.getId(), c.getTitle(), c.getBody(), c.isEncrypted(), c.getPassphraseHint(),
                        c.getUnlockType().name(), c.getUnlockParams(), c.getCreatedAt(), c.getUnlockedAt(),
                        c.getArchivedToJournalEntryId())).toList(),
                streakRepo.findAllByOrderByCreatedAtAsc().stream().map(st -> new StreakData(
                        st.getId(), st.getSkillId(), st.getCurrentStreak(), st.getLongestStreak(),
                        st.getLastCompletionDate(), st.getCreatedAt())).toList(),
                goalRepo.findAllByOrderByCreatedAtAsc().stream().map(g -> new GoalData(
                        g.getId(), g.getTitle(), g.getDescription(), g.getGoalType().name(), g.getTargetValue(),
                        g.getCurrentValue(), g.getStatus().name(), g.getSkillId(), List.copyOf(g.getMilestones()),
                        g.getDeadline(), g.getCreatedAt(), g.getCompletedAt())).toList(),
                templateRepo.findAllByOrderByCreatedAtAsc().stream().map(t -> new TemplateData(
                        t.getId(), t.getName(), t.getDescription(), t.getCategory().name(),
                        t.getMissions().stream().map(m -> new TemplateRequest.Entry(
                                m.getTitle(), m.getNote(), m.getDifficulty(), m.getEnergy())).toList(),
                        t.getTimesUsed(), t.getCreatedAt())).toList()
        );
        log.info("[快照] 匯出 {} 個技能、{} 個任務、{} 筆完成紀錄",
                snapshot.skills().size(), snapshot.missions().size(), snapshot.completions().size());
        return snapshot;
    }

    @Transactional
    public void importSnapshot(GameSnapshot snapshot, boolean merge) {
        if (snapshot == null) {
            throw new InvalidInputException("Snapshot is required");
        }
        if (snapshot.version() != GameSnapshot.CURRENT_VERSION) {
            throw new InvalidInputException(String.format("Snapshot version %d is not supported (expected %d)",
                    snapshot.version(), GameSnapshot.CURRENT_VERSION));
        }
        if (snapshot.player() == null) {
            throw new InvalidInputException("Snapshot has no player");
        }

        if (!merge) {
            clearAll();
        }

        if (!merge || playerRepo.count() == 0) {
            PlayerData p = snapshot.player();
            playerRepo.save(Player.builder()
                    .id(p.id()).displayName(p.displayName()).className(p.className())
                    .classDescription(p.classDescription()).level(p.level()).xp(p.xp()).coins(p.coins())
                    .dayStartHour(p.dayStartHour()).createdAt(p.createdAt())
                    .build());
        }

        int added;
        try {
            added = insertAll(snapshot);
        } catch (DataIntegrityViolationException e) {
            log.warn("[快照] 匯入違反資料庫約束，已拒絕: {}", e.getMostSpecificCause().getMessage());
            throw new InvalidInputException("Snapshot conflicts with existing data (duplicate cycle credit or id)");
        }

        navigatorService.invalidate();
        log.info("[快照] 匯入 {} 筆資料 ({} 模式)", added, merge ? "merge" : "replace");
    }

    /** 新增所有未知資料並 flush，讓約束違反在此拋出而非提交時 */
    private int insertAll(GameSnapshot snapshot) {
        int added = 0;
        added += insertMissing(skillRepo, nullToEmpty(snapshot.skills()), SkillData::id, s -> Skill.builder()
                .id(s.id()).name(s.name()).description(s.description()).level(s.level()).xp(s.xp())
                .cadence(CycleCadence.parse(s.cadence())).customIntervalDays(s.customIntervalDays())
                .cycleStart(s.cycleStart()).cycleEnd(s.cycleEnd()).targetMissionId(s.targetMissionId())
                .hitTargetThisCycle(s.hitTargetThisCycle()).focus(s.focus()).archived(s.archived())
                .notReadySince(s.notReadySince()).createdAt(s.createdAt())
                .build());
        added += insertMissing(missionRepo, nullToEmpty(snapshot.missions()), MissionData::id, m -> Mission.builder()
                .id(m.id()).title(m.title()).note(m.note()).difficulty(m.difficulty()).energy(m.energy())
                .skillIds(new ArrayList<>(nullToEmpty(m.skillIds()))).archived(m.archived())
                .createdAt(m.createdAt()).updatedAt(m.updatedAt())
                .build());
        added += insertMissing(completionRepo, nullToEmpty(snapshot.completions()), CompletionData::id, c -> Completion.builder()
                .id(c.id()).missionId(c.missionId()).difficulty(c.difficulty()).completedAt(c.completedAt())
                .basePlayerXp(c.basePlayerXp()).cyclePlayerXp(c.cyclePlayerXp()).coins(c.coins())
                .reflectionToken(c.reflectionToken())
                .awards(new ArrayList<>(nullToEmpty(c.awards()).stream().map(a -> SkillAward.builder()
                        .skillId(a.skillId()).cycleId(a.cycleId()).baseSkillXp(a.baseSkillXp())
                        .cycleSkillXp(a.cycleSkillXp()).cycleAward(a.cycleAward())
                        .cycleCreditKey(a.cycleAward() ? SkillAward.creditKey(c.missionId(), a.skillId(), a.cycleId()) : null)
                        .build()).toList()))
                .build());
        added += insertMissing(cycleRecordRepo, nullToEmpty(snapshot.cycleRecords()), CycleRecordData::id, r -> CycleRecord.builder()
                .id(r.id()).skillId(r.skillId()).cycleId(r.cycleId()).cycleStart(r.cycleStart()).cycleEnd(r.cycleEnd())
                .targetMissionId(r.targetMissionId()).ready(r.ready()).targetHit(r.targetHit())
                .build());
        added += insertMissing(rewardRepo, nullToEmpty(snapshot.rewards()), RewardData::id, r -> Reward.builder()
                .id(r.id()).title(r.title()).priceCoins(r.priceCoins()).note(r.note()).archived(r.archived())
                .timesRedeemed(r.timesRedeemed()).createdAt(r.createdAt())
                .build());
        added += insertMissing(redemptionRepo, nullToEmpty(snapshot.redemptions()), RedemptionData::id, r -> Redemption.builder()
                .id(r.id()).rewardId(r.rewardId()).coinsSpent(r.coinsSpent()).redeemedAt(r.redeemedAt()).note(r.note())
                .build());
        added += insertMissing(journalRepo, nullToEmpty(snapshot.journal()), JournalData::id, j -> JournalEntry.builder()
                .id(j.id()).text(j.text()).skillId(j.skillId()).missionId(j.missionId()).reflection(j.reflection())
                .createdAt(j.createdAt()).editedAt(j.editedAt())
                .build());
        added += insertMissing(capsuleRepo, nullToEmpty(snapshot.capsules()), CapsuleData::id, c -> TimeCapsule.builder()
                .id(c.id()).title(c.title()).body(c.body()).encrypted(c.encrypted()).passphraseHint(c.passphraseHint())
                .unlockType(parseUnlockType(c.unlockType())).unlockParams(c.unlockParams())
                .createdAt(c.createdAt()).unlockedAt(c.unlockedAt()).archivedToJournalEntryId(c.archivedToJournalEntryId())
                .build());
        added += insertMissing(streakRepo, nullToEmpty(snapshot.streaks()), StreakData::id, st -> Streak.builder()
                .id(st.id()).skillId(st.skillId()).currentStreak(st.currentStreak()).longestStreak(st.longestStreak())
                .lastCompletionDate(st.lastCompletionDate()).createdAt(st.createdAt())
                .build());
        added += insertMissing(goalRepo, nullToEmpty(snapshot.goals()), GoalData::id, g -> Goal.builder()
                .id(g.id()).title(g.title()).description(g.description()).goalType(GoalType.parse(g.goalType()))
                .targetValue(g.targetValue()).currentValue(g.currentValue()).status(parseGoalStatus(g.status()))
                .skillId(g.skillId()).milestones(new ArrayList<>(nullToEmpty(g.milestones())))
                .deadline(g.deadline()).createdAt(g.createdAt()).completedAt(g.completedAt())
                .build());
        added += insertMissing(templateRepo, nullToEmpty(snapshot.templates()), TemplateData::id, t -> MissionTemplate.builder()
                .id(t.id()).name(t.name()).description(t.description()).category(TemplateCategory.parse(t.category()))
                .missions(new ArrayList<>(nullToEmpty(t.missions()).stream().map(m -> TemplateMission.builder()
                        .title(m.title()).note(m.note()).difficulty(m.difficulty()).energy(m.energy())
                        .build()).toList()))
                .timesUsed(t.timesUsed()).createdAt(t.createdAt())
                .build());
        playerRepo.flush();
        return added;
    }

    public String toJson(GameSnapshot snapshot) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise snapshot", e);
        }
    }

    public GameSnapshot fromJson(String json) {
        try {
            return objectMapper.readValue(json, GameSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed snapshot: " + e.getOriginalMessage());
        }
    }

    // ===== 內部方法 =====

    private void clearAll() {
        completionRepo.deleteAll();
        cycleRecordRepo.deleteAll();
        missionRepo.deleteAll();
        skillRepo.deleteAll();
        redemptionRepo.deleteAll();
        rewardRepo.deleteAll();
        journalRepo.deleteAll();
        capsuleRepo.deleteAll();
        streakRepo.deleteAll();
        goalRepo.deleteAll();
        templateRepo.deleteAll();
        playerRepo.deleteAll();
        // 刪除須先寫入資料庫，才能重新插入相同 id
        playerRepo.flush();
    }

    private static <D, E> int insertMissing(JpaRepository<E, String> repo, List<D> rows,
                                            Function<D, String> idOf, Function<D, E> toEntity) {
        int added = 0;
        for (D row : rows) {
            if (repo.existsById(idOf.apply(row))) {
                continue;
            }
            repo.save(toEntity.apply(row));
            added++;
        }
        return added;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static GoalStatus parseGoalStatus(String value) {
        try {
            return GoalStatus.valueOf(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidInputException("Unrecognized goal status in snapshot: " + value);
        }
    }

    private static UnlockType parseUnlockType(String value) {
        try {
            return UnlockType.valueOf(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidInputException("Unrecognized unlock type in snapshot: " + value);
        }
    }
}
