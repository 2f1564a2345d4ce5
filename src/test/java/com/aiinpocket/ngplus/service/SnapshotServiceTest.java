package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.model.dto.GameSnapshot;
import com.aiinpocket.ngplus.model.dto.GoalRequest;
import com.aiinpocket.ngplus.model.dto.JournalRequest;
import com.aiinpocket.ngplus.model.dto.RewardRequest;
import com.aiinpocket.ngplus.model.dto.TemplateRequest;
import com.aiinpocket.ngplus.model.entity.Goal;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.repository.CompletionRepository;
import com.aiinpocket.ngplus.repository.MissionRepository;
import com.aiinpocket.ngplus.service.progression.CompletionProcessor;
import com.aiinpocket.ngplus.service.template.TemplateService;
import com.aiinpocket.ngplus.support.EngineJpaTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotServiceTest extends EngineJpaTest {

    @Autowired
    private SnapshotService snapshotService;

    @Autowired
    private CompletionProcessor processor;

    @Autowired
    private RewardService rewardService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private CompletionRepository completionRepo;

    @Autowired
    private MissionRepository missionRepo;

    @Autowired
    private GoalService goalService;

    @Autowired
    private StreakService streakService;

    @Autowired
    private TemplateService templateService;

    @Test
    void replaceImportReproducesCycleState() {
        Skill writing = newSkill("Writing");
        newMissions(8, 3, writing.getId());
        clock.set(Instant.parse("2026-03-09T12:00:00Z"));
        skillService.rolloverNow();
        String skillId = writing.getId();
        String target = writing.getTargetMissionId();
        processor.completeMission(target);
        rewardService.createReward(new RewardRequest("Movie", 50, null));
        journalService.write(new JournalRequest("First week done", skillId, target, true));

        String json = snapshotService.toJson(snapshotService.exportSnapshot());
        snapshotService.importSnapshot(snapshotService.fromJson(json), false);

        Skill restored = skillService.get(skillId);
        assertEquals(target, restored.getTargetMissionId());
        assertTrue(restored.isHitTargetThisCycle());
        assertEquals(Instant.parse("2026-03-09T00:00:00Z"), restored.getCycleStart());
        assertEquals(2, restored.getLevel());
        assertEquals(1, rewardService.listActive().size());
        assertEquals(1, journalService.list(skillId).size());
        assertEquals(132 - 120, playerService.currentPlayer().getXp());

        restored.setHitTargetThisCycle(false);
        assertFalse(processor.completeMission(target).anyCycleBonus());
    }

    @Test
    void mergeImportOnlyAddsUnknownRows() {
        Skill writing = newSkill("Writing");
        newMission("Essay", 2, writing.getId());
        GameSnapshot snapshot = snapshotService.exportSnapshot();

        newMission("Poem", 1, writing.getId());
        snapshotService.importSnapshot(snapshot, true);

        assertEquals(2, missionRepo.count());
        assertEquals("Writing", skillService.get(writing.getId()).getName());
    }

    @Test
    void replaceImportDropsRowsMissingFromSnapshot() {
        Skill writing = newSkill("Writing");
        GameSnapshot snapshot = snapshotService.exportSnapshot();

        newMission("Poem", 1, writing.getId());
        snapshotService.importSnapshot(snapshot, false);

        assertEquals(0, missionRepo.count());
        assertEquals(0, completionRepo.count());
    }

    @Test
    void rejectsUnsupportedVersionAndMalformedJson() {
        GameSnapshot current = snapshotService.exportSnapshot();
        GameSnapshot future = new GameSnapshot(99, current.exportedAt(), current.player(), current.skills(),
                current.missions(), current.completions(), current.cycleRecords(), current.rewards(),
                current.redemptions(), current.journal(), current.capsules(), current.streaks(), current.goals(),
                current.templates());

        assertThrows(InvalidInputException.class, () -> snapshotService.importSnapshot(future, false));
        assertThrows(InvalidInputException.class, () -> snapshotService.fromJson("{\"version\":"));
    }

    @Test
    void completionRowWithoutAwardsImportsAsBaseOnly() {
        Skill writing = newSkill("Writing");
        processor.completeMission(newMission("Essay", 2, writing.getId()).getId());
        GameSnapshot current = snapshotService.exportSnapshot();
        GameSnapshot.CompletionData row = current.completions().get(0);
        GameSnapshot.CompletionData bare = new GameSnapshot.CompletionData(row.id(), row.missionId(), row.difficulty(),
                row.completedAt(), row.basePlayerXp(), row.cyclePlayerXp(), row.coins(), row.reflectionToken(), null);

        snapshotService.importSnapshot(withCompletions(current, List.of(bare)), false);

        assertEquals(1, completionRepo.count());
        assertTrue(completionRepo.findById(row.id()).orElseThrow().getAwards().isEmpty());
    }

    @Test
    void mergeWithDuplicateCycleCreditIsRejected() {
        Skill writing = newSkill("Writing");
        newMissions(8, 3, writing.getId());
        clock.set(Instant.parse("2026-03-09T12:00:00Z"));
        skillService.rolloverNow();
        processor.completeMission(writing.getTargetMissionId());
        GameSnapshot current = snapshotService.exportSnapshot();
        GameSnapshot.CompletionData paid = current.completions().get(0);
        assertTrue(paid.awards().get(0).cycleAward());

        List<GameSnapshot.CompletionData> rows = new ArrayList<>(current.completions());
        rows.add(new GameSnapshot.CompletionData(UUID.randomUUID().toString(), paid.missionId(), paid.difficulty(),
                paid.completedAt(), paid.basePlayerXp(), paid.cyclePlayerXp(), paid.coins(), paid.reflectionToken(),
                paid.awards()));

        assertThrows(InvalidInputException.class,
                () -> snapshotService.importSnapshot(withCompletions(current, rows), true));
    }

    @Test
    void replaceImportKeepsGoalsStreaksAndTemplates() {
        Skill writing = newSkill("Writing");
        Goal goal = goalService.createGoal(new GoalRequest("Five missions", null, "MISSION_COUNT", 5,
                writing.getId(), null, List.of(2L, 4L))).goal();
        String goalId = goal.getId();
        processor.completeMission(newMission("Essay", 2, writing.getId()).getId());
        String templateId = templateService.createTemplate(new TemplateRequest("Evening", null, null,
                List.of(new TemplateRequest.Entry("Journal", null, 1, 1)))).id();

        String json = snapshotService.toJson(snapshotService.exportSnapshot());
        snapshotService.importSnapshot(snapshotService.fromJson(json), false);

        Goal restored = goalService.get(goalId);
        assertEquals(1, restored.getCurrentValue());
        assertEquals(List.of(2L, 4L), restored.getMilestones());
        assertEquals(1, streakService.currentStreak(writing.getId(), clock.instant()));
        assertEquals("Journal", templateService.get(templateId).missions().get(0).title());
    }

    private static GameSnapshot withCompletions(GameSnapshot s, List<GameSnapshot.CompletionData> completions) {
        return new GameSnapshot(s.version(), s.exportedAt(), s.player(), s.skills(), s.missions(), completions,
                s.cycleRecords(), s.rewards(), s.redemptions(), s.journal(), s.capsules(), s.streaks(), s.goals(),
                s.templates());
    }
}
