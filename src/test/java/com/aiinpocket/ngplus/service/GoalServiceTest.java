package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.exception.StateViolationException;
import com.aiinpocket.ngplus.model.dto.GoalProgress;
import com.aiinpocket.ngplus.model.dto.GoalRequest;
import com.aiinpocket.ngplus.model.dto.RewardRequest;
import com.aiinpocket.ngplus.model.entity.Goal;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.Reward;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.model.enums.GameEventType;
import com.aiinpocket.ngplus.model.enums.GoalStatus;
import com.aiinpocket.ngplus.repository.GameEventLogRepository;
import com.aiinpocket.ngplus.service.progression.CompletionProcessor;
import com.aiinpocket.ngplus.support.EngineJpaTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GoalServiceTest extends EngineJpaTest {

    @Autowired
    private GoalService goalService;

    @Autowired
    private CompletionProcessor processor;

    @Autowired
    private RewardService rewardService;

    @Autowired
    private GameEventLogRepository eventLogRepo;

    @Test
    void missionCountGoalTracksMilestonesAndCompletes() {
        Skill writing = newSkill("Writing");
        Mission essay = newMission("Essay", 2, writing.getId());
        processor.completeMission(essay.getId());
        clock.advance(Duration.ofMinutes(1));

        Goal goal = goalService.createGoal(goalRequest("Three essays", "MISSION_COUNT", 3, null, List.of(2L))).goal();
        assertEquals(0, goal.getCurrentValue());

        clock.advance(Duration.ofMinutes(1));
        processor.completeMission(essay.getId());
        assertEquals(1, goal.getCurrentValue());
        processor.completeMission(essay.getId());
        assertEquals(2, goal.getCurrentValue());
        assertEquals(1, eventLogRepo.countByEventType(GameEventType.GOAL_MILESTONE));
        assertNull(goal.nextMilestone());

        processor.completeMission(essay.getId());
        assertEquals(GoalStatus.COMPLETED, goal.getStatus());
        assertEquals(clock.instant(), goal.getCompletedAt());
        assertEquals(100.0, goal.progressPercentage(), 1e-9);
        assertEquals(1, eventLogRepo.countByEventType(GameEventType.GOAL_COMPLETED));
    }

    @Test
    void skillScopedCountIgnoresOtherSkills() {
        Skill writing = newSkill("Writing");
        Skill reading = newSkill("Reading");
        Mission essay = newMission("Essay", 2, writing.getId());
        Mission novel = newMission("Novel", 2, reading.getId());
        Mission review = newMission("Review", 2, writing.getId(), reading.getId());
        Goal goal = goalService.createGoal(goalRequest("Read more", "MISSION_COUNT", 10, reading.getId(), null)).goal();

        processor.completeMission(essay.getId());
        processor.completeMission(novel.getId());
        processor.completeMission(review.getId());

        assertEquals(2, goal.getCurrentValue());
        assertEquals(20.0, goal.progressPercentage(), 1e-9);
    }

    @Test
    void goalAlreadyMetCompletesOnCreation() {
        GoalProgress progress = goalService.createGoal(goalRequest("Exist", "PLAYER_LEVEL", 1, null, null));

        assertTrue(progress.justCompleted());
        assertEquals(GoalStatus.COMPLETED, progress.goal().getStatus());
        assertEquals(List.of(progress.goal()), goalService.list(GoalStatus.COMPLETED));
    }

    @Test
    void completedCoinGoalStaysCompletedAfterSpending() {
        Skill writing = newSkill("Writing");
        Mission hard = newMission("Hard", 5, writing.getId());
        Goal goal = goalService.createGoal(goalRequest("Save up", "COIN_TARGET", 10, null, null)).goal();

        processor.completeMission(hard.getId());
        assertEquals(GoalStatus.COMPLETED, goal.getStatus());

        Reward snack = rewardService.createReward(new RewardRequest("Snack", 8, null));
        rewardService.redeem(snack.getId(), null);

        assertEquals(GoalStatus.COMPLETED, goal.getStatus());
        assertEquals(10, goal.getCurrentValue());
    }

    @Test
    void skillLevelAndStreakGoalsFollowEngineState() {
        Skill writing = newSkill("Writing");
        Mission hard = newMission("Hard", 5, writing.getId());
        Goal level = goalService.createGoal(goalRequest("Writer II", "SKILL_LEVEL", 2, writing.getId(), null)).goal();
        Goal streak = goalService.createGoal(goalRequest("Two days", "STREAK", 2, writing.getId(), null)).goal();

        processor.completeMission(hard.getId());
        assertEquals(1, level.getCurrentValue());
        assertEquals(1, streak.getCurrentValue());

        for (int i = 0; i < 3; i++) {
            processor.completeMission(hard.getId());
        }
        assertEquals(GoalStatus.COMPLETED, level.getStatus());

        clock.advance(Duration.ofDays(1));
        processor.completeMission(hard.getId());
        assertEquals(GoalStatus.COMPLETED, streak.getStatus());
    }

    @Test
    void customGoalTakesManualProgressOnly() {
        Goal custom = goalService.createGoal(goalRequest("Read 12 books", "CUSTOM", 12, null, List.of(6L))).goal();
        Goal measured = goalService.createGoal(goalRequest("Level 5", "PLAYER_LEVEL", 5, null, null)).goal();

        GoalProgress half = goalService.updateProgress(custom.getId(), 7);
        assertEquals(6L, half.milestoneHit());
        assertFalse(half.justCompleted());

        assertThrows(StateViolationException.class, () -> goalService.updateProgress(measured.getId(), 5));

        goalService.archive(custom.getId());
        assertThrows(StateViolationException.class, () -> goalService.updateProgress(custom.getId(), 12));
    }

    @Test
    void rejectsBadGoals() {
        assertThrows(InvalidInputException.class,
                () -> goalService.createGoal(goalRequest("?", "WEALTH", 5, null, null)));
        assertThrows(InvalidInputException.class,
                () -> goalService.createGoal(goalRequest("No skill", "SKILL_LEVEL", 5, null, null)));
        assertThrows(NotFoundException.class,
                () -> goalService.createGoal(goalRequest("Ghost", "SKILL_LEVEL", 5, "missing", null)));
        assertThrows(InvalidInputException.class,
                () -> goalService.createGoal(goalRequest("Zero", "CUSTOM", 0, null, null)));
        assertThrows(InvalidInputException.class,
                () -> goalService.createGoal(goalRequest("Past target", "CUSTOM", 5, null, List.of(5L))));
        assertThrows(NotFoundException.class, () -> goalService.get("missing"));
    }

    private static GoalRequest goalRequest(String title, String type, long target, String skillId, List<Long> milestones) {
        return new GoalRequest(title, null, type, target, skillId, null, milestones);
    }
}
