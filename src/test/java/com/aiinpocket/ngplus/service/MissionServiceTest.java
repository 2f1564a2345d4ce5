package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.exception.InvalidDifficultyException;
import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.exception.StateViolationException;
import com.aiinpocket.ngplus.model.dto.MissionRequest;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.service.progression.CompletionLockService;
import com.aiinpocket.ngplus.service.progression.CompletionProcessor;
import com.aiinpocket.ngplus.support.EngineJpaTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

class MissionServiceTest extends EngineJpaTest {

    @Autowired
    private CompletionProcessor processor;

    @MockitoSpyBean
    private CompletionLockService lockService;

    @Test
    void editAndArchiveRunUnderCompletionLock() {
        Skill writing = newSkill("Writing");
        Mission mission = newMission("Draft", 2, writing.getId());

        missionService.updateMission(mission.getId(), new MissionRequest("Draft v2", null, 2, 3, List.of(writing.getId())));
        missionService.setArchived(mission.getId(), true);

        verify(lockService).executeWithLock(eq("update of mission " + mission.getId()), any());
        verify(lockService).executeWithLock(eq("archive of mission " + mission.getId()), any());
        assertTrue(missionService.get(mission.getId()).isArchived());
    }

    @Test
    void missionNeedsOneOrTwoDistinctSkills() {
        Skill a = newSkill("Writing");
        Skill b = newSkill("Reading");
        Skill c = newSkill("Cardio");

        assertThrows(InvalidInputException.class,
                () -> missionService.createMission(new MissionRequest("Nothing", null, 2, 3, List.of())));
        assertThrows(InvalidInputException.class,
                () -> missionService.createMission(new MissionRequest("Too many", null, 2, 3,
                        List.of(a.getId(), b.getId(), c.getId()))));
        assertThrows(InvalidInputException.class,
                () -> missionService.createMission(new MissionRequest("Twice", null, 2, 3,
                        List.of(a.getId(), a.getId()))));
        assertThrows(NotFoundException.class,
                () -> missionService.createMission(new MissionRequest("Ghost", null, 2, 3, List.of("missing"))));

        Mission pair = missionService.createMission(new MissionRequest("Essay", null, 2, 3, List.of(a.getId(), b.getId())));
        assertEquals(List.of(a.getId(), b.getId()), pair.getSkillIds());
    }

    @Test
    void archivedSkillCannotTakeMissions() {
        Skill a = newSkill("Writing");
        skillService.setArchived(a.getId(), true);

        assertThrows(StateViolationException.class, () -> newMission("Essay", 2, a.getId()));
    }

    @Test
    void rejectsOutOfRangeDifficultyAndEnergy() {
        Skill a = newSkill("Writing");

        assertThrows(InvalidDifficultyException.class,
                () -> missionService.createMission(new MissionRequest("Essay", null, 6, 3, List.of(a.getId()))));
        assertThrows(InvalidInputException.class,
                () -> missionService.createMission(new MissionRequest("Essay", null, 3, 0, List.of(a.getId()))));
        assertThrows(InvalidInputException.class,
                () -> missionService.createMission(new MissionRequest(" ", null, 3, 3, List.of(a.getId()))));
    }

    @Test
    void completedMissionFreezesDifficultyEnergyAndSkills() {
        Skill a = newSkill("Writing");
        Skill b = newSkill("Reading");
        Mission mission = newMission("Essay", 2, a.getId());

        Mission edited = missionService.updateMission(mission.getId(),
                new MissionRequest("Essay", null, 4, 2, List.of(a.getId(), b.getId())));
        assertEquals(4, edited.getDifficulty());

        processor.completeMission(mission.getId());

        assertThrows(StateViolationException.class, () -> missionService.updateMission(mission.getId(),
                new MissionRequest("Essay", null, 5, 2, List.of(a.getId(), b.getId()))));
        assertThrows(StateViolationException.class, () -> missionService.updateMission(mission.getId(),
                new MissionRequest("Essay", null, 4, 2, List.of(a.getId()))));

        Mission renamed = missionService.updateMission(mission.getId(),
                new MissionRequest("Long essay", "two pages", 4, 2, List.of(a.getId(), b.getId())));
        assertEquals("Long essay", renamed.getTitle());
        assertEquals("two pages", renamed.getNote());
    }

    @Test
    void archivedMissionLeavesAssignedSet() {
        Skill a = newSkill("Writing");
        List<Mission> missions = newMissions(3, 2, a.getId());

        missionService.setArchived(missions.get(0).getId(), true);

        assertEquals(2, missionService.assignedTo(a.getId()).size());
        assertEquals(2, missionService.list(false).size());
        assertEquals(3, missionService.list(true).size());
    }

    @Test
    void currentTargetCannotLeaveItsSkill() {
        Skill writing = newSkill("Writing");
        Skill reading = newSkill("Reading");
        List<Mission> missions = newMissions(8, 2, writing.getId());
        clock.set(writing.getCycleEnd());
        skillService.rolloverNow();
        String target = writing.getTargetMissionId();
        assertNotNull(target);

        assertThrows(StateViolationException.class, () -> missionService.updateMission(target,
                new MissionRequest("Moved", null, 2, 3, List.of(reading.getId()))));
        assertThrows(StateViolationException.class, () -> missionService.setArchived(target, true));

        List<String> assigned = missionService.assignedTo(writing.getId()).stream().map(Mission::getId).toList();
        assertTrue(assigned.contains(target));
        assertEquals(List.of(writing.getId()), missionService.get(target).getSkillIds());
        assertFalse(missionService.get(target).isArchived());

        Mission shared = missionService.updateMission(target,
                new MissionRequest("Shared", null, 2, 3, List.of(writing.getId(), reading.getId())));
        assertEquals(List.of(writing.getId(), reading.getId()), shared.getSkillIds());

        Mission spare = missions.stream().filter(m -> !m.getId().equals(target)).findFirst().orElseThrow();
        Mission moved = missionService.updateMission(spare.getId(),
                new MissionRequest("Moved", null, 2, 3, List.of(reading.getId())));
        assertEquals(List.of(reading.getId()), moved.getSkillIds());
        assertEquals(target, writing.getTargetMissionId());
    }

    @Test
    void formerTargetIsFreeAfterRollover() {
        Skill writing = newSkill("Writing");
        newMissions(8, 2, writing.getId());
        clock.set(writing.getCycleEnd());
        skillService.rolloverNow();
        String target = writing.getTargetMissionId();

        random.setIndex(1);
        clock.set(writing.getCycleEnd());
        skillService.rolloverNow();

        assertNotEquals(target, writing.getTargetMissionId());
        assertTrue(missionService.setArchived(target, true).isArchived());
    }
}
