package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.MissionNotFoundException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.exception.StateViolationException;
import com.aiinpocket.ngplus.model.dto.MissionRequest;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.repository.CompletionRepository;
import com.aiinpocket.ngplus.repository.MissionRepository;
import com.aiinpocket.ngplus.repository.SkillRepository;
import com.aiinpocket.ngplus.service.progression.CompletionLockService;
import com.aiinpocket.ngplus.service.progression.ProgressionCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 任務管理。技能指派的變更只在下次輪替時影響就緒判斷；
 * 作為技能目前目標的任務，在輪替前不能離開該技能。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MissionService {

    private static final int MAX_SKILLS = 2;

    private final MissionRepository missionRepo;
    private final SkillRepository skillRepo;
    private final CompletionRepository completionRepo;
    private final CompletionLockService lockService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Mission> list(boolean includeArchived) {
        return includeArchived
                ? missionRepo.findAllByOrderByCreatedAtAsc()
                : missionRepo.findByArchivedFalseOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public Mission get(String missionId) {
        return missionRepo.findById(missionId).orElseThrow(() -> new MissionNotFoundException(missionId));
    }

    @Transactional(readOnly = true)
    public List<Mission> assignedTo(String skillId) {
        return missionRepo.findAssignedToSkill(skillId);
    }

    @Transactional
    public Mission createMission(MissionRequest request) {
        requireTitle(request.title());
        ProgressionCalculator.requireDifficulty(request.difficulty());
        requireEnergy(request.energy());
        List<String> skillIds = validateSkills(request.skillIds());

        Mission mission = missionRepo.save(Mission.builder()
                .title(request.title().trim())
                .note(request.note())
                .difficulty(request.difficulty())
                .energy(request.energy())
                .skillIds(new ArrayList<>(skillIds))
                .createdAt(clock.instant())
                .build());
        log.info("[任務] 建立 {} (D{}，技能 {})", mission.getTitle(), mission.getDifficulty(), skillIds);
        return mission;
    }

    /**
     * 標題與備註隨時可改；任務一旦有完成紀錄，難度、體力與技能即凍結。
     */
    public Mission updateMission(String missionId, MissionRequest request) {
        return lockService.executeWithLock("update of mission " + missionId, () -> applyUpdate(missionId, request));
    }

    private Mission applyUpdate(String missionId, MissionRequest request) {
        Mission mission = get(missionId);
        requireTitle(request.title());
        ProgressionCalculator.requireDifficulty(request.difficulty());
        requireEnergy(request.energy());
        List<String> skillIds = validateSkills(request.skillIds());

        boolean frozenFieldsChanged = mission.getDifficulty() != request.difficulty()
                || mission.getEnergy() != request.energy()
                || !mission.getSkillIds().equals(skillIds);
        if (frozenFieldsChanged && completionRepo.existsByMissionId(missionId)) {
            throw new StateViolationException(
                    "Difficulty, energy and skills cannot change after a mission has been completed");
        }
        List<String> dropped = mission.getSkillIds().stream().filter(id -> !skillIds.contains(id)).toList();
        requireNotTargetOf(mission, dropped);

        mission.setTitle(request.title().trim());
        mission.setNote(request.note());
        mission.setDifficulty(request.difficulty());
        mission.setEnergy(request.energy());
        if (!mission.getSkillIds().equals(skillIds)) {
            mission.getSkillIds().clear();
            mission.getSkillIds().addAll(skillIds);
        }
        mission.setUpdatedAt(clock.instant());
        return missionRepo.save(mission);
    }

    public Mission setArchived(String missionId, boolean archived) {
        return lockService.executeWithLock("archive of mission " + missionId, () -> applyArchived(missionId, archived));
    }

    private Mission applyArchived(String missionId, boolean archived) {
        Mission mission = get(missionId);
        if (archived && !mission.isArchived()) {
            requireNotTargetOf(mission, mission.getSkillIds());
        }
        mission.setArchived(archived);
        mission.setUpdatedAt(clock.instant());
        log.info("[任務] {} {}", mission.getTitle(), archived ? "已封存" : "已還原");
        return missionRepo.save(mission);
    }

    // ===== 驗證 =====

    /** 技能的目前目標在週期輪替前必須留在該技能的任務中 */
    private void requireNotTargetOf(Mission mission, List<String> skillIds) {
        for (Skill skill : skillRepo.findAllById(skillIds)) {
            if (mission.getId().equals(skill.getTargetMissionId())) {
                throw new StateViolationException(String.format(
                        "Mission is the current cycle target of %s and stays assigned until %s",
                        skill.getName(), skill.getCycleEnd()));
            }
        }
    }

    private List<String> validateSkills(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new InvalidInputException("A mission needs at least one skill");
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(requested));
        if (distinct.size() != requested.size()) {
            throw new InvalidInputException("A skill can only be listed once per mission");
        }
        if (distinct.size() > MAX_SKILLS) {
            throw new InvalidInputException("A mission can have at most " + MAX_SKILLS + " skills, got " + distinct.size());
        }
        for (String skillId : distinct) {
            Skill skill = skillRepo.findById(skillId).orElseThrow(() -> NotFoundException.skill(skillId));
            if (skill.isArchived()) {
                throw new StateViolationException("Skill is archived: " + skill.getName());
            }
        }
        return distinct;
    }

    private static void requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new InvalidInputException("Mission title is required");
        }
    }

    private static void requireEnergy(int energy) {
        if (energy < 1 || energy > 5) {
            throw new InvalidInputException("Energy must be 1-5, got " + energy);
        }
    }
}
