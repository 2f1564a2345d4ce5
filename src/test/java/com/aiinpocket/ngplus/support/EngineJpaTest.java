package com.aiinpocket.ngplus.support;

import com.aiinpocket.ngplus.config.ProgressionProperties;
import com.aiinpocket.ngplus.model.dto.MissionRequest;
import com.aiinpocket.ngplus.model.dto.SkillRequest;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.service.GameEventService;
import com.aiinpocket.ngplus.service.GoalService;
import com.aiinpocket.ngplus.service.JournalService;
import com.aiinpocket.ngplus.service.MissionService;
import com.aiinpocket.ngplus.service.PlayerService;
import com.aiinpocket.ngplus.service.RewardService;
import com.aiinpocket.ngplus.service.SkillMetricsService;
import com.aiinpocket.ngplus.service.SkillService;
import com.aiinpocket.ngplus.service.SnapshotService;
import com.aiinpocket.ngplus.service.StreakService;
import com.aiinpocket.ngplus.service.capsule.CapsuleService;
import com.aiinpocket.ngplus.service.capsule.CapsuleTrigger;
import com.aiinpocket.ngplus.service.navigator.NavigatorEngine;
import com.aiinpocket.ngplus.service.navigator.NavigatorService;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshotLoader;
import com.aiinpocket.ngplus.service.navigator.detector.*;
import com.aiinpocket.ngplus.service.progression.CompletionLockService;
import com.aiinpocket.ngplus.service.progression.CompletionProcessor;
import com.aiinpocket.ngplus.service.progression.CycleManager;
import com.aiinpocket.ngplus.service.progression.ReflectionTokenPolicy;
import com.aiinpocket.ngplus.service.template.TemplateService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.ArrayList;
import java.util.List;

/**
 * 接上完整引擎的 JPA 切片測試。每個測試都從 {@link EngineTestConfig#START} 的新玩家開始。
 */
@DataJpaTest
@EnableConfigurationProperties(ProgressionProperties.class)
@Import({
        EngineTestConfig.class,
        PlayerService.class, SkillService.class, MissionService.class, RewardService.class,
        JournalService.class, GameEventService.class, SnapshotService.class,
        StreakService.class, GoalService.class, TemplateService.class, SkillMetricsService.class,
        CycleManager.class, CompletionProcessor.class, ReflectionTokenPolicy.class, CompletionLockService.class,
        CapsuleTrigger.class, CapsuleService.class,
        NavigatorService.class, NavigatorSnapshotLoader.class, NavigatorEngine.class,
        SkillImbalanceDetector.class, CycleUnderperformanceDetector.class, ReadinessGapDetector.class,
        ReflectionLapseDetector.class, FocusSaturationDetector.class, CoinHoardingDetector.class,
        DifficultySkewDetector.class
})
public abstract class EngineJpaTest {

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected FixedRandom random;

    @Autowired
    protected PlayerService playerService;

    @Autowired
    protected SkillService skillService;

    @Autowired
    protected MissionService missionService;

    @BeforeEach
    void resetEngine() {
        clock.set(EngineTestConfig.START);
        random.setDouble(0.0);
        random.setIndex(0);
        playerService.ensurePlayer();
    }

    protected Skill newSkill(String name) {
        return skillService.createSkill(new SkillRequest(name, null, "WEEKLY", null));
    }

    protected Mission newMission(String title, int difficulty, String... skillIds) {
        return missionService.createMission(new MissionRequest(title, null, difficulty, 3, List.of(skillIds)));
    }

    protected List<Mission> newMissions(int count, int difficulty, String skillId) {
        List<Mission> missions = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            missions.add(newMission("Mission " + i, difficulty, skillId));
        }
        return missions;
    }
}
