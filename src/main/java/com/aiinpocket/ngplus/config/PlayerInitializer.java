package com.aiinpocket.ngplus.config;

import com.aiinpocket.ngplus.model.entity.Player;
import com.aiinpocket.ngplus.service.PlayerService;
import com.aiinpocket.ngplus.service.capsule.CapsuleService;
import com.aiinpocket.ngplus.service.progression.CompletionLockService;
import com.aiinpocket.ngplus.service.progression.CycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 啟動時：
 * - 首次啟動建立玩家
 * - 補輪替停機期間已結束的週期
 * - 執行一次膠囊日期檢查，讓逾期膠囊立即開啟
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlayerInitializer implements ApplicationRunner {

    private final PlayerService playerService;
    private final CycleManager cycleManager;
    private final CompletionLockService lockService;
    private final CapsuleService capsuleService;

    @Override
    public void run(ApplicationArguments args) {
        Player player = playerService.ensurePlayer();
        int rolled = lockService.executeWithLock("startup rollover", cycleManager::rolloverDueSkills);
        capsuleService.tick();
        log.info("[啟動恢復] 玩家 {} Lv.{}，補輪替 {} 個逾期週期",
                player.getDisplayName(), player.getLevel(), rolled);
    }
}
