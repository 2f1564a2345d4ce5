package com.aiinpocket.ngplus.job;

import com.aiinpocket.ngplus.service.progression.CompletionLockService;
import com.aiinpocket.ngplus.service.progression.CycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 週期輪替排程（每 15 分鐘），沒有任務完成時也會輪替已結束的週期。
 * 在完成鎖內執行，不會與任務完成交錯。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CycleRolloverJob extends QuartzJobBean {

    private final CycleManager cycleManager;
    private final CompletionLockService lockService;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        try {
            int rolled = lockService.executeWithLock("CycleRolloverJob", cycleManager::rolloverDueSkills);
            log.debug("[週期排程] 輪替完成，共 {} 個技能", rolled);
        } catch (Exception e) {
            log.error("[週期排程] 執行失敗: {}", e.getMessage(), e);
        }
    }
}
