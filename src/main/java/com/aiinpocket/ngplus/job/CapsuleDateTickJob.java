package com.aiinpocket.ngplus.job;

import com.aiinpocket.ngplus.service.capsule.CapsuleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 時光膠囊每小時日期檢查。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapsuleDateTickJob extends QuartzJobBean {

    private final CapsuleService capsuleService;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        try {
            capsuleService.tick();
        } catch (Exception e) {
            log.error("[膠囊排程] 日期檢查失敗: {}", e.getMessage(), e);
        }
    }
}
