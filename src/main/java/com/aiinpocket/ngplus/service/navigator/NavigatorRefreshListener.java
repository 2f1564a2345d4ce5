package com.aiinpocket.ngplus.service.navigator;

import com.aiinpocket.ngplus.model.event.GameEvent;
import com.aiinpocket.ngplus.model.event.MissionCompleted;
import com.aiinpocket.ngplus.model.event.RewardRedeemed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 任務完成或兌換提交後，於背景重新分析。
 * 完成請求不會等待此處。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NavigatorRefreshListener {

    private final NavigatorService navigatorService;

    @Async("navigatorExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onMissionCompleted(MissionCompleted event) {
        refresh(event);
    }

    @Async("navigatorExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRewardRedeemed(RewardRedeemed event) {
        refresh(event);
    }

    private void refresh(GameEvent trigger) {
        try {
            navigatorService.refresh();
        } catch (RuntimeException e) {
            log.error("[導航] {} 後背景重算失敗", trigger.getClass().getSimpleName(), e);
        }
    }
}
