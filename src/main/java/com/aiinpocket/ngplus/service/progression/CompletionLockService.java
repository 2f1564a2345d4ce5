package com.aiinpocket.ngplus.service.progression;

import com.aiinpocket.ngplus.exception.ConcurrencyConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 完成鎖：序列化週期計分檢查與完成紀錄寫入。
 * 持鎖期間在單一交易內執行任務；獎勵表上的唯一計分鍵
 * 負責攔下漏過檢查的寫入。
 */
@Service
@Slf4j
public class CompletionLockService {

    private static final long LOCK_WAIT_SECONDS = 5;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public CompletionLockService(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * 取得鎖後在交易內執行 {@code task}。
     *
     * @param taskName 用於日誌與錯誤訊息
     * @throws ConcurrencyConflictException 無法及時取得鎖
     *                                      或唯一計分鍵拒絕寫入
     */
    public <T> T executeWithLock(String taskName, Supplier<T> task) {
        boolean acquired;
        try {
            acquired = lock.tryLock(LOCK_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException("Interrupted while waiting to run " + taskName, e);
        }
        if (!acquired) {
            log.warn("[完成鎖] {} 等待 {} 秒仍未取得鎖，放棄", taskName, LOCK_WAIT_SECONDS);
            throw new ConcurrencyConflictException("Another completion is in progress, retry " + taskName);
        }
        try {
            return transactionTemplate.execute(status -> task.get());
        } catch (DataIntegrityViolationException e) {
            log.warn("[完成鎖] {} 違反週期計分唯一鍵: {}", taskName, e.getMostSpecificCause().getMessage());
            throw new ConcurrencyConflictException("Cycle credit was already recorded, retry " + taskName, e);
        } finally {
            lock.unlock();
        }
    }
}
