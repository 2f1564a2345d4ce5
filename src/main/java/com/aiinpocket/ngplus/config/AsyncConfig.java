package com.aiinpocket.ngplus.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 背景任務設定。
 *
 * <ul>
 *   <li>{@code navigatorExecutor}：任務完成提交後的導航重新分析</li>
 * </ul>
 *
 * <p>任務完成不會等待此執行緒池。分析讀取的是快照，排隊較久的重算
 * 只會產生稍舊的建議。
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * 單一使用者一條執行緒即可，短佇列吸收連續完成的尖峰。
     * 佇列滿時由呼叫端（提交後的監聽執行緒）自行執行。
     */
    @Bean
    public TaskExecutor navigatorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(5);
        executor.setThreadNamePrefix("navigator-");
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
