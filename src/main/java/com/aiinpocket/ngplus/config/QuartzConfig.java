package com.aiinpocket.ngplus.config;

import com.aiinpocket.ngplus.job.CapsuleDateTickJob;
import com.aiinpocket.ngplus.job.CycleRolloverJob;
import org.quartz.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QuartzConfig {

    // 任務完成時會自行輪替，此排程負責玩家閒置期間結束的週期
    @Bean
    public JobDetail cycleRolloverJobDetail() {
        return JobBuilder.newJob(CycleRolloverJob.class)
                .withIdentity("cycleRolloverJob", "engine")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger cycleRolloverTrigger(JobDetail cycleRolloverJobDetail) {
        return TriggerBuilder.newTrigger()
                .forJob(cycleRolloverJobDetail)
                .withIdentity("cycleRolloverTrigger", "engine")
                .withSchedule(CronScheduleBuilder.cronSchedule("0 */15 * * * ?"))
                .build();
    }

    @Bean
    public JobDetail capsuleDateTickJobDetail() {
        return JobBuilder.newJob(CapsuleDateTickJob.class)
                .withIdentity("capsuleDateTickJob", "engine")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger capsuleDateTickTrigger(JobDetail capsuleDateTickJobDetail) {
        return TriggerBuilder.newTrigger()
                .forJob(capsuleDateTickJobDetail)
                .withIdentity("capsuleDateTickTrigger", "engine")
                .withSchedule(CronScheduleBuilder.cronSchedule("0 5 * * * ?"))
                .build();
    }
}
