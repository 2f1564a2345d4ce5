package com.aiinpocket.ngplus.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * 引擎使用的時鐘與亂數來源。
 * 兩者皆為一般 Bean，測試可替換為固定時鐘或指定種子的產生器。
 */
@Configuration
@Slf4j
public class EngineConfig {

    private static final String RNG_ALGORITHM = "L64X128MixRandom";

    @Bean
    public Clock engineClock(ProgressionProperties props) {
        ZoneId zone = ZoneId.of(props.zone());
        log.info("[引擎設定] 時鐘時區 {}", zone);
        return Clock.system(zone);
    }

    /**
     * 用於週期目標抽選與反思代幣擲骰。
     * 設定種子後每次抽選皆可重現。
     */
    @Bean
    public RandomGenerator engineRandom(ProgressionProperties props) {
        RandomGeneratorFactory<RandomGenerator> factory = RandomGeneratorFactory.of(RNG_ALGORITHM);
        if (props.randomSeed() != null) {
            log.info("[引擎設定] 亂數產生器 {} 使用種子 {}", RNG_ALGORITHM, props.randomSeed());
            return factory.create(props.randomSeed());
        }
        return factory.create();
    }
}
