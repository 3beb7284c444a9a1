package com.example.plannerv1.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class PerformanceConfig {

    /**
     * 旧形式移行ジョブ用の専用スレッドプール
     * 移行は1件ずつ順に処理するため、同時実行数は小さく抑える
     */
    @Bean(name = "migrationExecutor")
    public Executor migrationExecutor(
            @Value("${planner.migration.executor.core-pool-size:1}") int corePoolSize,
            @Value("${planner.migration.executor.max-pool-size:2}") int maxPoolSize,
            @Value("${planner.migration.executor.queue-capacity:10}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("Migration-");
        executor.initialize();
        return executor;
    }
}
