package com.wallet.monitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class SyncExecutorConfig {

    public static final String SYNC_EXECUTOR = "syncExecutor";

    @Bean(name = SYNC_EXECUTOR)
    public ThreadPoolTaskExecutor syncExecutor(MonitorConfig monitorConfig) {
        int poolSize = Math.max(1, monitorConfig.getSync().getPoolSize());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(poolSize);
        e.setMaxPoolSize(poolSize);
        e.setThreadNamePrefix("wallet-sync-");
        e.initialize();
        return e;
    }
}
