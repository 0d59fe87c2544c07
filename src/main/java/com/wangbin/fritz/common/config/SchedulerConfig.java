package com.wangbin.fritz.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

@Configuration
public class SchedulerConfig {

    /**
     * 轮询调度线程池，单线程保证回调串行执行
     */
    @Bean(name = "pollScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService pollScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1,
                new ThreadFactoryBuilder()
                        .setNameFormat("fritz-poll-%d")
                        .setDaemon(true)
                        .setPriority(Thread.NORM_PRIORITY)
                        .build());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
