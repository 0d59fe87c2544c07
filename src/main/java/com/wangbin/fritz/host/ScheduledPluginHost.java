package com.wangbin.fritz.host;

import com.wangbin.fritz.common.exception.CollectorException;
import com.wangbin.fritz.core.config.FritzProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 内嵌宿主：应用启动后依次执行配置、初始化回调，再按固定间隔调度读取回调，
 * 应用关闭时执行关闭回调。
 */
@Slf4j
@Component
public class ScheduledPluginHost implements PluginHost {

    private final FritzProperties properties;
    private final ScheduledExecutorService pollScheduler;

    private ConfigCallback configCallback;
    private InitCallback initCallback;
    private ReadCallback readCallback;
    private ShutdownCallback shutdownCallback;

    private ScheduledFuture<?> readTask;
    private volatile boolean started = false;

    public ScheduledPluginHost(FritzProperties properties,
                               @Qualifier("pollScheduler") ScheduledExecutorService pollScheduler) {
        this.properties = properties;
        this.pollScheduler = pollScheduler;
    }

    @Override
    public void registerConfig(ConfigCallback callback) {
        this.configCallback = callback;
    }

    @Override
    public void registerInit(InitCallback callback) {
        this.initCallback = callback;
    }

    @Override
    public void registerRead(ReadCallback callback) {
        this.readCallback = callback;
    }

    @Override
    public void registerShutdown(ShutdownCallback callback) {
        this.shutdownCallback = callback;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (configCallback != null) {
            configCallback.configure(properties.toConfigEntries());
        }

        started = true;
        if (initCallback != null) {
            try {
                initCallback.init();
            } catch (CollectorException e) {
                log.error("插件初始化失败，不再调度读取: {}", e.getMessage(), e);
                return;
            }
        }

        if (readCallback == null) {
            log.warn("插件未注册读取回调");
            return;
        }
        long intervalMs = properties.getInterval().toMillis();
        readTask = pollScheduler.scheduleWithFixedDelay(this::runRead, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("读取回调已调度，间隔 {}ms", intervalMs);
    }

    private void runRead() {
        try {
            readCallback.read();
        } catch (Exception e) {
            log.error("读取回调执行异常", e);
        }
    }

    @PreDestroy
    public void stop() {
        if (readTask != null) {
            readTask.cancel(false);
        }
        if (started && shutdownCallback != null) {
            // 与读取回调在同一线程执行，避免和正在进行的轮询并发
            try {
                pollScheduler.submit(shutdownCallback::shutdown).get(30, TimeUnit.SECONDS);
            } catch (Exception e) {
                log.error("关闭回调执行失败", e);
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        started = false;
    }
}
