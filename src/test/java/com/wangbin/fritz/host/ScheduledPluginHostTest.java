package com.wangbin.fritz.host;

import com.wangbin.fritz.common.exception.CollectorException;
import com.wangbin.fritz.core.config.ConfigEntry;
import com.wangbin.fritz.core.config.FritzProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledPluginHostTest {

    private ScheduledExecutorService scheduler;
    private FritzProperties properties;
    private ScheduledPluginHost host;

    private final List<String> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        properties = new FritzProperties();
        properties.setAddress("192.168.178.1");
        properties.setInterval(Duration.ofMillis(20));
        host = new ScheduledPluginHost(properties, scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void runsCallbacksInOrderAndRepeatsRead() throws Exception {
        CountDownLatch reads = new CountDownLatch(3);
        List<ConfigEntry> received = new CopyOnWriteArrayList<>();
        host.registerConfig(entries -> {
            events.add("config");
            received.addAll(entries);
        });
        host.registerInit(() -> events.add("init"));
        host.registerRead(() -> {
            events.add("read");
            reads.countDown();
        });
        host.registerShutdown(() -> events.add("shutdown"));

        host.start();
        assertTrue(reads.await(5, TimeUnit.SECONDS));
        host.stop();

        assertEquals(List.of("config", "init", "read"), events.subList(0, 3));
        assertEquals("shutdown", events.get(events.size() - 1));
        assertEquals(1, events.stream().filter("shutdown"::equals).count());
        assertEquals("Address", received.get(0).getKey());
        assertEquals("192.168.178.1", received.get(0).firstValue());
    }

    @Test
    void readFailureDoesNotStopSchedule() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch reads = new CountDownLatch(2);
        host.registerRead(() -> {
            attempts.incrementAndGet();
            reads.countDown();
            throw new IllegalStateException("boom");
        });

        host.start();
        assertTrue(reads.await(5, TimeUnit.SECONDS));
        host.stop();

        assertTrue(attempts.get() >= 2);
    }

    @Test
    void initFailureSkipsReadButStillShutsDown() throws Exception {
        host.registerInit(() -> {
            throw CollectorException.connectionException("unreachable", null);
        });
        host.registerRead(() -> events.add("read"));
        host.registerShutdown(() -> events.add("shutdown"));

        host.start();
        Thread.sleep(100);
        host.stop();

        assertEquals(List.of("shutdown"), events);
    }
}
