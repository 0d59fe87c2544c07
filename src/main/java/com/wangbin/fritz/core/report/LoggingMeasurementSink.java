package com.wangbin.fritz.core.report;

import com.wangbin.fritz.common.utils.JsonUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 日志上报通道：每条记录输出一行JSON，并保留每个指标的最新值
 */
@Slf4j
public class LoggingMeasurementSink implements MeasurementSink {

    private final Map<String, MeasurementRecord> latest = new ConcurrentHashMap<>();
    private final AtomicLong dispatched = new AtomicLong(0);
    private final AtomicLong warnings = new AtomicLong(0);

    @Override
    public void dispatch(MeasurementRecord record) {
        latest.put(record.getMetricKey(), record);
        dispatched.incrementAndGet();
        log.info("{}", JsonUtil.toJsonString(record));
    }

    @Override
    public void warning(String message) {
        warnings.incrementAndGet();
        log.warn(message);
    }

    /**
     * 每个指标最近一次上报的记录
     */
    public List<MeasurementRecord> getLatestRecords() {
        return latest.values().stream()
                .sorted(Comparator.comparing(MeasurementRecord::getMetricKey))
                .toList();
    }

    public long getDispatchedCount() {
        return dispatched.get();
    }

    public long getWarningCount() {
        return warnings.get();
    }
}
