package com.wangbin.fritz.core.report;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoggingMeasurementSinkTest {

    @Test
    void keepsLatestRecordPerMetric() {
        LoggingMeasurementSink sink = new LoggingMeasurementSink();

        sink.dispatch(record("bytes", "lan_tx", 100L));
        sink.dispatch(record("uptime", "", 35307L));
        sink.dispatch(record("bytes", "lan_tx", 250L));
        sink.warning("fritzcollectd: Unknown config UNKNOWN");

        List<MeasurementRecord> latest = sink.getLatestRecords();
        assertEquals(2, latest.size());
        assertEquals("bytes-lan_tx", latest.get(0).getMetricKey());
        assertEquals(List.of(250L), latest.get(0).getValues());
        assertEquals("uptime", latest.get(1).getMetricKey());
        assertEquals(3, sink.getDispatchedCount());
        assertEquals(1, sink.getWarningCount());
    }

    @Test
    void pluginNameDefaultsToFritzcollectd() {
        assertEquals("fritzcollectd", record("gauge", "constatus", 1).getPlugin());
    }

    private static MeasurementRecord record(String type, String typeInstance, Number value) {
        return MeasurementRecord.builder()
                .host("FRITZ!Box 7490")
                .pluginInstance("")
                .type(type)
                .typeInstance(typeInstance)
                .values(List.of(value))
                .build();
    }
}
