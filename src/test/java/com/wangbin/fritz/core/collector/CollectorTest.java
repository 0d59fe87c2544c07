package com.wangbin.fritz.core.collector;

import com.wangbin.fritz.common.enums.FailureType;
import com.wangbin.fritz.common.exception.CollectorException;
import com.wangbin.fritz.core.config.ConnectionConfig;
import com.wangbin.fritz.core.report.MeasurementRecord;
import com.wangbin.fritz.core.report.MeasurementSink;
import com.wangbin.fritz.support.FakeRouter;
import com.wangbin.fritz.support.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectorTest {

    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        sink = new RecordingSink();
    }

    @Test
    void fullFixtureDispatchesEveryCatalogField() {
        FakeRouter router = FakeRouter.fullFixture();
        Collector collector = new Collector(sink, router);
        collector.init(new ConnectionConfig());

        List<MeasurementRecord> records = collector.poll();

        assertEquals(11, records.size());
        assertEquals(records, sink.records);
        MeasurementRecord first = records.get(0);
        assertEquals(FakeRouter.MODEL_NAME, first.getHost());
        assertEquals("fritzcollectd", first.getPlugin());
        assertEquals("", first.getPluginInstance());
        assertEquals("gauge", first.getType());
        assertEquals("constatus", first.getTypeInstance());
        assertEquals(List.of(1), first.getValues());
    }

    @Test
    void literalScenarioDispatchesThreeRecordsInCatalogOrder() {
        FakeRouter router = new FakeRouter()
                .respond("WANIPConnection", "GetStatusInfo", Map.of("NewUptime", 35307))
                .respond("WANCommonInterfaceConfig", "GetAddonInfos", Map.of(
                        "NewByteSendRate", 3438,
                        "NewByteReceiveRate", 67649));
        Collector collector = new Collector(sink, router);
        collector.init(new ConnectionConfig());

        List<MeasurementRecord> records = collector.poll();

        assertEquals(3, records.size());
        assertEquals("uptime", records.get(0).getType());
        assertEquals(List.of(35307), records.get(0).getValues());
        assertEquals("if_octets", records.get(1).getType());
        assertEquals("tx", records.get(1).getTypeInstance());
        assertEquals(List.of(3438), records.get(1).getValues());
        assertEquals("if_octets", records.get(2).getType());
        assertEquals("rx", records.get(2).getTypeInstance());
        assertEquals(List.of(67649), records.get(2).getValues());
    }

    @Test
    void failingQueryDoesNotSuppressOtherQueries() {
        FakeRouter router = FakeRouter.fullFixture().fail("WANCommonInterfaceConfig", "GetAddonInfos");
        Collector collector = new Collector(sink, router);
        collector.init(new ConnectionConfig());

        List<MeasurementRecord> records = collector.poll();

        assertEquals(7, records.size());
        assertTrue(records.stream().noneMatch(r -> "if_octets".equals(r.getType())));
        assertTrue(records.stream().anyMatch(r -> "lan_rx".equals(r.getTypeInstance())));
        assertEquals(4, router.calls.size());
        assertEquals(1, collector.getStatistics().getFailedQueries("WANCommonInterfaceConfig#GetAddonInfos"));
    }

    @Test
    void unexpectedRuntimeFailureIsIsolatedToItsQuery() {
        FakeRouter router = FakeRouter.fullFixture();
        Collector collector = new Collector(sink, (address, port, user, password) -> {
            var delegate = router.connect(address, port, user, password);
            return new com.wangbin.fritz.core.connection.RemoteConnection() {
                @Override
                public Map<String, Object> call(String service, String action) {
                    if ("LANEthernetInterfaceConfig".equals(service)) {
                        throw new IllegalStateException("malformed response");
                    }
                    return delegate.call(service, action);
                }

                @Override
                public String getModelName() {
                    return delegate.getModelName();
                }

                @Override
                public void close() {
                    delegate.close();
                }
            };
        });
        collector.init(new ConnectionConfig());

        assertEquals(9, assertDoesNotThrow(collector::poll).size());
    }

    @Test
    void consecutivePollsProduceEqualRecords() {
        Collector collector = new Collector(sink, FakeRouter.fullFixture());
        collector.init(new ConnectionConfig());

        List<MeasurementRecord> first = collector.poll();
        List<MeasurementRecord> second = collector.poll();

        assertEquals(first.size(), second.size());
        assertEquals(first, second);
        assertEquals(2, collector.getStatistics().getTotalPolls());
    }

    @Test
    void configuredHostnameAndInstanceAreReported() {
        ConnectionConfig config = new ConnectionConfig();
        config.setReportHostname("hostname");
        config.setInstanceLabel("instance");
        Collector collector = new Collector(sink, FakeRouter.fullFixture());
        collector.init(config);

        List<MeasurementRecord> records = collector.poll();

        assertFalse(records.isEmpty());
        assertTrue(records.stream().allMatch(r -> "hostname".equals(r.getHost())));
        assertTrue(records.stream().allMatch(r -> "instance".equals(r.getPluginInstance())));
    }

    @Test
    void missingFieldOnlyDropsThatRecord() {
        FakeRouter router = new FakeRouter()
                .respond("WANCommonInterfaceConfig", "GetCommonLinkProperties", Map.of(
                        "NewLayer1UpstreamMaxBitRate", 2105000));
        Collector collector = new Collector(sink, router);
        collector.init(new ConnectionConfig());

        List<MeasurementRecord> records = collector.poll();

        assertEquals(1, records.size());
        assertEquals("send_max", records.get(0).getTypeInstance());
    }

    @Test
    void floatingPointAndLongValuesKeepTheirType() {
        FakeRouter router = new FakeRouter()
                .respond("WANCommonInterfaceConfig", "GetAddonInfos", Map.of(
                        "NewByteSendRate", 12.5,
                        "NewTotalBytesReceived", 5221019883L,
                        "NewTotalBytesSent", "1712232562"));
        Collector collector = new Collector(sink, router);
        collector.init(new ConnectionConfig());

        List<MeasurementRecord> records = collector.poll();

        assertEquals(List.of(12.5), records.get(0).getValues());
        assertEquals(List.of(1712232562L), records.get(1).getValues());
        assertEquals(List.of(5221019883L), records.get(2).getValues());
    }

    @Test
    void connectionFailureIsRaisedFromInit() {
        FakeRouter router = FakeRouter.fullFixture();
        router.refuseConnection = true;
        Collector collector = new Collector(sink, router);

        CollectorException e = assertThrows(CollectorException.class, () -> collector.init(new ConnectionConfig()));

        assertEquals(FailureType.CONNECTION_ERROR, e.getFailureType());
        assertEquals(CollectorState.UNINITIALIZED, collector.getState());
    }

    @Test
    void invalidConfigurationFailsInitWithoutConnecting() {
        FakeRouter router = FakeRouter.fullFixture();
        ConnectionConfig config = new ConnectionConfig();
        config.getInvalidKeys().add("Port");
        Collector collector = new Collector(sink, router);

        CollectorException e = assertThrows(CollectorException.class, () -> collector.init(config));

        assertEquals(FailureType.CONFIG_ERROR, e.getFailureType());
        assertTrue(router.connectCalls.isEmpty());
    }

    @Test
    void shutdownReleasesConnectionAndForbidsPolling() {
        FakeRouter router = FakeRouter.fullFixture();
        Collector collector = new Collector(sink, router);
        collector.init(new ConnectionConfig());

        collector.shutdown();

        assertTrue(router.closed);
        assertEquals(CollectorState.SHUT_DOWN, collector.getState());
        assertThrows(CollectorException.class, collector::poll);
    }

    @Test
    void pollBeforeInitIsRejected() {
        Collector collector = new Collector(sink, FakeRouter.fullFixture());

        CollectorException e = assertThrows(CollectorException.class, collector::poll);

        assertEquals(FailureType.STATE_ERROR, e.getFailureType());
        assertTrue(sink.records.isEmpty());
    }

    @Test
    void shutdownAfterFailedInitDoesNotThrow() {
        FakeRouter router = FakeRouter.fullFixture();
        router.refuseConnection = true;
        Collector collector = new Collector(sink, router);
        assertThrows(CollectorException.class, () -> collector.init(new ConnectionConfig()));

        assertDoesNotThrow(collector::shutdown);
        assertEquals(CollectorState.SHUT_DOWN, collector.getState());
    }

    @Test
    void sinkFailureDropsOnlyThatRecord() {
        MeasurementSink flakySink = new MeasurementSink() {
            @Override
            public void dispatch(MeasurementRecord record) {
                if ("constatus".equals(record.getTypeInstance())) {
                    throw new IllegalStateException("sink unavailable");
                }
                sink.dispatch(record);
            }

            @Override
            public void warning(String message) {
                sink.warning(message);
            }
        };
        Collector collector = new Collector(flakySink, FakeRouter.fullFixture());
        collector.init(new ConnectionConfig());

        List<MeasurementRecord> records = assertDoesNotThrow(collector::poll);

        assertEquals(10, records.size());
        assertEquals("uptime", records.get(0).getType());
        assertEquals(records, sink.records);
    }
}
