package com.wangbin.fritz.core.collector.catalog;

import java.util.List;

/**
 * 固定的采集目录，按目录顺序轮询，字段按声明顺序上报
 */
public final class MetricCatalog {

    public static final List<MetricQuery> DEFAULT = List.of(
            MetricQuery.of("WANIPConnection", "GetStatusInfo",
                    MetricField.state("NewConnectionStatus", "constatus", ValueConversion.CONNECTED_FLAG),
                    MetricField.of("NewUptime", "uptime")),
            MetricQuery.of("WANCommonInterfaceConfig", "GetCommonLinkProperties",
                    MetricField.state("NewPhysicalLinkStatus", "dslstatus", ValueConversion.LINK_UP_FLAG),
                    MetricField.of("NewLayer1DownstreamMaxBitRate", "bitrate", "receive_max"),
                    MetricField.of("NewLayer1UpstreamMaxBitRate", "bitrate", "send_max")),
            MetricQuery.of("WANCommonInterfaceConfig", "GetAddonInfos",
                    MetricField.of("NewByteSendRate", "if_octets", "tx"),
                    MetricField.of("NewByteReceiveRate", "if_octets", "rx"),
                    MetricField.of("NewTotalBytesSent", "bytes", "wan_tx"),
                    MetricField.of("NewTotalBytesReceived", "bytes", "wan_rx")),
            MetricQuery.of("LANEthernetInterfaceConfig", "GetStatistics",
                    MetricField.of("NewBytesSent", "bytes", "lan_tx"),
                    MetricField.of("NewBytesReceived", "bytes", "lan_rx"))
    );

    private MetricCatalog() {
    }
}
