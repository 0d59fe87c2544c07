package com.wangbin.fritz.core.collector.catalog;

import java.util.List;

/**
 * 一次远程调用及其需要提取的字段
 */
public record MetricQuery(String service, String action, List<MetricField> fields) {

    public MetricQuery {
        fields = List.copyOf(fields);
    }

    public static MetricQuery of(String service, String action, MetricField... fields) {
        return new MetricQuery(service, action, List.of(fields));
    }

    public String getName() {
        return service + "#" + action;
    }
}
