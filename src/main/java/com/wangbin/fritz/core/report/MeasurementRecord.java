package com.wangbin.fritz.core.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 单条上报测量值
 */
@Value
@Builder
public class MeasurementRecord {

    public static final String PLUGIN_NAME = "fritzcollectd";

    String host;

    @Builder.Default
    String plugin = PLUGIN_NAME;

    String pluginInstance;
    String type;
    String typeInstance;
    List<Number> values;

    /**
     * 按类型和类型实例组成的键，用于区分同一主机下的不同指标
     */
    public String getMetricKey() {
        return typeInstance == null || typeInstance.isEmpty() ? type : type + "-" + typeInstance;
    }
}
