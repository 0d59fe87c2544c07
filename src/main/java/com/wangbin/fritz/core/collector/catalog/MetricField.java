package com.wangbin.fritz.core.collector.catalog;

/**
 * 响应字段到指标类型的映射
 *
 * @param sourceField  响应中的字段名
 * @param type         上报类型
 * @param typeInstance 上报类型实例，可为空串
 * @param conversion   值转换方式
 */
public record MetricField(String sourceField, String type, String typeInstance, ValueConversion conversion) {

    public static MetricField of(String sourceField, String type, String typeInstance) {
        return new MetricField(sourceField, type, typeInstance, ValueConversion.RAW);
    }

    public static MetricField of(String sourceField, String type) {
        return of(sourceField, type, "");
    }

    public static MetricField state(String sourceField, String typeInstance, ValueConversion conversion) {
        return new MetricField(sourceField, "gauge", typeInstance, conversion);
    }
}
