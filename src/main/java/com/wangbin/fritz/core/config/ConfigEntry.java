package com.wangbin.fritz.core.config;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 原始配置项：一个键及其值序列
 */
@Value
public class ConfigEntry {

    String key;
    List<Object> values;

    public static ConfigEntry of(String key, Object value) {
        return new ConfigEntry(key, Collections.singletonList(value));
    }

    /**
     * 取第一个值，没有值时返回null
     */
    public Object firstValue() {
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
