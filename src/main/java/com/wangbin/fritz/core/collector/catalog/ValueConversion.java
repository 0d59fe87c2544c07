package com.wangbin.fritz.core.collector.catalog;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 字段值转换方式
 */
public enum ValueConversion {

    /**
     * 原样透传数值，字符串形式的数字按整数优先解析
     */
    RAW(null),

    /**
     * WAN连接状态，Connected为1，其余为0
     */
    CONNECTED_FLAG("Connected"),

    /**
     * 物理链路状态，Up为1，其余为0
     */
    LINK_UP_FLAG("Up");

    private static final Pattern INTEGER_PATTERN = Pattern.compile("-?\\d+");

    private final String expectedState;

    ValueConversion(String expectedState) {
        this.expectedState = expectedState;
    }

    public Optional<Number> convert(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (expectedState != null) {
            return Optional.of(expectedState.equals(String.valueOf(raw).trim()) ? 1 : 0);
        }
        if (raw instanceof Number number) {
            return Optional.of(number);
        }
        return parseNumber(String.valueOf(raw).trim());
    }

    private static Optional<Number> parseNumber(String text) {
        try {
            if (INTEGER_PATTERN.matcher(text).matches()) {
                return Optional.of(Long.valueOf(text));
            }
            return Optional.of(new BigDecimal(text).doubleValue());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
