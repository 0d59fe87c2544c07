package com.wangbin.fritz.core.config;

import com.wangbin.fritz.core.report.MeasurementSink;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;

/**
 * 配置解析器：将原始配置项转换为连接配置。
 * 未识别的键产生一条警告后忽略，解析过程本身从不抛出异常。
 */
@Slf4j
public class ConfigResolver {

    public static final String KEY_ADDRESS = "Address";
    public static final String KEY_PORT = "Port";
    public static final String KEY_USER = "User";
    public static final String KEY_PASSWORD = "Password";
    public static final String KEY_HOSTNAME = "Hostname";
    public static final String KEY_INSTANCE = "Instance";

    private final MeasurementSink sink;

    public ConfigResolver(MeasurementSink sink) {
        this.sink = sink;
    }

    public ConnectionConfig resolve(List<ConfigEntry> entries) {
        ConnectionConfig config = new ConnectionConfig();
        if (entries == null) {
            return config;
        }

        for (ConfigEntry entry : entries) {
            String key = entry.getKey();
            if (key == null) {
                sink.warning("fritzcollectd: Configuration entry without key");
                continue;
            }
            Object value = entry.firstValue();
            if (value == null && isRecognized(key)) {
                sink.warning("fritzcollectd: Configuration key " + key + " has no value");
                continue;
            }

            switch (key) {
                case KEY_ADDRESS -> config.setAddress(String.valueOf(value));
                case KEY_PORT -> applyPort(config, value);
                case KEY_USER -> config.setUser(String.valueOf(value));
                case KEY_PASSWORD -> config.setPassword(String.valueOf(value));
                case KEY_HOSTNAME -> config.setReportHostname(String.valueOf(value));
                case KEY_INSTANCE -> config.setInstanceLabel(String.valueOf(value));
                default -> sink.warning("fritzcollectd: Unknown config " + key);
            }
        }

        log.info("配置解析完成: {}", config);
        return config;
    }

    private void applyPort(ConnectionConfig config, Object value) {
        Integer port = toInteger(value);
        if (port == null) {
            config.getInvalidKeys().add(KEY_PORT);
            sink.warning("fritzcollectd: Configuration key " + KEY_PORT + " is not an integer: " + value);
            return;
        }
        config.setPort(port);
    }

    /**
     * 只接受int范围内的整数值，超出范围或带小数部分时返回null
     */
    private Integer toInteger(Object value) {
        String text = value instanceof Number ? value.toString() : String.valueOf(value).trim();
        try {
            return new BigDecimal(text).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("端口值转换失败: {}", value);
            return null;
        }
    }

    private boolean isRecognized(String key) {
        return switch (key) {
            case KEY_ADDRESS, KEY_PORT, KEY_USER, KEY_PASSWORD, KEY_HOSTNAME, KEY_INSTANCE -> true;
            default -> false;
        };
    }
}
