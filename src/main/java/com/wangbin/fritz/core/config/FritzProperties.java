package com.wangbin.fritz.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 采集配置类
 */
@Data
@ConfigurationProperties(prefix = "fritz")
public class FritzProperties {

    /**
     * 路由器地址，未设置时使用设备默认地址
     */
    private String address;

    /**
     * TR-064端口，保留字符串形式以便由配置解析器做类型转换
     */
    private String port;

    private String user;
    private String password;

    /**
     * 上报主机名，未设置时使用设备型号
     */
    private String hostname;

    /**
     * 上报插件实例名
     */
    private String instance;

    /**
     * 轮询间隔
     */
    private Duration interval = Duration.ofSeconds(10);

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);

    /**
     * 其他原始配置项，原样交给配置解析器
     */
    private Map<String, String> extra = new LinkedHashMap<>();

    /**
     * 转换为原始配置项，只包含已设置的键
     */
    public List<ConfigEntry> toConfigEntries() {
        List<ConfigEntry> entries = new ArrayList<>();
        addIfPresent(entries, ConfigResolver.KEY_ADDRESS, address);
        addIfPresent(entries, ConfigResolver.KEY_PORT, port);
        addIfPresent(entries, ConfigResolver.KEY_USER, user);
        addIfPresent(entries, ConfigResolver.KEY_PASSWORD, password);
        addIfPresent(entries, ConfigResolver.KEY_HOSTNAME, hostname);
        addIfPresent(entries, ConfigResolver.KEY_INSTANCE, instance);
        if (extra != null) {
            extra.forEach((key, value) -> entries.add(ConfigEntry.of(key, value)));
        }
        return entries;
    }

    private static void addIfPresent(List<ConfigEntry> entries, String key, String value) {
        if (value != null) {
            entries.add(ConfigEntry.of(key, value));
        }
    }
}
