package com.wangbin.fritz.host;

import com.wangbin.fritz.core.config.ConfigEntry;

import java.util.List;

/**
 * 配置回调，宿主加载插件配置时调用一次
 */
@FunctionalInterface
public interface ConfigCallback {

    void configure(List<ConfigEntry> entries);
}
