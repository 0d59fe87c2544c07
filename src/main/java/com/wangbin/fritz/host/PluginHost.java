package com.wangbin.fritz.host;

/**
 * 插件宿主的注册接口
 */
public interface PluginHost {

    void registerConfig(ConfigCallback callback);

    void registerInit(InitCallback callback);

    void registerRead(ReadCallback callback);

    void registerShutdown(ShutdownCallback callback);
}
