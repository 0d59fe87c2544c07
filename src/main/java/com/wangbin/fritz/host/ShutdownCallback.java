package com.wangbin.fritz.host;

/**
 * 关闭回调，宿主退出时调用一次
 */
@FunctionalInterface
public interface ShutdownCallback {

    void shutdown();
}
