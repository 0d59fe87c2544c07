package com.wangbin.fritz.host;

/**
 * 读取回调，宿主按固定周期串行调用，通过上报通道提交数据
 */
@FunctionalInterface
public interface ReadCallback {

    void read();
}
