package com.wangbin.fritz.core.collector;

/**
 * 采集器状态
 */
public enum CollectorState {

    UNINITIALIZED,
    READY,
    SHUT_DOWN
}
