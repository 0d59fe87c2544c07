package com.wangbin.fritz.common.enums;

/**
 * 连接状态枚举
 */
public enum ConnectionStatus {

    DISCONNECTED,
    CONNECTED,
    AUTHENTICATED;

    // 判断是否已连接
    public boolean isConnected() {
        return this == CONNECTED || this == AUTHENTICATED;
    }
}
