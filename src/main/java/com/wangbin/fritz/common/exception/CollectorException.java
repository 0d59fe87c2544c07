package com.wangbin.fritz.common.exception;

import com.wangbin.fritz.common.enums.FailureType;
import lombok.Getter;

/**
 * 采集器异常
 */
@Getter
public class CollectorException extends BusinessException {

    private final String service;
    private final String action;
    private final FailureType failureType;

    public CollectorException(String message, String service, String action, FailureType failureType) {
        super(failureType.getResultCode().getCode(), message);
        this.service = service;
        this.action = action;
        this.failureType = failureType;
    }

    public CollectorException(String message, String service, String action, FailureType failureType,
                              Throwable cause) {
        super(failureType.getResultCode().getCode(), message, cause);
        this.service = service;
        this.action = action;
        this.failureType = failureType;
    }

    // 创建连接异常
    public static CollectorException connectionException(String message, Throwable cause) {
        return new CollectorException(message, null, null, FailureType.CONNECTION_ERROR, cause);
    }

    // 创建认证异常
    public static CollectorException authException(String service, String action) {
        return new CollectorException("路由器认证失败", service, action, FailureType.AUTH_ERROR);
    }

    // 创建调用异常
    public static CollectorException callException(String message, String service, String action, Throwable cause) {
        return new CollectorException(message, service, action, FailureType.CALL_ERROR, cause);
    }

    // 创建协议异常
    public static CollectorException protocolException(String message, String service, String action) {
        return new CollectorException(message, service, action, FailureType.PROTOCOL_ERROR);
    }

    // 创建不支持操作异常
    public static CollectorException unsupportedException(String service, String action) {
        return new CollectorException("设备不支持该操作: " + service + "#" + action,
                service, action, FailureType.UNSUPPORTED_ACTION);
    }

    // 创建配置异常
    public static CollectorException configException(String message) {
        return new CollectorException(message, null, null, FailureType.CONFIG_ERROR);
    }

    // 创建状态异常
    public static CollectorException stateException(String message) {
        return new CollectorException(message, null, null, FailureType.STATE_ERROR);
    }
}
