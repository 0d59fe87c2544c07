package com.wangbin.fritz.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    NOT_FOUND(404, "资源不存在"),

    // 采集相关错误
    COLLECTOR_ERROR(2000, "采集器错误"),
    CONNECTION_ERROR(2001, "连接错误"),
    PROTOCOL_ERROR(2002, "协议错误"),
    COLLECTION_ERROR(2004, "采集错误"),

    // 配置相关错误
    CONFIG_INVALID(3002, "配置无效"),

    // 认证授权错误
    AUTH_FAILED(4001, "认证失败"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
