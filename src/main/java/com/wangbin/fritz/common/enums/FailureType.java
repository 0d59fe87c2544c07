package com.wangbin.fritz.common.enums;

import com.wangbin.fritz.common.web.result.ResultCode;

/**
 * 采集失败类型枚举
 */
public enum FailureType {

    CONFIG_ERROR(ResultCode.CONFIG_INVALID, "配置错误", "配置值无法转换为所需类型"),
    CONNECTION_ERROR(ResultCode.CONNECTION_ERROR, "连接错误", "无法建立到路由器的连接"),
    AUTH_ERROR(ResultCode.AUTH_FAILED, "认证错误", "路由器拒绝了提供的凭据"),
    CALL_ERROR(ResultCode.COLLECTION_ERROR, "调用错误", "远程调用失败"),
    PROTOCOL_ERROR(ResultCode.PROTOCOL_ERROR, "协议错误", "响应格式无法解析"),
    UNSUPPORTED_ACTION(ResultCode.NOT_FOUND, "不支持的操作", "设备未提供该服务或操作"),
    STATE_ERROR(ResultCode.COLLECTOR_ERROR, "状态错误", "采集器当前状态不允许该操作");

    private final ResultCode resultCode;
    private final String description;
    private final String detail;

    FailureType(ResultCode resultCode, String description, String detail) {
        this.resultCode = resultCode;
        this.description = description;
        this.detail = detail;
    }

    public ResultCode getResultCode() {
        return resultCode;
    }

    public String getDescription() {
        return description;
    }

    public String getDetail() {
        return detail;
    }

    // 判断是否只影响单次查询
    public boolean isQueryLocal() {
        return this == CALL_ERROR || this == PROTOCOL_ERROR || this == UNSUPPORTED_ACTION;
    }
}
