package com.wangbin.fritz.core.connection;

import com.wangbin.fritz.common.exception.CollectorException;

import java.util.Map;

/**
 * 路由器远程调用连接
 */
public interface RemoteConnection extends AutoCloseable {

    /**
     * 调用指定服务的操作，返回结果字段
     *
     * @throws CollectorException 设备不可达、认证失败或不支持该操作
     */
    Map<String, Object> call(String service, String action) throws CollectorException;

    /**
     * 设备型号，用作默认的上报主机名
     */
    String getModelName();

    /**
     * 释放连接资源
     */
    @Override
    void close();
}
