package com.wangbin.fritz.core.connection;

import com.wangbin.fritz.common.exception.CollectorException;

/**
 * 连接工厂
 */
public interface ConnectionFactory {

    /**
     * 建立到路由器的连接
     *
     * @throws CollectorException 无法建立连接时抛出
     */
    RemoteConnection connect(String address, int port, String user, String password) throws CollectorException;
}
