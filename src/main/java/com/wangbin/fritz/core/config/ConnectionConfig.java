package com.wangbin.fritz.core.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 路由器连接配置
 */
@Data
public class ConnectionConfig {

    public static final String DEFAULT_ADDRESS = "169.254.1.1";
    public static final int DEFAULT_PORT = 49000;

    private String address = DEFAULT_ADDRESS;
    private int port = DEFAULT_PORT;
    private String user = "";
    private String password = "";

    /**
     * 上报时使用的主机名，为空时使用设备型号
     */
    private String reportHostname;

    /**
     * 上报时使用的插件实例名，为空时上报空串
     */
    private String instanceLabel;

    /**
     * 无法转换的配置项，非空时初始化会失败
     */
    private final List<String> invalidKeys = new ArrayList<>();

    public boolean isValid() {
        return invalidKeys.isEmpty();
    }

    // 获取完整地址
    public String getFullAddress() {
        return address + ":" + port;
    }

    @Override
    public String toString() {
        return "ConnectionConfig{address=" + address + ", port=" + port + ", user=" + user
                + ", reportHostname=" + reportHostname + ", instanceLabel=" + instanceLabel
                + ", invalidKeys=" + invalidKeys + "}";
    }
}
