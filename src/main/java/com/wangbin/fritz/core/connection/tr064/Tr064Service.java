package com.wangbin.fritz.core.connection.tr064;

/**
 * 设备描述中声明的一个服务
 *
 * @param serviceType 完整服务类型，如 urn:dslforum-org:service:WANIPConnection:1
 * @param controlUrl  SOAP控制地址
 */
public record Tr064Service(String serviceType, String controlUrl) {

    /**
     * 服务短名，由服务类型最后两段组成，如 WANIPConnection:1
     */
    public String shortName() {
        return shortName(serviceType);
    }

    static String shortName(String serviceType) {
        String[] parts = serviceType.split(":");
        if (parts.length < 2) {
            return serviceType;
        }
        return parts[parts.length - 2] + ":" + parts[parts.length - 1];
    }
}
