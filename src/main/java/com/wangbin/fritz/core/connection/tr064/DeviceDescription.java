package com.wangbin.fritz.core.connection.tr064;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 解析后的设备描述：型号和按短名索引的服务
 */
public final class DeviceDescription {

    private static final String DEFAULT_VERSION = ":1";

    private final String modelName;
    private final Map<String, Tr064Service> services;

    public DeviceDescription(String modelName, Map<String, Tr064Service> services) {
        this.modelName = modelName;
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    public String getModelName() {
        return modelName;
    }

    public Map<String, Tr064Service> getServices() {
        return services;
    }

    /**
     * 按服务名查找，未带版本号时默认版本1
     */
    public Optional<Tr064Service> findService(String name) {
        String key = name.contains(":") ? name : name + DEFAULT_VERSION;
        return Optional.ofNullable(services.get(key));
    }

    /**
     * 合并另一份描述，已有的服务和型号优先
     */
    public DeviceDescription merge(DeviceDescription other) {
        Map<String, Tr064Service> merged = new LinkedHashMap<>(services);
        other.services.forEach(merged::putIfAbsent);
        String model = modelName != null ? modelName : other.modelName;
        return new DeviceDescription(model, merged);
    }
}
