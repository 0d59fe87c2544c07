package com.wangbin.fritz.core.connection.tr064;

import com.wangbin.fritz.common.exception.CollectorException;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 设备描述解析器（tr64desc.xml / igddesc.xml）
 */
@Slf4j
public final class DeviceDescriptionParser {

    private DeviceDescriptionParser() {
    }

    public static DeviceDescription parse(String xml) throws CollectorException {
        Document document;
        try {
            document = XmlSupport.parse(xml);
        } catch (Exception e) {
            throw CollectorException.connectionException("设备描述解析失败: " + e.getMessage(), e);
        }

        Element modelElement = XmlSupport.firstDescendant(document, "modelName");
        String modelName = modelElement != null ? modelElement.getTextContent().trim() : null;

        // 嵌套设备的服务一并收集，按文档顺序保留第一次出现
        Map<String, Tr064Service> services = new LinkedHashMap<>();
        NodeList serviceNodes = document.getElementsByTagNameNS("*", "service");
        for (int i = 0; i < serviceNodes.getLength(); i++) {
            Element element = (Element) serviceNodes.item(i);
            String serviceType = XmlSupport.childText(element, "serviceType");
            String controlUrl = XmlSupport.childText(element, "controlURL");
            if (serviceType == null || controlUrl == null) {
                log.debug("忽略不完整的服务声明: {}", serviceType);
                continue;
            }
            Tr064Service service = new Tr064Service(serviceType, controlUrl);
            services.putIfAbsent(service.shortName(), service);
        }

        log.debug("设备描述解析完成: model={}, 服务数: {}", modelName, services.size());
        return new DeviceDescription(modelName, services);
    }
}
