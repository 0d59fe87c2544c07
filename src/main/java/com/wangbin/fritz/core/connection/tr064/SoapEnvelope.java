package com.wangbin.fritz.core.connection.tr064;

import com.wangbin.fritz.common.enums.FailureType;
import com.wangbin.fritz.common.exception.CollectorException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SOAP 1.1 请求构造与响应解析
 */
public final class SoapEnvelope {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("-?\\d+");

    // UPnP错误码
    private static final String UPNP_INVALID_ACTION = "401";
    private static final String UPNP_ACTION_NOT_AUTHORIZED = "606";

    private SoapEnvelope() {
    }

    /**
     * 构造无参数的操作请求
     */
    public static String buildRequest(String serviceType, String action) {
        String escapedAction = XmlSupport.escape(action);
        return "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
                + "<s:Envelope s:encodingStyle=\"http://schemas.xmlsoap.org/soap/encoding/\""
                + " xmlns:s=\"http://schemas.xmlsoap.org/soap/envelope/\">"
                + "<s:Body>"
                + "<u:" + escapedAction + " xmlns:u=\"" + XmlSupport.escape(serviceType) + "\">"
                + "</u:" + escapedAction + ">"
                + "</s:Body>"
                + "</s:Envelope>";
    }

    /**
     * SOAPAction请求头的值
     */
    public static String soapActionHeader(String serviceType, String action) {
        return "\"" + serviceType + "#" + action + "\"";
    }

    /**
     * 解析响应体中的输出参数；SOAP Fault转换为异常
     */
    public static Map<String, Object> parseResponse(String xml, String service, String action)
            throws CollectorException {
        Document document;
        try {
            document = XmlSupport.parse(xml);
        } catch (Exception e) {
            throw new CollectorException("SOAP响应解析失败: " + e.getMessage(),
                    service, action, FailureType.PROTOCOL_ERROR, e);
        }

        Element body = XmlSupport.firstDescendant(document, "Body");
        if (body == null) {
            throw CollectorException.protocolException("SOAP响应缺少Body", service, action);
        }
        List<Element> children = XmlSupport.childElements(body);
        if (children.isEmpty()) {
            throw CollectorException.protocolException("SOAP响应Body为空", service, action);
        }

        Element response = children.get(0);
        if ("Fault".equals(XmlSupport.localName(response))) {
            throw toFaultException(document, response, service, action);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        for (Element argument : XmlSupport.childElements(response)) {
            fields.put(XmlSupport.localName(argument), toValue(argument.getTextContent().trim()));
        }
        return fields;
    }

    private static CollectorException toFaultException(Document document, Element fault,
                                                       String service, String action) {
        Element errorCode = XmlSupport.firstDescendant(document, "errorCode");
        Element errorDescription = XmlSupport.firstDescendant(document, "errorDescription");
        String code = errorCode != null ? errorCode.getTextContent().trim() : null;
        String description = errorDescription != null
                ? errorDescription.getTextContent().trim()
                : XmlSupport.childText(fault, "faultstring");

        if (UPNP_INVALID_ACTION.equals(code)) {
            return CollectorException.unsupportedException(service, action);
        }
        if (UPNP_ACTION_NOT_AUTHORIZED.equals(code)) {
            return CollectorException.authException(service, action);
        }
        return new CollectorException("SOAP Fault: " + code + " " + description,
                service, action, FailureType.CALL_ERROR);
    }

    private static Object toValue(String text) {
        if (INTEGER_PATTERN.matcher(text).matches()) {
            try {
                return Long.valueOf(text);
            } catch (NumberFormatException e) {
                return text;
            }
        }
        return text;
    }
}
