package com.wangbin.fritz.core.connection.tr064;

import com.wangbin.fritz.support.Fixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeviceDescriptionParserTest {

    @Test
    void collectsServicesFromNestedDevices() {
        DeviceDescription description = DeviceDescriptionParser.parse(Fixtures.read("tr64desc.xml"));

        assertEquals("FRITZ!Box 7490", description.getModelName());
        assertEquals(4, description.getServices().size());
        Tr064Service wanIp = description.findService("WANIPConnection").orElseThrow();
        assertEquals("/upnp/control/wanipconnection1", wanIp.controlUrl());
        assertEquals("urn:dslforum-org:service:WANIPConnection:1", wanIp.serviceType());
        assertTrue(description.findService("LANEthernetInterfaceConfig:1").isPresent());
        assertTrue(description.findService("WANIPConnection:2").isEmpty());
    }

    @Test
    void firstDescriptionWinsWhenMerging() {
        DeviceDescription tr64 = DeviceDescriptionParser.parse(Fixtures.read("tr64desc.xml"));
        DeviceDescription igd = DeviceDescriptionParser.parse(Fixtures.read("igddesc.xml"));

        DeviceDescription merged = tr64.merge(igd);

        assertEquals("FRITZ!Box 7490", merged.getModelName());
        assertEquals("/upnp/control/wanipconnection1",
                merged.findService("WANIPConnection").orElseThrow().controlUrl());
        assertTrue(merged.findService("WANIPv6FirewallControl").isPresent());
        assertEquals(6, merged.getServices().size());
    }
}
