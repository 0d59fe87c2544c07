package com.wangbin.fritz.plugin;

import com.wangbin.fritz.common.exception.CollectorException;
import com.wangbin.fritz.core.collector.Collector;
import com.wangbin.fritz.core.config.ConfigEntry;
import com.wangbin.fritz.core.config.ConfigResolver;
import com.wangbin.fritz.core.config.ConnectionConfig;
import com.wangbin.fritz.core.connection.ConnectionFactory;
import com.wangbin.fritz.core.report.MeasurementSink;
import com.wangbin.fritz.host.PluginHost;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * FRITZ!Box插件：把配置解析器和采集器挂到宿主的四个回调上
 */
@Slf4j
public class FritzCollectdPlugin {

    private final PluginHost host;
    private final ConfigResolver configResolver;

    @Getter
    private final Collector collector;

    // 宿主未下发配置时使用默认值
    @Getter
    private ConnectionConfig config = new ConnectionConfig();

    public FritzCollectdPlugin(PluginHost host, MeasurementSink sink, ConnectionFactory connectionFactory) {
        this(host, new ConfigResolver(sink), new Collector(sink, connectionFactory));
    }

    public FritzCollectdPlugin(PluginHost host, ConfigResolver configResolver, Collector collector) {
        this.host = host;
        this.configResolver = configResolver;
        this.collector = collector;
    }

    /**
     * 向宿主注册全部回调
     */
    public void register() {
        host.registerConfig(this::configure);
        host.registerInit(this::init);
        host.registerRead(this::read);
        host.registerShutdown(this::shutdown);
        log.info("插件回调注册完成");
    }

    void configure(List<ConfigEntry> entries) {
        config = configResolver.resolve(entries);
    }

    void init() throws CollectorException {
        collector.init(config);
    }

    void read() {
        collector.poll();
    }

    void shutdown() {
        collector.shutdown();
    }
}
