package com.wangbin.fritz.plugin;

import com.wangbin.fritz.core.config.FritzProperties;
import com.wangbin.fritz.core.connection.ConnectionFactory;
import com.wangbin.fritz.core.connection.tr064.Tr064ConnectionFactory;
import com.wangbin.fritz.core.report.LoggingMeasurementSink;
import com.wangbin.fritz.host.PluginHost;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 插件装配：上报通道、连接工厂和插件本身
 */
@Configuration
@EnableConfigurationProperties(FritzProperties.class)
public class PluginConfiguration {

    @Bean
    public LoggingMeasurementSink measurementSink() {
        return new LoggingMeasurementSink();
    }

    @Bean
    public ConnectionFactory connectionFactory(FritzProperties properties) {
        return new Tr064ConnectionFactory(properties.getConnectTimeout(), properties.getReadTimeout());
    }

    @Bean
    public FritzCollectdPlugin fritzCollectdPlugin(PluginHost pluginHost,
                                                   LoggingMeasurementSink measurementSink,
                                                   ConnectionFactory connectionFactory) {
        FritzCollectdPlugin plugin = new FritzCollectdPlugin(pluginHost, measurementSink, connectionFactory);
        plugin.register();
        return plugin;
    }
}
