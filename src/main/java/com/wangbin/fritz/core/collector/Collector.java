package com.wangbin.fritz.core.collector;

import com.wangbin.fritz.common.exception.CollectorException;
import com.wangbin.fritz.core.collector.catalog.MetricCatalog;
import com.wangbin.fritz.core.collector.catalog.MetricField;
import com.wangbin.fritz.core.collector.catalog.MetricQuery;
import com.wangbin.fritz.core.config.ConnectionConfig;
import com.wangbin.fritz.core.connection.ConnectionFactory;
import com.wangbin.fritz.core.connection.RemoteConnection;
import com.wangbin.fritz.core.report.MeasurementRecord;
import com.wangbin.fritz.core.report.MeasurementSink;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 路由器指标采集器。
 * <p>
 * 持有远程连接，按固定目录依次调用并将提取出的字段上报给宿主。
 * 单个查询失败只丢弃该查询产生的记录，不影响同一轮询周期内的其他查询。
 * 宿主保证回调串行执行，采集器内部不做同步。
 */
@Slf4j
public class Collector {

    private final MeasurementSink sink;
    private final ConnectionFactory connectionFactory;
    private final List<MetricQuery> catalog;

    @Getter
    private final CollectionStatistics statistics = new CollectionStatistics();

    @Getter
    private volatile CollectorState state = CollectorState.UNINITIALIZED;

    private RemoteConnection connection;
    private String host;
    private String pluginInstance;

    public Collector(MeasurementSink sink, ConnectionFactory connectionFactory) {
        this(sink, connectionFactory, MetricCatalog.DEFAULT);
    }

    public Collector(MeasurementSink sink, ConnectionFactory connectionFactory, List<MetricQuery> catalog) {
        this.sink = sink;
        this.connectionFactory = connectionFactory;
        this.catalog = List.copyOf(catalog);
    }

    /**
     * 建立远程连接，失败时抛出异常且状态保持未初始化
     */
    public void init(ConnectionConfig config) throws CollectorException {
        if (state != CollectorState.UNINITIALIZED) {
            throw CollectorException.stateException("采集器状态不允许初始化: " + state);
        }
        if (!config.isValid()) {
            throw CollectorException.configException("配置无效: " + config.getInvalidKeys());
        }

        log.info("开始连接路由器: {}", config.getFullAddress());
        try {
            connection = connectionFactory.connect(
                    config.getAddress(), config.getPort(), config.getUser(), config.getPassword());
        } catch (CollectorException e) {
            log.error("路由器连接失败: {}", config.getFullAddress(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("路由器连接失败: {}", config.getFullAddress(), e);
            throw CollectorException.connectionException("路由器连接失败: " + e.getMessage(), e);
        }

        host = hasText(config.getReportHostname()) ? config.getReportHostname() : connection.getModelName();
        if (host == null) {
            host = "";
        }
        pluginInstance = config.getInstanceLabel() != null ? config.getInstanceLabel() : "";
        state = CollectorState.READY;

        log.info("采集器初始化完成: host={}, instance={}, 查询数: {}", host, pluginInstance, catalog.size());
    }

    /**
     * 执行一次轮询并逐条上报，返回本轮上报的记录
     */
    public List<MeasurementRecord> poll() {
        if (state != CollectorState.READY) {
            throw CollectorException.stateException("采集器未就绪，无法轮询: " + state);
        }

        long startTime = System.currentTimeMillis();
        List<MeasurementRecord> dispatched = new ArrayList<>();

        for (MetricQuery query : catalog) {
            QueryResult result;
            try {
                result = QueryResult.of(connection.call(query.service(), query.action()));
            } catch (Exception e) {
                statistics.queryFailed(query.getName(), e.getMessage());
                if (e instanceof CollectorException ce && !ce.getFailureType().isQueryLocal()) {
                    log.warn("查询失败，连接或认证异常: {} - {} ({})",
                            query.getName(), e.getMessage(), ce.getFailureType().getDescription());
                } else {
                    log.warn("查询失败，跳过本轮该查询: {} - {}", query.getName(), e.getMessage());
                }
                log.debug("查询失败详情: {}", query.getName(), e);
                continue;
            }

            int before = dispatched.size();
            for (MetricField field : query.fields()) {
                buildRecord(query, field, result).ifPresent(record -> {
                    if (dispatch(record)) {
                        dispatched.add(record);
                    }
                });
            }
            statistics.querySucceeded(query.getName(), dispatched.size() - before);
        }

        long executionTime = System.currentTimeMillis() - startTime;
        statistics.pollCompleted(dispatched.size(), executionTime);
        log.debug("轮询完成，上报 {} 条记录，耗时 {}ms", dispatched.size(), executionTime);
        return dispatched;
    }

    /**
     * 释放远程连接
     */
    public void shutdown() {
        if (state == CollectorState.SHUT_DOWN) {
            log.warn("采集器已关闭");
            return;
        }

        if (connection != null) {
            connection.close();
            connection = null;
        }
        state = CollectorState.SHUT_DOWN;
        log.info("采集器已关闭，共轮询 {} 次", statistics.getTotalPolls());
    }

    private boolean dispatch(MeasurementRecord record) {
        try {
            sink.dispatch(record);
            return true;
        } catch (RuntimeException e) {
            log.warn("记录上报失败，继续本轮轮询: {} - {}", record.getMetricKey(), e.getMessage());
            return false;
        }
    }

    private Optional<MeasurementRecord> buildRecord(MetricQuery query, MetricField field, QueryResult result) {
        Optional<Object> raw = result.field(field.sourceField());
        if (raw.isEmpty()) {
            log.debug("字段缺失: {}.{}", query.getName(), field.sourceField());
            return Optional.empty();
        }

        Optional<Number> value = field.conversion().convert(raw.get());
        if (value.isEmpty()) {
            log.debug("字段值无法转换为数值: {}.{} = {}", query.getName(), field.sourceField(), raw.get());
            return Optional.empty();
        }

        return Optional.of(MeasurementRecord.builder()
                .host(host)
                .pluginInstance(pluginInstance)
                .type(field.type())
                .typeInstance(field.typeInstance())
                .values(List.of(value.get()))
                .build());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
