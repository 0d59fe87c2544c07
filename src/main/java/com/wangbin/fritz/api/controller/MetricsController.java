package com.wangbin.fritz.api.controller;

import com.wangbin.fritz.common.exception.CollectorException;
import com.wangbin.fritz.common.web.result.ApiResult;
import com.wangbin.fritz.core.collector.Collector;
import com.wangbin.fritz.core.collector.CollectorState;
import com.wangbin.fritz.core.report.LoggingMeasurementSink;
import com.wangbin.fritz.core.report.MeasurementRecord;
import com.wangbin.fritz.plugin.FritzCollectdPlugin;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 采集状态与最新指标查询接口
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MetricsController {

    private final FritzCollectdPlugin plugin;
    private final LoggingMeasurementSink measurementSink;

    @GetMapping("/metrics")
    public ApiResult<List<MeasurementRecord>> metrics() {
        CollectorState state = plugin.getCollector().getState();
        if (state == CollectorState.UNINITIALIZED) {
            throw CollectorException.stateException("采集器尚未初始化，暂无指标");
        }
        return ApiResult.success(measurementSink.getLatestRecords());
    }

    @GetMapping("/collector")
    public ApiResult<Map<String, Object>> collector() {
        Collector collector = plugin.getCollector();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", collector.getState().name());
        status.put("address", plugin.getConfig().getFullAddress());
        status.put("dispatched", measurementSink.getDispatchedCount());
        status.put("warnings", measurementSink.getWarningCount());
        status.put("statistics", collector.getStatistics().getStatistics());
        return ApiResult.success(status);
    }
}
