package com.wangbin.fritz.core.report;

/**
 * 宿主提供的上报通道
 */
public interface MeasurementSink {

    /**
     * 上报一条测量值，不关心返回结果
     */
    void dispatch(MeasurementRecord record);

    /**
     * 输出非致命的诊断信息
     */
    void warning(String message);
}
