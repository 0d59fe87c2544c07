package com.wangbin.fritz.common.exception;

import com.wangbin.fritz.common.web.result.ApiResult;
import com.wangbin.fritz.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理采集器异常
     */
    @ExceptionHandler(CollectorException.class)
    public ApiResult<?> handleCollectorException(CollectorException e, HttpServletRequest request) {
        log.error("采集器异常 - Service: {}, Action: {}, Type: {}",
                e.getService(), e.getAction(), e.getFailureType(), e);

        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.addExtra("service", e.getService());
        result.addExtra("action", e.getAction());
        result.addExtra("failureType", e.getFailureType().name());
        result.addExtra("failureDetail", e.getFailureType().getDetail());
        return result;
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}",
                request.getRequestURI(), request.getMethod(), e.getMessage(), e);
        return ApiResult.error(ResultCode.SYSTEM_ERROR);
    }
}
