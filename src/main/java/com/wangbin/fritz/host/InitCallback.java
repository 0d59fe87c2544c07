package com.wangbin.fritz.host;

import com.wangbin.fritz.common.exception.CollectorException;

/**
 * 初始化回调，配置之后调用一次；抛出异常表示插件不可用
 */
@FunctionalInterface
public interface InitCallback {

    void init() throws CollectorException;
}
