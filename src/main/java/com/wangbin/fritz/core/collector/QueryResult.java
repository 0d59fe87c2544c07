package com.wangbin.fritz.core.collector;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * 单次远程调用的结果字段
 */
public final class QueryResult {

    private static final QueryResult EMPTY = new QueryResult(Collections.emptyMap());

    private final Map<String, Object> fields;

    private QueryResult(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static QueryResult of(Map<String, Object> fields) {
        return fields == null || fields.isEmpty() ? EMPTY : new QueryResult(Collections.unmodifiableMap(fields));
    }

    public Optional<Object> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
