package com.wangbin.fritz.core.collector;

import lombok.Getter;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 采集统计：轮询次数及每个查询的成功/失败次数。
 * 轮询线程写入，HTTP接口线程读取。
 */
public class CollectionStatistics {

    private final AtomicLong totalPolls = new AtomicLong(0);
    private final AtomicLong totalRecords = new AtomicLong(0);
    private final AtomicLong totalPollTime = new AtomicLong(0);
    private volatile long lastPollTime = 0;
    private volatile int lastPollRecords = 0;

    // 查询统计：service#action -> QueryStatistics
    private final Map<String, QueryStatistics> queryStatistics = new ConcurrentHashMap<>();

    /**
     * 记录一次完成的轮询
     */
    public void pollCompleted(int recordCount, long executionTime) {
        totalPolls.incrementAndGet();
        totalRecords.addAndGet(recordCount);
        totalPollTime.addAndGet(executionTime);
        lastPollRecords = recordCount;
        lastPollTime = System.currentTimeMillis();
    }

    /**
     * 查询成功
     */
    public void querySucceeded(String queryName, int recordCount) {
        queryStatistics.computeIfAbsent(queryName, QueryStatistics::new).recordSuccess(recordCount);
    }

    /**
     * 查询失败
     */
    public void queryFailed(String queryName, String error) {
        queryStatistics.computeIfAbsent(queryName, QueryStatistics::new).recordFailed(error);
    }

    public long getTotalPolls() {
        return totalPolls.get();
    }

    public int getFailedQueries(String queryName) {
        QueryStatistics stats = queryStatistics.get(queryName);
        return stats != null ? stats.getFailedExecutions().get() : 0;
    }

    /**
     * 获取统计快照
     */
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        long polls = totalPolls.get();
        stats.put("totalPolls", polls);
        stats.put("totalRecords", totalRecords.get());
        stats.put("lastPollRecords", lastPollRecords);
        stats.put("lastPollTime", lastPollTime);
        stats.put("averagePollTime", polls > 0 ? totalPollTime.get() / polls : 0);

        Map<String, Object> queries = new LinkedHashMap<>();
        queryStatistics.forEach((name, queryStats) -> queries.put(name, queryStats.getStatistics()));
        stats.put("queries", queries);
        return stats;
    }

    /**
     * 单个查询统计
     */
    @Getter
    private static class QueryStatistics {
        private final String queryName;
        private final AtomicInteger successfulExecutions = new AtomicInteger(0);
        private final AtomicInteger failedExecutions = new AtomicInteger(0);
        private final AtomicLong totalRecords = new AtomicLong(0);
        private volatile String lastError;

        QueryStatistics(String queryName) {
            this.queryName = queryName;
        }

        void recordSuccess(int recordCount) {
            successfulExecutions.incrementAndGet();
            totalRecords.addAndGet(recordCount);
        }

        void recordFailed(String error) {
            failedExecutions.incrementAndGet();
            lastError = error;
        }

        Map<String, Object> getStatistics() {
            Map<String, Object> stats = new HashMap<>();
            int total = successfulExecutions.get() + failedExecutions.get();
            stats.put("successfulExecutions", successfulExecutions.get());
            stats.put("failedExecutions", failedExecutions.get());
            stats.put("totalRecords", totalRecords.get());
            stats.put("successRate", total > 0 ? successfulExecutions.get() * 100.0 / total : 0);
            stats.put("lastError", lastError);
            return stats;
        }
    }
}
