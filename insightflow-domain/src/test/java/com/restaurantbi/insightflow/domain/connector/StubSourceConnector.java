package com.restaurantbi.insightflow.domain.connector;

import com.restaurantbi.insightflow.domain.batch.DataBatch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * StubSourceConnector - 返回预置记录的数据源，可模拟前几次不可用
 */
public class StubSourceConnector implements SourceConnector {

    private final List<Map<String, Object>> records;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile int failuresBeforeSuccess;
    private volatile Instant lastSince;

    public StubSourceConnector(List<Map<String, Object>> records) {
        this.records = records;
    }

    /**
     * 生成 count 条门店订单记录，nullRestaurantIds 中的下标 restaurant_id 为空
     */
    public static List<Map<String, Object>> orders(int count, int... nullRestaurantIds) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Object> record = new HashMap<>();
            record.put("order_id", "o-" + i);
            record.put("restaurant_id", "r-" + (i % 50));
            record.put("platform", i % 2 == 0 ? "ubereats" : "doordash");
            record.put("amount", 10.0 + (i % 40));
            markNull(record, i, nullRestaurantIds);
            result.add(record);
        }
        return result;
    }

    private static void markNull(Map<String, Object> record, int index, int[] nullRestaurantIds) {
        for (int nullIndex : nullRestaurantIds) {
            if (nullIndex == index) {
                record.put("restaurant_id", null);
            }
        }
    }

    public void failFirst(int times) {
        this.failuresBeforeSuccess = times;
    }

    @Override
    public DataBatch fetch(String sourceId, Instant since) {
        lastSince = since;
        if (calls.incrementAndGet() <= failuresBeforeSuccess) {
            throw new ConnectorUnavailableException("Source [" + sourceId + "] unavailable");
        }
        return DataBatch.of(sourceId, Instant.parse("2024-05-01T01:00:00Z"), records);
    }

    public int getCalls() {
        return calls.get();
    }

    public Instant getLastSince() {
        return lastSince;
    }
}
