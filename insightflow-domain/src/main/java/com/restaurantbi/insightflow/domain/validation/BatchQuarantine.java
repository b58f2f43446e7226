package com.restaurantbi.insightflow.domain.validation;

import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * BatchQuarantine - 被拒绝批次的隔离区
 * <p>
 * 记录未通过校验的批次句柄，供人工排查与修正后重新采集。容量有上限，超出时丢弃最旧条目。
 * </p>
 */
public class BatchQuarantine {

    private static final int DEFAULT_CAPACITY = 1000;

    private final Deque<Entry> entries = new ConcurrentLinkedDeque<>();

    private final int capacity;

    public BatchQuarantine() {
        this(DEFAULT_CAPACITY);
    }

    public BatchQuarantine(int capacity) {
        this.capacity = capacity;
    }

    public void add(Entry entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.pollFirst();
        }
    }

    public List<Entry> list() {
        return new ArrayList<>(entries);
    }

    public int size() {
        return entries.size();
    }

    @Value
    public static class Entry {
        String batchId;
        String runId;
        String logicalKey;
        String sourceId;
        int violationCount;
        Instant quarantinedAt;
    }
}
