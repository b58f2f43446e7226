package com.restaurantbi.insightflow.domain.batch;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryBatchStore - 进程内批次存储，句柄即批次 ID
 */
public class InMemoryBatchStore implements BatchStore {

    private final Map<String, DataBatch> batches = new ConcurrentHashMap<>();

    @Override
    public String put(DataBatch batch) {
        batches.put(batch.getId(), batch);
        return batch.getId();
    }

    @Override
    public Optional<DataBatch> get(String handle) {
        return Optional.ofNullable(batches.get(handle));
    }

    @Override
    public void remove(String handle) {
        batches.remove(handle);
    }

    public int size() {
        return batches.size();
    }
}
