package com.restaurantbi.insightflow.domain.run;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AdmissionTable - 运行准入表
 * <p>
 * (pipelineId, logicalKey) 到活动 runId 的映射。准入是一次 putIfAbsent 比较并交换，
 * 并发的两个触发恰好一个成功。运行进入终态时释放。
 * </p>
 */
public class AdmissionTable {

    private final Map<String, String> active = new ConcurrentHashMap<>();

    /**
     * 尝试准入
     *
     * @return 为空表示准入成功，否则返回已占用该键的 runId
     */
    public Optional<String> tryAdmit(String pipelineId, String logicalKey, String runId) {
        return Optional.ofNullable(active.putIfAbsent(key(pipelineId, logicalKey), runId));
    }

    /**
     * 释放准入，仅当该键仍由 runId 占用时生效
     */
    public boolean release(String pipelineId, String logicalKey, String runId) {
        return active.remove(key(pipelineId, logicalKey), runId);
    }

    public Optional<String> activeRunId(String pipelineId, String logicalKey) {
        return Optional.ofNullable(active.get(key(pipelineId, logicalKey)));
    }

    public int size() {
        return active.size();
    }

    private static String key(String pipelineId, String logicalKey) {
        return pipelineId + "|" + logicalKey;
    }
}
