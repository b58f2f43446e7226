package com.restaurantbi.insightflow.domain.batch;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * DataBatch - 采集批次
 * <p>
 * 某个逻辑键下一次采集得到的记录快照及其来源信息。发布后不可变，
 * 下游任务按引用共享，无需同步。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DataBatch {

    String id;

    /**
     * 逻辑键（例如日期 2024-05-01）
     */
    String logicalKey;

    /**
     * 来源连接器 ID
     */
    String sourceId;

    Instant ingestedAt;

    /**
     * 只读记录列表
     */
    List<Map<String, Object>> records;

    public static DataBatch of(String sourceId, Instant ingestedAt, List<Map<String, Object>> records) {
        List<Map<String, Object>> copy = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            // 记录中允许出现 null 值，所以不能用 Map.copyOf
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(record)));
        }
        return new DataBatch(UUID.randomUUID().toString(), null, sourceId, ingestedAt,
                Collections.unmodifiableList(copy));
    }

    /**
     * 绑定逻辑键，记录列表按引用共享
     */
    public DataBatch withLogicalKey(String key) {
        return new DataBatch(id, key, sourceId, ingestedAt, records);
    }

    public int getRecordCount() {
        return records.size();
    }
}
