package com.restaurantbi.insightflow.domain.batch;

import java.util.Optional;

/**
 * BatchStore - 批次对象存储
 * <p>
 * 大体量批次存放在对象存储中，核心模型只持有不透明句柄。
 * </p>
 */
public interface BatchStore {

    /**
     * 存入批次
     * @return 句柄
     */
    String put(DataBatch batch);

    Optional<DataBatch> get(String handle);

    void remove(String handle);
}
