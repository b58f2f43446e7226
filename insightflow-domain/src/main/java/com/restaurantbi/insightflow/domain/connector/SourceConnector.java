package com.restaurantbi.insightflow.domain.connector;

import com.restaurantbi.insightflow.domain.batch.DataBatch;

import java.time.Instant;

/**
 * SourceConnector - 外部数据源连接器
 * <p>
 * 从外卖平台等外部数据源拉取某一时间点之后的记录。
 * </p>
 */
public interface SourceConnector {

    /**
     * 拉取数据
     *
     * @param sourceId 数据源标识
     * @param since    起始时间（含）
     * @return 采集到的批次，尚未绑定逻辑键
     * @throws ConnectorUnavailableException 数据源暂时不可用（可重试）
     * @throws ConnectorAuthException        认证失败（不可重试）
     */
    DataBatch fetch(String sourceId, Instant since);
}
