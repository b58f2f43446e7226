package com.restaurantbi.insightflow.domain.pipeline;

/**
 * TaskKind - 任务种类
 * <p>
 * 一次运行中可能出现的任务种类是封闭集合，引擎据此选择执行器。
 * </p>
 */
public enum TaskKind {

    /**
     * 从外部配送平台拉取当日数据，产出 DataBatch
     */
    INGEST("数据采集"),

    /**
     * 校验 DataBatch，失败时运行进入 BLOCKED
     */
    VALIDATE("数据校验"),

    /**
     * 自然语言查询（向量索引、问答）
     */
    NLP_QUERY("NLP 查询"),

    /**
     * 需求预测
     */
    FORECAST("需求预测"),

    /**
     * 餐厅/菜品聚类
     */
    CLUSTER("聚类分析"),

    /**
     * 模型重训练
     */
    RETRAIN("模型重训练");

    private final String description;

    TaskKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否为 AI 分析类任务（产出模型指标）
     */
    public boolean isAnalysis() {
        return this == NLP_QUERY || this == FORECAST || this == CLUSTER || this == RETRAIN;
    }
}
