package com.restaurantbi.insightflow.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Single Response with data
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class SingleResponse<T> extends Response {
    private T data;

    public static <T> SingleResponse<T> of(T data) {
        SingleResponse<T> response = new SingleResponse<>();
        response.setSuccess(true);
        response.setData(data);
        return response;
    }

    /**
     * 失败响应，data 携带补充信息（例如冲突时的活动运行 ID）
     */
    public static <T> SingleResponse<T> buildFailureWith(String errCode, String errMessage, T data) {
        SingleResponse<T> response = new SingleResponse<>();
        response.fail(errCode, errMessage);
        response.setData(data);
        return response;
    }
}
