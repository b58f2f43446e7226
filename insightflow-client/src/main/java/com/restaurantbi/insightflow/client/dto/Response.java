package com.restaurantbi.insightflow.client.dto;

import lombok.Data;

import java.io.Serializable;

/**
 * Base Response DTO
 * <p>
 * errCode 取领域错误码名称，例如 CONFLICT、RUN_NOT_FOUND
 * </p>
 */
@Data
public class Response implements Serializable {
    private static final long serialVersionUID = 1L;

    private boolean success = true;
    private String errCode;
    private String errMessage;

    public static Response buildSuccess() {
        Response response = new Response();
        response.setSuccess(true);
        return response;
    }

    public static Response buildFailure(String errCode, String errMessage) {
        Response response = new Response();
        response.fail(errCode, errMessage);
        return response;
    }

    protected void fail(String errCode, String errMessage) {
        this.success = false;
        this.errCode = errCode;
        this.errMessage = errMessage;
    }
}
