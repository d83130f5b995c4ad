package com.draftflow.client.dto;

import lombok.Data;

import java.io.Serializable;

/**
 * Response - 统一响应信封
 * <p>
 * 所有 /api/v1 接口都以此结构返回，失败时携带错误码（VALIDATION_ERROR、NOT_FOUND、
 * INVALID_TRANSITION、SYSTEM_ERROR）和可读的错误信息。
 * </p>
 *
 * @author draftflow
 */
@Data
public class Response implements Serializable {
    private static final long serialVersionUID = 1L;

    private boolean success = true;
    private String errCode;
    private String errMessage;

    public static Response buildSuccess() {
        return new Response();
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
