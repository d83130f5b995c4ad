package com.draftflow.domain.exception;

/**
 * WorkflowException - 工作流领域异常基类
 * <p>
 * 携带错误码，适配层据此映射为统一响应中的 errCode。
 * </p>
 *
 * @author draftflow
 */
public abstract class WorkflowException extends RuntimeException {

    private final String errCode;

    protected WorkflowException(String errCode, String message) {
        super(message);
        this.errCode = errCode;
    }

    protected WorkflowException(String errCode, String message, Throwable cause) {
        super(message, cause);
        this.errCode = errCode;
    }

    public String getErrCode() {
        return errCode;
    }
}
