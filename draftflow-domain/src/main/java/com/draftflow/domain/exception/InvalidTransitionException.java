package com.draftflow.domain.exception;

/**
 * InvalidTransitionException - 非法的阶段状态迁移
 * <p>
 * 包括完成一个未处于 IN_PROGRESS 的阶段，以及并发推进时状态已被其他调用方修改。
 * 不自动重试，调用方应重新读取状态后再决定。
 * </p>
 *
 * @author draftflow
 */
public class InvalidTransitionException extends WorkflowException {

    public static final String ERR_CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String message) {
        super(ERR_CODE, message);
    }
}
