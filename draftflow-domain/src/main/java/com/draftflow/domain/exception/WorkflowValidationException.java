package com.draftflow.domain.exception;

/**
 * WorkflowValidationException - 输入不合法
 * <p>
 * 模板步骤序号不连续/重复、必填字段为空、工期为负、参与人为空等。
 * 抛出时不会持久化任何数据。
 * </p>
 *
 * @author draftflow
 */
public class WorkflowValidationException extends WorkflowException {

    public static final String ERR_CODE = "VALIDATION_ERROR";

    public WorkflowValidationException(String message) {
        super(ERR_CODE, message);
    }
}
