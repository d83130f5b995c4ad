package com.draftflow.domain.exception;

/**
 * WorkflowNotFoundException - 模板、项目工作流或评审不存在
 *
 * @author draftflow
 */
public class WorkflowNotFoundException extends WorkflowException {

    public static final String ERR_CODE = "NOT_FOUND";

    public WorkflowNotFoundException(String message) {
        super(ERR_CODE, message);
    }
}
