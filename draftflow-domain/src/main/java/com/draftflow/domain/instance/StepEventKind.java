package com.draftflow.domain.instance;

/**
 * StepEventKind - 项目步骤事件类型
 *
 * @author draftflow
 */
public enum StepEventKind {

    /**
     * 开始/取消开始，首次开始时记录时间
     */
    START("开始"),

    /**
     * 完成/取消完成，首次完成时记录时间
     */
    COMPLETE("完成"),

    /**
     * 移交给某人，首次移交时记录时间
     */
    TRANSFER("移交"),

    /**
     * 从某人处接收，首次接收时记录时间
     */
    RECEIVE("接收");

    private final String description;

    StepEventKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
