package com.draftflow.domain.template;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * TemplateStep - 模板步骤
 * <p>
 * 归属于某一个模板版本，orderIndex 决定阶段顺序，同一模板内从 0 开始连续递增。
 * </p>
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateStep {

    /**
     * 阶段顺序，从 0 开始
     */
    private int orderIndex;

    /**
     * 负责部门，如 "Drafting"
     */
    private String department;

    /**
     * 分组名称，如 "Project Scheduling"
     */
    private String groupName;

    /**
     * 步骤标题
     */
    private String title;

    /**
     * 计划工期（工作日）
     */
    private int plannedDurationDays;

    /**
     * 检查项列表
     */
    @Builder.Default
    private List<TemplateStepTask> tasks = new ArrayList<>();

    /**
     * 深拷贝，发布新版本时使用，避免与调用方共享可变列表
     */
    public TemplateStep copy() {
        List<TemplateStepTask> taskCopies = tasks == null ? new ArrayList<>() : tasks.stream()
                .map(t -> new TemplateStepTask(t.getOrderIndex(), t.getTitle(), t.isDefaultChecked()))
                .collect(Collectors.toList());
        return new TemplateStep(orderIndex, department, groupName, title, plannedDurationDays, taskCopies);
    }
}
