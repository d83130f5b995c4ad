package com.draftflow.domain.template;

import com.draftflow.domain.exception.WorkflowValidationException;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * WorkflowTemplate - 工作流模板版本（聚合根）
 * <p>
 * 业务标识为 (name, version)。发布后不可修改：任何编辑都会产生一个新版本，
 * 同名模板同一时刻最多只有一个版本处于激活状态，旧版本只会被取代，不会被删除。
 * </p>
 *
 * @author draftflow
 */
@Data
public class WorkflowTemplate {

    /**
     * 模板名称，如 "Standard"
     */
    private String name;

    /**
     * 版本号，同名模板内从 1 开始递增
     */
    private int version;

    /**
     * 是否为当前激活版本
     */
    private boolean active;

    /**
     * 创建时间
     */
    private Instant createdAt;

    /**
     * 发布者
     */
    private String createdBy;

    /**
     * 步骤列表（按 orderIndex 升序）
     */
    private List<TemplateStep> steps = new ArrayList<>();

    /**
     * 创建一个新的激活版本
     * <p>
     * 步骤列表会先做校验，再按 orderIndex 排序后深拷贝保存。
     * </p>
     */
    public static WorkflowTemplate newVersion(String name, int version, List<TemplateStep> steps,
                                              String createdBy, Instant createdAt) {
        if (name == null || name.isBlank()) {
            throw new WorkflowValidationException("Template name cannot be empty");
        }
        validateSteps(steps);

        WorkflowTemplate template = new WorkflowTemplate();
        template.name = name;
        template.version = version;
        template.active = true;
        template.createdBy = createdBy;
        template.createdAt = createdAt;
        template.steps = steps.stream()
                .sorted(Comparator.comparingInt(TemplateStep::getOrderIndex))
                .map(TemplateStep::copy)
                .collect(Collectors.toList());
        template.steps.forEach(WorkflowTemplate::normalizeTaskOrder);
        return template;
    }

    /**
     * 校验步骤列表
     * <p>
     * orderIndex 必须从 0 开始连续且不重复；部门、标题不能为空；计划工期不能为负；
     * 检查项标题不能为空。
     * </p>
     */
    public static void validateSteps(List<TemplateStep> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new WorkflowValidationException("Template must contain at least one step");
        }
        Set<Integer> seen = new HashSet<>();
        for (TemplateStep step : steps) {
            if (step == null) {
                throw new WorkflowValidationException("Template step cannot be null");
            }
            if (!seen.add(step.getOrderIndex())) {
                throw new WorkflowValidationException("Duplicate step order index: " + step.getOrderIndex());
            }
            if (step.getDepartment() == null || step.getDepartment().isBlank()) {
                throw new WorkflowValidationException("Step " + step.getOrderIndex() + " has no department");
            }
            if (step.getTitle() == null || step.getTitle().isBlank()) {
                throw new WorkflowValidationException("Step " + step.getOrderIndex() + " has no title");
            }
            if (step.getPlannedDurationDays() < 0) {
                throw new WorkflowValidationException(
                    "Step " + step.getOrderIndex() + " has negative planned duration: " + step.getPlannedDurationDays());
            }
            if (step.getTasks() != null) {
                for (TemplateStepTask task : step.getTasks()) {
                    if (task == null || task.getTitle() == null || task.getTitle().isBlank()) {
                        throw new WorkflowValidationException("Step " + step.getOrderIndex() + " has a task without title");
                    }
                }
            }
        }
        for (int i = 0; i < steps.size(); i++) {
            if (!seen.contains(i)) {
                throw new WorkflowValidationException(
                    "Step order indices must be contiguous from 0, missing: " + i);
            }
        }
    }

    /**
     * 获取指定顺序的步骤
     */
    public Optional<TemplateStep> getStep(int orderIndex) {
        return steps.stream()
                .filter(s -> s.getOrderIndex() == orderIndex)
                .findFirst();
    }

    /**
     * 复合键，用于日志和错误信息
     */
    public String toKey() {
        return name + ":v" + version;
    }

    private static void normalizeTaskOrder(TemplateStep step) {
        List<TemplateStepTask> tasks = step.getTasks();
        if (tasks == null) {
            step.setTasks(new ArrayList<>());
            return;
        }
        tasks.sort(Comparator.comparingInt(TemplateStepTask::getOrderIndex));
        for (int i = 0; i < tasks.size(); i++) {
            tasks.get(i).setOrderIndex(i);
        }
    }
}
