package com.draftflow.infrastructure.persistence.template.converter;

import com.draftflow.domain.template.TemplateStep;
import com.draftflow.domain.template.TemplateStepTask;
import com.draftflow.domain.template.WorkflowTemplate;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowStepTaskDO;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowTemplateDO;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowTemplateStepDO;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * WorkflowTemplateConverter - 工作流模板转换器
 * <p>
 * 负责领域对象与数据对象之间的转换
 * </p>
 *
 * @author draftflow
 */
public class WorkflowTemplateConverter {

    /**
     * 模板领域对象转数据对象
     */
    public static WorkflowTemplateDO toDataObject(WorkflowTemplate domain) {
        if (domain == null) {
            return null;
        }

        WorkflowTemplateDO dataObject = new WorkflowTemplateDO();
        dataObject.setName(domain.getName());
        dataObject.setVersion(domain.getVersion());
        dataObject.setActive(domain.isActive());
        dataObject.setCreatedAt(domain.getCreatedAt());
        dataObject.setCreatedBy(domain.getCreatedBy());
        return dataObject;
    }

    public static WorkflowTemplateStepDO stepToDataObject(TemplateStep step, Long templateId) {
        WorkflowTemplateStepDO dataObject = new WorkflowTemplateStepDO();
        dataObject.setTemplateId(templateId);
        dataObject.setOrderIndex(step.getOrderIndex());
        dataObject.setDepartment(step.getDepartment());
        dataObject.setGroupName(step.getGroupName());
        dataObject.setTitle(step.getTitle());
        dataObject.setPlannedDurationDays(step.getPlannedDurationDays());
        return dataObject;
    }

    public static WorkflowStepTaskDO taskToDataObject(TemplateStepTask task, Long templateStepId) {
        WorkflowStepTaskDO dataObject = new WorkflowStepTaskDO();
        dataObject.setTemplateStepId(templateStepId);
        dataObject.setOrderIndex(task.getOrderIndex());
        dataObject.setTitle(task.getTitle());
        dataObject.setDefaultChecked(task.isDefaultChecked());
        return dataObject;
    }

    /**
     * 数据对象转领域对象
     *
     * @param tasksByStepId 步骤ID -> 检查项
     */
    public static WorkflowTemplate toDomain(WorkflowTemplateDO dataObject,
                                            List<WorkflowTemplateStepDO> stepDOs,
                                            Map<Long, List<WorkflowStepTaskDO>> tasksByStepId) {
        if (dataObject == null) {
            return null;
        }

        WorkflowTemplate domain = new WorkflowTemplate();
        domain.setName(dataObject.getName());
        domain.setVersion(dataObject.getVersion());
        domain.setActive(Boolean.TRUE.equals(dataObject.getActive()));
        domain.setCreatedAt(dataObject.getCreatedAt());
        domain.setCreatedBy(dataObject.getCreatedBy());
        domain.setSteps(stepDOs.stream()
            .sorted(Comparator.comparing(WorkflowTemplateStepDO::getOrderIndex))
            .map(stepDO -> stepToDomain(stepDO, tasksByStepId.getOrDefault(stepDO.getId(), Collections.emptyList())))
            .collect(Collectors.toList()));
        return domain;
    }

    private static TemplateStep stepToDomain(WorkflowTemplateStepDO dataObject, List<WorkflowStepTaskDO> taskDOs) {
        return TemplateStep.builder()
            .orderIndex(dataObject.getOrderIndex())
            .department(dataObject.getDepartment())
            .groupName(dataObject.getGroupName())
            .title(dataObject.getTitle())
            .plannedDurationDays(dataObject.getPlannedDurationDays() == null ? 0 : dataObject.getPlannedDurationDays())
            .tasks(taskDOs.stream()
                .sorted(Comparator.comparing(WorkflowStepTaskDO::getOrderIndex))
                .map(t -> TemplateStepTask.builder()
                    .orderIndex(t.getOrderIndex())
                    .title(t.getTitle())
                    .defaultChecked(Boolean.TRUE.equals(t.getDefaultChecked()))
                    .build())
                .collect(Collectors.toList()))
            .build();
    }
}
