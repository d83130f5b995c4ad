package com.draftflow.infrastructure.persistence.instance.converter;

import com.draftflow.domain.instance.ProjectStepState;
import com.draftflow.domain.instance.ProjectStepTask;
import com.draftflow.domain.instance.ProjectWorkflowInstance;
import com.draftflow.infrastructure.persistence.instance.entity.ProjectStepTaskDO;
import com.draftflow.infrastructure.persistence.instance.entity.ProjectWorkflowStepDO;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ProjectWorkflowConverter - 项目工作流转换器
 *
 * @author draftflow
 */
public class ProjectWorkflowConverter {

    /**
     * 步骤领域对象转数据对象
     */
    public static ProjectWorkflowStepDO stepToDataObject(ProjectStepState step, ProjectWorkflowInstance instance,
                                                        Long templateId, Long templateStepId) {
        ProjectWorkflowStepDO dataObject = new ProjectWorkflowStepDO();
        dataObject.setProjectId(instance.getProjectId());
        dataObject.setTemplateId(templateId);
        dataObject.setTemplateStepId(templateStepId);
        dataObject.setOrderIndex(step.getOrderIndex());
        dataObject.setDepartment(step.getDepartment());
        dataObject.setGroupName(step.getGroupName());
        dataObject.setTitle(step.getTitle());
        dataObject.setPlannedDurationDays(step.getPlannedDurationDays());
        dataObject.setStartFlag(step.isStartFlag());
        dataObject.setStartTs(step.getStartTimestamp());
        dataObject.setCompletedFlag(step.isCompletedFlag());
        dataObject.setCompletedTs(step.getCompletedTimestamp());
        dataObject.setTransferToName(step.getTransferToName());
        dataObject.setTransferToTs(step.getTransferToTimestamp());
        dataObject.setReceivedFromName(step.getReceivedFromName());
        dataObject.setReceivedFromTs(step.getReceivedFromTimestamp());
        dataObject.setPlannedDueDate(step.getPlannedDueDate());
        dataObject.setActualDurationDays(step.getActualDurationDays());
        dataObject.setCreatedAt(instance.getCreatedAt());
        return dataObject;
    }

    public static ProjectStepTaskDO taskToDataObject(ProjectStepTask task, Long projectStepId, Long templateTaskId) {
        ProjectStepTaskDO dataObject = new ProjectStepTaskDO();
        dataObject.setProjectStepId(projectStepId);
        dataObject.setTemplateTaskId(templateTaskId);
        dataObject.setOrderIndex(task.getOrderIndex());
        dataObject.setTitle(task.getTitle());
        dataObject.setChecked(task.isChecked());
        dataObject.setCheckedTs(task.getCheckedTimestamp());
        return dataObject;
    }

    /**
     * 数据对象转领域对象
     *
     * @param tasksByStepId             步骤行ID -> 检查项
     * @param templateTaskOrderById     模板检查项ID -> 模板检查项序号
     */
    public static ProjectWorkflowInstance toDomain(String projectId, String templateName, int templateVersion,
                                                   List<ProjectWorkflowStepDO> stepDOs,
                                                   Map<Long, List<ProjectStepTaskDO>> tasksByStepId,
                                                   Map<Long, Integer> templateTaskOrderById) {
        ProjectWorkflowInstance instance = new ProjectWorkflowInstance();
        instance.setProjectId(projectId);
        instance.setTemplateName(templateName);
        instance.setTemplateVersion(templateVersion);
        instance.setCreatedAt(stepDOs.get(0).getCreatedAt());
        instance.setSteps(stepDOs.stream()
            .sorted(Comparator.comparing(ProjectWorkflowStepDO::getOrderIndex))
            .map(stepDO -> stepToDomain(stepDO,
                tasksByStepId.getOrDefault(stepDO.getId(), Collections.emptyList()), templateTaskOrderById))
            .collect(Collectors.toList()));
        return instance;
    }

    private static ProjectStepState stepToDomain(ProjectWorkflowStepDO dataObject, List<ProjectStepTaskDO> taskDOs,
                                                 Map<Long, Integer> templateTaskOrderById) {
        ProjectStepState step = new ProjectStepState();
        step.setOrderIndex(dataObject.getOrderIndex());
        step.setDepartment(dataObject.getDepartment());
        step.setGroupName(dataObject.getGroupName());
        step.setTitle(dataObject.getTitle());
        step.setPlannedDurationDays(dataObject.getPlannedDurationDays() == null ? 0 : dataObject.getPlannedDurationDays());
        step.setStartFlag(Boolean.TRUE.equals(dataObject.getStartFlag()));
        step.setStartTimestamp(dataObject.getStartTs());
        step.setCompletedFlag(Boolean.TRUE.equals(dataObject.getCompletedFlag()));
        step.setCompletedTimestamp(dataObject.getCompletedTs());
        step.setTransferToName(dataObject.getTransferToName());
        step.setTransferToTimestamp(dataObject.getTransferToTs());
        step.setReceivedFromName(dataObject.getReceivedFromName());
        step.setReceivedFromTimestamp(dataObject.getReceivedFromTs());
        step.setPlannedDueDate(dataObject.getPlannedDueDate());
        step.setActualDurationDays(dataObject.getActualDurationDays());
        step.setTasks(taskDOs.stream()
            .sorted(Comparator.comparing(ProjectStepTaskDO::getOrderIndex))
            .map(t -> ProjectStepTask.builder()
                .orderIndex(t.getOrderIndex())
                .title(t.getTitle())
                .checked(Boolean.TRUE.equals(t.getChecked()))
                .checkedTimestamp(t.getCheckedTs())
                .templateTaskOrderIndex(t.getTemplateTaskId() == null ? null : templateTaskOrderById.get(t.getTemplateTaskId()))
                .build())
            .collect(Collectors.toList()));
        return step;
    }
}
