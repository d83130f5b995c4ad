package com.draftflow.infrastructure.persistence.instance;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.draftflow.domain.instance.ProjectStepState;
import com.draftflow.domain.instance.ProjectStepTask;
import com.draftflow.domain.instance.ProjectWorkflowInstance;
import com.draftflow.domain.instance.repository.ProjectWorkflowRepository;
import com.draftflow.infrastructure.persistence.instance.converter.ProjectWorkflowConverter;
import com.draftflow.infrastructure.persistence.instance.entity.ProjectStepTaskDO;
import com.draftflow.infrastructure.persistence.instance.entity.ProjectWorkflowStepDO;
import com.draftflow.infrastructure.persistence.instance.mapper.ProjectStepTaskMapper;
import com.draftflow.infrastructure.persistence.instance.mapper.ProjectWorkflowStepMapper;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowStepTaskDO;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowTemplateDO;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowTemplateStepDO;
import com.draftflow.infrastructure.persistence.template.mapper.WorkflowStepTaskMapper;
import com.draftflow.infrastructure.persistence.template.mapper.WorkflowTemplateMapper;
import com.draftflow.infrastructure.persistence.template.mapper.WorkflowTemplateStepMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * ProjectWorkflowRepositoryImpl - 项目工作流仓储实现
 * <p>
 * 实例没有单独的表，由 project_workflow_steps 中同一 project_id 的行组成。
 * 保存时按 (project_id, order_index) 定位步骤行、按 (project_step_id, order_index) 定位检查项行，
 * 只更新可变列，行从不删除。
 * </p>
 *
 * @author draftflow
 */
@Repository
@Validated
public class ProjectWorkflowRepositoryImpl implements ProjectWorkflowRepository {

    private final ProjectWorkflowStepMapper stepMapper;
    private final ProjectStepTaskMapper taskMapper;
    private final WorkflowTemplateMapper templateMapper;
    private final WorkflowTemplateStepMapper templateStepMapper;
    private final WorkflowStepTaskMapper templateTaskMapper;

    public ProjectWorkflowRepositoryImpl(ProjectWorkflowStepMapper stepMapper,
                                         ProjectStepTaskMapper taskMapper,
                                         WorkflowTemplateMapper templateMapper,
                                         WorkflowTemplateStepMapper templateStepMapper,
                                         WorkflowStepTaskMapper templateTaskMapper) {
        this.stepMapper = stepMapper;
        this.taskMapper = taskMapper;
        this.templateMapper = templateMapper;
        this.templateStepMapper = templateStepMapper;
        this.templateTaskMapper = templateTaskMapper;
    }

    @Override
    public Optional<ProjectWorkflowInstance> findByProjectId(String projectId) {
        List<ProjectWorkflowStepDO> stepDOs = stepMapper.selectList(
            new LambdaQueryWrapper<ProjectWorkflowStepDO>()
                .eq(ProjectWorkflowStepDO::getProjectId, projectId)
                .orderByAsc(ProjectWorkflowStepDO::getOrderIndex)
        );
        if (stepDOs.isEmpty()) {
            return Optional.empty();
        }

        WorkflowTemplateDO templateDO = stepDOs.get(0).getTemplateId() == null
            ? null : templateMapper.selectById(stepDOs.get(0).getTemplateId());

        List<Long> stepIds = stepDOs.stream().map(ProjectWorkflowStepDO::getId).collect(Collectors.toList());
        List<ProjectStepTaskDO> taskDOs = taskMapper.selectList(
            new LambdaQueryWrapper<ProjectStepTaskDO>()
                .in(ProjectStepTaskDO::getProjectStepId, stepIds)
        );

        List<Long> templateTaskIds = taskDOs.stream()
            .map(ProjectStepTaskDO::getTemplateTaskId)
            .filter(Objects::nonNull)
            .distinct()
            .collect(Collectors.toList());
        Map<Long, Integer> templateTaskOrderById = templateTaskIds.isEmpty()
            ? Collections.emptyMap()
            : templateTaskMapper.selectBatchIds(templateTaskIds).stream()
                .collect(Collectors.toMap(WorkflowStepTaskDO::getId, WorkflowStepTaskDO::getOrderIndex));

        return Optional.of(ProjectWorkflowConverter.toDomain(
            projectId,
            templateDO == null ? null : templateDO.getName(),
            templateDO == null ? 0 : templateDO.getVersion(),
            stepDOs,
            taskDOs.stream().collect(Collectors.groupingBy(ProjectStepTaskDO::getProjectStepId)),
            templateTaskOrderById));
    }

    @Override
    public boolean exists(String projectId) {
        return stepMapper.selectCount(
            new LambdaQueryWrapper<ProjectWorkflowStepDO>()
                .eq(ProjectWorkflowStepDO::getProjectId, projectId)
        ) > 0;
    }

    @Override
    @Transactional
    public void save(ProjectWorkflowInstance instance) {
        TemplateRefs refs = resolveTemplate(instance.getTemplateName(), instance.getTemplateVersion());

        Map<Integer, ProjectWorkflowStepDO> existingSteps = stepMapper.selectList(
                new LambdaQueryWrapper<ProjectWorkflowStepDO>()
                    .eq(ProjectWorkflowStepDO::getProjectId, instance.getProjectId())
            ).stream()
            .collect(Collectors.toMap(ProjectWorkflowStepDO::getOrderIndex, Function.identity()));

        for (ProjectStepState step : instance.getSteps()) {
            Long templateStepId = refs.stepIdByOrder.get(step.getOrderIndex());
            ProjectWorkflowStepDO existing = existingSteps.get(step.getOrderIndex());
            Long projectStepId;
            if (existing == null) {
                ProjectWorkflowStepDO stepDO = ProjectWorkflowConverter.stepToDataObject(
                    step, instance, refs.templateId, templateStepId);
                stepMapper.insert(stepDO);
                projectStepId = stepDO.getId();
            } else {
                updateMutableColumns(existing.getId(), step);
                projectStepId = existing.getId();
            }
            saveTasks(projectStepId, step.getTasks(),
                refs.taskIdByOrder.getOrDefault(templateStepId, Collections.emptyMap()));
        }
    }

    // ==================== 私有方法 ====================

    private void updateMutableColumns(Long id, ProjectStepState step) {
        // 用 set 显式写入，允许把到期日等派生列清空
        stepMapper.update(null,
            new LambdaUpdateWrapper<ProjectWorkflowStepDO>()
                .set(ProjectWorkflowStepDO::getStartFlag, step.isStartFlag())
                .set(ProjectWorkflowStepDO::getStartTs, step.getStartTimestamp())
                .set(ProjectWorkflowStepDO::getCompletedFlag, step.isCompletedFlag())
                .set(ProjectWorkflowStepDO::getCompletedTs, step.getCompletedTimestamp())
                .set(ProjectWorkflowStepDO::getTransferToName, step.getTransferToName())
                .set(ProjectWorkflowStepDO::getTransferToTs, step.getTransferToTimestamp())
                .set(ProjectWorkflowStepDO::getReceivedFromName, step.getReceivedFromName())
                .set(ProjectWorkflowStepDO::getReceivedFromTs, step.getReceivedFromTimestamp())
                .set(ProjectWorkflowStepDO::getPlannedDueDate, step.getPlannedDueDate())
                .set(ProjectWorkflowStepDO::getActualDurationDays, step.getActualDurationDays())
                .eq(ProjectWorkflowStepDO::getId, id)
        );
    }

    private void saveTasks(Long projectStepId, List<ProjectStepTask> tasks, Map<Integer, Long> templateTaskIdByOrder) {
        Map<Integer, ProjectStepTaskDO> existingTasks = taskMapper.selectList(
                new LambdaQueryWrapper<ProjectStepTaskDO>()
                    .eq(ProjectStepTaskDO::getProjectStepId, projectStepId)
            ).stream()
            .collect(Collectors.toMap(ProjectStepTaskDO::getOrderIndex, Function.identity()));

        for (ProjectStepTask task : tasks) {
            Long templateTaskId = task.getTemplateTaskOrderIndex() == null
                ? null : templateTaskIdByOrder.get(task.getTemplateTaskOrderIndex());
            ProjectStepTaskDO existing = existingTasks.get(task.getOrderIndex());
            if (existing == null) {
                taskMapper.insert(ProjectWorkflowConverter.taskToDataObject(task, projectStepId, templateTaskId));
            } else {
                taskMapper.update(null,
                    new LambdaUpdateWrapper<ProjectStepTaskDO>()
                        .set(ProjectStepTaskDO::getTitle, task.getTitle())
                        .set(ProjectStepTaskDO::getChecked, task.isChecked())
                        .set(ProjectStepTaskDO::getCheckedTs, task.getCheckedTimestamp())
                        .set(ProjectStepTaskDO::getTemplateTaskId, templateTaskId)
                        .eq(ProjectStepTaskDO::getId, existing.getId())
                );
            }
        }
    }

    private TemplateRefs resolveTemplate(String templateName, int templateVersion) {
        TemplateRefs refs = new TemplateRefs();
        if (templateName == null) {
            return refs;
        }
        WorkflowTemplateDO templateDO = templateMapper.selectOne(
            new LambdaQueryWrapper<WorkflowTemplateDO>()
                .eq(WorkflowTemplateDO::getName, templateName)
                .eq(WorkflowTemplateDO::getVersion, templateVersion)
        );
        if (templateDO == null) {
            return refs;
        }
        refs.templateId = templateDO.getId();

        List<WorkflowTemplateStepDO> stepDOs = templateStepMapper.selectList(
            new LambdaQueryWrapper<WorkflowTemplateStepDO>()
                .eq(WorkflowTemplateStepDO::getTemplateId, templateDO.getId())
        );
        for (WorkflowTemplateStepDO stepDO : stepDOs) {
            refs.stepIdByOrder.put(stepDO.getOrderIndex(), stepDO.getId());
        }
        if (!stepDOs.isEmpty()) {
            List<Long> stepIds = stepDOs.stream().map(WorkflowTemplateStepDO::getId).collect(Collectors.toList());
            for (WorkflowStepTaskDO taskDO : templateTaskMapper.selectList(
                new LambdaQueryWrapper<WorkflowStepTaskDO>().in(WorkflowStepTaskDO::getTemplateStepId, stepIds))) {
                refs.taskIdByOrder
                    .computeIfAbsent(taskDO.getTemplateStepId(), k -> new HashMap<>())
                    .put(taskDO.getOrderIndex(), taskDO.getId());
            }
        }
        return refs;
    }

    /**
     * 实例来源模板版本的行ID
     */
    private static class TemplateRefs {
        private Long templateId;
        private final Map<Integer, Long> stepIdByOrder = new HashMap<>();
        private final Map<Long, Map<Integer, Long>> taskIdByOrder = new HashMap<>();
    }
}
