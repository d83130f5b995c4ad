package com.draftflow.domain.instance.service;

import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.exception.WorkflowValidationException;
import com.draftflow.domain.instance.ProjectStepState;
import com.draftflow.domain.instance.ProjectStepTask;
import com.draftflow.domain.instance.ProjectWorkflowInstance;
import com.draftflow.domain.instance.command.RecordStepEventCommand;
import com.draftflow.domain.instance.repository.ProjectWorkflowRepository;
import com.draftflow.domain.schedule.ScheduleCalculator;
import com.draftflow.domain.schedule.ScheduleStage;
import com.draftflow.domain.template.TemplateStep;
import com.draftflow.domain.template.TemplateStepTask;
import com.draftflow.domain.template.WorkflowTemplate;
import com.draftflow.domain.template.repository.WorkflowTemplateRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * ProjectWorkflowService - 项目工作流实例领域服务
 * <p>
 * 负责实例的创建、复制、事件记录、排期重算以及步骤检查项维护。
 * 实例一旦创建就不会再从模板重新生成。
 * </p>
 *
 * @author draftflow
 */
@Slf4j
public class ProjectWorkflowService {

    private final WorkflowTemplateRepository templateRepository;
    private final ProjectWorkflowRepository instanceRepository;
    private final ScheduleCalculator scheduleCalculator;
    private final Clock clock;
    private final String templateName;

    public ProjectWorkflowService(WorkflowTemplateRepository templateRepository,
                                  ProjectWorkflowRepository instanceRepository,
                                  ScheduleCalculator scheduleCalculator,
                                  Clock clock,
                                  String templateName) {
        this.templateRepository = templateRepository;
        this.instanceRepository = instanceRepository;
        this.scheduleCalculator = scheduleCalculator;
        this.clock = clock;
        this.templateName = templateName;
    }

    /**
     * 为项目创建实例；已存在时原样返回
     *
     * @throws WorkflowNotFoundException 没有激活的模板
     */
    public ProjectWorkflowInstance seedInstance(String projectId) {
        requireProjectId(projectId);
        Optional<ProjectWorkflowInstance> existing = instanceRepository.findByProjectId(projectId);
        if (existing.isPresent()) {
            log.debug("Workflow for project {} already exists, skip seeding", projectId);
            return existing.get();
        }

        WorkflowTemplate template = templateRepository.findActive(templateName)
            .orElseThrow(() -> new WorkflowNotFoundException("No active workflow template: " + templateName));
        ProjectWorkflowInstance instance = ProjectWorkflowInstance.seedFrom(projectId, template, now());
        instanceRepository.save(instance);
        log.info("Seeded workflow for project {} from template {}", projectId, template.toKey());
        return instance;
    }

    public ProjectWorkflowInstance getInstance(String projectId) {
        return instanceRepository.findByProjectId(projectId)
            .orElseThrow(() -> new WorkflowNotFoundException("No workflow for project: " + projectId));
    }

    /**
     * 记录步骤事件
     */
    public ProjectStepState recordEvent(RecordStepEventCommand command) {
        ProjectWorkflowInstance instance = getInstance(command.getProjectId());
        ProjectStepState step = instance.getStep(command.getStepOrderIndex());
        LocalDateTime now = now();
        boolean value = command.getValue() == null || command.getValue();

        switch (command.getKind()) {
            case START:
                step.markStarted(value, now);
                break;
            case COMPLETE:
                step.markCompleted(value, now);
                break;
            case TRANSFER:
                step.transferTo(command.getActorName(), now);
                break;
            case RECEIVE:
                step.receiveFrom(command.getActorName(), now);
                break;
            default:
                throw new WorkflowValidationException("Unsupported step event: " + command.getKind());
        }

        instanceRepository.save(instance);
        log.info("Recorded {} on step {} of project {}",
            command.getKind(), command.getStepOrderIndex(), command.getProjectId());
        return step;
    }

    /**
     * 按项目到期日重算所有步骤的计划到期日和实际工期
     *
     * @param projectDueDate 项目到期日，可以为 null
     */
    public List<ProjectStepState> recomputeSchedule(String projectId, LocalDate projectDueDate) {
        ProjectWorkflowInstance instance = getInstance(projectId);
        List<ScheduleStage> stages = instance.toScheduleStages();
        instance.applySchedule(
            scheduleCalculator.computeDueDates(projectDueDate, stages),
            scheduleCalculator.computeActualDurations(stages));
        instanceRepository.save(instance);
        log.debug("Recomputed schedule of project {} against due date {}", projectId, projectDueDate);
        return instance.getSteps();
    }

    /**
     * 复制项目工作流：只复制结构，不复制进度
     *
     * @throws WorkflowValidationException 目标项目已有工作流
     */
    public ProjectWorkflowInstance duplicateInstance(String sourceProjectId, String targetProjectId) {
        requireProjectId(targetProjectId);
        if (targetProjectId.equals(sourceProjectId)) {
            throw new WorkflowValidationException("Cannot duplicate workflow onto the same project: " + sourceProjectId);
        }
        ProjectWorkflowInstance source = getInstance(sourceProjectId);
        if (instanceRepository.exists(targetProjectId)) {
            throw new WorkflowValidationException("Project " + targetProjectId + " already has a workflow");
        }
        ProjectWorkflowInstance copy = source.duplicateAs(targetProjectId, now());
        instanceRepository.save(copy);
        log.info("Duplicated workflow of project {} into project {}", sourceProjectId, targetProjectId);
        return copy;
    }

    public ProjectStepTask toggleTask(String projectId, int stepOrderIndex, int taskOrderIndex, boolean checked) {
        ProjectWorkflowInstance instance = getInstance(projectId);
        ProjectStepTask task = instance.getStep(stepOrderIndex).getTask(taskOrderIndex);
        task.toggle(checked, now());
        instanceRepository.save(instance);
        return task;
    }

    public ProjectStepTask addTask(String projectId, int stepOrderIndex, String title) {
        ProjectWorkflowInstance instance = getInstance(projectId);
        ProjectStepTask task = instance.getStep(stepOrderIndex).addTask(title);
        instanceRepository.save(instance);
        return task;
    }

    /**
     * 补齐实例来源模板版本中有、实例中缺失的检查项，不删除任何已有检查项
     *
     * @return 新增的检查项数量
     */
    public int syncTemplateTasks(String projectId) {
        ProjectWorkflowInstance instance = getInstance(projectId);
        WorkflowTemplate template = templateRepository
            .findByNameAndVersion(instance.getTemplateName(), instance.getTemplateVersion())
            .orElseThrow(() -> new WorkflowNotFoundException("Workflow template not found: "
                + instance.getTemplateName() + ":v" + instance.getTemplateVersion()));

        int added = 0;
        for (ProjectStepState step : instance.getSteps()) {
            Optional<TemplateStep> templateStep = template.getStep(step.getOrderIndex());
            if (templateStep.isEmpty()) {
                continue;
            }
            for (TemplateStepTask templateTask : templateStep.get().getTasks()) {
                if (step.hasTemplateTask(templateTask.getOrderIndex())) {
                    continue;
                }
                ProjectStepTask task = step.addTask(templateTask.getTitle());
                task.setTemplateTaskOrderIndex(templateTask.getOrderIndex());
                task.setChecked(templateTask.isDefaultChecked());
                added++;
            }
        }
        if (added > 0) {
            instanceRepository.save(instance);
            log.info("Added {} template tasks to workflow of project {}", added, projectId);
        }
        return added;
    }

    // ==================== 私有方法 ====================

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static void requireProjectId(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new WorkflowValidationException("Project id cannot be empty");
        }
    }
}
