package com.draftflow.domain.instance;

import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.exception.WorkflowValidationException;
import com.draftflow.domain.schedule.ScheduleStage;
import com.draftflow.domain.template.TemplateStep;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ProjectStepState - 项目工作流中单个步骤的状态
 * <p>
 * orderIndex、department、groupName、title、plannedDurationDays 是实例化时从模板步骤复制的快照，
 * 之后模板如何变化都不会影响它们。
 * 所有时间戳只追加：一旦写入，取消对应标记也不会清除时间，重新勾选也不会覆盖。
 * </p>
 *
 * @author draftflow
 */
@Data
public class ProjectStepState {

    private int orderIndex;

    private String department;

    private String groupName;

    private String title;

    private int plannedDurationDays;

    private boolean startFlag;

    private LocalDateTime startTimestamp;

    private boolean completedFlag;

    private LocalDateTime completedTimestamp;

    private String transferToName;

    private LocalDateTime transferToTimestamp;

    private String receivedFromName;

    private LocalDateTime receivedFromTimestamp;

    /**
     * 计划到期日（派生值，由排期重算写回）
     */
    private LocalDate plannedDueDate;

    /**
     * 实际工期（派生值，完成后才有）
     */
    private Integer actualDurationDays;

    private List<ProjectStepTask> tasks = new ArrayList<>();

    /**
     * 由模板步骤生成初始状态，所有可变字段为空
     */
    public static ProjectStepState fromTemplate(TemplateStep step) {
        ProjectStepState state = new ProjectStepState();
        state.orderIndex = step.getOrderIndex();
        state.department = step.getDepartment();
        state.groupName = step.getGroupName();
        state.title = step.getTitle();
        state.plannedDurationDays = step.getPlannedDurationDays();
        if (step.getTasks() != null) {
            state.tasks = step.getTasks().stream()
                .map(t -> ProjectStepTask.builder()
                    .orderIndex(t.getOrderIndex())
                    .title(t.getTitle())
                    .checked(t.isDefaultChecked())
                    .templateTaskOrderIndex(t.getOrderIndex())
                    .build())
                .collect(Collectors.toList());
        }
        return state;
    }

    /**
     * 只复制结构（含检查项标题），不复制任何进度
     */
    public ProjectStepState copyStructure() {
        ProjectStepState copy = new ProjectStepState();
        copy.orderIndex = orderIndex;
        copy.department = department;
        copy.groupName = groupName;
        copy.title = title;
        copy.plannedDurationDays = plannedDurationDays;
        copy.tasks = tasks.stream()
            .map(t -> ProjectStepTask.builder()
                .orderIndex(t.getOrderIndex())
                .title(t.getTitle())
                .templateTaskOrderIndex(t.getTemplateTaskOrderIndex())
                .build())
            .collect(Collectors.toList());
        return copy;
    }

    public void markStarted(boolean value, LocalDateTime now) {
        this.startFlag = value;
        if (value && startTimestamp == null) {
            this.startTimestamp = now;
        }
    }

    public void markCompleted(boolean value, LocalDateTime now) {
        this.completedFlag = value;
        if (value && completedTimestamp == null) {
            this.completedTimestamp = now;
        }
    }

    /**
     * 移交给指定参与人，时间只在第一次移交时记录
     */
    public void transferTo(String actorName, LocalDateTime now) {
        this.transferToName = requireActor(actorName);
        if (transferToTimestamp == null) {
            this.transferToTimestamp = now;
        }
    }

    /**
     * 从指定参与人处接收，时间只在第一次接收时记录
     */
    public void receiveFrom(String actorName, LocalDateTime now) {
        this.receivedFromName = requireActor(actorName);
        if (receivedFromTimestamp == null) {
            this.receivedFromTimestamp = now;
        }
    }

    public ProjectStepTask getTask(int taskOrderIndex) {
        return tasks.stream()
            .filter(t -> t.getOrderIndex() == taskOrderIndex)
            .findFirst()
            .orElseThrow(() -> new WorkflowNotFoundException(
                "Task " + taskOrderIndex + " not found in step " + orderIndex));
    }

    /**
     * 追加手工检查项，序号为当前最大序号 + 1
     */
    public ProjectStepTask addTask(String taskTitle) {
        if (taskTitle == null || taskTitle.isBlank()) {
            throw new WorkflowValidationException("Task title cannot be empty");
        }
        int next = tasks.stream().mapToInt(ProjectStepTask::getOrderIndex).max().orElse(-1) + 1;
        ProjectStepTask task = ProjectStepTask.builder()
            .orderIndex(next)
            .title(taskTitle.trim())
            .build();
        tasks.add(task);
        return task;
    }

    public boolean hasTemplateTask(int templateTaskOrderIndex) {
        return tasks.stream()
            .anyMatch(t -> t.getTemplateTaskOrderIndex() != null
                && t.getTemplateTaskOrderIndex() == templateTaskOrderIndex);
    }

    ScheduleStage toScheduleStage() {
        return ScheduleStage.builder()
            .plannedDurationDays(plannedDurationDays)
            .actualStart(startTimestamp)
            .actualCompletion(completedTimestamp)
            .build();
    }

    private static String requireActor(String actorName) {
        if (actorName == null || actorName.isBlank()) {
            throw new WorkflowValidationException("Actor name cannot be empty");
        }
        return actorName.trim();
    }
}
