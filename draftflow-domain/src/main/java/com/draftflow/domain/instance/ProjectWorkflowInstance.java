package com.draftflow.domain.instance;

import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.schedule.ScheduleStage;
import com.draftflow.domain.template.WorkflowTemplate;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ProjectWorkflowInstance - 项目工作流实例（聚合根）
 * <p>
 * 每个项目一个，创建时从激活模板复制步骤快照，之后不再跟随模板变化。
 * templateName/templateVersion 仅用于溯源展示。
 * </p>
 *
 * @author draftflow
 */
@Data
public class ProjectWorkflowInstance {

    private String projectId;

    private String templateName;

    private int templateVersion;

    private LocalDateTime createdAt;

    /**
     * 步骤状态（按 orderIndex 升序）
     */
    private List<ProjectStepState> steps = new ArrayList<>();

    /**
     * 从模板版本生成实例
     */
    public static ProjectWorkflowInstance seedFrom(String projectId, WorkflowTemplate template, LocalDateTime now) {
        ProjectWorkflowInstance instance = new ProjectWorkflowInstance();
        instance.projectId = projectId;
        instance.templateName = template.getName();
        instance.templateVersion = template.getVersion();
        instance.createdAt = now;
        instance.steps = template.getSteps().stream()
            .sorted(Comparator.comparingInt(s -> s.getOrderIndex()))
            .map(ProjectStepState::fromTemplate)
            .collect(Collectors.toList());
        return instance;
    }

    /**
     * 复制为另一个项目的实例：保留步骤结构，清空全部进度
     */
    public ProjectWorkflowInstance duplicateAs(String targetProjectId, LocalDateTime now) {
        ProjectWorkflowInstance copy = new ProjectWorkflowInstance();
        copy.projectId = targetProjectId;
        copy.templateName = templateName;
        copy.templateVersion = templateVersion;
        copy.createdAt = now;
        copy.steps = steps.stream()
            .map(ProjectStepState::copyStructure)
            .collect(Collectors.toList());
        return copy;
    }

    public ProjectStepState getStep(int orderIndex) {
        return steps.stream()
            .filter(s -> s.getOrderIndex() == orderIndex)
            .findFirst()
            .orElseThrow(() -> new WorkflowNotFoundException(
                "Step " + orderIndex + " not found in workflow of project " + projectId));
    }

    public List<ScheduleStage> toScheduleStages() {
        return steps.stream()
            .map(ProjectStepState::toScheduleStage)
            .collect(Collectors.toList());
    }

    /**
     * 写回排期结果
     * <p>
     * 已完成且已有到期日的步骤保持原到期日不变。
     * </p>
     */
    public void applySchedule(List<LocalDate> dueDates, List<Integer> actualDurations) {
        for (int i = 0; i < steps.size(); i++) {
            ProjectStepState step = steps.get(i);
            if (!(step.isCompletedFlag() && step.getPlannedDueDate() != null)) {
                step.setPlannedDueDate(dueDates.get(i));
            }
            step.setActualDurationDays(actualDurations.get(i));
        }
    }
}
