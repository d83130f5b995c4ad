package com.draftflow.app.service;

import com.draftflow.app.parser.TemplateYamlParser;
import com.draftflow.domain.gateway.ProjectRecordGateway;
import com.draftflow.domain.instance.ProjectStepState;
import com.draftflow.domain.instance.ProjectStepTask;
import com.draftflow.domain.instance.ProjectWorkflowInstance;
import com.draftflow.domain.instance.command.RecordStepEventCommand;
import com.draftflow.domain.instance.service.ProjectWorkflowService;
import com.draftflow.domain.person.PersonDirectoryService;
import com.draftflow.domain.review.AdvanceResult;
import com.draftflow.domain.review.PendingReview;
import com.draftflow.domain.review.RelocationReport;
import com.draftflow.domain.review.ReviewPipelineInstance;
import com.draftflow.domain.review.ReviewSummary;
import com.draftflow.domain.review.StageFile;
import com.draftflow.domain.review.command.AdvanceStageCommand;
import com.draftflow.domain.review.service.ReviewPipelineService;
import com.draftflow.domain.template.WorkflowTemplate;
import com.draftflow.domain.template.command.PublishTemplateCommand;
import com.draftflow.domain.template.service.WorkflowTemplateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * WorkflowAppService - 工作流编排服务
 * <p>
 * 界面和接口层的唯一入口。每个写操作都在一个事务里完成，
 * 步骤事件之后会按项目到期日重算排期。
 * </p>
 *
 * @author draftflow
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowAppService {

    private final TemplateYamlParser parser;
    private final WorkflowTemplateService templateService;
    private final ProjectWorkflowService projectWorkflowService;
    private final ReviewPipelineService reviewPipelineService;
    private final PersonDirectoryService personDirectoryService;
    private final ProjectRecordGateway projectRecordGateway;

    // ==================== 模板 ====================

    @Transactional
    public WorkflowTemplate publishTemplate(PublishTemplateCommand command) {
        return templateService.publishNewVersion(command);
    }

    @Transactional
    public WorkflowTemplate importTemplate(String yamlContent) {
        PublishTemplateCommand command = parser.parse(yamlContent);
        log.info("Importing workflow template {} from YAML", command.getName());
        return templateService.publishNewVersion(command);
    }

    public WorkflowTemplate getActiveTemplate(String name) {
        return templateService.getActiveTemplate(name);
    }

    public WorkflowTemplate getTemplateVersion(String name, int version) {
        return templateService.getVersion(name, version);
    }

    public List<WorkflowTemplate> listTemplateVersions(String name) {
        return templateService.listVersions(name);
    }

    // ==================== 项目工作流 ====================

    /**
     * 新项目：创建实例并按项目到期日排期
     */
    @Transactional
    public ProjectWorkflowInstance onProjectCreated(String projectId) {
        projectWorkflowService.seedInstance(projectId);
        projectWorkflowService.recomputeSchedule(projectId, projectDueDate(projectId));
        return projectWorkflowService.getInstance(projectId);
    }

    /**
     * 复制项目：只复制步骤结构，然后按新项目的到期日排期
     */
    @Transactional
    public ProjectWorkflowInstance onProjectDuplicated(String sourceProjectId, String targetProjectId) {
        projectWorkflowService.duplicateInstance(sourceProjectId, targetProjectId);
        projectWorkflowService.recomputeSchedule(targetProjectId, projectDueDate(targetProjectId));
        return projectWorkflowService.getInstance(targetProjectId);
    }

    @Transactional
    public ProjectStepState onStepEvent(RecordStepEventCommand command) {
        projectWorkflowService.recordEvent(command);
        List<ProjectStepState> steps = projectWorkflowService.recomputeSchedule(
            command.getProjectId(), projectDueDate(command.getProjectId()));
        return steps.stream()
            .filter(s -> s.getOrderIndex() == command.getStepOrderIndex())
            .findFirst()
            .orElseThrow(IllegalStateException::new);
    }

    @Transactional
    public List<ProjectStepState> onDueDateChanged(String projectId, LocalDate newDueDate) {
        log.info("Due date of project {} changed to {}", projectId, newDueDate);
        return projectWorkflowService.recomputeSchedule(projectId, newDueDate);
    }

    public ProjectWorkflowInstance getProjectWorkflow(String projectId) {
        return projectWorkflowService.getInstance(projectId);
    }

    @Transactional
    public ProjectStepTask toggleStepTask(String projectId, int stepOrderIndex, int taskOrderIndex, boolean checked) {
        return projectWorkflowService.toggleTask(projectId, stepOrderIndex, taskOrderIndex, checked);
    }

    @Transactional
    public ProjectStepTask addStepTask(String projectId, int stepOrderIndex, String title) {
        return projectWorkflowService.addTask(projectId, stepOrderIndex, title);
    }

    @Transactional
    public int syncStepTasks(String projectId) {
        return projectWorkflowService.syncTemplateTasks(projectId);
    }

    public List<String> listActors() {
        return personDirectoryService.listActors();
    }

    // ==================== 打印包评审 ====================

    @Transactional
    public ReviewPipelineInstance createReview(String jobNumber, String createdBy) {
        return reviewPipelineService.createReview(jobNumber, createdBy);
    }

    @Transactional
    public AdvanceResult onReviewAdvance(AdvanceStageCommand command) {
        AdvanceResult result = reviewPipelineService.advanceStage(command);
        if (result.getRelocation().hasFailures()) {
            log.warn("Job {} advanced past stage {} with {} file(s) left behind",
                result.getJobNumber(), result.getCompletedStage(), result.getRelocation().getFailures().size());
        }
        return result;
    }

    @Transactional
    public StageFile attachReviewFile(String jobNumber, String filePath) {
        return reviewPipelineService.attachFile(jobNumber, filePath);
    }

    @Transactional
    public RelocationReport retryRelocation(String jobNumber, List<String> fileNames) {
        return reviewPipelineService.retryRelocation(jobNumber, fileNames);
    }

    public ReviewSummary getReviewSummary(String jobNumber) {
        return reviewPipelineService.getSummary(jobNumber);
    }

    public List<PendingReview> listPendingReviews(String department) {
        return reviewPipelineService.getPendingReviews(department);
    }

    public List<StageFile> getFilesForStage(String jobNumber, int stageIndex) {
        return reviewPipelineService.getFilesForStage(jobNumber, stageIndex);
    }

    private LocalDate projectDueDate(String projectId) {
        return projectRecordGateway.findDueDate(projectId).orElse(null);
    }
}
