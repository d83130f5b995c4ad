package com.draftflow.adapter.web;

import com.draftflow.adapter.web.request.AddTaskRequest;
import com.draftflow.adapter.web.request.DueDateRequest;
import com.draftflow.adapter.web.request.StepEventRequest;
import com.draftflow.adapter.web.request.ToggleTaskRequest;
import com.draftflow.app.service.WorkflowAppService;
import com.draftflow.client.dto.MultiResponse;
import com.draftflow.client.dto.SingleResponse;
import com.draftflow.domain.instance.ProjectStepState;
import com.draftflow.domain.instance.ProjectStepTask;
import com.draftflow.domain.instance.ProjectWorkflowInstance;
import com.draftflow.domain.instance.command.RecordStepEventCommand;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 项目工作流接口
 *
 * @author draftflow
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/workflow")
@RequiredArgsConstructor
public class ProjectWorkflowController {

    private final WorkflowAppService appService;

    @PostMapping
    public SingleResponse<ProjectWorkflowInstance> create(@PathVariable("projectId") String projectId) {
        return SingleResponse.of(appService.onProjectCreated(projectId));
    }

    @PostMapping("/duplicate")
    public SingleResponse<ProjectWorkflowInstance> duplicate(@PathVariable("projectId") String projectId,
                                                             @RequestParam("source") String sourceProjectId) {
        return SingleResponse.of(appService.onProjectDuplicated(sourceProjectId, projectId));
    }

    @GetMapping
    public SingleResponse<ProjectWorkflowInstance> get(@PathVariable("projectId") String projectId) {
        return SingleResponse.of(appService.getProjectWorkflow(projectId));
    }

    @PostMapping("/steps/{order}/events")
    public SingleResponse<ProjectStepState> recordEvent(@PathVariable("projectId") String projectId,
                                                        @PathVariable("order") int order,
                                                        @Valid @RequestBody StepEventRequest request) {
        RecordStepEventCommand command = RecordStepEventCommand.builder()
            .projectId(projectId)
            .stepOrderIndex(order)
            .kind(request.getKind())
            .value(request.getValue())
            .actorName(request.getActorName())
            .build();
        return SingleResponse.of(appService.onStepEvent(command));
    }

    @PutMapping("/due-date")
    public MultiResponse<ProjectStepState> changeDueDate(@PathVariable("projectId") String projectId,
                                                         @RequestBody DueDateRequest request) {
        return MultiResponse.of(appService.onDueDateChanged(projectId, request.getDueDate()));
    }

    @PostMapping("/steps/{order}/tasks")
    public SingleResponse<ProjectStepTask> addTask(@PathVariable("projectId") String projectId,
                                                   @PathVariable("order") int order,
                                                   @Valid @RequestBody AddTaskRequest request) {
        return SingleResponse.of(appService.addStepTask(projectId, order, request.getTitle()));
    }

    @PutMapping("/steps/{order}/tasks/{task}")
    public SingleResponse<ProjectStepTask> toggleTask(@PathVariable("projectId") String projectId,
                                                      @PathVariable("order") int order,
                                                      @PathVariable("task") int task,
                                                      @Valid @RequestBody ToggleTaskRequest request) {
        return SingleResponse.of(appService.toggleStepTask(projectId, order, task, request.getChecked()));
    }

    /**
     * 补齐来源模板中新增的检查项，返回新增数量
     */
    @PostMapping("/tasks/sync")
    public SingleResponse<Integer> syncTasks(@PathVariable("projectId") String projectId) {
        return SingleResponse.of(appService.syncStepTasks(projectId));
    }
}
