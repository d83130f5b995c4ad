package com.draftflow.adapter.web;

import com.draftflow.app.service.WorkflowAppService;
import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.exception.WorkflowValidationException;
import com.draftflow.domain.instance.ProjectStepState;
import com.draftflow.domain.instance.ProjectStepTask;
import com.draftflow.domain.instance.StepEventKind;
import com.draftflow.domain.instance.command.RecordStepEventCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ProjectWorkflowControllerTest {

    private WorkflowAppService appService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        appService = mock(WorkflowAppService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ProjectWorkflowController(appService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testStepEventIsForwardedAsCommand() throws Exception {
        ProjectStepState step = new ProjectStepState();
        step.setOrderIndex(2);
        step.setTransferToName("Dana");
        when(appService.onStepEvent(any())).thenReturn(step);

        mockMvc.perform(post("/api/v1/projects/J-100/workflow/steps/2/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"TRANSFER\",\"actorName\":\"Dana\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.transferToName").value("Dana"));

        ArgumentCaptor<RecordStepEventCommand> captor = ArgumentCaptor.forClass(RecordStepEventCommand.class);
        verify(appService).onStepEvent(captor.capture());
        assertThat(captor.getValue().getProjectId()).isEqualTo("J-100");
        assertThat(captor.getValue().getStepOrderIndex()).isEqualTo(2);
        assertThat(captor.getValue().getKind()).isEqualTo(StepEventKind.TRANSFER);
    }

    @Test
    void testStepEventWithoutKindIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/projects/J-100/workflow/steps/0/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(appService);
    }

    @Test
    void testDomainValidationMapsToBadRequest() throws Exception {
        when(appService.onStepEvent(any())).thenThrow(new WorkflowValidationException("Actor name cannot be empty"));

        mockMvc.perform(post("/api/v1/projects/J-100/workflow/steps/0/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"RECEIVE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errMessage").value("Actor name cannot be empty"));
    }

    @Test
    void testUnknownProjectMapsToNotFound() throws Exception {
        when(appService.getProjectWorkflow("J-404")).thenThrow(new WorkflowNotFoundException("No workflow for project: J-404"));

        mockMvc.perform(get("/api/v1/projects/J-404/workflow"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errCode").value("NOT_FOUND"));
    }

    @Test
    void testDueDateChange() throws Exception {
        when(appService.onDueDateChanged(eq("J-100"), any())).thenReturn(Collections.emptyList());

        mockMvc.perform(put("/api/v1/projects/J-100/workflow/due-date")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dueDate\":\"2025-11-21\"}"))
                .andExpect(status().isOk());

        verify(appService).onDueDateChanged("J-100", LocalDate.of(2025, 11, 21));
    }

    @Test
    void testDuplicateUsesSourceParameter() throws Exception {
        mockMvc.perform(post("/api/v1/projects/J-101/workflow/duplicate").param("source", "J-100"))
                .andExpect(status().isOk());

        verify(appService).onProjectDuplicated("J-100", "J-101");
    }

    @Test
    void testChecklistEndpoints() throws Exception {
        ProjectStepTask task = new ProjectStepTask();
        task.setOrderIndex(3);
        task.setTitle("Check welds");
        when(appService.addStepTask("J-100", 1, "Check welds")).thenReturn(task);
        when(appService.syncStepTasks("J-100")).thenReturn(2);

        mockMvc.perform(post("/api/v1/projects/J-100/workflow/steps/1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Check welds\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.orderIndex").value(3));

        mockMvc.perform(put("/api/v1/projects/J-100/workflow/steps/1/tasks/3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checked\":true}"))
                .andExpect(status().isOk());
        verify(appService).toggleStepTask("J-100", 1, 3, true);

        mockMvc.perform(post("/api/v1/projects/J-100/workflow/tasks/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(2));
    }
}
