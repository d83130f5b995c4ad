package com.draftflow.domain.instance.service;

import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.exception.WorkflowValidationException;
import com.draftflow.domain.instance.ProjectStepState;
import com.draftflow.domain.instance.ProjectStepTask;
import com.draftflow.domain.instance.ProjectWorkflowInstance;
import com.draftflow.domain.instance.StepEventKind;
import com.draftflow.domain.instance.command.RecordStepEventCommand;
import com.draftflow.domain.instance.repository.InMemoryProjectWorkflowRepository;
import com.draftflow.domain.schedule.ScheduleCalculator;
import com.draftflow.domain.support.TemplateFixtures;
import com.draftflow.domain.support.TickingClock;
import com.draftflow.domain.template.TemplateStepTask;
import com.draftflow.domain.template.repository.InMemoryWorkflowTemplateRepository;
import com.draftflow.domain.template.service.WorkflowTemplateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static com.draftflow.domain.support.TemplateFixtures.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ProjectWorkflowServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 11, 10, 9, 0);

    private TickingClock clock;
    private InMemoryProjectWorkflowRepository instanceRepository;
    private WorkflowTemplateService templateService;
    private ProjectWorkflowService service;

    @BeforeEach
    void setUp() {
        clock = new TickingClock(T0);
        InMemoryWorkflowTemplateRepository templateRepository = new InMemoryWorkflowTemplateRepository();
        instanceRepository = new InMemoryProjectWorkflowRepository();
        templateService = new WorkflowTemplateService(templateRepository, clock);
        service = new ProjectWorkflowService(templateRepository, instanceRepository,
            new ScheduleCalculator(), clock, "Standard");
        templateService.publishNewVersion("Standard", TemplateFixtures.standardSteps(), "admin");
    }

    @Test
    void seedCopiesTemplateSnapshot() {
        ProjectWorkflowInstance instance = service.seedInstance("J-100");

        assertThat(instance.getTemplateName()).isEqualTo("Standard");
        assertThat(instance.getTemplateVersion()).isEqualTo(1);
        assertThat(instance.getSteps()).extracting(ProjectStepState::getTitle)
            .containsExactly("Initial Layout", "Engineering Review", "Release Drawings");
        ProjectStepState first = instance.getStep(0);
        assertThat(first.isStartFlag()).isFalse();
        assertThat(first.getStartTimestamp()).isNull();
        assertThat(first.getPlannedDurationDays()).isEqualTo(2);
        assertThat(first.getTasks()).extracting(ProjectStepTask::getTitle, ProjectStepTask::isChecked)
            .containsExactly(
                tuple("Verify job folder", false),
                tuple("Confirm customer data", true));
    }

    @Test
    void seedIsIdempotentAndIgnoresLaterTemplates() {
        ProjectWorkflowInstance first = service.seedInstance("J-100");
        templateService.publishNewVersion("Standard",
            Arrays.asList(step(0, "Drafting", "G", "Brand New", 1)), "admin");

        ProjectWorkflowInstance second = service.seedInstance("J-100");

        assertThat(second).isEqualTo(first);
        assertThat(second.getTemplateVersion()).isEqualTo(1);
        assertThat(instanceRepository.getSaveCount()).isEqualTo(1);
    }

    @Test
    void seedWithoutActiveTemplateIsNotFound() {
        ProjectWorkflowService other = new ProjectWorkflowService(new InMemoryWorkflowTemplateRepository(),
            instanceRepository, new ScheduleCalculator(), clock, "Standard");

        assertThatThrownBy(() -> other.seedInstance("J-100")).isInstanceOf(WorkflowNotFoundException.class);
    }

    @Test
    void completeTimestampIsAppendOnly() {
        service.seedInstance("J-100");

        service.recordEvent(event("J-100", 1, StepEventKind.COMPLETE, true));
        clock.advance(Duration.ofHours(1));
        service.recordEvent(event("J-100", 1, StepEventKind.COMPLETE, false));
        clock.advance(Duration.ofHours(1));
        service.recordEvent(event("J-100", 1, StepEventKind.COMPLETE, true));
        clock.advance(Duration.ofHours(1));
        ProjectStepState step = service.recordEvent(event("J-100", 1, StepEventKind.COMPLETE, false));

        assertThat(step.isCompletedFlag()).isFalse();
        assertThat(step.getCompletedTimestamp()).isEqualTo(T0);
        assertThat(service.getInstance("J-100").getStep(1).getCompletedTimestamp()).isEqualTo(T0);
    }

    @Test
    void startWithoutValueMeansTrue() {
        service.seedInstance("J-100");

        ProjectStepState step = service.recordEvent(RecordStepEventCommand.builder()
            .projectId("J-100").stepOrderIndex(0).kind(StepEventKind.START).build());

        assertThat(step.isStartFlag()).isTrue();
        assertThat(step.getStartTimestamp()).isEqualTo(T0);
    }

    @Test
    void transferStampsOnlyOnFirstAssignment() {
        service.seedInstance("J-100");

        service.recordEvent(actor("J-100", 0, StepEventKind.TRANSFER, "Dana"));
        clock.advance(Duration.ofDays(1));
        ProjectStepState step = service.recordEvent(actor("J-100", 0, StepEventKind.TRANSFER, "Eli"));

        assertThat(step.getTransferToName()).isEqualTo("Eli");
        assertThat(step.getTransferToTimestamp()).isEqualTo(T0);
    }

    @Test
    void receiveRequiresActor() {
        service.seedInstance("J-100");

        assertThatThrownBy(() -> service.recordEvent(actor("J-100", 0, StepEventKind.RECEIVE, " ")))
            .isInstanceOf(WorkflowValidationException.class);
        assertThat(service.getInstance("J-100").getStep(0).getReceivedFromTimestamp()).isNull();
    }

    @Test
    void unknownStepOrProjectIsNotFound() {
        service.seedInstance("J-100");

        assertThatThrownBy(() -> service.recordEvent(event("J-100", 9, StepEventKind.START, true)))
            .isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> service.recordEvent(event("J-404", 0, StepEventKind.START, true)))
            .isInstanceOf(WorkflowNotFoundException.class);
    }

    @Test
    void recomputeWritesDueDatesAndDurations() {
        service.seedInstance("J-100");
        service.recordEvent(event("J-100", 0, StepEventKind.START, true));
        clock.set(LocalDateTime.of(2025, 11, 12, 16, 0));
        service.recordEvent(event("J-100", 0, StepEventKind.COMPLETE, true));

        List<ProjectStepState> steps = service.recomputeSchedule("J-100", LocalDate.of(2025, 11, 14));

        // 工期 [2, 3, 1]：11-14, 11-13, 11-10
        assertThat(steps).extracting(ProjectStepState::getPlannedDueDate).containsExactly(
            LocalDate.of(2025, 11, 10), LocalDate.of(2025, 11, 13), LocalDate.of(2025, 11, 14));
        assertThat(steps.get(0).getActualDurationDays()).isEqualTo(2);
        assertThat(steps.get(1).getActualDurationDays()).isNull();
    }

    @Test
    void completedStepKeepsRecordedDueDate() {
        service.seedInstance("J-100");
        service.recomputeSchedule("J-100", LocalDate.of(2025, 11, 14));
        service.recordEvent(event("J-100", 0, StepEventKind.COMPLETE, true));

        List<ProjectStepState> steps = service.recomputeSchedule("J-100", LocalDate.of(2025, 11, 28));

        assertThat(steps.get(0).getPlannedDueDate()).isEqualTo(LocalDate.of(2025, 11, 10));
        assertThat(steps.get(2).getPlannedDueDate()).isEqualTo(LocalDate.of(2025, 11, 28));
    }

    @Test
    void unsetDueDateClearsOpenSteps() {
        service.seedInstance("J-100");
        service.recomputeSchedule("J-100", LocalDate.of(2025, 11, 14));

        List<ProjectStepState> steps = service.recomputeSchedule("J-100", null);

        assertThat(steps).extracting(ProjectStepState::getPlannedDueDate).containsOnlyNulls();
    }

    @Test
    void duplicateResetsProgress() {
        service.seedInstance("J-100");
        service.recordEvent(event("J-100", 0, StepEventKind.START, true));
        service.recordEvent(event("J-100", 0, StepEventKind.COMPLETE, true));
        service.recordEvent(actor("J-100", 1, StepEventKind.TRANSFER, "Dana"));
        service.toggleTask("J-100", 0, 0, true);

        ProjectWorkflowInstance copy = service.duplicateInstance("J-100", "J-200");
        ProjectWorkflowInstance source = service.getInstance("J-100");

        assertThat(copy.getSteps()).extracting(ProjectStepState::getTitle, ProjectStepState::getDepartment,
                ProjectStepState::getOrderIndex)
            .isEqualTo(source.getSteps().stream()
                .map(s -> tuple(s.getTitle(), s.getDepartment(), s.getOrderIndex()))
                .collect(Collectors.toList()));
        assertThat(copy.getSteps()).allSatisfy(step -> {
            assertThat(step.isStartFlag()).isFalse();
            assertThat(step.isCompletedFlag()).isFalse();
            assertThat(step.getStartTimestamp()).isNull();
            assertThat(step.getCompletedTimestamp()).isNull();
            assertThat(step.getTransferToName()).isNull();
            assertThat(step.getTransferToTimestamp()).isNull();
            assertThat(step.getReceivedFromName()).isNull();
            assertThat(step.getReceivedFromTimestamp()).isNull();
            assertThat(step.getTasks()).noneMatch(ProjectStepTask::isChecked);
        });
        assertThat(service.getInstance("J-200").getStep(0).getTasks()).hasSize(2);
    }

    @Test
    void duplicateIntoExistingWorkflowIsRejected() {
        service.seedInstance("J-100");
        service.seedInstance("J-200");

        assertThatThrownBy(() -> service.duplicateInstance("J-100", "J-200"))
            .isInstanceOf(WorkflowValidationException.class);
    }

    @Test
    void taskCheckTimestampIsAppendOnly() {
        service.seedInstance("J-100");

        service.toggleTask("J-100", 0, 0, true);
        clock.advance(Duration.ofMinutes(30));
        service.toggleTask("J-100", 0, 0, false);
        ProjectStepTask task = service.toggleTask("J-100", 0, 0, true);

        assertThat(task.isChecked()).isTrue();
        assertThat(task.getCheckedTimestamp()).isEqualTo(T0);
    }

    @Test
    void addTaskAppendsAfterMax() {
        service.seedInstance("J-100");

        ProjectStepTask added = service.addTask("J-100", 0, "Call customer");
        ProjectStepTask first = service.addTask("J-100", 1, "Check loads");

        assertThat(added.getOrderIndex()).isEqualTo(2);
        assertThat(added.getTemplateTaskOrderIndex()).isNull();
        assertThat(first.getOrderIndex()).isZero();
        assertThatThrownBy(() -> service.addTask("J-100", 0, ""))
            .isInstanceOf(WorkflowValidationException.class);
    }

    @Test
    void syncAddsOnlyMissingTemplateTasks() {
        ProjectWorkflowInstance seeded = service.seedInstance("J-100");
        ProjectStepState first = seeded.getStep(0);
        first.getTasks().remove(1);
        first.getTasks().get(0).setTitle("Renamed by user");
        instanceRepository.save(seeded);

        int added = service.syncTemplateTasks("J-100");

        assertThat(added).isEqualTo(1);
        assertThat(service.getInstance("J-100").getStep(0).getTasks())
            .extracting(ProjectStepTask::getTitle)
            .containsExactly("Renamed by user", "Confirm customer data");
        assertThat(service.syncTemplateTasks("J-100")).isZero();
    }

    @Test
    void syncUsesInstanceTemplateVersion() {
        service.seedInstance("J-100");
        templateService.publishNewVersion("Standard", Arrays.asList(
            step(0, "Drafting", "G", "Initial Layout", 2,
                TemplateStepTask.builder().orderIndex(0).title("Only in v2").build()),
            step(1, "Engineering", "G", "Engineering Review", 3),
            step(2, "Drafting", "G", "Release Drawings", 1)), "admin");

        assertThat(service.syncTemplateTasks("J-100")).isZero();
        assertThat(service.getInstance("J-100").getStep(0).getTasks())
            .extracting(ProjectStepTask::getTitle)
            .doesNotContain("Only in v2");
    }

    private static RecordStepEventCommand event(String projectId, int step, StepEventKind kind, boolean value) {
        return RecordStepEventCommand.builder()
            .projectId(projectId).stepOrderIndex(step).kind(kind).value(value).build();
    }

    private static RecordStepEventCommand actor(String projectId, int step, StepEventKind kind, String name) {
        return RecordStepEventCommand.builder()
            .projectId(projectId).stepOrderIndex(step).kind(kind).actorName(name).build();
    }
}
