package com.draftflow.domain.template.service;

import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.exception.WorkflowValidationException;
import com.draftflow.domain.support.TemplateFixtures;
import com.draftflow.domain.support.TickingClock;
import com.draftflow.domain.template.TemplateStep;
import com.draftflow.domain.template.TemplateStepTask;
import com.draftflow.domain.template.WorkflowTemplate;
import com.draftflow.domain.template.command.PublishTemplateCommand;
import com.draftflow.domain.template.repository.InMemoryWorkflowTemplateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static com.draftflow.domain.support.TemplateFixtures.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class WorkflowTemplateServiceTest {

    private InMemoryWorkflowTemplateRepository repository;
    private WorkflowTemplateService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowTemplateRepository();
        service = new WorkflowTemplateService(repository, new TickingClock(LocalDateTime.of(2025, 11, 3, 9, 0)));
    }

    @Test
    void firstPublishCreatesVersionOne() {
        WorkflowTemplate template = service.publishNewVersion("Standard", TemplateFixtures.standardSteps(), "alice");

        assertThat(template.getVersion()).isEqualTo(1);
        assertThat(template.isActive()).isTrue();
        assertThat(template.getCreatedBy()).isEqualTo("alice");
        assertThat(service.getActiveTemplate("Standard").getSteps())
            .extracting(TemplateStep::getTitle)
            .containsExactly("Initial Layout", "Engineering Review", "Release Drawings");
    }

    @Test
    void publishDeactivatesPreviousVersion() {
        service.publishNewVersion("Standard", TemplateFixtures.standardSteps(), "alice");
        service.publishNewVersion("Standard",
            Arrays.asList(step(0, "Drafting", "G", "Only Step", 5)), "bob");

        assertThat(service.getActiveTemplate("Standard").getVersion()).isEqualTo(2);
        assertThat(service.listVersions("Standard"))
            .extracting(WorkflowTemplate::getVersion, WorkflowTemplate::isActive)
            .containsExactly(
                tuple(2, true),
                tuple(1, false));
    }

    @Test
    void publishedVersionsAreNeverMutated() {
        service.publishNewVersion("Standard", TemplateFixtures.standardSteps(), "alice");
        WorkflowTemplate before = service.getVersion("Standard", 1);

        service.publishNewVersion("Standard",
            Arrays.asList(step(0, "Drafting", "G", "Changed", 9)), "bob");

        assertThat(service.getVersion("Standard", 1).getSteps()).isEqualTo(before.getSteps());
    }

    @Test
    void callerListIsNotShared() {
        List<TemplateStep> steps = TemplateFixtures.standardSteps();
        service.publishNewVersion("Standard", steps, "alice");

        steps.get(0).setTitle("Mutated afterwards");

        assertThat(service.getActiveTemplate("Standard").getStep(0))
            .hasValueSatisfying(s -> assertThat(s.getTitle()).isEqualTo("Initial Layout"));
    }

    @Test
    void stepsAreSortedByOrderIndex() {
        WorkflowTemplate template = service.publishNewVersion("Standard", Arrays.asList(
            step(1, "Engineering", "G", "Second", 1),
            step(0, "Drafting", "G", "First", 1)), "alice");

        assertThat(template.getSteps()).extracting(TemplateStep::getTitle).containsExactly("First", "Second");
    }

    @Test
    void rejectsGapInOrder() {
        assertThatThrownBy(() -> service.publishNewVersion("Standard", Arrays.asList(
            step(0, "Drafting", "G", "A", 1),
            step(2, "Drafting", "G", "B", 1)), "alice"))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("contiguous");
        assertThat(repository.size("Standard")).isZero();
    }

    @Test
    void rejectsDuplicateOrder() {
        assertThatThrownBy(() -> service.publishNewVersion("Standard", Arrays.asList(
            step(0, "Drafting", "G", "A", 1),
            step(0, "Drafting", "G", "B", 1)), "alice"))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    void rejectsEmptyTitleDepartmentAndNegativeDuration() {
        assertThatThrownBy(() -> service.publishNewVersion("Standard",
            Arrays.asList(step(0, "Drafting", "G", " ", 1)), "alice"))
            .isInstanceOf(WorkflowValidationException.class);
        assertThatThrownBy(() -> service.publishNewVersion("Standard",
            Arrays.asList(step(0, "", "G", "A", 1)), "alice"))
            .isInstanceOf(WorkflowValidationException.class);
        assertThatThrownBy(() -> service.publishNewVersion("Standard",
            Arrays.asList(step(0, "Drafting", "G", "A", -1)), "alice"))
            .isInstanceOf(WorkflowValidationException.class);
        assertThatThrownBy(() -> service.publishNewVersion("Standard", List.of(), "alice"))
            .isInstanceOf(WorkflowValidationException.class);
        assertThat(repository.size("Standard")).isZero();
    }

    @Test
    void missingActiveTemplateIsNotFound() {
        assertThatThrownBy(() -> service.getActiveTemplate("Standard"))
            .isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> service.getVersion("Standard", 3))
            .isInstanceOf(WorkflowNotFoundException.class);
    }

    @Test
    void stepsWithoutTasksInheritPreviousChecklist() {
        service.publishNewVersion("Standard", TemplateFixtures.standardSteps(), "alice");

        WorkflowTemplate v2 = service.publishNewVersion(PublishTemplateCommand.builder()
            .name("Standard")
            .steps(Arrays.asList(
                step(0, "Drafting", "G", "Initial Layout", 2),
                step(1, "Engineering", "G", "Engineering Review", 3,
                    TemplateStepTask.builder().orderIndex(0).title("Check loads").build())))
            .publishedBy("bob")
            .build());

        assertThat(v2.getStep(0).get().getTasks())
            .extracting(TemplateStepTask::getTitle)
            .containsExactly("Verify job folder", "Confirm customer data");
        assertThat(v2.getStep(1).get().getTasks())
            .extracting(TemplateStepTask::getTitle)
            .containsExactly("Check loads");
    }

    @Test
    void taskOrderIsRenumberedFromZero() {
        WorkflowTemplate template = service.publishNewVersion("Standard", Arrays.asList(
            step(0, "Drafting", "G", "A", 1,
                TemplateStepTask.builder().orderIndex(7).title("later").build(),
                TemplateStepTask.builder().orderIndex(3).title("earlier").build())), "alice");

        assertThat(template.getStep(0).get().getTasks())
            .extracting(TemplateStepTask::getOrderIndex, TemplateStepTask::getTitle)
            .containsExactly(
                tuple(0, "earlier"),
                tuple(1, "later"));
    }
}
