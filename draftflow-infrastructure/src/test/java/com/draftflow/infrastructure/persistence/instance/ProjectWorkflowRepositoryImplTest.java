package com.draftflow.infrastructure.persistence.instance;

import com.draftflow.domain.instance.ProjectStepState;
import com.draftflow.domain.instance.ProjectStepTask;
import com.draftflow.domain.instance.ProjectWorkflowInstance;
import com.draftflow.domain.instance.repository.ProjectWorkflowRepository;
import com.draftflow.domain.template.TemplateStep;
import com.draftflow.domain.template.TemplateStepTask;
import com.draftflow.domain.template.WorkflowTemplate;
import com.draftflow.domain.template.repository.WorkflowTemplateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * ProjectWorkflowRepositoryImpl 集成测试
 */
@SpringBootTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.ANY)
@ActiveProfiles("test")
@Transactional
class ProjectWorkflowRepositoryImplTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 11, 10, 9, 0);

    @Autowired
    private ProjectWorkflowRepository repository;

    @Autowired
    private WorkflowTemplateRepository templateRepository;

    private WorkflowTemplate template;

    @BeforeEach
    void setUp() {
        template = WorkflowTemplate.newVersion("Standard", 1, Arrays.asList(
            TemplateStep.builder().orderIndex(0).department("Drafting").groupName("G").title("Layout")
                .plannedDurationDays(2)
                .tasks(new ArrayList<>(Arrays.asList(
                    TemplateStepTask.builder().orderIndex(0).title("Verify folder").build())))
                .build(),
            TemplateStep.builder().orderIndex(1).department("Engineering").groupName("G").title("Review")
                .plannedDurationDays(3).build()
        ), "admin", Instant.parse("2025-11-03T09:00:00Z"));
        templateRepository.insertAndActivate(template);
    }

    @Test
    void testSaveAndLoadSeededInstance() {
        repository.save(ProjectWorkflowInstance.seedFrom("J-100", template, NOW));

        ProjectWorkflowInstance loaded = repository.findByProjectId("J-100").orElseThrow();

        assertThat(loaded.getTemplateName()).isEqualTo("Standard");
        assertThat(loaded.getTemplateVersion()).isEqualTo(1);
        assertThat(loaded.getCreatedAt()).isEqualTo(NOW);
        assertThat(loaded.getSteps()).extracting(ProjectStepState::getTitle).containsExactly("Layout", "Review");
        assertThat(loaded.getStep(1).getPlannedDurationDays()).isEqualTo(3);
        ProjectStepTask task = loaded.getStep(0).getTasks().get(0);
        assertThat(task.getTitle()).isEqualTo("Verify folder");
        assertThat(task.getTemplateTaskOrderIndex()).isZero();
        assertThat(repository.exists("J-100")).isTrue();
        assertThat(repository.exists("J-200")).isFalse();
    }

    @Test
    void testUpdatePersistsMutableStateAndClearsDerivedColumns() {
        repository.save(ProjectWorkflowInstance.seedFrom("J-100", template, NOW));
        ProjectWorkflowInstance instance = repository.findByProjectId("J-100").orElseThrow();
        ProjectStepState first = instance.getStep(0);
        first.markStarted(true, NOW);
        first.markCompleted(true, NOW.plusDays(2));
        first.transferTo("Dana", NOW.plusDays(2));
        first.setPlannedDueDate(LocalDate.of(2025, 11, 11));
        first.setActualDurationDays(2);
        first.getTask(0).toggle(true, NOW.plusHours(1));
        first.addTask("Manual check");
        instance.getStep(1).setPlannedDueDate(LocalDate.of(2025, 11, 14));
        repository.save(instance);

        ProjectWorkflowInstance reloaded = repository.findByProjectId("J-100").orElseThrow();
        ProjectStepState step = reloaded.getStep(0);
        assertThat(step.isStartFlag()).isTrue();
        assertThat(step.getStartTimestamp()).isEqualTo(NOW);
        assertThat(step.getCompletedTimestamp()).isEqualTo(NOW.plusDays(2));
        assertThat(step.getTransferToName()).isEqualTo("Dana");
        assertThat(step.getPlannedDueDate()).isEqualTo(LocalDate.of(2025, 11, 11));
        assertThat(step.getActualDurationDays()).isEqualTo(2);
        assertThat(step.getTasks()).extracting(ProjectStepTask::getTitle, ProjectStepTask::isChecked)
            .containsExactly(tuple("Verify folder", true), tuple("Manual check", false));
        assertThat(step.getTasks().get(1).getTemplateTaskOrderIndex()).isNull();

        reloaded.getStep(1).setPlannedDueDate(null);
        repository.save(reloaded);

        assertThat(repository.findByProjectId("J-100").orElseThrow().getStep(1).getPlannedDueDate()).isNull();
    }

    @Test
    void testMissingProject() {
        assertThat(repository.findByProjectId("J-404")).isEmpty();
    }
}
