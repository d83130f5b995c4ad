package com.draftflow.infrastructure.persistence.template;

import com.draftflow.domain.template.TemplateStep;
import com.draftflow.domain.template.TemplateStepTask;
import com.draftflow.domain.template.WorkflowTemplate;
import com.draftflow.domain.template.repository.WorkflowTemplateRepository;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * WorkflowTemplateRepositoryImpl 集成测试
 */
@SpringBootTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.ANY)
@ActiveProfiles("test")
@Transactional
class WorkflowTemplateRepositoryImplTest {

    @Autowired
    private WorkflowTemplateRepository repository;

    @Test
    void testInsertAndFindActive() {
        repository.insertAndActivate(template("Standard", 1));

        Optional<WorkflowTemplate> found = repository.findActive("Standard");

        assertThat(found).isPresent();
        WorkflowTemplate template = found.get();
        assertThat(template.getVersion()).isEqualTo(1);
        assertThat(template.isActive()).isTrue();
        assertThat(template.getCreatedBy()).isEqualTo("admin");
        assertThat(template.getSteps()).extracting(TemplateStep::getTitle)
            .containsExactly("Layout", "Engineering Review");
        assertThat(template.getSteps().get(0).getTasks())
            .extracting(TemplateStepTask::getTitle, TemplateStepTask::isDefaultChecked)
            .containsExactly(
                tuple("Verify folder", false),
                tuple("Confirm data", true));
        assertThat(template.getSteps().get(1).getPlannedDurationDays()).isEqualTo(3);
    }

    @Test
    void testActivationSwapsAtomically() {
        repository.insertAndActivate(template("Standard", 1));
        repository.insertAndActivate(template("Standard", 2));
        repository.insertAndActivate(template("Other", 1));

        assertThat(repository.findActive("Standard")).hasValueSatisfying(t -> assertThat(t.getVersion()).isEqualTo(2));
        assertThat(repository.findAllVersions("Standard"))
            .extracting(WorkflowTemplate::getVersion, WorkflowTemplate::isActive)
            .containsExactly(
                tuple(2, true),
                tuple(1, false));
        assertThat(repository.findActive("Other")).isPresent();
        assertThat(repository.findLatestVersionNumber("Standard")).isEqualTo(2);
        assertThat(repository.findLatestVersionNumber("Missing")).isZero();
    }

    @Test
    void testOldVersionUnchangedAfterNewPublish() {
        repository.insertAndActivate(template("Standard", 1));
        WorkflowTemplate before = repository.findByNameAndVersion("Standard", 1).orElseThrow();

        WorkflowTemplate v2 = template("Standard", 2);
        v2.getSteps().get(0).setTitle("Changed");
        repository.insertAndActivate(v2);

        WorkflowTemplate after = repository.findByNameAndVersion("Standard", 1).orElseThrow();
        assertThat(after.getSteps()).isEqualTo(before.getSteps());
    }

    @Test
    void testFindMissing() {
        assertThat(repository.findActive("Nope")).isEmpty();
        assertThat(repository.findByNameAndVersion("Nope", 1)).isEmpty();
        assertThat(repository.findAllVersions("Nope")).isEmpty();
    }

    @Test
    void testBlankNameRejectedByValidation() {
        assertThatThrownBy(() -> repository.findActive(" "))
            .isInstanceOf(ConstraintViolationException.class);
    }

    private static WorkflowTemplate template(String name, int version) {
        List<TemplateStep> steps = Arrays.asList(
            TemplateStep.builder().orderIndex(0).department("Drafting").groupName("Scheduling")
                .title("Layout").plannedDurationDays(2)
                .tasks(new ArrayList<>(Arrays.asList(
                    TemplateStepTask.builder().orderIndex(0).title("Verify folder").build(),
                    TemplateStepTask.builder().orderIndex(1).title("Confirm data").defaultChecked(true).build())))
                .build(),
            TemplateStep.builder().orderIndex(1).department("Engineering").groupName("Scheduling")
                .title("Engineering Review").plannedDurationDays(3).build());
        return WorkflowTemplate.newVersion(name, version, steps, "admin", Instant.parse("2025-11-03T09:00:00Z"));
    }
}
