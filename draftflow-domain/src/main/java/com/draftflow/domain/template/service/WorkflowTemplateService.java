package com.draftflow.domain.template.service;

import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.template.TemplateStep;
import com.draftflow.domain.template.TemplateStepTask;
import com.draftflow.domain.template.WorkflowTemplate;
import com.draftflow.domain.template.command.PublishTemplateCommand;
import com.draftflow.domain.template.repository.WorkflowTemplateRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * WorkflowTemplateService - 工作流模板领域服务
 * <p>
 * 负责模板版本的查询与发布
 * </p>
 *
 * @author draftflow
 */
@Slf4j
public class WorkflowTemplateService {

    private final WorkflowTemplateRepository repository;
    private final Clock clock;

    public WorkflowTemplateService(WorkflowTemplateRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * 获取激活版本
     *
     * @throws WorkflowNotFoundException 该名称下没有激活版本
     */
    public WorkflowTemplate getActiveTemplate(String name) {
        return repository.findActive(name)
            .orElseThrow(() -> new WorkflowNotFoundException("No active workflow template: " + name));
    }

    /**
     * 获取指定版本
     */
    public WorkflowTemplate getVersion(String name, int version) {
        return repository.findByNameAndVersion(name, version)
            .orElseThrow(() -> new WorkflowNotFoundException(
                "Workflow template not found: " + name + ":v" + version));
    }

    /**
     * 列出全部版本
     */
    public List<WorkflowTemplate> listVersions(String name) {
        return repository.findAllVersions(name);
    }

    public WorkflowTemplate publishNewVersion(PublishTemplateCommand command) {
        return publishNewVersion(command.getName(), command.getSteps(), command.getPublishedBy());
    }

    /**
     * 发布新版本
     * <p>
     * 未提供检查项的步骤沿用上一个激活版本中相同 orderIndex 步骤的检查项。
     * </p>
     */
    public WorkflowTemplate publishNewVersion(String name, List<TemplateStep> steps, String publishedBy) {
        WorkflowTemplate.validateSteps(steps);

        Optional<WorkflowTemplate> previous = repository.findActive(name);
        List<TemplateStep> prepared = steps.stream()
            .map(TemplateStep::copy)
            .collect(Collectors.toList());
        previous.ifPresent(p -> carryOverTasks(p, prepared));

        int nextVersion = repository.findLatestVersionNumber(name) + 1;
        WorkflowTemplate template = WorkflowTemplate.newVersion(
            name, nextVersion, prepared, publishedBy, Instant.now(clock));

        repository.insertAndActivate(template);
        log.info("Published workflow template {} with {} steps (previous active: {})",
            template.toKey(), template.getSteps().size(),
            previous.map(WorkflowTemplate::toKey).orElse("none"));
        return template;
    }

    // ==================== 私有方法 ====================

    private void carryOverTasks(WorkflowTemplate previous, List<TemplateStep> steps) {
        for (TemplateStep step : steps) {
            if (step.getTasks() != null && !step.getTasks().isEmpty()) {
                continue;
            }
            List<TemplateStepTask> inherited = previous.getStep(step.getOrderIndex())
                .map(old -> old.copy().getTasks())
                .orElseGet(ArrayList::new);
            step.setTasks(inherited);
        }
    }
}
