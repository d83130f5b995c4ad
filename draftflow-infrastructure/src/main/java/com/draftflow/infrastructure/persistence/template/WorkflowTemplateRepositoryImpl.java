package com.draftflow.infrastructure.persistence.template;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.draftflow.domain.template.TemplateStep;
import com.draftflow.domain.template.TemplateStepTask;
import com.draftflow.domain.template.WorkflowTemplate;
import com.draftflow.domain.template.repository.WorkflowTemplateRepository;
import com.draftflow.infrastructure.persistence.template.converter.WorkflowTemplateConverter;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowStepTaskDO;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowTemplateDO;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowTemplateStepDO;
import com.draftflow.infrastructure.persistence.template.mapper.WorkflowStepTaskMapper;
import com.draftflow.infrastructure.persistence.template.mapper.WorkflowTemplateMapper;
import com.draftflow.infrastructure.persistence.template.mapper.WorkflowTemplateStepMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * WorkflowTemplateRepositoryImpl - 工作流模板仓储实现
 * <p>
 * 模板版本只插入不修改，唯一会被更新的列是 is_active。
 * </p>
 *
 * @author draftflow
 */
@Repository
@Validated
public class WorkflowTemplateRepositoryImpl implements WorkflowTemplateRepository {

    private final WorkflowTemplateMapper templateMapper;
    private final WorkflowTemplateStepMapper stepMapper;
    private final WorkflowStepTaskMapper taskMapper;

    public WorkflowTemplateRepositoryImpl(WorkflowTemplateMapper templateMapper,
                                          WorkflowTemplateStepMapper stepMapper,
                                          WorkflowStepTaskMapper taskMapper) {
        this.templateMapper = templateMapper;
        this.stepMapper = stepMapper;
        this.taskMapper = taskMapper;
    }

    @Override
    public Optional<WorkflowTemplate> findActive(String name) {
        WorkflowTemplateDO templateDO = templateMapper.selectOne(
            new LambdaQueryWrapper<WorkflowTemplateDO>()
                .eq(WorkflowTemplateDO::getName, name)
                .eq(WorkflowTemplateDO::getActive, true)
        );
        return Optional.ofNullable(templateDO).map(this::assemble);
    }

    @Override
    public Optional<WorkflowTemplate> findByNameAndVersion(String name, int version) {
        WorkflowTemplateDO templateDO = templateMapper.selectOne(
            new LambdaQueryWrapper<WorkflowTemplateDO>()
                .eq(WorkflowTemplateDO::getName, name)
                .eq(WorkflowTemplateDO::getVersion, version)
        );
        return Optional.ofNullable(templateDO).map(this::assemble);
    }

    @Override
    public List<WorkflowTemplate> findAllVersions(String name) {
        return templateMapper.selectList(
                new LambdaQueryWrapper<WorkflowTemplateDO>()
                    .eq(WorkflowTemplateDO::getName, name)
                    .orderByDesc(WorkflowTemplateDO::getVersion)
            ).stream()
            .map(this::assemble)
            .collect(Collectors.toList());
    }

    @Override
    public int findLatestVersionNumber(String name) {
        return templateMapper.selectList(
                new LambdaQueryWrapper<WorkflowTemplateDO>()
                    .select(WorkflowTemplateDO::getVersion)
                    .eq(WorkflowTemplateDO::getName, name)
            ).stream()
            .mapToInt(WorkflowTemplateDO::getVersion)
            .max()
            .orElse(0);
    }

    @Override
    @Transactional
    public void insertAndActivate(WorkflowTemplate template) {
        // 先停用同名的所有版本，再插入新的激活版本
        templateMapper.update(null,
            new LambdaUpdateWrapper<WorkflowTemplateDO>()
                .set(WorkflowTemplateDO::getActive, false)
                .eq(WorkflowTemplateDO::getName, template.getName())
        );

        WorkflowTemplateDO templateDO = WorkflowTemplateConverter.toDataObject(template);
        templateDO.setActive(true);
        templateMapper.insert(templateDO);

        for (TemplateStep step : template.getSteps()) {
            WorkflowTemplateStepDO stepDO = WorkflowTemplateConverter.stepToDataObject(step, templateDO.getId());
            stepMapper.insert(stepDO);
            for (TemplateStepTask task : step.getTasks()) {
                taskMapper.insert(WorkflowTemplateConverter.taskToDataObject(task, stepDO.getId()));
            }
        }
    }

    // ==================== 私有方法 ====================

    private WorkflowTemplate assemble(WorkflowTemplateDO templateDO) {
        List<WorkflowTemplateStepDO> stepDOs = stepMapper.selectList(
            new LambdaQueryWrapper<WorkflowTemplateStepDO>()
                .eq(WorkflowTemplateStepDO::getTemplateId, templateDO.getId())
                .orderByAsc(WorkflowTemplateStepDO::getOrderIndex)
        );

        Map<Long, List<WorkflowStepTaskDO>> tasksByStepId = Collections.emptyMap();
        if (!stepDOs.isEmpty()) {
            List<Long> stepIds = stepDOs.stream().map(WorkflowTemplateStepDO::getId).collect(Collectors.toList());
            tasksByStepId = taskMapper.selectList(
                    new LambdaQueryWrapper<WorkflowStepTaskDO>()
                        .in(WorkflowStepTaskDO::getTemplateStepId, stepIds)
                ).stream()
                .collect(Collectors.groupingBy(WorkflowStepTaskDO::getTemplateStepId));
        }
        return WorkflowTemplateConverter.toDomain(templateDO, stepDOs, tasksByStepId);
    }
}
