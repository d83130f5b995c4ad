package com.draftflow.app.parser;

import com.draftflow.app.dto.StepYamlDto;
import com.draftflow.app.dto.TaskYamlDto;
import com.draftflow.app.dto.TemplateYamlDto;
import com.draftflow.domain.exception.WorkflowValidationException;
import com.draftflow.domain.schedule.DurationText;
import com.draftflow.domain.template.TemplateStep;
import com.draftflow.domain.template.TemplateStepTask;
import com.draftflow.domain.template.command.PublishTemplateCommand;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * TemplateYamlParser - 把 YAML 模板定义解析为发布命令
 * <p>
 * 步骤工期用时长文本书写，解析时向上取整为工作日。
 * </p>
 *
 * @author draftflow
 */
@Component
public class TemplateYamlParser {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public PublishTemplateCommand parse(String yamlContent) {
        if (yamlContent == null || yamlContent.isBlank()) {
            throw new WorkflowValidationException("Template YAML is empty");
        }
        TemplateYamlDto dto;
        try {
            dto = mapper.readValue(yamlContent, TemplateYamlDto.class);
        } catch (JsonProcessingException e) {
            throw new WorkflowValidationException("Failed to parse template YAML: " + e.getOriginalMessage());
        }
        return convert(dto);
    }

    private PublishTemplateCommand convert(TemplateYamlDto dto) {
        List<TemplateStep> steps = new ArrayList<>();
        if (dto.getSteps() != null) {
            for (int i = 0; i < dto.getSteps().size(); i++) {
                StepYamlDto stepDto = dto.getSteps().get(i);
                if (stepDto == null) {
                    throw new WorkflowValidationException("Template step " + i + " is empty");
                }
                steps.add(convertStep(stepDto, i));
            }
        }
        return PublishTemplateCommand.builder()
                .name(dto.getName())
                .steps(steps)
                .publishedBy(dto.getCreatedBy())
                .build();
    }

    private TemplateStep convertStep(StepYamlDto stepDto, int position) {
        List<TemplateStepTask> tasks = new ArrayList<>();
        if (stepDto.getTasks() != null) {
            for (int i = 0; i < stepDto.getTasks().size(); i++) {
                TaskYamlDto taskDto = stepDto.getTasks().get(i);
                if (taskDto == null) {
                    throw new WorkflowValidationException("Task " + i + " of step " + position + " is empty");
                }
                tasks.add(new TemplateStepTask(i, taskDto.getTitle(), taskDto.isDefaultChecked()));
            }
        }
        return TemplateStep.builder()
                .orderIndex(stepDto.getOrder() != null ? stepDto.getOrder() : position)
                .department(stepDto.getDepartment())
                .groupName(stepDto.getGroup())
                .title(stepDto.getTitle())
                .plannedDurationDays(stepDto.getDuration() == null ? 0 : DurationText.toBusinessDays(stepDto.getDuration()))
                .tasks(tasks)
                .build();
    }
}
