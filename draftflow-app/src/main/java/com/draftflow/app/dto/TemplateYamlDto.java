package com.draftflow.app.dto;

import lombok.Data;

import java.util.List;

/**
 * TemplateYamlDto - YAML 模板文件的顶层结构
 *
 * @author draftflow
 */
@Data
public class TemplateYamlDto {
    private String name;
    private String description;
    private String createdBy;
    private List<StepYamlDto> steps;
}
