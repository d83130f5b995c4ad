package com.draftflow.app.dto;

import lombok.Data;

import java.util.List;

/**
 * StepYamlDto - YAML 模板中的步骤定义
 *
 * @author draftflow
 */
@Data
public class StepYamlDto {

    /**
     * 阶段顺序，缺省时取列表位置
     */
    private Integer order;

    /**
     * 负责部门
     */
    private String department;

    /**
     * 分组名称
     */
    private String group;

    /**
     * 步骤标题
     */
    private String title;

    /**
     * 计划时长，如 "2d"、"4h"、"1w"，纯数字按天计
     */
    private String duration;

    /**
     * 步骤下的任务
     */
    private List<TaskYamlDto> tasks;
}
