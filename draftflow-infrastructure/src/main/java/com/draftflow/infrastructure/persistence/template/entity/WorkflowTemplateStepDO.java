package com.draftflow.infrastructure.persistence.template.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * WorkflowTemplateStepDO - 模板步骤数据对象
 *
 * @author draftflow
 */
@Data
@TableName("workflow_template_steps")
public class WorkflowTemplateStepDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 所属模板版本ID
     */
    private Long templateId;

    private Integer orderIndex;

    private String department;

    private String groupName;

    private String title;

    private Integer plannedDurationDays;
}
