package com.draftflow.infrastructure.persistence.template.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * WorkflowStepTaskDO - 模板步骤检查项数据对象
 *
 * @author draftflow
 */
@Data
@TableName("workflow_step_tasks")
public class WorkflowStepTaskDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long templateStepId;

    private Integer orderIndex;

    private String title;

    private Boolean defaultChecked;
}
