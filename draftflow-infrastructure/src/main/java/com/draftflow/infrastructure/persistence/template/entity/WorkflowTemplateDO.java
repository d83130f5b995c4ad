package com.draftflow.infrastructure.persistence.template.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * WorkflowTemplateDO - 工作流模板版本数据对象
 *
 * @author draftflow
 */
@Data
@TableName("workflow_templates")
public class WorkflowTemplateDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;

    private Integer version;

    /**
     * 是否激活
     */
    @TableField("is_active")
    private Boolean active;

    private Instant createdAt;

    private String createdBy;
}
