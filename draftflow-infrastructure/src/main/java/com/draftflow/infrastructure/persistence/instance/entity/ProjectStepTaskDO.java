package com.draftflow.infrastructure.persistence.instance.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * ProjectStepTaskDO - 项目步骤检查项数据对象
 *
 * @author draftflow
 */
@Data
@TableName("project_step_tasks")
public class ProjectStepTaskDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long projectStepId;

    /**
     * 来源模板检查项ID，手工添加时为空
     */
    private Long templateTaskId;

    private Integer orderIndex;

    private String title;

    @TableField("is_checked")
    private Boolean checked;

    private LocalDateTime checkedTs;
}
