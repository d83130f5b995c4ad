package com.draftflow.infrastructure.persistence.instance.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * ProjectWorkflowStepDO - 项目工作流步骤数据对象
 * <p>
 * 每个项目每个步骤一行，步骤字段是模板的快照，template_id/template_step_id 只用于溯源。
 * </p>
 *
 * @author draftflow
 */
@Data
@TableName("project_workflow_steps")
public class ProjectWorkflowStepDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String projectId;

    private Long templateId;

    private Long templateStepId;

    private Integer orderIndex;

    private String department;

    private String groupName;

    private String title;

    /**
     * 计划工期快照（工作日）
     */
    private Integer plannedDurationDays;

    private Boolean startFlag;

    private LocalDateTime startTs;

    private Boolean completedFlag;

    private LocalDateTime completedTs;

    private String transferToName;

    private LocalDateTime transferToTs;

    private String receivedFromName;

    private LocalDateTime receivedFromTs;

    private LocalDate plannedDueDate;

    private Integer actualDurationDays;

    private LocalDateTime createdAt;
}
