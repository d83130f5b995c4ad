package com.draftflow.infrastructure.persistence.review.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * PrintPackageStageDO - 评审阶段数据对象
 *
 * @author draftflow
 */
@Data
@TableName("print_package_workflow")
public class PrintPackageStageDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long reviewId;

    private String jobNumber;

    private Integer stage;

    private String stageName;

    private String department;

    /**
     * 阶段状态：NOT_STARTED / IN_PROGRESS / COMPLETED
     */
    private String status;

    private String reviewer;

    private LocalDateTime startedDate;

    private LocalDateTime completedDate;

    private String notes;
}
