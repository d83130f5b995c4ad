package com.draftflow.infrastructure.persistence.review.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * PrintPackageReviewDO - 打印包评审数据对象
 *
 * @author draftflow
 */
@Data
@TableName("print_package_reviews")
public class PrintPackageReviewDO {

    @TableId(value = "review_id", type = IdType.AUTO)
    private Long reviewId;

    private String jobNumber;

    /**
     * 评审状态：IN_PROGRESS / COMPLETED
     */
    private String status;

    private Integer currentStage;

    private String initializedBy;

    private LocalDateTime initializedDate;

    private LocalDateTime completedDate;
}
