package com.draftflow.infrastructure.persistence.review.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * PrintPackageFileDO - 评审文件数据对象
 *
 * @author draftflow
 */
@Data
@TableName("print_package_files")
public class PrintPackageFileDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long reviewId;

    private String jobNumber;

    private String fileName;

    private String path;

    private Integer stageIndex;

    private LocalDateTime updatedAt;
}
