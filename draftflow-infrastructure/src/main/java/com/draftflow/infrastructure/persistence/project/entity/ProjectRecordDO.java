package com.draftflow.infrastructure.persistence.project.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDate;

/**
 * ProjectRecordDO - 宿主项目记录（只读）
 * <p>
 * projects 表由项目管理模块维护，这里只读取到期日和项目目录。
 * </p>
 *
 * @author draftflow
 */
@Data
@TableName("projects")
public class ProjectRecordDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String jobNumber;

    private LocalDate dueDate;

    private String jobDirectory;
}
