package com.draftflow.infrastructure.persistence.person.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * EngineerDO - 工程师（只读）
 *
 * @author draftflow
 */
@Data
@TableName("engineers")
public class EngineerDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;
}
