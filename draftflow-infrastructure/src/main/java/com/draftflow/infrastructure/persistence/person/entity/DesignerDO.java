package com.draftflow.infrastructure.persistence.person.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * DesignerDO - 设计师（只读）
 *
 * @author draftflow
 */
@Data
@TableName("designers")
public class DesignerDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;
}
