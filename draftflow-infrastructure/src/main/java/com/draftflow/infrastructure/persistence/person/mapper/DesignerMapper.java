package com.draftflow.infrastructure.persistence.person.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.person.entity.DesignerDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * DesignerMapper - 设计师Mapper
 *
 * @author draftflow
 */
@Mapper
public interface DesignerMapper extends BaseMapper<DesignerDO> {
}
