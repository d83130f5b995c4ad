package com.draftflow.infrastructure.persistence.person.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.person.entity.EngineerDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * EngineerMapper - 工程师Mapper
 *
 * @author draftflow
 */
@Mapper
public interface EngineerMapper extends BaseMapper<EngineerDO> {
}
