package com.draftflow.infrastructure.persistence.project.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.project.entity.ProjectRecordDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * ProjectRecordMapper - 项目记录Mapper
 *
 * @author draftflow
 */
@Mapper
public interface ProjectRecordMapper extends BaseMapper<ProjectRecordDO> {
}
