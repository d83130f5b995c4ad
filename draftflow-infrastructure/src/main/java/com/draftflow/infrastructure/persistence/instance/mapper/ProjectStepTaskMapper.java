package com.draftflow.infrastructure.persistence.instance.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.instance.entity.ProjectStepTaskDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * ProjectStepTaskMapper - 项目步骤检查项Mapper
 *
 * @author draftflow
 */
@Mapper
public interface ProjectStepTaskMapper extends BaseMapper<ProjectStepTaskDO> {
}
