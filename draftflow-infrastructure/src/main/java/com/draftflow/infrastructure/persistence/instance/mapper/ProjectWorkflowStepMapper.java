package com.draftflow.infrastructure.persistence.instance.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.instance.entity.ProjectWorkflowStepDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * ProjectWorkflowStepMapper - 项目工作流步骤Mapper
 *
 * @author draftflow
 */
@Mapper
public interface ProjectWorkflowStepMapper extends BaseMapper<ProjectWorkflowStepDO> {
}
