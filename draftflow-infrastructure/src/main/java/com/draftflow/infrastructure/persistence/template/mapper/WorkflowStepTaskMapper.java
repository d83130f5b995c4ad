package com.draftflow.infrastructure.persistence.template.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowStepTaskDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * WorkflowStepTaskMapper - 模板检查项Mapper
 *
 * @author draftflow
 */
@Mapper
public interface WorkflowStepTaskMapper extends BaseMapper<WorkflowStepTaskDO> {
}
