package com.draftflow.infrastructure.persistence.template.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowTemplateStepDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * WorkflowTemplateStepMapper - 模板步骤Mapper
 *
 * @author draftflow
 */
@Mapper
public interface WorkflowTemplateStepMapper extends BaseMapper<WorkflowTemplateStepDO> {
}
