package com.draftflow.infrastructure.persistence.template.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.template.entity.WorkflowTemplateDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * WorkflowTemplateMapper - 工作流模板Mapper
 *
 * @author draftflow
 */
@Mapper
public interface WorkflowTemplateMapper extends BaseMapper<WorkflowTemplateDO> {
}
