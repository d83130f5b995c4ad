package com.draftflow.infrastructure.persistence.review.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.review.entity.PrintPackageStageDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * PrintPackageStageMapper - 评审阶段Mapper
 *
 * @author draftflow
 */
@Mapper
public interface PrintPackageStageMapper extends BaseMapper<PrintPackageStageDO> {
}
