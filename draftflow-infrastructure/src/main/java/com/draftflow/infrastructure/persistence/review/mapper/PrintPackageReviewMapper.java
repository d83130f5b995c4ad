package com.draftflow.infrastructure.persistence.review.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.review.entity.PrintPackageReviewDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * PrintPackageReviewMapper - 打印包评审Mapper
 *
 * @author draftflow
 */
@Mapper
public interface PrintPackageReviewMapper extends BaseMapper<PrintPackageReviewDO> {
}
