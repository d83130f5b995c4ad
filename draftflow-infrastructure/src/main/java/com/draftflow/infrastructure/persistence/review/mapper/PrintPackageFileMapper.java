package com.draftflow.infrastructure.persistence.review.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.draftflow.infrastructure.persistence.review.entity.PrintPackageFileDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * PrintPackageFileMapper - 评审文件Mapper
 *
 * @author draftflow
 */
@Mapper
public interface PrintPackageFileMapper extends BaseMapper<PrintPackageFileDO> {
}
