package com.draftflow.domain.review;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AdvanceResult - 阶段推进结果
 * <p>
 * 状态流转总是成功的（否则会抛出异常），文件重定位可能部分失败。
 * </p>
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvanceResult {

    private String jobNumber;

    private int completedStage;

    /**
     * 新开始的阶段，完成最后一个阶段时为 null
     */
    private Integer startedStage;

    private boolean reviewCompleted;

    private RelocationReport relocation;
}
