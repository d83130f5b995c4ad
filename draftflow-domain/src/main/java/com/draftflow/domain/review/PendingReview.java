package com.draftflow.domain.review;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * PendingReview - 待处理的评审阶段
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingReview {

    private String jobNumber;

    private int stageIndex;

    private String stageName;

    private String department;

    private LocalDateTime startedAt;
}
