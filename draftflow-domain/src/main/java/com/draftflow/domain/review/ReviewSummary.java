package com.draftflow.domain.review;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * ReviewSummary - 评审概要
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewSummary {

    private String jobNumber;

    private ReviewStatus status;

    private int currentStage;

    private String createdBy;

    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    private List<StageState> stages;

    private List<StageFile> files;

    private int completedStages;

    private int totalStages;

    private double progressPercentage;

    private boolean complete;
}
