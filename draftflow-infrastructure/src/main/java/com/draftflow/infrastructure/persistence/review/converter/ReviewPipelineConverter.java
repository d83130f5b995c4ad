package com.draftflow.infrastructure.persistence.review.converter;

import com.draftflow.domain.review.PendingReview;
import com.draftflow.domain.review.ReviewPipelineInstance;
import com.draftflow.domain.review.ReviewStatus;
import com.draftflow.domain.review.StageFile;
import com.draftflow.domain.review.StageState;
import com.draftflow.domain.review.StageStatus;
import com.draftflow.infrastructure.persistence.review.entity.PrintPackageFileDO;
import com.draftflow.infrastructure.persistence.review.entity.PrintPackageReviewDO;
import com.draftflow.infrastructure.persistence.review.entity.PrintPackageStageDO;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ReviewPipelineConverter - 打印包评审转换器
 *
 * @author draftflow
 */
public class ReviewPipelineConverter {

    public static PrintPackageReviewDO toDataObject(ReviewPipelineInstance domain) {
        PrintPackageReviewDO dataObject = new PrintPackageReviewDO();
        dataObject.setJobNumber(domain.getJobNumber());
        dataObject.setStatus(domain.getStatus().name());
        dataObject.setCurrentStage(domain.getCurrentStage());
        dataObject.setInitializedBy(domain.getCreatedBy());
        dataObject.setInitializedDate(domain.getCreatedAt());
        dataObject.setCompletedDate(domain.getCompletedAt());
        return dataObject;
    }

    public static PrintPackageStageDO stageToDataObject(StageState stage, Long reviewId, String jobNumber) {
        PrintPackageStageDO dataObject = new PrintPackageStageDO();
        dataObject.setReviewId(reviewId);
        dataObject.setJobNumber(jobNumber);
        dataObject.setStage(stage.getStageIndex());
        dataObject.setStageName(stage.getStageName());
        dataObject.setDepartment(stage.getDepartment());
        dataObject.setStatus(stage.getStatus().name());
        dataObject.setReviewer(stage.getReviewerName());
        dataObject.setStartedDate(stage.getStartedAt());
        dataObject.setCompletedDate(stage.getCompletedAt());
        dataObject.setNotes(stage.getNotes());
        return dataObject;
    }

    public static ReviewPipelineInstance toDomain(PrintPackageReviewDO reviewDO,
                                                  List<PrintPackageStageDO> stageDOs,
                                                  List<PrintPackageFileDO> fileDOs) {
        ReviewPipelineInstance domain = new ReviewPipelineInstance();
        domain.setJobNumber(reviewDO.getJobNumber());
        domain.setStatus(ReviewStatus.valueOf(reviewDO.getStatus()));
        domain.setCurrentStage(reviewDO.getCurrentStage());
        domain.setCreatedBy(reviewDO.getInitializedBy());
        domain.setCreatedAt(reviewDO.getInitializedDate());
        domain.setCompletedAt(reviewDO.getCompletedDate());
        domain.setStages(stageDOs.stream()
            .sorted(Comparator.comparing(PrintPackageStageDO::getStage))
            .map(ReviewPipelineConverter::stageToDomain)
            .collect(Collectors.toList()));
        domain.setFiles(fileDOs.stream()
            .map(f -> new StageFile(f.getFileName(), f.getPath(), f.getStageIndex()))
            .collect(Collectors.toList()));
        return domain;
    }

    public static StageState stageToDomain(PrintPackageStageDO dataObject) {
        StageState stage = new StageState();
        stage.setStageIndex(dataObject.getStage());
        stage.setStageName(dataObject.getStageName());
        stage.setDepartment(dataObject.getDepartment());
        stage.setStatus(StageStatus.valueOf(dataObject.getStatus()));
        stage.setReviewerName(dataObject.getReviewer());
        stage.setStartedAt(dataObject.getStartedDate());
        stage.setCompletedAt(dataObject.getCompletedDate());
        stage.setNotes(dataObject.getNotes());
        return stage;
    }

    public static PendingReview toPendingReview(PrintPackageStageDO dataObject) {
        return PendingReview.builder()
            .jobNumber(dataObject.getJobNumber())
            .stageIndex(dataObject.getStage())
            .stageName(dataObject.getStageName())
            .department(dataObject.getDepartment())
            .startedAt(dataObject.getStartedDate())
            .build();
    }
}
