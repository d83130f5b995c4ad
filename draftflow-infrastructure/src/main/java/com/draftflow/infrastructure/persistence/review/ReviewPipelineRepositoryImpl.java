package com.draftflow.infrastructure.persistence.review;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.review.PendingReview;
import com.draftflow.domain.review.ReviewPipelineInstance;
import com.draftflow.domain.review.StageFile;
import com.draftflow.domain.review.StageState;
import com.draftflow.domain.review.StageStatus;
import com.draftflow.domain.review.repository.ReviewPipelineRepository;
import com.draftflow.infrastructure.persistence.review.converter.ReviewPipelineConverter;
import com.draftflow.infrastructure.persistence.review.entity.PrintPackageFileDO;
import com.draftflow.infrastructure.persistence.review.entity.PrintPackageReviewDO;
import com.draftflow.infrastructure.persistence.review.entity.PrintPackageStageDO;
import com.draftflow.infrastructure.persistence.review.mapper.PrintPackageFileMapper;
import com.draftflow.infrastructure.persistence.review.mapper.PrintPackageReviewMapper;
import com.draftflow.infrastructure.persistence.review.mapper.PrintPackageStageMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ReviewPipelineRepositoryImpl - 打印包评审仓储实现
 * <p>
 * 阶段状态迁移使用 UPDATE ... WHERE status = 期望状态，影响行数为 0 即视为被并发修改。
 * </p>
 *
 * @author draftflow
 */
@Repository
@Validated
public class ReviewPipelineRepositoryImpl implements ReviewPipelineRepository {

    private final PrintPackageReviewMapper reviewMapper;
    private final PrintPackageStageMapper stageMapper;
    private final PrintPackageFileMapper fileMapper;

    public ReviewPipelineRepositoryImpl(PrintPackageReviewMapper reviewMapper,
                                        PrintPackageStageMapper stageMapper,
                                        PrintPackageFileMapper fileMapper) {
        this.reviewMapper = reviewMapper;
        this.stageMapper = stageMapper;
        this.fileMapper = fileMapper;
    }

    @Override
    public Optional<ReviewPipelineInstance> findByJobNumber(String jobNumber) {
        PrintPackageReviewDO reviewDO = findReview(jobNumber);
        if (reviewDO == null) {
            return Optional.empty();
        }

        List<PrintPackageStageDO> stageDOs = stageMapper.selectList(
            new LambdaQueryWrapper<PrintPackageStageDO>()
                .eq(PrintPackageStageDO::getReviewId, reviewDO.getReviewId())
                .orderByAsc(PrintPackageStageDO::getStage)
        );
        List<PrintPackageFileDO> fileDOs = fileMapper.selectList(
            new LambdaQueryWrapper<PrintPackageFileDO>()
                .eq(PrintPackageFileDO::getReviewId, reviewDO.getReviewId())
                .orderByAsc(PrintPackageFileDO::getFileName)
        );
        return Optional.of(ReviewPipelineConverter.toDomain(reviewDO, stageDOs, fileDOs));
    }

    @Override
    public boolean exists(String jobNumber) {
        return reviewMapper.selectCount(
            new LambdaQueryWrapper<PrintPackageReviewDO>()
                .eq(PrintPackageReviewDO::getJobNumber, jobNumber)
        ) > 0;
    }

    @Override
    @Transactional
    public void insert(ReviewPipelineInstance instance) {
        PrintPackageReviewDO reviewDO = ReviewPipelineConverter.toDataObject(instance);
        reviewMapper.insert(reviewDO);
        for (StageState stage : instance.getStages()) {
            stageMapper.insert(ReviewPipelineConverter.stageToDataObject(
                stage, reviewDO.getReviewId(), instance.getJobNumber()));
        }
    }

    @Override
    @Transactional
    public boolean transitionStage(String jobNumber, StageState state, StageStatus expected) {
        int updated = stageMapper.update(null,
            new LambdaUpdateWrapper<PrintPackageStageDO>()
                .set(PrintPackageStageDO::getStatus, state.getStatus().name())
                .set(PrintPackageStageDO::getDepartment, state.getDepartment())
                .set(PrintPackageStageDO::getReviewer, state.getReviewerName())
                .set(PrintPackageStageDO::getStartedDate, state.getStartedAt())
                .set(PrintPackageStageDO::getCompletedDate, state.getCompletedAt())
                .set(PrintPackageStageDO::getNotes, state.getNotes())
                .eq(PrintPackageStageDO::getJobNumber, jobNumber)
                .eq(PrintPackageStageDO::getStage, state.getStageIndex())
                .eq(PrintPackageStageDO::getStatus, expected.name())
        );
        return updated == 1;
    }

    @Override
    @Transactional
    public void updateReviewHeader(ReviewPipelineInstance instance) {
        reviewMapper.update(null,
            new LambdaUpdateWrapper<PrintPackageReviewDO>()
                .set(PrintPackageReviewDO::getStatus, instance.getStatus().name())
                .set(PrintPackageReviewDO::getCurrentStage, instance.getCurrentStage())
                .set(PrintPackageReviewDO::getCompletedDate, instance.getCompletedAt())
                .eq(PrintPackageReviewDO::getJobNumber, instance.getJobNumber())
        );
    }

    @Override
    @Transactional
    public void saveFile(String jobNumber, StageFile file) {
        PrintPackageReviewDO reviewDO = findReview(jobNumber);
        if (reviewDO == null) {
            throw new WorkflowNotFoundException("No print package review for job " + jobNumber);
        }
        PrintPackageFileDO existing = fileMapper.selectOne(
            new LambdaQueryWrapper<PrintPackageFileDO>()
                .eq(PrintPackageFileDO::getReviewId, reviewDO.getReviewId())
                .eq(PrintPackageFileDO::getFileName, file.getFileName())
        );

        if (existing == null) {
            PrintPackageFileDO fileDO = new PrintPackageFileDO();
            fileDO.setReviewId(reviewDO.getReviewId());
            fileDO.setJobNumber(jobNumber);
            fileDO.setFileName(file.getFileName());
            fileDO.setPath(file.getPath());
            fileDO.setStageIndex(file.getStageIndex());
            fileDO.setUpdatedAt(LocalDateTime.now());
            fileMapper.insert(fileDO);
        } else {
            existing.setPath(file.getPath());
            existing.setStageIndex(file.getStageIndex());
            existing.setUpdatedAt(LocalDateTime.now());
            fileMapper.updateById(existing);
        }
    }

    @Override
    public List<PendingReview> findPendingStages(String department) {
        return stageMapper.selectList(
                new LambdaQueryWrapper<PrintPackageStageDO>()
                    .eq(PrintPackageStageDO::getStatus, StageStatus.IN_PROGRESS.name())
                    .eq(department != null, PrintPackageStageDO::getDepartment, department)
                    .orderByAsc(PrintPackageStageDO::getStartedDate)
                    .orderByAsc(PrintPackageStageDO::getJobNumber)
            ).stream()
            .map(ReviewPipelineConverter::toPendingReview)
            .collect(Collectors.toList());
    }

    private PrintPackageReviewDO findReview(String jobNumber) {
        return reviewMapper.selectOne(
            new LambdaQueryWrapper<PrintPackageReviewDO>()
                .eq(PrintPackageReviewDO::getJobNumber, jobNumber)
        );
    }
}
