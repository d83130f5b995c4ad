package com.draftflow.domain.review.service;

import com.draftflow.domain.exception.InvalidTransitionException;
import com.draftflow.domain.exception.RelocationException;
import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.exception.WorkflowValidationException;
import com.draftflow.domain.gateway.FileRelocator;
import com.draftflow.domain.gateway.ProjectRecordGateway;
import com.draftflow.domain.review.AdvanceResult;
import com.draftflow.domain.review.PendingReview;
import com.draftflow.domain.review.RelocationFailure;
import com.draftflow.domain.review.RelocationReport;
import com.draftflow.domain.review.ReviewFolderLayout;
import com.draftflow.domain.review.ReviewPipelineInstance;
import com.draftflow.domain.review.ReviewStage;
import com.draftflow.domain.review.ReviewStatus;
import com.draftflow.domain.review.ReviewSummary;
import com.draftflow.domain.review.StageFile;
import com.draftflow.domain.review.StageState;
import com.draftflow.domain.review.StageStatus;
import com.draftflow.domain.review.command.AdvanceStageCommand;
import com.draftflow.domain.review.repository.ReviewPipelineRepository;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * ReviewPipelineService - 打印包评审领域服务
 * <p>
 * 阶段推进分两部分：
 * 1. 状态迁移：完成当前阶段、开始下一阶段，通过条件更新检测并发推进，失败时整体回滚；
 * 2. 文件重定位：逐个复制完成阶段的文件到下一阶段目录，单个文件失败只记录，不影响状态迁移。
 * </p>
 *
 * @author draftflow
 */
@Slf4j
public class ReviewPipelineService {

    private final ReviewPipelineRepository repository;
    private final FileRelocator fileRelocator;
    private final ProjectRecordGateway projectRecordGateway;
    private final ReviewFolderLayout folderLayout;
    private final Clock clock;

    public ReviewPipelineService(ReviewPipelineRepository repository,
                                 FileRelocator fileRelocator,
                                 ProjectRecordGateway projectRecordGateway,
                                 ReviewFolderLayout folderLayout,
                                 Clock clock) {
        this.repository = repository;
        this.fileRelocator = fileRelocator;
        this.projectRecordGateway = projectRecordGateway;
        this.folderLayout = folderLayout;
        this.clock = clock;
    }

    /**
     * 创建评审并建立 8 个阶段目录
     *
     * @throws WorkflowValidationException 该项目已有评审
     * @throws WorkflowNotFoundException 找不到项目目录
     */
    public ReviewPipelineInstance createReview(String jobNumber, String createdBy) {
        if (jobNumber == null || jobNumber.isBlank()) {
            throw new WorkflowValidationException("Job number cannot be empty");
        }
        if (repository.exists(jobNumber)) {
            throw new WorkflowValidationException("Print package review already exists for job " + jobNumber);
        }
        Path jobDirectory = projectRecordGateway.findJobDirectory(jobNumber)
            .orElseThrow(() -> new WorkflowNotFoundException("No job directory recorded for job " + jobNumber));

        ReviewPipelineInstance instance = ReviewPipelineInstance.create(jobNumber, createdBy, now());
        repository.insert(instance);
        fileRelocator.createDirectories(folderLayout.allStageDirectories(jobDirectory));
        log.info("Created print package review for job {} under {}", jobNumber, folderLayout.packageRoot(jobDirectory));
        return instance;
    }

    public ReviewPipelineInstance getReview(String jobNumber) {
        return repository.findByJobNumber(jobNumber)
            .orElseThrow(() -> new WorkflowNotFoundException("No print package review for job " + jobNumber));
    }

    /**
     * 完成指定阶段并推进到下一阶段
     *
     * @throws InvalidTransitionException 阶段不在进行中，或被并发推进
     */
    public AdvanceResult advanceStage(AdvanceStageCommand command) {
        String jobNumber = command.getJobNumber();
        ReviewStage completing = ReviewStage.fromIndex(command.getStageIndex());
        ReviewPipelineInstance instance = getReview(jobNumber);
        LocalDateTime now = now();

        StageState completingState = instance.getStage(completing.getIndex());
        completingState.complete(command.getReviewerName(), command.getDepartment(), command.getNotes(), now);
        casTransition(jobNumber, completingState, StageStatus.IN_PROGRESS);

        Optional<ReviewStage> next = completing.next();
        if (next.isPresent()) {
            StageState nextState = instance.getStage(next.get().getIndex());
            nextState.start(now);
            casTransition(jobNumber, nextState, StageStatus.NOT_STARTED);
            instance.setCurrentStage(next.get().getIndex());
        } else {
            instance.setStatus(ReviewStatus.COMPLETED);
            instance.setCompletedAt(now);
        }
        repository.updateReviewHeader(instance);

        RelocationReport report = next
            .map(target -> relocate(instance, instance.filesAtStage(completing.getIndex()), target))
            .orElseGet(RelocationReport::empty);

        log.info("Job {} completed stage {} by {}; next stage {}; relocated {} file(s), {} failure(s)",
            jobNumber, completing.getIndex(), command.getReviewerName(),
            next.map(ReviewStage::getIndex).map(String::valueOf).orElse("none"),
            report.getRelocated().size(), report.getFailures().size());

        return AdvanceResult.builder()
            .jobNumber(jobNumber)
            .completedStage(completing.getIndex())
            .startedStage(next.map(ReviewStage::getIndex).orElse(null))
            .reviewCompleted(instance.isCompleted())
            .relocation(report)
            .build();
    }

    /**
     * 在当前活动阶段登记文件；同名文件会被重新登记到当前阶段
     *
     * @throws InvalidTransitionException 评审已完成
     */
    public StageFile attachFile(String jobNumber, String filePath) {
        ReviewPipelineInstance instance = getReview(jobNumber);
        if (instance.isCompleted()) {
            throw new InvalidTransitionException("Print package review for job " + jobNumber + " is already completed");
        }
        String fileName = fileNameOf(filePath);
        StageFile file = instance.findFile(fileName).orElseGet(StageFile::new);
        file.setFileName(fileName);
        file.setPath(filePath);
        file.setStageIndex(instance.getCurrentStage());
        repository.saveFile(jobNumber, file);
        log.info("Attached {} to stage {} of job {}", fileName, instance.getCurrentStage(), jobNumber);
        return file;
    }

    /**
     * 重新尝试把滞留在较早阶段的文件复制到当前活动阶段
     *
     * @param fileNames 文件名或路径，为空时重试所有滞留文件
     */
    public RelocationReport retryRelocation(String jobNumber, List<String> fileNames) {
        ReviewPipelineInstance instance = getReview(jobNumber);
        int target = instance.getCurrentStage();

        List<StageFile> candidates = new ArrayList<>();
        if (fileNames == null || fileNames.isEmpty()) {
            instance.getFiles().stream()
                .filter(f -> f.getStageIndex() < target)
                .forEach(candidates::add);
        } else {
            for (String name : fileNames) {
                StageFile file = instance.findFile(name)
                    .orElseThrow(() -> new WorkflowNotFoundException("File " + name + " is not registered for job " + jobNumber));
                if (file.getStageIndex() >= target) {
                    throw new WorkflowValidationException("File " + file.getFileName() + " is already at stage " + target);
                }
                candidates.add(file);
            }
        }
        return relocate(instance, candidates, ReviewStage.fromIndex(target));
    }

    public ReviewSummary getSummary(String jobNumber) {
        return getReview(jobNumber).toSummary();
    }

    public List<PendingReview> getPendingReviews(String department) {
        String filter = department == null || department.isBlank() ? null : department;
        return repository.findPendingStages(filter);
    }

    public List<StageFile> getFilesForStage(String jobNumber, int stageIndex) {
        ReviewStage stage = ReviewStage.fromIndex(stageIndex);
        return getReview(jobNumber).filesAtStage(stage.getIndex());
    }

    // ==================== 私有方法 ====================

    private void casTransition(String jobNumber, StageState state, StageStatus expected) {
        if (!repository.transitionStage(jobNumber, state, expected)) {
            throw new InvalidTransitionException("Stage " + state.getStageIndex() + " of job " + jobNumber
                + " is no longer " + expected + ", it was changed concurrently");
        }
    }

    private RelocationReport relocate(ReviewPipelineInstance instance, List<StageFile> files, ReviewStage target) {
        RelocationReport report = RelocationReport.to(target.getIndex());
        if (files.isEmpty()) {
            return report;
        }
        Optional<Path> jobDirectory = projectRecordGateway.findJobDirectory(instance.getJobNumber());
        if (jobDirectory.isEmpty()) {
            log.warn("No job directory recorded for job {}, {} file(s) left in place",
                instance.getJobNumber(), files.size());
            files.forEach(f -> report.getFailures().add(
                new RelocationFailure(f.getFileName(), f.getPath(), "No job directory recorded")));
            return report;
        }

        Path targetDirectory = folderLayout.stageDirectory(jobDirectory.get(), target);
        for (StageFile file : files) {
            try {
                Path copied = fileRelocator.copyInto(Paths.get(file.getPath()), targetDirectory);
                file.setPath(copied.toString());
                file.setStageIndex(target.getIndex());
                repository.saveFile(instance.getJobNumber(), file);
                report.getRelocated().add(file.getFileName());
            } catch (RelocationException | InvalidPathException e) {
                log.warn("Failed to relocate {} of job {} to stage {}: {}",
                    file.getFileName(), instance.getJobNumber(), target.getIndex(), e.getMessage());
                report.getFailures().add(new RelocationFailure(file.getFileName(), file.getPath(), e.getMessage()));
            }
        }
        return report;
    }

    private static String fileNameOf(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new WorkflowValidationException("File path cannot be empty");
        }
        try {
            Path fileName = Paths.get(filePath).getFileName();
            if (fileName == null) {
                throw new WorkflowValidationException("File path has no file name: " + filePath);
            }
            return fileName.toString();
        } catch (InvalidPathException e) {
            throw new WorkflowValidationException("Invalid file path: " + filePath);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
