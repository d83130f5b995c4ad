package com.draftflow.domain.review;

import com.draftflow.domain.exception.WorkflowNotFoundException;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ReviewPipelineInstance - 打印包评审实例（聚合根）
 * <p>
 * 每个项目编号一个，包含固定的 8 个阶段状态和已登记的文件。
 * 创建时阶段 0 处于进行中，其余阶段未开始。
 * </p>
 *
 * @author draftflow
 */
@Data
public class ReviewPipelineInstance {

    private String jobNumber;

    private ReviewStatus status;

    /**
     * 当前活动阶段；评审完成后停留在最后一个阶段
     */
    private int currentStage;

    private LocalDateTime createdAt;

    private String createdBy;

    private LocalDateTime completedAt;

    private List<StageState> stages = new ArrayList<>();

    private List<StageFile> files = new ArrayList<>();

    public static ReviewPipelineInstance create(String jobNumber, String createdBy, LocalDateTime now) {
        ReviewPipelineInstance instance = new ReviewPipelineInstance();
        instance.jobNumber = jobNumber;
        instance.createdBy = createdBy;
        instance.createdAt = now;
        instance.status = ReviewStatus.IN_PROGRESS;
        instance.currentStage = 0;
        instance.stages = Arrays.stream(ReviewStage.values())
            .map(StageState::initial)
            .collect(Collectors.toList());
        instance.stages.get(0).start(now);
        return instance;
    }

    public StageState getStage(int stageIndex) {
        return stages.stream()
            .filter(s -> s.getStageIndex() == stageIndex)
            .findFirst()
            .orElseThrow(() -> new WorkflowNotFoundException(
                "Stage " + stageIndex + " not found in review " + jobNumber));
    }

    public List<StageFile> filesAtStage(int stageIndex) {
        return files.stream()
            .filter(f -> f.getStageIndex() == stageIndex)
            .sorted(Comparator.comparing(StageFile::getFileName))
            .collect(Collectors.toList());
    }

    public Optional<StageFile> findFile(String fileNameOrPath) {
        return files.stream()
            .filter(f -> f.getFileName().equals(fileNameOrPath) || fileNameOrPath.equals(f.getPath()))
            .findFirst();
    }

    public boolean isCompleted() {
        return status == ReviewStatus.COMPLETED;
    }

    public int completedStageCount() {
        return (int) stages.stream()
            .filter(s -> s.getStatus() == StageStatus.COMPLETED)
            .count();
    }

    public ReviewSummary toSummary() {
        int completed = completedStageCount();
        int total = ReviewStage.count();
        return ReviewSummary.builder()
            .jobNumber(jobNumber)
            .status(status)
            .currentStage(currentStage)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .completedAt(completedAt)
            .stages(stages)
            .files(files)
            .completedStages(completed)
            .totalStages(total)
            .progressPercentage(completed * 100.0 / total)
            .complete(isCompleted())
            .build();
    }
}
