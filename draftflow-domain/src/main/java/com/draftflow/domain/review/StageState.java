package com.draftflow.domain.review;

import com.draftflow.domain.exception.InvalidTransitionException;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * StageState - 单个评审阶段的状态
 *
 * @author draftflow
 */
@Data
public class StageState {

    private int stageIndex;

    private String stageName;

    private String department;

    private StageStatus status;

    private String reviewerName;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private String notes;

    public static StageState initial(ReviewStage stage) {
        StageState state = new StageState();
        state.stageIndex = stage.getIndex();
        state.stageName = stage.getStageName();
        state.department = stage.getDepartment();
        state.status = StageStatus.NOT_STARTED;
        return state;
    }

    /**
     * NOT_STARTED → IN_PROGRESS
     */
    public void start(LocalDateTime now) {
        if (status != StageStatus.NOT_STARTED) {
            throw new InvalidTransitionException(
                "Stage " + stageIndex + " cannot be started from status " + status);
        }
        this.status = StageStatus.IN_PROGRESS;
        this.startedAt = now;
    }

    /**
     * IN_PROGRESS → COMPLETED，记录评审人和部门
     */
    public void complete(String reviewer, String reviewerDepartment, String completionNotes, LocalDateTime now) {
        if (status != StageStatus.IN_PROGRESS) {
            throw new InvalidTransitionException(
                "Stage " + stageIndex + " cannot be completed from status " + status);
        }
        this.status = StageStatus.COMPLETED;
        this.reviewerName = reviewer;
        if (reviewerDepartment != null && !reviewerDepartment.isBlank()) {
            this.department = reviewerDepartment;
        }
        this.notes = completionNotes;
        this.completedAt = now;
    }
}
