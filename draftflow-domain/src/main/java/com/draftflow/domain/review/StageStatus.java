package com.draftflow.domain.review;

/**
 * StageStatus - 评审阶段状态
 * <p>
 * 只允许 NOT_STARTED → IN_PROGRESS → COMPLETED 单向流转
 * </p>
 *
 * @author draftflow
 */
public enum StageStatus {

    NOT_STARTED,

    IN_PROGRESS,

    COMPLETED
}
