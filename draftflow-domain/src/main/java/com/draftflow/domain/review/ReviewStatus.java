package com.draftflow.domain.review;

/**
 * ReviewStatus - 评审整体状态
 *
 * @author draftflow
 */
public enum ReviewStatus {

    IN_PROGRESS,

    COMPLETED
}
