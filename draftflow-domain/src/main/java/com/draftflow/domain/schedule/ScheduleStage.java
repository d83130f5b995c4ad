package com.draftflow.domain.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * ScheduleStage - 排期计算的单个阶段输入（值对象）
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleStage {

    /**
     * 计划工期（工作日）
     */
    private int plannedDurationDays;

    /**
     * 实际开始时间，未开始为 null
     */
    private LocalDateTime actualStart;

    /**
     * 实际完成时间，未完成为 null
     */
    private LocalDateTime actualCompletion;
}
