package com.draftflow.domain.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * ScheduleCalculator - 阶段到期日计算
 * <p>
 * 以项目到期日为锚点，沿阶段链倒排：最后一个阶段到期日即项目到期日，
 * 阶段 i 的到期日 = 阶段 i+1 的到期日 - 阶段 i+1 的计划工期（工作日）。
 * 分两遍完成：
 * 1. backProject：纯投影，不看任何实际发生的事件；
 * 2. reconcile：后继阶段已有实际开始时间时，用其开始日期替换当前阶段的到期日，
 *    并从替换点继续向前倒排。
 * 无状态，结果从不作为唯一数据源，随时可由时间戳和工期重新算出。
 * </p>
 *
 * @author draftflow
 */
public class ScheduleCalculator {

    /**
     * 计算每个阶段的到期日
     *
     * @param anchorDate 项目到期日，为 null 时所有阶段都没有到期日
     * @param stages 按顺序排列的阶段
     * @return 与 stages 一一对应的到期日
     */
    public List<LocalDate> computeDueDates(LocalDate anchorDate, List<ScheduleStage> stages) {
        if (stages == null || stages.isEmpty()) {
            return Collections.emptyList();
        }
        if (anchorDate == null) {
            return Arrays.asList(new LocalDate[stages.size()]);
        }
        return reconcile(backProject(anchorDate, stages), stages);
    }

    /**
     * 第一遍：纯倒排投影
     */
    public List<LocalDate> backProject(LocalDate anchorDate, List<ScheduleStage> stages) {
        LocalDate[] due = new LocalDate[stages.size()];
        int last = stages.size() - 1;
        due[last] = anchorDate;
        for (int i = last - 1; i >= 0; i--) {
            due[i] = BusinessDays.subtract(due[i + 1], stages.get(i + 1).getPlannedDurationDays());
        }
        return Arrays.asList(due);
    }

    /**
     * 第二遍：用实际开始时间校正投影
     */
    public List<LocalDate> reconcile(List<LocalDate> projected, List<ScheduleStage> stages) {
        LocalDate[] due = new LocalDate[stages.size()];
        int last = stages.size() - 1;
        due[last] = projected.get(last);
        for (int i = last - 1; i >= 0; i--) {
            ScheduleStage successor = stages.get(i + 1);
            if (successor.getActualStart() != null) {
                due[i] = successor.getActualStart().toLocalDate();
            } else if (due[i + 1].equals(projected.get(i + 1))) {
                due[i] = projected.get(i);
            } else {
                due[i] = BusinessDays.subtract(due[i + 1], successor.getPlannedDurationDays());
            }
        }
        return Arrays.asList(due);
    }

    /**
     * 计算已完成阶段的实际工期（工作日）
     * <p>
     * 起点取本阶段开始时间，没有则取上一阶段完成时间；起点或完成时间缺失时为 null。
     * </p>
     */
    public List<Integer> computeActualDurations(List<ScheduleStage> stages) {
        List<Integer> durations = new ArrayList<>(stages.size());
        LocalDateTime previousCompletion = null;
        for (ScheduleStage stage : stages) {
            LocalDateTime start = stage.getActualStart() != null ? stage.getActualStart() : previousCompletion;
            LocalDateTime completion = stage.getActualCompletion();
            if (start == null || completion == null) {
                durations.add(null);
            } else {
                durations.add(BusinessDays.countBetween(start.toLocalDate(), completion.toLocalDate()));
            }
            previousCompletion = completion;
        }
        return durations;
    }
}
