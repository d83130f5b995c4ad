package com.draftflow.domain.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * BusinessDays - 工作日日历
 * <p>
 * 仅排除周六、周日，不处理节假日。
 * </p>
 *
 * @author draftflow
 */
public final class BusinessDays {

    private static final int BUSINESS_DAYS_PER_WEEK = 5;

    private BusinessDays() {
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /**
     * 从 date 向前回退 days 个工作日
     * <p>
     * days <= 0 时原样返回；回退结果一定落在工作日上。
     * </p>
     */
    public static LocalDate subtract(LocalDate date, int days) {
        if (days <= 0) {
            return date;
        }
        // 连续 7 天恰好含 5 个工作日，按整周跳过；余数至少留 1 天逐日回退，结果才会落在工作日
        int weeks = (days - 1) / BUSINESS_DAYS_PER_WEEK;
        LocalDate result = date.minusWeeks(weeks);
        int remaining = days - weeks * BUSINESS_DAYS_PER_WEEK;
        while (remaining > 0) {
            result = result.minusDays(1);
            if (!isWeekend(result)) {
                remaining--;
            }
        }
        return result;
    }

    /**
     * 统计 (start, end] 区间内的工作日数量，end 不晚于 start 时为 0
     */
    public static int countBetween(LocalDate start, LocalDate end) {
        if (!start.isBefore(end)) {
            return 0;
        }
        long weeks = ChronoUnit.WEEKS.between(start, end);
        long count = weeks * BUSINESS_DAYS_PER_WEEK;
        LocalDate cursor = start.plusWeeks(weeks);
        while (cursor.isBefore(end)) {
            cursor = cursor.plusDays(1);
            if (!isWeekend(cursor)) {
                count++;
            }
        }
        return Math.toIntExact(count);
    }
}
