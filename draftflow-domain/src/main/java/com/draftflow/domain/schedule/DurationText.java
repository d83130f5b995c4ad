package com.draftflow.domain.schedule;

import com.draftflow.domain.exception.WorkflowValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DurationText - 可读工期文本
 * <p>
 * 支持 "15m"、"2h"、"1.5d"、"1w"，不带单位时按天处理，大小写不敏感。
 * 解析结果为分钟；排期只按日期计算，换算成工作日时向上取整。
 * </p>
 *
 * @author draftflow
 */
public final class DurationText {

    public static final int MINUTES_PER_HOUR = 60;
    public static final int MINUTES_PER_DAY = 24 * MINUTES_PER_HOUR;
    public static final int MINUTES_PER_WEEK = 7 * MINUTES_PER_DAY;

    private static final Pattern DURATION = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*([mMhHdDwW])?\\s*$");

    private DurationText() {
    }

    /**
     * 解析为分钟数（四舍五入到整分钟）
     *
     * @throws WorkflowValidationException 格式不合法，或分钟数超出 int 范围
     */
    public static int parseToMinutes(String text) {
        if (text == null || text.isBlank()) {
            throw new WorkflowValidationException("Duration cannot be empty");
        }
        Matcher matcher = DURATION.matcher(text);
        if (!matcher.matches()) {
            throw new WorkflowValidationException("Invalid duration: '" + text + "'");
        }
        double value = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) == null ? "d" : matcher.group(2).toLowerCase(Locale.ROOT);
        double minutes;
        switch (unit) {
            case "m":
                minutes = value;
                break;
            case "h":
                minutes = value * MINUTES_PER_HOUR;
                break;
            case "w":
                minutes = value * MINUTES_PER_WEEK;
                break;
            default:
                minutes = value * MINUTES_PER_DAY;
        }
        long rounded = Math.round(minutes);
        if (rounded > Integer.MAX_VALUE) {
            throw new WorkflowValidationException("Duration is too long: '" + text + "'");
        }
        return (int) rounded;
    }

    /**
     * 格式化为最大可用单位，最多保留两位小数，如 90 -> "1.5h"
     */
    public static String formatCompact(Integer minutes) {
        if (minutes == null) {
            return "";
        }
        if (minutes >= MINUTES_PER_WEEK) {
            return format(minutes, MINUTES_PER_WEEK, "w");
        }
        if (minutes >= MINUTES_PER_DAY) {
            return format(minutes, MINUTES_PER_DAY, "d");
        }
        if (minutes >= MINUTES_PER_HOUR) {
            return format(minutes, MINUTES_PER_HOUR, "h");
        }
        return minutes + "m";
    }

    /**
     * 分钟数向上取整为工作日，非正数为 0
     */
    public static int ceilToBusinessDays(int minutes) {
        if (minutes <= 0) {
            return 0;
        }
        return (minutes - 1) / MINUTES_PER_DAY + 1;
    }

    /**
     * 文本直接换算为排期用的工作日数
     */
    public static int toBusinessDays(String text) {
        return ceilToBusinessDays(parseToMinutes(text));
    }

    private static String format(int minutes, int unitMinutes, String suffix) {
        BigDecimal value = BigDecimal.valueOf(minutes)
                .divide(BigDecimal.valueOf(unitMinutes), 2, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        return value.toPlainString() + suffix;
    }
}
