package com.draftflow.domain.review;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * RelocationReport - 批量文件重定位结果
 * <p>
 * 每个文件独立尝试，成功与失败分别记录。
 * </p>
 *
 * @author draftflow
 */
@Data
public class RelocationReport {

    /**
     * 目标阶段
     */
    private Integer targetStage;

    private List<String> relocated = new ArrayList<>();

    private List<RelocationFailure> failures = new ArrayList<>();

    public static RelocationReport empty() {
        return new RelocationReport();
    }

    public static RelocationReport to(int targetStage) {
        RelocationReport report = new RelocationReport();
        report.targetStage = targetStage;
        return report;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
