package com.draftflow.domain.review;

import com.draftflow.domain.exception.WorkflowValidationException;

import java.util.Optional;

/**
 * ReviewStage - 打印包评审的固定阶段
 * <p>
 * 阶段数量和顺序固定，不由模板驱动，严格按 0 → 7 线性推进。
 * </p>
 *
 * @author draftflow
 */
public enum ReviewStage {

    DRAFTING_PRINT_PACKAGE(0, "Drafting-Print Package", "Drafting", "原始打印包（不修改）"),
    ENGINEER_REVIEW(1, "Engineer Review", "Engineering", "工程评审与批注"),
    ENGINEERING_QC_REVIEW(2, "Engineering QC Review", "Engineering QC", "工程质量评审"),
    DRAFTING_UPDATES_ENG(3, "Drafting Updates (ENG)", "Drafting", "制图落实工程修改"),
    LEAD_DESIGNER_REVIEW(4, "Lead Designer Review", "Lead Designer", "主设计师评审"),
    PRODUCTION_OPS_REVIEW(5, "Production OPS Review", "Production OPS", "生产运营评审"),
    DRAFTING_UPDATES_OPS(6, "Drafting Updates (OPS)", "Drafting", "制图落实运营修改"),
    FINAL_PRINT_PACKAGE(7, "FINAL Print Package (Approved)", "Final Approval", "最终批准的打印包");

    private final int index;
    private final String stageName;
    private final String department;
    private final String description;

    ReviewStage(int index, String stageName, String department, String description) {
        this.index = index;
        this.stageName = stageName;
        this.department = department;
        this.description = description;
    }

    public int getIndex() {
        return index;
    }

    public String getStageName() {
        return stageName;
    }

    public String getDepartment() {
        return department;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 阶段目录名，如 "3-Drafting Updates (ENG)"
     */
    public String folderName() {
        return index + "-" + stageName;
    }

    public boolean isFinal() {
        return this == FINAL_PRINT_PACKAGE;
    }

    public Optional<ReviewStage> next() {
        return isFinal() ? Optional.empty() : Optional.of(values()[index + 1]);
    }

    public static ReviewStage fromIndex(int index) {
        if (index < 0 || index >= values().length) {
            throw new WorkflowValidationException("Review stage index out of range: " + index);
        }
        return values()[index];
    }

    public static int count() {
        return values().length;
    }
}
