package com.draftflow.domain.review.command;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AdvanceStageCommand - 推进评审阶段命令
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvanceStageCommand {

    @NotBlank(message = "项目编号不能为空")
    private String jobNumber;

    /**
     * 要完成的阶段
     */
    @Min(value = 0, message = "阶段序号不能小于0")
    @Max(value = 7, message = "阶段序号不能大于7")
    private int stageIndex;

    @NotBlank(message = "评审人不能为空")
    private String reviewerName;

    /**
     * 评审人所在部门，为空时沿用阶段默认部门
     */
    private String department;

    private String notes;
}
