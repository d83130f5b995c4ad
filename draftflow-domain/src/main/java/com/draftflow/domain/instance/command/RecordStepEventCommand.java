package com.draftflow.domain.instance.command;

import com.draftflow.domain.instance.StepEventKind;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RecordStepEventCommand - 记录步骤事件命令
 * <p>
 * START/COMPLETE 使用 value；TRANSFER/RECEIVE 使用 actorName。
 * </p>
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordStepEventCommand {

    @NotBlank(message = "项目ID不能为空")
    private String projectId;

    @Min(value = 0, message = "步骤序号不能为负数")
    private int stepOrderIndex;

    @NotNull(message = "事件类型不能为空")
    private StepEventKind kind;

    /**
     * 开关值，START/COMPLETE 时使用，缺省为 true
     */
    private Boolean value;

    /**
     * 参与人，TRANSFER/RECEIVE 时使用
     */
    private String actorName;
}
