package com.draftflow.adapter.web.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 推进评审阶段请求，阶段序号取自路径
 */
@Data
public class AdvanceStageRequest {

    @NotBlank(message = "评审人不能为空")
    private String reviewerName;

    private String department;

    private String notes;
}
