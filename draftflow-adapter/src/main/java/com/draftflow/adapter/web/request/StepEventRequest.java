package com.draftflow.adapter.web.request;

import com.draftflow.domain.instance.StepEventKind;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 步骤事件请求
 */
@Data
public class StepEventRequest {

    @NotNull(message = "事件类型不能为空")
    private StepEventKind kind;

    /**
     * START / COMPLETE 的取值，缺省为 true
     */
    private Boolean value;

    /**
     * TRANSFER / RECEIVE 的参与人
     */
    private String actorName;
}
