package com.draftflow.adapter.web.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ToggleTaskRequest {

    @NotNull(message = "勾选状态不能为空")
    private Boolean checked;
}
