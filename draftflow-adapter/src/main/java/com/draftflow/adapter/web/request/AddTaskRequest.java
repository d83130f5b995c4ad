package com.draftflow.adapter.web.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AddTaskRequest {

    @NotBlank(message = "检查项标题不能为空")
    private String title;
}
