package com.draftflow.adapter.web.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CreateReviewRequest {

    @NotBlank(message = "发起人不能为空")
    private String createdBy;
}
