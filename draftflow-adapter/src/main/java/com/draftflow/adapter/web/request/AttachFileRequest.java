package com.draftflow.adapter.web.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AttachFileRequest {

    @NotBlank(message = "文件路径不能为空")
    private String path;
}
