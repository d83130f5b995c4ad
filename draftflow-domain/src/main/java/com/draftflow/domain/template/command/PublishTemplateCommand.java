package com.draftflow.domain.template.command;

import com.draftflow.domain.template.TemplateStep;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * PublishTemplateCommand - 发布模板新版本命令
 * <p>
 * 对应 API: POST /api/v1/templates
 * 发布后立即成为该名称下唯一的激活版本
 * </p>
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishTemplateCommand {

    /**
     * 模板名称，如 "Standard"
     */
    @NotBlank(message = "模板名称不能为空")
    private String name;

    /**
     * 步骤列表
     */
    @Valid
    @NotEmpty(message = "步骤列表不能为空")
    private List<TemplateStep> steps;

    /**
     * 发布者
     */
    private String publishedBy;
}
