package com.draftflow.domain.template;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TemplateStepTask - 模板步骤下的检查项（值对象）
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateStepTask {

    /**
     * 步骤内的顺序
     */
    private int orderIndex;

    /**
     * 检查项标题
     */
    private String title;

    /**
     * 实例化到项目时是否默认勾选
     */
    private boolean defaultChecked;
}
