package com.draftflow.app.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 检查项既可以写成纯标题字符串，也可以写成 {title, defaultChecked}
 */
@Data
@NoArgsConstructor
public class TaskYamlDto {
    private String title;
    private boolean defaultChecked;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public TaskYamlDto(String title) {
        this.title = title;
    }
}
