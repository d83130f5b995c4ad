package com.draftflow.adapter.web.request;

import lombok.Data;

import java.time.LocalDate;

/**
 * 项目到期日变更请求，dueDate 为空表示清除排期
 */
@Data
public class DueDateRequest {

    private LocalDate dueDate;
}
