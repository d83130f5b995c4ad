package com.draftflow.adapter.web.request;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 重试文件重定位请求，files 为空时重试所有滞留文件
 */
@Data
public class RetryRelocationRequest {

    private List<String> files = new ArrayList<>();
}
