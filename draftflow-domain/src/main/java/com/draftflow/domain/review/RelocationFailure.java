package com.draftflow.domain.review;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RelocationFailure - 单个文件的重定位失败记录
 *
 * @author draftflow
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelocationFailure {

    private String fileName;

    private String sourcePath;

    private String reason;
}
