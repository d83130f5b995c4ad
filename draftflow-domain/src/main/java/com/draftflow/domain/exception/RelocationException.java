package com.draftflow.domain.exception;

import java.nio.file.Path;

/**
 * RelocationException - 单个文件在阶段目录间复制失败
 * <p>
 * 只在文件搬运网关与评审服务之间传递，评审服务会把它收集到推进结果中，
 * 不会中断阶段状态迁移。
 * </p>
 *
 * @author draftflow
 */
public class RelocationException extends WorkflowException {

    public static final String ERR_CODE = "RELOCATION_ERROR";

    private final Path source;

    public RelocationException(Path source, String message, Throwable cause) {
        super(ERR_CODE, message, cause);
        this.source = source;
    }

    public RelocationException(Path source, String message) {
        super(ERR_CODE, message);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
