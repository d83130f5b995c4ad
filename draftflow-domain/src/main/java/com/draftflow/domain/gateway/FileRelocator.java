package com.draftflow.domain.gateway;

import com.draftflow.domain.exception.RelocationException;

import java.nio.file.Path;
import java.util.List;

/**
 * FileRelocator - 文件重定位网关
 * <p>
 * 在阶段目录之间复制文件，由基础设施层实现
 * </p>
 *
 * @author draftflow
 */
public interface FileRelocator {

    /**
     * 创建目录（已存在时忽略）
     *
     * @throws RelocationException 任一目录创建失败
     */
    void createDirectories(List<Path> directories);

    /**
     * 把文件复制到目标目录，保留文件名，已存在时覆盖
     *
     * @return 目标文件路径
     * @throws RelocationException 源文件不存在、被占用或无权限
     */
    Path copyInto(Path source, Path targetDirectory);
}
