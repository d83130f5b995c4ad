package com.draftflow.infrastructure.file;

import com.draftflow.domain.exception.RelocationException;
import com.draftflow.domain.gateway.FileRelocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * LocalFileRelocator - 基于本地文件系统的文件重定位
 * <p>
 * 复制而不是移动，源文件保留在原阶段目录；目标已存在同名文件时覆盖，并保留修改时间等属性。
 * </p>
 *
 * @author draftflow
 */
@Slf4j
@Component
public class LocalFileRelocator implements FileRelocator {

    @Override
    public void createDirectories(List<Path> directories) {
        for (Path directory : directories) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new RelocationException(directory, "Failed to create directory " + directory + ": " + e.getMessage(), e);
            }
        }
        log.debug("Ensured {} directories", directories.size());
    }

    @Override
    public Path copyInto(Path source, Path targetDirectory) {
        if (!Files.isRegularFile(source)) {
            throw new RelocationException(source, "Source file does not exist: " + source);
        }
        Path target = targetDirectory.resolve(source.getFileName());
        try {
            Files.createDirectories(targetDirectory);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new RelocationException(source, "Failed to copy " + source + " to " + targetDirectory + ": " + e.getMessage(), e);
        }
        log.debug("Copied {} to {}", source, target);
        return target;
    }
}
