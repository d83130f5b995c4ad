package com.draftflow.domain.gateway;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;

/**
 * ProjectRecordGateway - 项目记录网关
 * <p>
 * 读取宿主项目记录中的到期日和项目目录，本系统不维护这些数据
 * </p>
 *
 * @author draftflow
 */
public interface ProjectRecordGateway {

    Optional<LocalDate> findDueDate(String projectId);

    Optional<Path> findJobDirectory(String jobNumber);
}
