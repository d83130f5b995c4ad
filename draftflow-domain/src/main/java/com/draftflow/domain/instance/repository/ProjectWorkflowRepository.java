package com.draftflow.domain.instance.repository;

import com.draftflow.domain.instance.ProjectWorkflowInstance;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Optional;

/**
 * ProjectWorkflowRepository - 项目工作流实例仓储接口
 *
 * @author draftflow
 */
public interface ProjectWorkflowRepository {

    /**
     * 按项目查询实例（含步骤和检查项）
     */
    Optional<ProjectWorkflowInstance> findByProjectId(@NotBlank(message = "项目ID不能为空") String projectId);

    boolean exists(@NotBlank(message = "项目ID不能为空") String projectId);

    /**
     * 保存实例
     * <p>
     * 按 (projectId, orderIndex) 更新已有步骤、插入新步骤；检查项按 orderIndex 同理。
     * </p>
     */
    void save(@NotNull(message = "工作流实例不能为空") ProjectWorkflowInstance instance);
}
