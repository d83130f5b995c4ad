package com.draftflow.domain.template.repository;

import com.draftflow.domain.template.WorkflowTemplate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * WorkflowTemplateRepository - 工作流模板仓储接口
 * <p>
 * 只追加：不提供更新和删除，唯一的写操作是发布新版本。
 * </p>
 *
 * @author draftflow
 */
public interface WorkflowTemplateRepository {

    /**
     * 查找当前激活版本
     *
     * @param name 模板名称，不能为空或空白
     * @return 激活版本的 Optional
     */
    Optional<WorkflowTemplate> findActive(@NotBlank String name);

    /**
     * 查找指定版本
     *
     * @param name 模板名称，不能为空或空白
     * @param version 版本号
     * @return 模板版本的 Optional
     */
    Optional<WorkflowTemplate> findByNameAndVersion(@NotBlank String name, int version);

    /**
     * 查找同名模板的全部版本（按版本号倒序）
     *
     * @param name 模板名称，不能为空或空白
     * @return 版本列表
     */
    List<WorkflowTemplate> findAllVersions(@NotBlank String name);

    /**
     * 查询同名模板的最大版本号，没有任何版本时返回 0
     *
     * @param name 模板名称，不能为空或空白
     * @return 最大版本号
     */
    int findLatestVersionNumber(@NotBlank String name);

    /**
     * 保存新版本并将其设为唯一激活版本
     * <p>
     * 插入新版本与停用旧版本必须在同一事务内完成。
     * </p>
     *
     * @param template 新版本，不能为空
     */
    void insertAndActivate(@NotNull WorkflowTemplate template);
}
