package com.draftflow.domain.review.repository;

import com.draftflow.domain.review.PendingReview;
import com.draftflow.domain.review.ReviewPipelineInstance;
import com.draftflow.domain.review.StageFile;
import com.draftflow.domain.review.StageState;
import com.draftflow.domain.review.StageStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * ReviewPipelineRepository - 打印包评审仓储接口
 *
 * @author draftflow
 */
public interface ReviewPipelineRepository {

    /**
     * 查询评审（含阶段和文件）
     */
    Optional<ReviewPipelineInstance> findByJobNumber(@NotBlank(message = "项目编号不能为空") String jobNumber);

    boolean exists(@NotBlank(message = "项目编号不能为空") String jobNumber);

    /**
     * 插入新评审及其全部阶段
     */
    void insert(@NotNull(message = "评审不能为空") ReviewPipelineInstance instance);

    /**
     * 条件更新阶段状态
     * <p>
     * 仅当存储中的状态仍为 expected 时才写入 state，用于检测并发推进。
     * </p>
     *
     * @return 是否更新成功
     */
    boolean transitionStage(@NotBlank(message = "项目编号不能为空") String jobNumber,
                            @NotNull(message = "阶段状态不能为空") StageState state,
                            @NotNull(message = "期望状态不能为空") StageStatus expected);

    /**
     * 更新评审整体状态、当前阶段和完成时间
     */
    void updateReviewHeader(@NotNull(message = "评审不能为空") ReviewPipelineInstance instance);

    /**
     * 按 fileName 插入或更新文件
     */
    void saveFile(@NotBlank(message = "项目编号不能为空") String jobNumber,
                  @NotNull(message = "文件不能为空") StageFile file);

    /**
     * 查询进行中的阶段，按开始时间升序
     *
     * @param department 部门，为 null 时不过滤
     */
    List<PendingReview> findPendingStages(String department);
}
