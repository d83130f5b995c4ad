package com.draftflow.domain.review;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * StageFile - 评审文件及其当前所在阶段
 * <p>
 * 同一评审内以 fileName 唯一标识；重定位成功后 path 指向新阶段目录中的副本，
 * 失败时保持原 path 和 stageIndex。
 * </p>
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageFile {

    private String fileName;

    private String path;

    private int stageIndex;
}
