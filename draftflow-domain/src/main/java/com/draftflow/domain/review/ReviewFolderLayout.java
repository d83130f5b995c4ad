package com.draftflow.domain.review;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ReviewFolderLayout - 评审阶段目录布局
 * <p>
 * 阶段目录为 {@code <项目目录>/<draftingFolder>/<packageFolder>/<index>-<stageName>}
 * </p>
 *
 * @author draftflow
 */
public class ReviewFolderLayout {

    private final String draftingFolder;
    private final String packageFolder;

    public ReviewFolderLayout(String draftingFolder, String packageFolder) {
        this.draftingFolder = draftingFolder;
        this.packageFolder = packageFolder;
    }

    public Path packageRoot(Path jobDirectory) {
        return jobDirectory.resolve(draftingFolder).resolve(packageFolder);
    }

    public Path stageDirectory(Path jobDirectory, ReviewStage stage) {
        return packageRoot(jobDirectory).resolve(stage.folderName());
    }

    public List<Path> allStageDirectories(Path jobDirectory) {
        return Arrays.stream(ReviewStage.values())
            .map(stage -> stageDirectory(jobDirectory, stage))
            .collect(Collectors.toList());
    }
}
