package com.draftflow.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * DraftflowProperties - draftflow.* 配置项
 *
 * @author draftflow
 */
@Data
@ConfigurationProperties(prefix = "draftflow")
public class DraftflowProperties {

    private Workflow workflow = new Workflow();

    private Review review = new Review();

    @Data
    public static class Workflow {

        /**
         * 新项目使用的模板名称
         */
        private String templateName = "Standard";

        /**
         * 参与人列表中固定追加的生产角色
         */
        private String productionActor = "Production";
    }

    @Data
    public static class Review {

        /**
         * 项目目录下的制图目录
         */
        private String draftingFolder = "4. Drafting";

        /**
         * 制图目录下的打印包根目录，八个阶段目录都建在这里
         */
        private String packageFolder = "PP-Print Packages";
    }
}
