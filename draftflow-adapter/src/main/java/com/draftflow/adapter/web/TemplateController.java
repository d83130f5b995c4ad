package com.draftflow.adapter.web;

import com.draftflow.app.service.WorkflowAppService;
import com.draftflow.client.dto.MultiResponse;
import com.draftflow.client.dto.SingleResponse;
import com.draftflow.domain.template.WorkflowTemplate;
import com.draftflow.domain.template.command.PublishTemplateCommand;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 工作流模板接口
 * <p>
 * 模板只能发布新版本，没有修改和删除接口。
 * </p>
 *
 * @author draftflow
 */
@RestController
@RequestMapping("/api/v1/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final WorkflowAppService appService;

    @PostMapping
    public SingleResponse<WorkflowTemplate> publish(@Valid @RequestBody PublishTemplateCommand command) {
        return SingleResponse.of(appService.publishTemplate(command));
    }

    /**
     * 请求体为 YAML 文本
     */
    @PostMapping("/import")
    public SingleResponse<WorkflowTemplate> importYaml(@RequestBody String yamlContent) {
        return SingleResponse.of(appService.importTemplate(yamlContent));
    }

    @GetMapping("/{name}/active")
    public SingleResponse<WorkflowTemplate> getActive(@PathVariable("name") String name) {
        return SingleResponse.of(appService.getActiveTemplate(name));
    }

    @GetMapping("/{name}/versions")
    public MultiResponse<WorkflowTemplate> listVersions(@PathVariable("name") String name) {
        return MultiResponse.of(appService.listTemplateVersions(name));
    }

    @GetMapping("/{name}/versions/{version}")
    public SingleResponse<WorkflowTemplate> getVersion(@PathVariable("name") String name,
                                                       @PathVariable("version") int version) {
        return SingleResponse.of(appService.getTemplateVersion(name, version));
    }
}
