package com.draftflow.adapter.web;

import com.draftflow.app.service.WorkflowAppService;
import com.draftflow.client.dto.MultiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 移交/接收参与人接口
 *
 * @author draftflow
 */
@RestController
@RequestMapping("/api/v1/actors")
@RequiredArgsConstructor
public class ActorController {

    private final WorkflowAppService appService;

    @GetMapping
    public MultiResponse<String> list() {
        return MultiResponse.of(appService.listActors());
    }
}
