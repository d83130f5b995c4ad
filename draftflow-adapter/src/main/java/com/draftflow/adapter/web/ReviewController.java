package com.draftflow.adapter.web;

import com.draftflow.adapter.web.request.AdvanceStageRequest;
import com.draftflow.adapter.web.request.AttachFileRequest;
import com.draftflow.adapter.web.request.CreateReviewRequest;
import com.draftflow.adapter.web.request.RetryRelocationRequest;
import com.draftflow.app.service.WorkflowAppService;
import com.draftflow.client.dto.MultiResponse;
import com.draftflow.client.dto.SingleResponse;
import com.draftflow.domain.review.AdvanceResult;
import com.draftflow.domain.review.PendingReview;
import com.draftflow.domain.review.RelocationReport;
import com.draftflow.domain.review.ReviewSummary;
import com.draftflow.domain.review.StageFile;
import com.draftflow.domain.review.command.AdvanceStageCommand;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;

/**
 * 打印包评审接口
 *
 * @author draftflow
 */
@RestController
@RequestMapping("/api/v1/reviews")
@RequiredArgsConstructor
public class ReviewController {

    private final WorkflowAppService appService;

    @GetMapping("/pending")
    public MultiResponse<PendingReview> pending(@RequestParam(value = "department", required = false) String department) {
        return MultiResponse.of(appService.listPendingReviews(department));
    }

    @PostMapping("/{jobNumber}")
    public SingleResponse<ReviewSummary> create(@PathVariable("jobNumber") String jobNumber,
                                                @Valid @RequestBody CreateReviewRequest request) {
        appService.createReview(jobNumber, request.getCreatedBy());
        return SingleResponse.of(appService.getReviewSummary(jobNumber));
    }

    @GetMapping("/{jobNumber}")
    public SingleResponse<ReviewSummary> summary(@PathVariable("jobNumber") String jobNumber) {
        return SingleResponse.of(appService.getReviewSummary(jobNumber));
    }

    @PostMapping("/{jobNumber}/files")
    public SingleResponse<StageFile> attachFile(@PathVariable("jobNumber") String jobNumber,
                                                @Valid @RequestBody AttachFileRequest request) {
        return SingleResponse.of(appService.attachReviewFile(jobNumber, request.getPath()));
    }

    @PostMapping("/{jobNumber}/files/retry")
    public SingleResponse<RelocationReport> retry(@PathVariable("jobNumber") String jobNumber,
                                                  @RequestBody(required = false) RetryRelocationRequest request) {
        return SingleResponse.of(appService.retryRelocation(jobNumber,
            request == null ? Collections.emptyList() : request.getFiles()));
    }

    @PostMapping("/{jobNumber}/stages/{stage}/advance")
    public SingleResponse<AdvanceResult> advance(@PathVariable("jobNumber") String jobNumber,
                                                 @PathVariable("stage") int stage,
                                                 @Valid @RequestBody AdvanceStageRequest request) {
        AdvanceStageCommand command = AdvanceStageCommand.builder()
            .jobNumber(jobNumber)
            .stageIndex(stage)
            .reviewerName(request.getReviewerName())
            .department(request.getDepartment())
            .notes(request.getNotes())
            .build();
        return SingleResponse.of(appService.onReviewAdvance(command));
    }

    @GetMapping("/{jobNumber}/stages/{stage}/files")
    public MultiResponse<StageFile> stageFiles(@PathVariable("jobNumber") String jobNumber,
                                               @PathVariable("stage") int stage) {
        return MultiResponse.of(appService.getFilesForStage(jobNumber, stage));
    }
}
