package com.draftflow.app.config;

import com.draftflow.domain.gateway.FileRelocator;
import com.draftflow.domain.gateway.PersonDirectoryGateway;
import com.draftflow.domain.gateway.ProjectRecordGateway;
import com.draftflow.domain.instance.repository.ProjectWorkflowRepository;
import com.draftflow.domain.instance.service.ProjectWorkflowService;
import com.draftflow.domain.person.PersonDirectoryService;
import com.draftflow.domain.review.ReviewFolderLayout;
import com.draftflow.domain.review.repository.ReviewPipelineRepository;
import com.draftflow.domain.review.service.ReviewPipelineService;
import com.draftflow.domain.schedule.ScheduleCalculator;
import com.draftflow.domain.template.repository.WorkflowTemplateRepository;
import com.draftflow.domain.template.service.WorkflowTemplateService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * DomainServiceConfig - 领域服务装配
 * <p>
 * 领域层不依赖 Spring，领域服务在这里统一创建并注入仓储和网关实现。
 * </p>
 *
 * @author draftflow
 */
@Configuration
@EnableConfigurationProperties(DraftflowProperties.class)
public class DomainServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ScheduleCalculator scheduleCalculator() {
        return new ScheduleCalculator();
    }

    @Bean
    public WorkflowTemplateService workflowTemplateService(WorkflowTemplateRepository templateRepository,
                                                          Clock clock) {
        return new WorkflowTemplateService(templateRepository, clock);
    }

    @Bean
    public ProjectWorkflowService projectWorkflowService(WorkflowTemplateRepository templateRepository,
                                                        ProjectWorkflowRepository instanceRepository,
                                                        ScheduleCalculator scheduleCalculator,
                                                        Clock clock,
                                                        DraftflowProperties properties) {
        return new ProjectWorkflowService(templateRepository, instanceRepository, scheduleCalculator, clock,
            properties.getWorkflow().getTemplateName());
    }

    @Bean
    public ReviewPipelineService reviewPipelineService(ReviewPipelineRepository reviewRepository,
                                                      FileRelocator fileRelocator,
                                                      ProjectRecordGateway projectRecordGateway,
                                                      Clock clock,
                                                      DraftflowProperties properties) {
        ReviewFolderLayout layout = new ReviewFolderLayout(
            properties.getReview().getDraftingFolder(), properties.getReview().getPackageFolder());
        return new ReviewPipelineService(reviewRepository, fileRelocator, projectRecordGateway, layout, clock);
    }

    @Bean
    public PersonDirectoryService personDirectoryService(PersonDirectoryGateway personDirectoryGateway,
                                                        DraftflowProperties properties) {
        return new PersonDirectoryService(personDirectoryGateway, properties.getWorkflow().getProductionActor());
    }
}
