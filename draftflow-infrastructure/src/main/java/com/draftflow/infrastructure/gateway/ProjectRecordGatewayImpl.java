package com.draftflow.infrastructure.gateway;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.draftflow.domain.gateway.ProjectRecordGateway;
import com.draftflow.infrastructure.persistence.project.entity.ProjectRecordDO;
import com.draftflow.infrastructure.persistence.project.mapper.ProjectRecordMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Optional;

/**
 * ProjectRecordGatewayImpl - 从 projects 表读取项目到期日和项目目录
 *
 * @author draftflow
 */
@Slf4j
@Component
public class ProjectRecordGatewayImpl implements ProjectRecordGateway {

    private final ProjectRecordMapper projectRecordMapper;

    public ProjectRecordGatewayImpl(ProjectRecordMapper projectRecordMapper) {
        this.projectRecordMapper = projectRecordMapper;
    }

    @Override
    public Optional<LocalDate> findDueDate(String projectId) {
        return findProject(projectId).map(ProjectRecordDO::getDueDate);
    }

    @Override
    public Optional<Path> findJobDirectory(String jobNumber) {
        Optional<String> directory = findProject(jobNumber)
            .map(ProjectRecordDO::getJobDirectory)
            .filter(d -> !d.isBlank());
        if (directory.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Paths.get(directory.get()));
        } catch (InvalidPathException e) {
            log.warn("Job {} has an invalid job directory '{}': {}", jobNumber, directory.get(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ProjectRecordDO> findProject(String jobNumber) {
        return Optional.ofNullable(projectRecordMapper.selectOne(
            new LambdaQueryWrapper<ProjectRecordDO>()
                .eq(ProjectRecordDO::getJobNumber, jobNumber)
        ));
    }
}
