package com.draftflow.domain.gateway;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class StubProjectRecordGateway implements ProjectRecordGateway {

    private final Map<String, LocalDate> dueDates = new HashMap<>();

    private final Map<String, Path> jobDirectories = new HashMap<>();

    public StubProjectRecordGateway withDueDate(String projectId, LocalDate dueDate) {
        dueDates.put(projectId, dueDate);
        return this;
    }

    public StubProjectRecordGateway withJobDirectory(String jobNumber, Path directory) {
        jobDirectories.put(jobNumber, directory);
        return this;
    }

    @Override
    public Optional<LocalDate> findDueDate(String projectId) {
        return Optional.ofNullable(dueDates.get(projectId));
    }

    @Override
    public Optional<Path> findJobDirectory(String jobNumber) {
        return Optional.ofNullable(jobDirectories.get(jobNumber));
    }
}
