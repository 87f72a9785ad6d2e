package org.learningjava.scalarstore.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import org.learningjava.scalarstore.application.usecase.ProjectTablesUseCase;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.CreateProjectRequest;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.ExperimentIdResponse;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.MessageResponse;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.ProjectTableResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/projects")
public class ProjectsController {

    private final ProjectTablesUseCase projects;

    public ProjectsController(ProjectTablesUseCase projects) {
        this.projects = projects;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectTableResponse create(@Valid @RequestBody CreateProjectRequest req) {
        return new ProjectTableResponse(projects.createTable(req.projectId()), req.projectId(), null);
    }

    @GetMapping("/exists/{projectId}")
    public ProjectTableResponse exists(@PathVariable String projectId) {
        return new ProjectTableResponse(projects.tableName(projectId), projectId, projects.exists(projectId));
    }

    @DeleteMapping("/{projectId}")
    public MessageResponse delete(@PathVariable String projectId) {
        String table = projects.dropTable(projectId);
        return new MessageResponse("Table " + table + " deleted successfully.");
    }

    @GetMapping("/{projectId}/experiments")
    public List<ExperimentIdResponse> experiments(@PathVariable String projectId) {
        return projects.experimentIds(projectId).stream().map(ExperimentIdResponse::new).toList();
    }
}
