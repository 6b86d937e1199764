package io.github.drompincen.noject.gateway.controller;

import io.github.drompincen.noject.gateway.mapping.OutlineMapper;
import io.github.drompincen.noject.persistence.document.ProjectDocument;
import io.github.drompincen.noject.protocol.api.CreateProjectRequest;
import io.github.drompincen.noject.protocol.api.ProjectDto;
import io.github.drompincen.noject.protocol.api.RenameProjectRequest;
import io.github.drompincen.noject.runtime.project.ProjectService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PostMapping
    public ResponseEntity<ProjectDto> create(@RequestBody CreateProjectRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        ProjectDocument doc = projectService.create(req.name(), req.createdBy());
        return ResponseEntity.ok(OutlineMapper.toDto(doc));
    }

    @GetMapping
    public List<ProjectDto> list(@RequestParam(required = false) String createdBy) {
        return projectService.list(createdBy).stream()
                .map(OutlineMapper::toDto).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProjectDto> get(@PathVariable String id) {
        return projectService.find(id)
                .map(d -> ResponseEntity.ok(OutlineMapper.toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public ResponseEntity<ProjectDto> rename(@PathVariable String id, @RequestBody RenameProjectRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return projectService.rename(id, req.name())
                .map(d -> ResponseEntity.ok(OutlineMapper.toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (projectService.delete(id)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }
}
