package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

public record CreateProjectRequest(@NotBlank String projectId) { }
