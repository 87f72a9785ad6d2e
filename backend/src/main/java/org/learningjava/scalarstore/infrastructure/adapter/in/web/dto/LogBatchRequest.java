package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record LogBatchRequest(@NotNull List<@Valid @NotNull LogScalarRequest> scalars) { }
