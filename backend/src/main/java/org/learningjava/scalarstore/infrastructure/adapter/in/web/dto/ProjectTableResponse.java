package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** {@code exists} is only set by the existence check. */
public record ProjectTableResponse(
        String tableName,
        String projectId,
        @JsonInclude(JsonInclude.Include.NON_NULL) Boolean exists
) { }
