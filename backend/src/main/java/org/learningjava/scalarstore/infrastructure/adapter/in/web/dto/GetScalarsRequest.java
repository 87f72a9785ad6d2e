package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

import java.util.List;

/** Body of the POST variant of the query endpoint; timestamps are ISO-8601 strings. */
public record GetScalarsRequest(
        List<String> experimentIds,
        Integer maxPoints,
        Boolean returnTags,
        String startTime,
        String endTime
) { }
