package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

public record ExperimentIdResponse(String experimentId) { }
