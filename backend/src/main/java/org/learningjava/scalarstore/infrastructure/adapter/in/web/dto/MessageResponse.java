package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

public record MessageResponse(String message) { }
