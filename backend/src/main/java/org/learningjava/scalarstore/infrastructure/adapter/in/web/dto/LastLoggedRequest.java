package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

import java.util.List;

public record LastLoggedRequest(List<String> experimentIds) { }
