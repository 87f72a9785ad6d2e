package org.learningjava.scalarstore.infrastructure.adapter.in.web.dto;

import org.learningjava.scalarstore.domain.model.LastLogged;

import java.time.Instant;

public record LastLoggedResponse(String experimentId, Instant lastModified) {
    public static LastLoggedResponse from(LastLogged l) {
        return new LastLoggedResponse(l.experimentId(), l.lastModified());
    }
}
