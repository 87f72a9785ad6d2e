package org.learningjava.scalarstore.domain.model;

import java.time.Instant;

public record LastLogged(String experimentId, Instant lastModified) { }
