package org.learningjava.scalarstore.domain.service.mapping;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Draws internal column identifiers from a random 128-bit namespace.
 */
@Component
public class ColumnIdGenerator {

    static final String PREFIX = "s_";

    private final Supplier<UUID> uuids;

    public ColumnIdGenerator() {
        this(UUID::randomUUID);
    }

    public ColumnIdGenerator(Supplier<UUID> uuids) {
        this.uuids = uuids;
    }

    public String next() {
        return PREFIX + uuids.get().toString().replace("-", "");
    }
}
