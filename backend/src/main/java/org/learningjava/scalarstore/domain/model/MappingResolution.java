package org.learningjava.scalarstore.domain.model;

import java.util.Map;

/**
 * Outcome of resolving a batch of scalar names.
 *
 * @param columns  requested name to column, for the requested names only
 * @param mapping  the project's full mapping after resolution
 * @param changed  whether new entries were allocated (the mapping must then be saved)
 */
public record MappingResolution(
        Map<String, String> columns,
        NameMapping mapping,
        boolean changed
) { }
