package org.learningjava.scalarstore.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one project's scalar name to column translation table.
 * <p>
 * {@link #with(String, String)} only adds names and never repoints an existing one.
 * {@link #merge(NameMapping)} keeps every name of both sides; where both know a name, the argument
 * (the persisted snapshot) wins and may repoint it.
 */
public final class NameMapping {

    private static final NameMapping EMPTY = new NameMapping(Map.of());

    private final Map<String, String> columnsByName;
    private final Map<String, String> namesByColumn;

    public NameMapping(Map<String, String> columnsByName) {
        Map<String, String> copy = new LinkedHashMap<>(columnsByName);
        Map<String, String> reverse = new HashMap<>();
        copy.forEach((name, column) -> reverse.put(column, name));
        this.columnsByName = Collections.unmodifiableMap(copy);
        this.namesByColumn = Collections.unmodifiableMap(reverse);
    }

    public static NameMapping empty() {
        return EMPTY;
    }

    public Optional<String> columnFor(String name) {
        return Optional.ofNullable(columnsByName.get(name));
    }

    public Optional<String> nameFor(String column) {
        return Optional.ofNullable(namesByColumn.get(column));
    }

    public boolean containsName(String name) {
        return columnsByName.containsKey(name);
    }

    public boolean containsColumn(String column) {
        return namesByColumn.containsKey(column);
    }

    public Set<String> columns() {
        return namesByColumn.keySet();
    }

    public Map<String, String> asMap() {
        return columnsByName;
    }

    public int size() {
        return columnsByName.size();
    }

    public boolean isEmpty() {
        return columnsByName.isEmpty();
    }

    public NameMapping with(String name, String column) {
        if (columnsByName.containsKey(name)) {
            return this;
        }
        Map<String, String> next = new LinkedHashMap<>(columnsByName);
        next.put(name, column);
        return new NameMapping(next);
    }

    /**
     * Union of both snapshots. Where both know a name, {@code other} wins, since it is the
     * persisted (authoritative) side in every caller.
     */
    public NameMapping merge(NameMapping other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, String> next = new LinkedHashMap<>(columnsByName);
        next.putAll(other.columnsByName);
        return new NameMapping(next);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NameMapping that)) return false;
        return columnsByName.equals(that.columnsByName);
    }

    @Override
    public int hashCode() {
        return columnsByName.hashCode();
    }

    @Override
    public String toString() {
        return "NameMapping" + columnsByName;
    }
}
