package org.learningjava.scalarstore.domain.service.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Columns present in every project scalar table, in table order.
 */
public enum BaseColumn {
    TIMESTAMP("timestamp", "DateTime64(3, 'UTC')"),
    EXPERIMENT_ID("experiment_id", "String"),
    STEP("step", "Int64"),
    TAGS("tags", "Array(String)");

    /** Storage type of every dynamic scalar column. */
    public static final String SCALAR_COLUMN_TYPE = "Nullable(Float64)";

    private static final List<String> NAMES = Arrays.stream(values()).map(BaseColumn::columnName).toList();
    private static final Set<String> NAME_SET = Arrays.stream(values()).map(BaseColumn::columnName)
            .collect(Collectors.toUnmodifiableSet());

    private final String columnName;
    private final String dbType;

    BaseColumn(String columnName, String dbType) {
        this.columnName = columnName;
        this.dbType = dbType;
    }

    public String columnName() {
        return columnName;
    }

    public String dbType() {
        return dbType;
    }

    public static List<String> names() {
        return NAMES;
    }

    public static boolean isBase(String column) {
        return NAME_SET.contains(column);
    }
}
