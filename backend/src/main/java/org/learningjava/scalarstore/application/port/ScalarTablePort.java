package org.learningjava.scalarstore.application.port;

import org.learningjava.scalarstore.domain.model.RowFilter;
import org.learningjava.scalarstore.domain.model.ScalarRow;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Wide per-project scalar tables in the columnar backend. Table and column names handed to
 * this port are already validated identifiers.
 */
public interface ScalarTablePort {

    boolean tableExists(String table);

    /** All column names of the table, base columns included. */
    Set<String> describeColumns(String table);

    // Schema (idempotent)
    void createTable(String table, Collection<String> scalarColumns);

    void addColumns(String table, Collection<String> scalarColumns);

    void dropTable(String table);

    // Rows
    void insertRows(String table, List<String> scalarColumns, List<ScalarRow> rows);

    /** Rows ordered by experiment then step; values hold only the non-null scalar columns. */
    List<ScalarRow> selectRows(String table, List<String> scalarColumns, RowFilter filter);

    List<String> distinctExperimentIds(String table);
}
