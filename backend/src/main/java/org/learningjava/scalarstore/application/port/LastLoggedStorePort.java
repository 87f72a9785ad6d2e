package org.learningjava.scalarstore.application.port;

import org.learningjava.scalarstore.domain.model.LastLogged;

import java.time.Instant;
import java.util.List;

public interface LastLoggedStorePort {

    /** Records the latest write time of an experiment, creating the table if needed. */
    void touch(String table, String experimentId, Instant at);

    /** Latest write time per experiment; null {@code experimentIds} means every experiment. */
    List<LastLogged> find(String table, List<String> experimentIds);

    boolean tableExists(String table);

    void dropTable(String table);
}
