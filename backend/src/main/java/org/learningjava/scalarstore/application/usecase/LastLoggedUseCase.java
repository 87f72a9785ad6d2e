package org.learningjava.scalarstore.application.usecase;

import org.learningjava.scalarstore.application.port.LastLoggedStorePort;
import org.learningjava.scalarstore.config.ScalarsProperties;
import org.learningjava.scalarstore.domain.model.LastLogged;
import org.learningjava.scalarstore.domain.service.schema.TableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Per-experiment "last written at" hints. Only an optimization for pollers: nothing else reads it,
 * and a failed update never fails the write that triggered it.
 */
@Service
public class LastLoggedUseCase {
    private static final Logger log = LoggerFactory.getLogger(LastLoggedUseCase.class);

    private final LastLoggedStorePort store;
    private final TableManager tableManager;
    private final Clock clock;
    private final boolean enabled;

    public LastLoggedUseCase(LastLoggedStorePort store,
                             TableManager tableManager,
                             Clock clock,
                             ScalarsProperties props) {
        this.store = store;
        this.tableManager = tableManager;
        this.clock = clock;
        this.enabled = props.getLastLogged().isEnabled();
    }

    /**
     * Best-effort update after a successful write.
     *
     * @return whether the hint was recorded
     */
    public boolean touch(String projectId, String experimentId) {
        if (!enabled) {
            return false;
        }
        try {
            store.touch(tableManager.lastLoggedTableName(projectId), experimentId, clock.instant());
            return true;
        } catch (RuntimeException e) {
            log.warn("Could not update last-logged for {}/{}", projectId, experimentId, e);
            return false;
        }
    }

    /** Latest write time per experiment; empty when nothing was recorded for the project. */
    public List<LastLogged> lastLogged(String projectId, List<String> experimentIds) {
        String table = tableManager.lastLoggedTableName(projectId);
        if (!store.tableExists(table)) {
            return List.of();
        }
        List<String> ids = (experimentIds == null || experimentIds.isEmpty()) ? null : experimentIds;
        return store.find(table, ids);
    }

    public void drop(String projectId) {
        store.dropTable(tableManager.lastLoggedTableName(projectId));
    }
}
