package org.learningjava.scalarstore.config;

import org.learningjava.scalarstore.application.port.MappingStorePort;
import org.learningjava.scalarstore.domain.error.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the shared mapping table at startup. A backend that is not up yet only delays this:
 * the mapping store creates the table on first use as well.
 */
@Component
public class StartupTasks implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final MappingStorePort mappingStore;
    private final boolean initOnStartup;

    public StartupTasks(MappingStorePort mappingStore, ScalarsProperties props) {
        this.mappingStore = mappingStore;
        this.initOnStartup = props.getSchema().isInitOnStartup();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!initOnStartup) {
            log.info("Schema init disabled (scalars.schema.init-on-startup=false)");
            return;
        }
        try {
            mappingStore.ensureSchema();
        } catch (BackendUnavailableException e) {
            log.warn("ClickHouse not reachable at startup, mapping table will be created on first use", e);
        }
    }
}
