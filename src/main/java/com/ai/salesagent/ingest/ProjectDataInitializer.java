package com.ai.salesagent.ingest;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Imports the configured listings CSV once the application is up. Re-running is safe:
 * existing projects are updated in place.
 */
@Component
public class ProjectDataInitializer {

    private static final Logger log = LoggerFactory.getLogger(ProjectDataInitializer.class);

    private final ProjectCsvImporter importer;

    @Value("${agent.data.csv-path:}")
    private String csvPath;

    @Value("${agent.data.clear-on-import:false}")
    private boolean clearOnImport;

    public ProjectDataInitializer(ProjectCsvImporter importer) {
        this.importer = importer;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void load() {
        if (StringUtils.isBlank(csvPath)) {
            log.info("No project CSV configured, skipping import");
            return;
        }
        Path path = Paths.get(csvPath.trim());
        if (!Files.isReadable(path)) {
            log.warn("Project CSV not found: {}", path);
            return;
        }
        try {
            importer.importFile(path, clearOnImport);
        } catch (IOException e) {
            log.error("Project CSV import failed: {}", path, e);
        }
    }
}
