package com.ai.salesagent.ingest;

import com.ai.salesagent.entity.Project;
import com.ai.salesagent.repository.ProjectRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Loads projects from the listings CSV. Rows are upserted by project name; rows without
 * a name are skipped and unparseable numbers are left empty.
 */
@Component
public class ProjectCsvImporter {

    private static final Logger log = LoggerFactory.getLogger(ProjectCsvImporter.class);

    static final String COL_NAME = "Project Name";
    static final String COL_BEDROOMS = "Bedrooms";
    static final String COL_BATHROOMS = "Bathrooms";
    static final String COL_COMPLETION_STATUS = "Completion Status";
    static final String COL_UNIT_TYPE = "Unit Type";
    static final String COL_DEVELOPER = "Developer Name";
    static final String COL_PRICE = "Price";
    static final String COL_AREA = "Area (sqm)";
    static final String COL_PROPERTY_TYPE = "Property Type";
    static final String COL_CITY = "City";
    static final String COL_COUNTRY = "Country";
    static final String COL_COMPLETION_DATE = "Completion Date";
    static final String COL_FEATURES = "Features";
    static final String COL_FACILITIES = "Facilities";
    static final String COL_DESCRIPTION = "Description";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ProjectRepository projectRepository;

    public ProjectCsvImporter(ProjectRepository projectRepository) {
        this.projectRepository = projectRepository;
    }

    @Transactional
    public ImportResult importFile(Path csvPath, boolean clearExisting) throws IOException {
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            return importCsv(reader, clearExisting);
        }
    }

    @Transactional
    public ImportResult importCsv(Reader reader, boolean clearExisting) throws IOException {
        if (clearExisting) {
            long count = projectRepository.count();
            projectRepository.deleteAllInBatch();
            log.info("Cleared {} existing projects", count);
        }

        int created = 0;
        int updated = 0;
        int skipped = 0;
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                String name = value(record, COL_NAME);
                if (name == null) {
                    skipped++;
                    continue;
                }
                Project project = projectRepository.findByProjectName(name).orElse(null);
                boolean isNew = project == null;
                if (isNew) {
                    project = Project.builder().projectName(name).build();
                }
                apply(record, project);
                projectRepository.save(project);
                if (isNew) created++; else updated++;
            }
        }

        ImportResult result = new ImportResult(created, updated, skipped);
        log.info("Project import complete: {} created, {} updated, {} skipped", created, updated, skipped);
        return result;
    }

    private static void apply(CSVRecord record, Project project) {
        project.setBedrooms(parseInteger(value(record, COL_BEDROOMS)));
        project.setBathrooms(parseInteger(value(record, COL_BATHROOMS)));
        project.setCompletionStatus(value(record, COL_COMPLETION_STATUS));
        project.setUnitType(value(record, COL_UNIT_TYPE));
        project.setDeveloperName(value(record, COL_DEVELOPER));
        project.setPriceUsd(parsePrice(value(record, COL_PRICE)));
        project.setAreaSqm(parseDouble(value(record, COL_AREA)));
        String type = value(record, COL_PROPERTY_TYPE);
        project.setPropertyType(type != null ? type.toLowerCase(Locale.ROOT) : null);
        project.setCity(value(record, COL_CITY));
        project.setCountry(value(record, COL_COUNTRY));
        project.setCompletionDate(value(record, COL_COMPLETION_DATE));
        project.setFeatures(parseList(value(record, COL_FEATURES)));
        project.setFacilities(parseList(value(record, COL_FACILITIES)));
        project.setDescription(value(record, COL_DESCRIPTION));
    }

    private static String value(CSVRecord record, String column) {
        if (!record.isSet(column)) return null;
        return StringUtils.trimToNull(record.get(column));
    }

    static Double parsePrice(String raw) {
        if (raw == null) return null;
        return parseDouble(raw.replace(",", "").replace("$", "").trim());
    }

    static Double parseDouble(String raw) {
        if (StringUtils.isBlank(raw)) return null;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Integer parseInteger(String raw) {
        if (StringUtils.isBlank(raw)) return null;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** A JSON array, or a comma separated list when the cell is not JSON. */
    static List<String> parseList(String raw) {
        if (StringUtils.isBlank(raw)) return new ArrayList<>();
        if (raw.trim().startsWith("[")) {
            try {
                return new ArrayList<>(MAPPER.readValue(raw, new TypeReference<List<String>>() {}));
            } catch (JsonProcessingException e) {
                log.debug("Not a JSON list, splitting on commas: {}", raw);
            }
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(s -> StringUtils.strip(s, "[]\"'"))
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.toList());
    }

    public static final class ImportResult {
        private final int created;
        private final int updated;
        private final int skipped;

        public ImportResult(int created, int updated, int skipped) {
            this.created = created;
            this.updated = updated;
            this.skipped = skipped;
        }

        public int getCreated() {
            return created;
        }

        public int getUpdated() {
            return updated;
        }

        public int getSkipped() {
            return skipped;
        }
    }
}
