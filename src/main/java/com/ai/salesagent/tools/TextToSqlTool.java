package com.ai.salesagent.tools;

import com.ai.salesagent.exception.LlmUnavailableException;
import com.ai.salesagent.service.LlmService;
import com.ai.salesagent.service.PromptTemplates;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Answers free-form questions about the property catalogue by having the LLM write a
 * single read-only query against the projects table.
 */
@Component
public class TextToSqlTool {

    private static final Logger log = LoggerFactory.getLogger(TextToSqlTool.class);

    static final String PROJECTS_SCHEMA =
            "CREATE TABLE projects (\n"
            + "  id UUID PRIMARY KEY,\n"
            + "  project_name VARCHAR(500) NOT NULL,\n"
            + "  bedrooms INTEGER,\n"
            + "  bathrooms INTEGER,\n"
            + "  completion_status VARCHAR(50),   -- e.g. 'available', 'off plan'\n"
            + "  unit_type VARCHAR(100),\n"
            + "  developer_name VARCHAR(255),\n"
            + "  price_usd DOUBLE PRECISION,\n"
            + "  area_sqm DOUBLE PRECISION,\n"
            + "  property_type VARCHAR(50),       -- 'apartment' or 'villa'\n"
            + "  city VARCHAR(100),\n"
            + "  country VARCHAR(10),             -- ISO country code\n"
            + "  completion_date VARCHAR(50),\n"
            + "  features TEXT,                   -- JSON array of strings\n"
            + "  facilities TEXT,                 -- JSON array of strings\n"
            + "  description TEXT\n"
            + ");";

    private static final Pattern READ_ONLY_START = Pattern.compile("^(select|with)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern FORBIDDEN = Pattern.compile(
            "\\b(insert|update|delete|merge|drop|alter|create|truncate|grant|revoke|copy|call|execute|do|vacuum|set|lock)\\b",
            Pattern.CASE_INSENSITIVE
    );

    /** String literals and quoted identifiers, with doubled quotes as escapes. */
    private static final Pattern QUOTED = Pattern.compile("'(?:[^']|'')*'|\"(?:[^\"]|\"\")*\"");

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");

    private final LlmService llmService;
    private final PromptTemplates prompts;
    private final NamedParameterJdbcTemplate jdbc;
    private final int maxRows;

    public TextToSqlTool(LlmService llmService, PromptTemplates prompts, NamedParameterJdbcTemplate jdbc,
                         @Value("${agent.text-to-sql.max-rows:20}") int maxRows) {
        this.llmService = llmService;
        this.prompts = prompts;
        this.jdbc = jdbc;
        this.maxRows = maxRows;
    }

    public boolean isAvailable() {
        return llmService.isConfigured();
    }

    public SqlQueryResult query(String question) {
        log.info("SQL tool processing question: {}", question);
        if (!isAvailable()) {
            return SqlQueryResult.failed(null, "Text-to-SQL not available");
        }

        String sql;
        try {
            sql = cleanSql(llmService.complete(prompts.textToSql(PROJECTS_SCHEMA, question, maxRows), 0.0));
        } catch (LlmUnavailableException ex) {
            log.warn("SQL generation failed: {}", ex.getMessage());
            return SqlQueryResult.failed(null, ex.getMessage());
        }

        String rejection = validate(sql);
        if (rejection != null) {
            log.warn("Rejected generated SQL ({}): {}", rejection, sql);
            return SqlQueryResult.failed(sql, rejection);
        }

        String bounded = "SELECT * FROM (" + sql + ") AS q LIMIT :maxRows";
        try {
            List<Map<String, Object>> rows = jdbc.queryForList(bounded, new MapSqlParameterSource("maxRows", maxRows));
            List<Map<String, Object>> results = rows.stream()
                    .map(PropertySearchTool::normalize)
                    .collect(Collectors.toList());
            log.info("Generated SQL returned {} rows", results.size());
            return new SqlQueryResult(sql, results, null);
        } catch (DataAccessException ex) {
            log.error("Generated SQL failed: {}", sql, ex);
            return SqlQueryResult.failed(sql, "Query failed: " + ex.getMostSpecificCause().getMessage());
        }
    }

    static String cleanSql(String raw) {
        String sql = StringUtils.trimToEmpty(raw);
        sql = CODE_FENCE.matcher(sql).replaceAll("").trim();
        if (StringUtils.startsWithIgnoreCase(sql, "sql\n")) sql = sql.substring(4).trim();
        while (sql.endsWith(";")) sql = sql.substring(0, sql.length() - 1).trim();
        return sql;
    }

    /**
     * @return null when the statement is a single read-only query, otherwise the reason
     */
    static String validate(String sql) {
        if (StringUtils.isBlank(sql)) return "empty statement";
        if (!READ_ONLY_START.matcher(sql).find()) return "not a SELECT statement";
        String code = QUOTED.matcher(sql).replaceAll("''");
        if (code.contains(";")) return "multiple statements";
        if (FORBIDDEN.matcher(code).find()) return "statement is not read-only";
        return null;
    }
}
