package com.ai.salesagent.tools;

import com.ai.salesagent.exception.LlmUnavailableException;
import com.ai.salesagent.service.LlmService;
import com.ai.salesagent.service.PromptTemplates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TextToSqlToolTest {

    @Mock
    private LlmService llmService;

    @Mock
    private NamedParameterJdbcTemplate jdbc;

    private TextToSqlTool tool;

    @BeforeEach
    void setUp() {
        tool = new TextToSqlTool(llmService, new PromptTemplates("Silvy", "Silver Land"), jdbc, 20);
    }

    @Test
    void cleansCodeFencesAndTrailingSemicolons() {
        assertThat(TextToSqlTool.cleanSql("```sql\nSELECT * FROM projects;\n```")).isEqualTo("SELECT * FROM projects");
        assertThat(TextToSqlTool.cleanSql("  select 1 ;; ")).isEqualTo("select 1");
        assertThat(TextToSqlTool.cleanSql(null)).isEmpty();
    }

    @Test
    void acceptsOnlySingleReadOnlyQueries() {
        assertThat(TextToSqlTool.validate("SELECT project_name FROM projects WHERE city ILIKE '%dubai%'")).isNull();
        assertThat(TextToSqlTool.validate("WITH x AS (SELECT 1) SELECT * FROM x")).isNull();
        assertThat(TextToSqlTool.validate(
                "SELECT project_name FROM projects WHERE description ILIKE '%do%' OR facilities ILIKE '%set; copy%'"))
                .isNull();
        assertThat(TextToSqlTool.validate("SELECT \"update\" FROM projects WHERE city = 'O''Brien'")).isNull();

        assertThat(TextToSqlTool.validate("")).isEqualTo("empty statement");
        assertThat(TextToSqlTool.validate("DELETE FROM projects")).isEqualTo("not a SELECT statement");
        assertThat(TextToSqlTool.validate("SELECT 1; DROP TABLE projects")).isEqualTo("multiple statements");
        assertThat(TextToSqlTool.validate("SELECT 'a'; DELETE FROM projects")).isEqualTo("multiple statements");
        assertThat(TextToSqlTool.validate("WITH d AS (DELETE FROM projects RETURNING *) SELECT * FROM d"))
                .isEqualTo("statement is not read-only");
    }

    @Test
    void unavailableWithoutLlm() {
        when(llmService.isConfigured()).thenReturn(false);

        SqlQueryResult result = tool.query("how many villas?");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getResults()).isNull();
        verifyNoInteractions(jdbc);
    }

    @SuppressWarnings("unchecked")
    @Test
    void runsGeneratedQueryWithRowCap() {
        when(llmService.isConfigured()).thenReturn(true);
        when(llmService.complete(anyString(), anyDouble())).thenReturn("SELECT COUNT(*) AS villas FROM projects WHERE property_type = 'villa';");
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
        when(jdbc.queryForList(sql.capture(), params.capture())).thenReturn(List.of(Map.of("VILLAS", 3L)));

        SqlQueryResult result = tool.query("how many villas?");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSql()).isEqualTo("SELECT COUNT(*) AS villas FROM projects WHERE property_type = 'villa'");
        assertThat(result.getResults()).containsExactly(Map.of("villas", 3L));
        assertThat(sql.getValue()).startsWith("SELECT * FROM (SELECT COUNT(*)").endsWith("LIMIT :maxRows");
        assertThat(params.getValue().getValue("maxRows")).isEqualTo(20);
    }

    @Test
    void rejectsWritesWithoutTouchingTheDatabase() {
        when(llmService.isConfigured()).thenReturn(true);
        when(llmService.complete(anyString(), anyDouble())).thenReturn("UPDATE projects SET price_usd = 0");

        SqlQueryResult result = tool.query("make everything free");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("not a SELECT statement");
        verifyNoInteractions(jdbc);
    }

    @Test
    void databaseAndLlmFailuresDegradeToErrors() {
        when(llmService.isConfigured()).thenReturn(true);
        when(llmService.complete(anyString(), anyDouble()))
                .thenReturn("SELECT * FROM nowhere")
                .thenThrow(new LlmUnavailableException("down"));
        when(jdbc.queryForList(anyString(), any(MapSqlParameterSource.class)))
                .thenThrow(new DataAccessResourceFailureException("table not found"));

        assertThat(tool.query("q1").getError()).startsWith("Query failed");
        assertThat(tool.query("q2").getError()).isEqualTo("down");
    }
}
