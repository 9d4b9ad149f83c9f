package com.ai.salesagent.tools;

import com.ai.salesagent.conversation.PropertyMatch;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Criteria search over the projects table. Every criterion is bound as a parameter.
 */
@Component
public class PropertySearchTool {

    private static final Logger log = LoggerFactory.getLogger(PropertySearchTool.class);

    public static final int DEFAULT_LIMIT = 5;

    private static final String SEARCH_COLUMNS =
            "id, project_name, bedrooms, bathrooms, price_usd, area_sqm, city, country, "
            + "property_type, completion_status, developer_name, description";

    private final NamedParameterJdbcTemplate jdbc;

    public PropertySearchTool(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<PropertyMatch> searchProperties(String city, Double minPrice, Double maxPrice,
                                                Integer bedrooms, String propertyType, int limit) {
        log.info("Searching properties: city={}, price={}-{}, beds={}, type={}",
                city, minPrice, maxPrice, bedrooms, propertyType);

        StringBuilder sql = new StringBuilder("SELECT ").append(SEARCH_COLUMNS)
                .append(" FROM projects WHERE price_usd IS NOT NULL");
        MapSqlParameterSource params = new MapSqlParameterSource();

        if (StringUtils.isNotBlank(city)) {
            sql.append(" AND (LOWER(city) LIKE :cityPattern OR LOWER(country) = :cityExact)");
            params.addValue("cityPattern", "%" + city.trim().toLowerCase(Locale.ROOT) + "%");
            params.addValue("cityExact", city.trim().toLowerCase(Locale.ROOT));
        }
        if (minPrice != null && minPrice > 0) {
            sql.append(" AND price_usd >= :minPrice");
            params.addValue("minPrice", minPrice);
        }
        if (maxPrice != null && maxPrice > 0) {
            sql.append(" AND price_usd <= :maxPrice");
            params.addValue("maxPrice", maxPrice);
        }
        if (bedrooms != null && bedrooms > 0) {
            sql.append(" AND bedrooms = :bedrooms");
            params.addValue("bedrooms", bedrooms);
        }
        if (StringUtils.isNotBlank(propertyType)) {
            sql.append(" AND LOWER(property_type) = :propertyType");
            params.addValue("propertyType", propertyType.trim().toLowerCase(Locale.ROOT));
        }
        sql.append(" ORDER BY price_usd ASC LIMIT :limit");
        params.addValue("limit", limit > 0 ? limit : DEFAULT_LIMIT);

        try {
            List<PropertyMatch> results = jdbc.query(sql.toString(), params, MATCH_MAPPER);
            log.info("Property search returned {} results", results.size());
            return results;
        } catch (DataAccessException ex) {
            log.error("Property search failed", ex);
            return new ArrayList<>();
        }
    }

    /** All columns of the first project whose name contains {@code projectName}. */
    public Optional<Map<String, Object>> getProjectDetails(String projectName) {
        if (StringUtils.isBlank(projectName)) return Optional.empty();
        String sql = "SELECT id, project_name, bedrooms, bathrooms, price_usd, area_sqm, city, country, "
                + "property_type, completion_status, completion_date, unit_type, developer_name, description, "
                + "features, facilities FROM projects WHERE LOWER(project_name) LIKE :pattern "
                + "ORDER BY project_name LIMIT 1";
        try {
            List<Map<String, Object>> rows = jdbc.queryForList(sql,
                    new MapSqlParameterSource("pattern", "%" + projectName.trim().toLowerCase(Locale.ROOT) + "%"));
            return rows.isEmpty() ? Optional.empty() : Optional.of(normalize(rows.get(0)));
        } catch (DataAccessException ex) {
            log.error("Error getting project details for {}", projectName, ex);
            return Optional.empty();
        }
    }

    public List<String> getCities() {
        return jdbc.queryForList("SELECT DISTINCT city FROM projects WHERE city IS NOT NULL ORDER BY city",
                new MapSqlParameterSource(), String.class);
    }

    public PriceRange getPriceRange(String city) {
        StringBuilder sql = new StringBuilder(
                "SELECT MIN(price_usd) AS min_price, MAX(price_usd) AS max_price, AVG(price_usd) AS avg_price "
                + "FROM projects WHERE price_usd IS NOT NULL");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (StringUtils.isNotBlank(city)) {
            sql.append(" AND LOWER(city) LIKE :cityPattern");
            params.addValue("cityPattern", "%" + city.trim().toLowerCase(Locale.ROOT) + "%");
        }
        return jdbc.queryForObject(sql.toString(), params, (rs, rowNum) -> new PriceRange(
                doubleOrZero(rs, "min_price"), doubleOrZero(rs, "max_price"), doubleOrZero(rs, "avg_price")));
    }

    public static final class PriceRange {
        private final double minPrice;
        private final double maxPrice;
        private final double avgPrice;

        public PriceRange(double minPrice, double maxPrice, double avgPrice) {
            this.minPrice = minPrice;
            this.maxPrice = maxPrice;
            this.avgPrice = avgPrice;
        }

        public double getMinPrice() {
            return minPrice;
        }

        public double getMaxPrice() {
            return maxPrice;
        }

        public double getAvgPrice() {
            return avgPrice;
        }
    }

    private static final RowMapper<PropertyMatch> MATCH_MAPPER = (rs, rowNum) -> PropertyMatch.builder()
            .id(rs.getString("id"))
            .projectName(rs.getString("project_name"))
            .city(rs.getString("city"))
            .country(rs.getString("country"))
            .priceUsd(nullableDouble(rs, "price_usd"))
            .bedrooms(nullableInt(rs, "bedrooms"))
            .propertyType(rs.getString("property_type"))
            .description(StringUtils.left(rs.getString("description"), PropertyMatch.DESCRIPTION_LIMIT))
            .build();

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    private static double doubleOrZero(ResultSet rs, String column) throws SQLException {
        Double v = nullableDouble(rs, column);
        return v != null ? v : 0d;
    }

    /** Lower-cases column labels; some drivers return them upper-case. */
    static Map<String, Object> normalize(Map<String, Object> row) {
        Map<String, Object> out = new LinkedHashMap<>();
        row.forEach((k, v) -> out.put(k.toLowerCase(Locale.ROOT), v instanceof UUID ? v.toString() : v));
        return out;
    }
}
