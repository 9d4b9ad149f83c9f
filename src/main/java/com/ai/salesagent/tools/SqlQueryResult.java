package com.ai.salesagent.tools;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/** Outcome of a natural-language database question. */
@Getter
@AllArgsConstructor
public class SqlQueryResult {

    private final String sql;
    private final List<Map<String, Object>> results;
    private final String error;

    public static SqlQueryResult failed(String sql, String error) {
        return new SqlQueryResult(sql, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
