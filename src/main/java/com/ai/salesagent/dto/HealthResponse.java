package com.ai.salesagent.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    private String status;
    private String appName;
    private String version;
    private boolean textToSqlAvailable;
    private boolean webSearchAvailable;
}
