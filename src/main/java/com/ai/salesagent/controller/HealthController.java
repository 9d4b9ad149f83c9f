package com.ai.salesagent.controller;

import com.ai.salesagent.dto.HealthResponse;
import com.ai.salesagent.tools.TextToSqlTool;
import com.ai.salesagent.tools.WebSearchTool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final TextToSqlTool textToSqlTool;
    private final WebSearchTool webSearchTool;

    @Value("${app.name:Property Sales Agent}")
    private String appName;

    @Value("${app.version:1.0.0}")
    private String version;

    public HealthController(TextToSqlTool textToSqlTool, WebSearchTool webSearchTool) {
        this.textToSqlTool = textToSqlTool;
        this.webSearchTool = webSearchTool;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", appName, version,
                textToSqlTool.isAvailable(), webSearchTool.isEnabled());
    }
}
