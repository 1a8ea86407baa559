package com.purchasingpower.hybridquery.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class OllamaProperties {

    private String baseUrl = "http://localhost:11434";

    private String embeddingModel = "mxbai-embed-large";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 3;
}
