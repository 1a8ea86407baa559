package com.purchasingpower.hybridquery.configuration;

import lombok.Data;

@Data
public class PineconeProperties {

    private String apiKey;

    private String indexName;

    /**
     * Empty string is Pinecone's default namespace.
     */
    private String namespace = "";
}
