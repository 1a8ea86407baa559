package com.purchasingpower.hybridquery.configuration;

import lombok.Data;

@Data
public class SchemaProperties {

    /**
     * Spring resource location of the schema JSON document. Blank means empty schema.
     */
    private String location;

    private boolean failOnMissing = false;
}
