package com.example.activities.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "activities")
public class ActivityProperties {

    /**
     * Classpath location of the JSON document the directory is seeded from.
     */
    private String seedResource = "seed-activities.json";

    public String getSeedResource() {
        return seedResource;
    }

    public void setSeedResource(String seedResource) {
        this.seedResource = seedResource;
    }
}
