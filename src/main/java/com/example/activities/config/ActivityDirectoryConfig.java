package com.example.activities.config;

import com.example.activities.domain.model.Activity;
import com.example.activities.domain.model.ActivityDetails;
import com.example.activities.domain.repository.ActivityRepository;
import com.example.activities.domain.repository.InMemoryActivityRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(ActivityProperties.class)
public class ActivityDirectoryConfig {

    private static final Logger logger = LoggerFactory.getLogger(ActivityDirectoryConfig.class);

    private static final TypeReference<LinkedHashMap<String, ActivityDetails>> SEED_TYPE = new TypeReference<>() {};

    @Bean
    public ActivityRepository activityRepository(ObjectMapper objectMapper, ActivityProperties activityProperties) {
        String resourceName = activityProperties.getSeedResource();
        logger.info("Seeding activity directory from classpath resource: {}", resourceName);

        Map<String, ActivityDetails> seed = loadSeed(objectMapper, resourceName);
        List<Activity> activities = new ArrayList<>(seed.size());
        seed.forEach((name, details) -> activities.add(toActivity(name, details)));

        InMemoryActivityRepository repository = new InMemoryActivityRepository(activities);
        logger.info("Activity directory ready with {} activities", activities.size());
        return repository;
    }

    static Map<String, ActivityDetails> loadSeed(ObjectMapper objectMapper, String resourceName) {
        try (InputStream inputStream = ActivityDirectoryConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IllegalStateException("Seed resource not found: " + resourceName);
            }
            Map<String, ActivityDetails> seed = objectMapper.readValue(inputStream, SEED_TYPE);
            if (seed == null || seed.isEmpty()) {
                throw new IllegalStateException("Seed resource " + resourceName + " defines no activities");
            }
            return seed;
        } catch (IOException e) {
            throw new IllegalStateException("Could not read seed resource " + resourceName, e);
        }
    }

    static Activity toActivity(String name, ActivityDetails details) {
        if (details == null) {
            throw new IllegalStateException("Seed entry for activity '" + name + "' is empty");
        }
        if (details.getDescription() == null || details.getDescription().isBlank()) {
            throw new IllegalStateException("Activity '" + name + "' has no description");
        }
        if (details.getSchedule() == null || details.getSchedule().isBlank()) {
            throw new IllegalStateException("Activity '" + name + "' has no schedule");
        }
        try {
            return new Activity(name, details.getDescription(), details.getSchedule(),
                    details.getMaxParticipants(), details.getParticipants());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid seed entry for activity '" + name + "': " + e.getMessage(), e);
        }
    }
}
