package com.example.activities.domain.repository;

import com.example.activities.domain.model.Activity;

import java.util.List;
import java.util.Optional;

public interface ActivityRepository {
    Optional<Activity> findByName(String name);

    /**
     * All activities in the order they were loaded.
     */
    List<Activity> findAll();
}
