package com.example.activities.domain.repository;

import com.example.activities.domain.model.Activity;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-memory directory of activities keyed by name.
 * <p>
 * The name index is built once in the constructor and never changes afterwards; only the
 * rosters inside each {@link Activity} mutate, under that activity's own lock.
 */
public class InMemoryActivityRepository implements ActivityRepository {

    private final Map<String, Activity> activitiesByName;

    public InMemoryActivityRepository(Collection<Activity> activities) {
        Map<String, Activity> index = new LinkedHashMap<>();
        for (Activity activity : activities) {
            if (index.putIfAbsent(activity.getName(), activity) != null) {
                throw new IllegalArgumentException("Duplicate activity name: " + activity.getName());
            }
        }
        this.activitiesByName = Collections.unmodifiableMap(index);
    }

    @Override
    public Optional<Activity> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(activitiesByName.get(name));
    }

    @Override
    public List<Activity> findAll() {
        return List.copyOf(activitiesByName.values());
    }
}
