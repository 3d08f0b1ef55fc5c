package com.example.activities.service;

import com.example.activities.domain.model.ActivityDetails;

import java.util.Map;

public interface ActivityService {

    /**
     * Snapshot of every activity keyed by name, in directory order.
     */
    Map<String, ActivityDetails> listActivities();

    ActivityDetails getActivity(String activityName);

    /**
     * @return confirmation message, {@code "Signed up <email> for <activityName>"}
     */
    String signup(String activityName, String email);

    /**
     * @return confirmation message, {@code "Unregistered <email> from <activityName>"}
     */
    String unregister(String activityName, String email);
}
