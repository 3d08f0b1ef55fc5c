package com.example.activities.service.impl;

import com.example.activities.domain.exception.ActivityNotFoundException;
import com.example.activities.domain.exception.InvalidEmailException;
import com.example.activities.domain.model.Activity;
import com.example.activities.domain.model.ActivityDetails;
import com.example.activities.domain.repository.ActivityRepository;
import com.example.activities.service.ActivityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class ActivityServiceImpl implements ActivityService {

    private static final Logger log = LoggerFactory.getLogger(ActivityServiceImpl.class);

    private final ActivityRepository activityRepository;

    @Autowired
    public ActivityServiceImpl(ActivityRepository activityRepository) {
        this.activityRepository = activityRepository;
    }

    @Override
    public Map<String, ActivityDetails> listActivities() {
        Map<String, ActivityDetails> activities = new LinkedHashMap<>();
        for (Activity activity : activityRepository.findAll()) {
            activities.put(activity.getName(), activity.snapshot());
        }
        log.debug("Listing {} activities", activities.size());
        return activities;
    }

    @Override
    public ActivityDetails getActivity(String activityName) {
        return findActivity(activityName).snapshot();
    }

    @Override
    public String signup(String activityName, String email) {
        Activity activity = findActivity(activityName);
        requireEmail(activityName, email);

        activity.signup(email);
        log.debug("Signed up {} for activity '{}'", email, activityName);
        return "Signed up " + email + " for " + activityName;
    }

    @Override
    public String unregister(String activityName, String email) {
        Activity activity = findActivity(activityName);
        requireEmail(activityName, email);

        activity.unregister(email);
        log.debug("Unregistered {} from activity '{}'", email, activityName);
        return "Unregistered " + email + " from " + activityName;
    }

    private Activity findActivity(String activityName) {
        return activityRepository.findByName(activityName)
                .orElseThrow(() -> new ActivityNotFoundException(activityName));
    }

    private static void requireEmail(String activityName, String email) {
        if (email == null || email.isBlank()) {
            throw new InvalidEmailException(activityName);
        }
    }
}
