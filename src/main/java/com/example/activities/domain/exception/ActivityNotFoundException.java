package com.example.activities.domain.exception;

public class ActivityNotFoundException extends ActivityException {

    public ActivityNotFoundException(String activityName) {
        super(activityName, "Activity not found");
    }
}
