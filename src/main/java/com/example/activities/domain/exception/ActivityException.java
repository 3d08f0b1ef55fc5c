package com.example.activities.domain.exception;

/**
 * Base type for rejected activity directory operations.
 * Subclasses are translated to HTTP status codes at the controller boundary.
 */
public abstract class ActivityException extends RuntimeException {

    private final String activityName;

    protected ActivityException(String activityName, String message) {
        super(message);
        this.activityName = activityName;
    }

    public String getActivityName() {
        return activityName;
    }
}
