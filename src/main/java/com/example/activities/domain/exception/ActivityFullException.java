package com.example.activities.domain.exception;

/**
 * Thrown when a signup would take an activity past its maximum number of participants.
 */
public class ActivityFullException extends ActivityException {

    private final int maxParticipants;

    public ActivityFullException(String activityName, int maxParticipants) {
        super(activityName, "Activity is full");
        this.maxParticipants = maxParticipants;
    }

    public int getMaxParticipants() {
        return maxParticipants;
    }
}
