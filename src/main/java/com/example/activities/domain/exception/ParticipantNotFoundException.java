package com.example.activities.domain.exception;

public class ParticipantNotFoundException extends ActivityException {

    private final String email;

    public ParticipantNotFoundException(String activityName, String email) {
        super(activityName, "Student is not signed up for this activity");
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
