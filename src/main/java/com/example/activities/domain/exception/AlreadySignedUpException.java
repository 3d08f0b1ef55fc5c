package com.example.activities.domain.exception;

public class AlreadySignedUpException extends ActivityException {

    private final String email;

    public AlreadySignedUpException(String activityName, String email) {
        super(activityName, "Student is already signed up");
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
