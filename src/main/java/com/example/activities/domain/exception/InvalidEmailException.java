package com.example.activities.domain.exception;

public class InvalidEmailException extends ActivityException {

    public InvalidEmailException(String activityName) {
        super(activityName, "Email is required");
    }
}
