package com.example.activities.controller;

import com.example.activities.domain.model.ActivityDetails;
import com.example.activities.domain.model.SignupRequest;
import com.example.activities.service.ActivityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/activities")
public class ActivityController {

    private static final Logger logger = LoggerFactory.getLogger(ActivityController.class);
    private final ActivityService activityService;

    @Autowired
    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    @GetMapping
    public ResponseEntity<Map<String, ActivityDetails>> getActivities() {
        return ResponseEntity.ok(activityService.listActivities());
    }

    @GetMapping("/{activityName}")
    public ResponseEntity<ActivityDetails> getActivity(@PathVariable String activityName) {
        return ResponseEntity.ok(activityService.getActivity(activityName));
    }

    @PostMapping("/{activityName}/signup")
    public ResponseEntity<Map<String, String>> signup(@PathVariable String activityName,
                                                      @RequestBody SignupRequest signupRequest) {
        logger.info("Received signup request for activity: '{}', email: {}", activityName, signupRequest.getEmail());

        String message = activityService.signup(activityName, signupRequest.getEmail());

        Map<String, String> response = new HashMap<>();
        response.put("message", message);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{activityName}/unregister")
    public ResponseEntity<Map<String, String>> unregister(@PathVariable String activityName,
                                                          @RequestParam String email) {
        logger.info("Received unregister request for activity: '{}', email: {}", activityName, email);

        String message = activityService.unregister(activityName, email);

        Map<String, String> response = new HashMap<>();
        response.put("message", message);
        return ResponseEntity.ok(response);
    }
}
