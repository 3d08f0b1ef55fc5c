package com.example.activities.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a single activity, keyed by name in both the seed resource
 * and the {@code GET /api/activities} response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityDetails {
    private String description;
    private String schedule;
    private int maxParticipants;
    @Builder.Default
    private List<String> participants = new ArrayList<>();
}
