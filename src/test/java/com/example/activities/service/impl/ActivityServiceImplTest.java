package com.example.activities.service.impl;

import com.example.activities.domain.exception.ActivityFullException;
import com.example.activities.domain.exception.ActivityNotFoundException;
import com.example.activities.domain.exception.AlreadySignedUpException;
import com.example.activities.domain.exception.InvalidEmailException;
import com.example.activities.domain.exception.ParticipantNotFoundException;
import com.example.activities.domain.model.Activity;
import com.example.activities.domain.model.ActivityDetails;
import com.example.activities.domain.repository.ActivityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class ActivityServiceImplTest {

    private ActivityRepository activityRepository;
    private ActivityServiceImpl activityService;
    private Activity chessClub;
    private Activity mathClub;

    @BeforeEach
    public void setUp() {
        chessClub = new Activity("Chess Club", "Learn strategies", "Fridays", 3, List.of("michael@mergington.edu"));
        mathClub = new Activity("Math Club", "Solve problems", "Tuesdays", 1, List.of("james@mergington.edu"));

        activityRepository = mock(ActivityRepository.class);
        when(activityRepository.findAll()).thenReturn(List.of(chessClub, mathClub));
        when(activityRepository.findByName(anyString())).thenReturn(Optional.empty());
        when(activityRepository.findByName("Chess Club")).thenReturn(Optional.of(chessClub));
        when(activityRepository.findByName("Math Club")).thenReturn(Optional.of(mathClub));

        activityService = new ActivityServiceImpl(activityRepository);
    }

    @Test
    public void testListActivities_KeyedByNameInDirectoryOrder() {
        Map<String, ActivityDetails> activities = activityService.listActivities();

        assertEquals(List.of("Chess Club", "Math Club"), List.copyOf(activities.keySet()));
        assertEquals(List.of("michael@mergington.edu"), activities.get("Chess Club").getParticipants());
        assertEquals(1, activities.get("Math Club").getMaxParticipants());
    }

    @Test
    public void testGetActivity_Unknown_Throws() {
        assertThrows(ActivityNotFoundException.class, () -> activityService.getActivity("Knitting"));
    }

    @Test
    public void testSignup_ReturnsConfirmationMessage() {
        String message = activityService.signup("Chess Club", "a@x.edu");

        assertEquals("Signed up a@x.edu for Chess Club", message);
        assertTrue(chessClub.snapshot().getParticipants().contains("a@x.edu"));
        verify(activityRepository).findByName("Chess Club");
    }

    @Test
    public void testSignup_UnknownActivity_ThrowsNotFoundBeforeEmailCheck() {
        ActivityNotFoundException e = assertThrows(ActivityNotFoundException.class,
                () -> activityService.signup("NonExistentActivity", ""));
        assertEquals("NonExistentActivity", e.getActivityName());
    }

    @Test
    public void testSignup_BlankEmail_Throws() {
        assertThrows(InvalidEmailException.class, () -> activityService.signup("Chess Club", "  "));
        assertThrows(InvalidEmailException.class, () -> activityService.signup("Chess Club", null));
        assertEquals(1, chessClub.snapshot().getParticipants().size());
    }

    @Test
    public void testSignup_Duplicate_Throws() {
        assertThrows(AlreadySignedUpException.class,
                () -> activityService.signup("Chess Club", "michael@mergington.edu"));
    }

    @Test
    public void testSignup_Full_Throws() {
        assertThrows(ActivityFullException.class, () -> activityService.signup("Math Club", "new@x.edu"));
    }

    @Test
    public void testUnregister_ReturnsConfirmationMessage() {
        String message = activityService.unregister("Chess Club", "michael@mergington.edu");

        assertEquals("Unregistered michael@mergington.edu from Chess Club", message);
        assertFalse(chessClub.snapshot().getParticipants().contains("michael@mergington.edu"));
    }

    @Test
    public void testUnregister_NotRegistered_Throws() {
        assertThrows(ParticipantNotFoundException.class,
                () -> activityService.unregister("Chess Club", "notregistered@mergington.edu"));
    }

    @Test
    public void testUnregister_BlankEmail_Throws() {
        assertThrows(InvalidEmailException.class, () -> activityService.unregister("Chess Club", "  "));
        assertThrows(InvalidEmailException.class, () -> activityService.unregister("Chess Club", ""));
        assertThrows(InvalidEmailException.class, () -> activityService.unregister("Chess Club", null));
        assertEquals(List.of("michael@mergington.edu"), chessClub.snapshot().getParticipants());
    }

    @Test
    public void testUnregister_UnknownActivity_Throws() {
        assertThrows(ActivityNotFoundException.class,
                () -> activityService.unregister("NonExistentActivity", "test@mergington.edu"));
    }
}
