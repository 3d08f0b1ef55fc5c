package com.example.activities.domain.model;

import com.example.activities.domain.exception.ActivityFullException;
import com.example.activities.domain.exception.AlreadySignedUpException;
import com.example.activities.domain.exception.ParticipantNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * An extracurricular activity and its participant roster.
 * <p>
 * Name, description, schedule and capacity are fixed at construction. The roster is
 * guarded by a per-activity read/write lock: membership changes take the write lock,
 * {@link #snapshot()} takes the read lock.
 */
public class Activity {

    private final String name;
    private final String description;
    private final String schedule;
    private final int maxParticipants;

    private final Set<String> participants = new LinkedHashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Activity(String name, String description, String schedule, int maxParticipants,
                    Collection<String> initialParticipants) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Activity name must not be blank");
        }
        if (maxParticipants <= 0) {
            throw new IllegalArgumentException("maxParticipants must be positive for activity '" + name + "'");
        }
        this.name = name;
        this.description = description;
        this.schedule = schedule;
        this.maxParticipants = maxParticipants;

        if (initialParticipants != null) {
            for (String email : initialParticipants) {
                if (!participants.add(email)) {
                    throw new IllegalArgumentException("Duplicate participant '" + email + "' in activity '" + name + "'");
                }
            }
        }
        if (participants.size() > maxParticipants) {
            throw new IllegalArgumentException("Activity '" + name + "' has " + participants.size()
                    + " participants but allows only " + maxParticipants);
        }
    }

    public String getName() { return name; }

    public String getDescription() { return description; }

    public String getSchedule() { return schedule; }

    public int getMaxParticipants() { return maxParticipants; }

    /**
     * Adds {@code email} to the roster.
     *
     * @throws AlreadySignedUpException if the email is already registered
     * @throws ActivityFullException    if the roster is at capacity
     */
    public void signup(String email) {
        lock.writeLock().lock();
        try {
            if (participants.contains(email)) {
                throw new AlreadySignedUpException(name, email);
            }
            if (participants.size() >= maxParticipants) {
                throw new ActivityFullException(name, maxParticipants);
            }
            participants.add(email);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes {@code email} from the roster.
     *
     * @throws ParticipantNotFoundException if the email is not registered
     */
    public void unregister(String email) {
        lock.writeLock().lock();
        try {
            if (!participants.remove(email)) {
                throw new ParticipantNotFoundException(name, email);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Copies the current state, with participants in signup order.
     */
    public ActivityDetails snapshot() {
        lock.readLock().lock();
        try {
            return ActivityDetails.builder()
                    .description(description)
                    .schedule(schedule)
                    .maxParticipants(maxParticipants)
                    .participants(new ArrayList<>(participants))
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "Activity{" +
                "name='" + name + '\'' +
                ", schedule='" + schedule + '\'' +
                ", maxParticipants=" + maxParticipants +
                '}';
    }
}
