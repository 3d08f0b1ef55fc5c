/**
 * Domain model entities representing the core business concepts.
 * 
 * Key entities:
 * - Activity: An extracurricular activity and its participant roster
 * - ActivityDetails: Snapshot of an activity as it appears in JSON
 * - SignupRequest: Body of a signup request
 */
package com.example.activities.domain.model;
