/**
 * REST API controllers handling HTTP requests.
 * 
 * Controllers in this package:
 * - ActivityController: Activity listing and participant membership
 *   - GET /api/activities: List all activities with their participants
 *   - GET /api/activities/{name}: Show a single activity
 *   - POST /api/activities/{name}/signup: Sign up an email for an activity
 *   - DELETE /api/activities/{name}/unregister?email=...: Remove an email from an activity
 * - ApiExceptionHandler: Translates rejected operations into HTTP status codes
 * 
 * Controllers handle request/response mapping and delegate business
 * logic to services.
 */
package com.example.activities.controller;
