/**
 * Domain layer containing core business entities and repository interfaces.
 * 
 * - model: Activities and the request/response shapes built from them
 * - repository: The activity directory
 * - exception: Rejected directory operations
 */
package com.example.activities.domain;
