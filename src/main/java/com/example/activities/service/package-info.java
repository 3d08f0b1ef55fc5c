/**
 * Business service layer interfaces.
 * 
 * - ActivityService: Listing activities, signup and unregister
 * 
 * Implementations are located in the impl subpackage.
 */
package com.example.activities.service;
