/**
 * Configuration classes for application setup.
 * 
 * Key configurations:
 * - ActivityDirectoryConfig: Builds the in-memory activity directory from the seed resource
 * - ActivityProperties: Binds the "activities.*" application properties
 */
package com.example.activities.config;
