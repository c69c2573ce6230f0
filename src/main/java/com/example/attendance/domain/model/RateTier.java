package com.example.attendance.domain.model;

/**
 * Coarse grading of a monthly attendance rate. RED sits below the configurable threshold,
 * GREEN at or above 90%, YELLOW in between.
 */
public enum RateTier {
    RED,
    YELLOW,
    GREEN
}
