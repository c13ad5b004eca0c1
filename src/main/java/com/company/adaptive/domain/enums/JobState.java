package com.company.adaptive.domain.enums;

/**
 * Lifecycle of a scheduled job:
 * IDLE -> DUE -> RUNNING -> IDLE, or RUNNING -> FAILED. A FAILED job keeps that state
 * until it is next due, then follows the same path as an IDLE one.
 */
public enum JobState {
    IDLE,
    DUE,
    RUNNING,
    FAILED
}
