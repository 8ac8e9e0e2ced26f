package com.ouroboros.core.model;

/**
 * Kind of improvement an opportunity asks for.
 */
public enum OpportunityType {
    FIX_FAILURE,
    OPTIMIZE_SPEED,
    NEW_CAPABILITY,
    AUTOMATE_PATTERN
}
