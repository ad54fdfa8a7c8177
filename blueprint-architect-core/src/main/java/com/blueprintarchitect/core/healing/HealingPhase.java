package com.blueprintarchitect.core.healing;

/**
 * Phase of a healing pass.
 */
public enum HealingPhase {
    /** Document shape, bindings and terminals; runs before port inference */
    STRUCTURAL,

    /** Schema reconciliation on bound ports; runs after port inference */
    SCHEMA
}
