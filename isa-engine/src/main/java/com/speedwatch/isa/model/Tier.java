package com.speedwatch.isa.model;

/**
 * Policy tier of an entity's windowed total.
 */
public enum Tier {
    COMPLIANT,
    WARNING,
    REQUIRED
}
