package org.gopti.planner.converter;

/**
 * Enum constant with a stable wire code.
 */
public interface Coded {
    String code();
}
