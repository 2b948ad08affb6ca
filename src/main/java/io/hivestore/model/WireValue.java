package io.hivestore.model;

/**
 * Enumerated column value with a stable lower-case representation in the database.
 */
public interface WireValue {
    String wireValue();
}
