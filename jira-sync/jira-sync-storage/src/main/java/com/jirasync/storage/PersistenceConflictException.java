package com.jirasync.storage;

/**
 * Thrown when a unit of work collides with a concurrent write (unique key
 * violation, lock timeout, deadlock) and has been rolled back. Retrying the
 * same unit is safe.
 */
public class PersistenceConflictException extends Exception {
    public PersistenceConflictException(String message)                  { super(message); }
    public PersistenceConflictException(String message, Throwable cause) { super(message, cause); }
}
