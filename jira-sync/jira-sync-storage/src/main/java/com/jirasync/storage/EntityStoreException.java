package com.jirasync.storage;

/** Unrecoverable store failure, such as a lost connection or broken schema. */
public class EntityStoreException extends RuntimeException {
    public EntityStoreException(String message)                  { super(message); }
    public EntityStoreException(String message, Throwable cause) { super(message, cause); }
}
