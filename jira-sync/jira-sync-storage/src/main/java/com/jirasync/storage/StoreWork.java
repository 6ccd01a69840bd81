package com.jirasync.storage;

/** A unit of work executed by {@link EntityStore#atomically}. */
@FunctionalInterface
public interface StoreWork<T> {

    T execute(RecordSession session) throws PersistenceConflictException;
}
