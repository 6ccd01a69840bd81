package com.jirasync.storage.model;

/**
 * Maximum text lengths, matching the column sizes in {@code db/jira-sync-schema.sql}.
 * The in-memory store has no such limits, so writers check these values up front
 * and both stores accept the same input.
 */
public final class ColumnLimits {

    public static final int SOURCE_ID = 128;
    public static final int KEY       = 128;
    public static final int NAME      = 512;
    public static final int SUMMARY   = 2048;
    public static final int STATUS    = 256;

    private ColumnLimits() {}
}
