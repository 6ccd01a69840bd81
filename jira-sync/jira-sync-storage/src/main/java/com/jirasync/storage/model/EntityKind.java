package com.jirasync.storage.model;

/** Kinds of Jira entity mirrored in the local store. */
public enum EntityKind {
    PROJECT,
    ISSUE
}
