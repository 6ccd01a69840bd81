package com.jirasync.webhooks.processor;

import com.jirasync.storage.model.ColumnLimits;
import com.jirasync.webhooks.error.ValidationException;
import com.jirasync.webhooks.model.IssueSnapshot;
import com.jirasync.webhooks.model.ProjectSnapshot;

/** Rejects snapshot values that do not fit the store's columns. */
final class FieldLimits {

    private static final int SHOWN_ID_CHARS = 32;

    private FieldLimits() {}

    static void checkId(String eventType, String id) throws ValidationException {
        check(eventType, id, "id", id, ColumnLimits.SOURCE_ID);
    }

    static void checkProject(String eventType, ProjectSnapshot p) throws ValidationException {
        checkId(eventType, p.getId());
        check(eventType, p.getId(), "key", p.getKey(), ColumnLimits.KEY);
        check(eventType, p.getId(), "name", p.getName(), ColumnLimits.NAME);
    }

    static void checkIssue(String eventType, IssueSnapshot i) throws ValidationException {
        checkId(eventType, i.getId());
        check(eventType, i.getId(), "key", i.getKey(), ColumnLimits.KEY);
        check(eventType, i.getId(), "summary", i.getSummary(), ColumnLimits.SUMMARY);
        check(eventType, i.getId(), "status", i.getStatus(), ColumnLimits.STATUS);
        check(eventType, i.getId(), "project id", i.getProjectId(), ColumnLimits.SOURCE_ID);
        check(eventType, i.getId(), "project key", i.getProjectKey(), ColumnLimits.KEY);
        check(eventType, i.getId(), "project name", i.getProjectName(), ColumnLimits.NAME);
    }

    private static void check(String eventType, String id, String field, String value, int max)
            throws ValidationException {
        if (value != null && value.length() > max) {
            throw new ValidationException(
                    "Snapshot " + field + " is " + value.length() + " characters long, at most " + max + " allowed",
                    eventType, shorten(id));
        }
    }

    /** Long ids are cut for log lines and response bodies. */
    static String shorten(String id) {
        return id == null || id.length() <= SHOWN_ID_CHARS ? id : id.substring(0, SHOWN_ID_CHARS) + "...";
    }
}
