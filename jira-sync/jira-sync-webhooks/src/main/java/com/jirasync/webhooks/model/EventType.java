package com.jirasync.webhooks.model;

/**
 * Jira webhook event-type constants.
 *
 * Jira places a tag of the form {@code <domain>:<entity>_<operation>} in the
 * {@code webhookEvent} field, e.g. {@code jira:issue_created}. Project events
 * are sent without the domain prefix ({@code project_created}). The constants
 * below are the bare {@code <entity>_<operation>} names that processors are
 * registered under.
 */
public final class EventType {

    private EventType() {}

    public static final String JIRA_DOMAIN = "jira";

    // ---------------------------------------------------------------
    // Project lifecycle
    // ---------------------------------------------------------------
    public static final String PROJECT_CREATED = "project_created";
    public static final String PROJECT_UPDATED = "project_updated";
    public static final String PROJECT_DELETED = "project_deleted";

    // ---------------------------------------------------------------
    // Issue lifecycle
    // ---------------------------------------------------------------
    public static final String ISSUE_CREATED = "issue_created";
    public static final String ISSUE_UPDATED = "issue_updated";
    public static final String ISSUE_DELETED = "issue_deleted";

    /**
     * Returns the domain part of a tag, or {@code null} when the tag has none.
     * {@code domainOf("jira:issue_created")} is {@code "jira"}.
     */
    public static String domainOf(String tag) {
        int colon = tag.indexOf(':');
        return colon < 0 ? null : tag.substring(0, colon);
    }

    /**
     * Returns the tag without its domain prefix.
     * {@code nameOf("jira:issue_created")} is {@code "issue_created"}.
     */
    public static String nameOf(String tag) {
        int colon = tag.indexOf(':');
        return colon < 0 ? tag : tag.substring(colon + 1);
    }
}
