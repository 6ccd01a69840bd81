package com.jirasync.storage.model;

import java.util.Objects;

/**
 * Identity correlation key for a mirrored entity.
 *
 * <p>The Jira id is unique per {@link EntityKind} in the local store and is the
 * only key used to correlate webhook deliveries with local records. Local ids
 * are never used for correlation.
 *
 * <pre>
 *   ExternalEntityRef ref = ExternalEntityRef.issue("10002");
 *   ExternalEntityRef ref = ExternalEntityRef.of(EntityKind.PROJECT, "PRJ-1");
 * </pre>
 */
public final class ExternalEntityRef {

    private final EntityKind entityKind;
    private final String     sourceSystemId;

    private ExternalEntityRef(EntityKind entityKind, String sourceSystemId) {
        this.entityKind     = Objects.requireNonNull(entityKind, "entityKind");
        this.sourceSystemId = Objects.requireNonNull(sourceSystemId, "sourceSystemId");
        if (sourceSystemId.isBlank()) {
            throw new IllegalArgumentException("sourceSystemId must not be blank");
        }
    }

    public static ExternalEntityRef of(EntityKind kind, String sourceSystemId) {
        return new ExternalEntityRef(kind, sourceSystemId);
    }

    public static ExternalEntityRef project(String sourceSystemId) {
        return new ExternalEntityRef(EntityKind.PROJECT, sourceSystemId);
    }

    public static ExternalEntityRef issue(String sourceSystemId) {
        return new ExternalEntityRef(EntityKind.ISSUE, sourceSystemId);
    }

    public EntityKind getEntityKind()     { return entityKind; }
    public String     getSourceSystemId() { return sourceSystemId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExternalEntityRef)) return false;
        ExternalEntityRef other = (ExternalEntityRef) o;
        return entityKind == other.entityKind && sourceSystemId.equals(other.sourceSystemId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityKind, sourceSystemId);
    }

    @Override
    public String toString() {
        return entityKind + ":" + sourceSystemId;
    }
}
