package com.locamat.rental.exception;

import java.util.Collection;
import java.util.List;

/**
 * The referenced rows exist but are in the wrong state for the operation, or could not be
 * locked in time. Callers may retry a {@link #LOCK_TIMEOUT} conflict.
 */
public class ResourceConflictException extends RentalException {

    public static final String LOCK_TIMEOUT = "lock timeout";

    private final String reason;
    private final List<Long> conflictingIds;

    public ResourceConflictException(String reason, Collection<Long> conflictingIds) {
        super(reason + ": " + List.copyOf(conflictingIds));
        this.reason = reason;
        this.conflictingIds = List.copyOf(conflictingIds);
    }

    private ResourceConflictException(String reason, Collection<Long> conflictingIds, Throwable cause) {
        super(reason + ": " + List.copyOf(conflictingIds), cause);
        this.reason = reason;
        this.conflictingIds = List.copyOf(conflictingIds);
    }

    public static ResourceConflictException lockTimeout(Collection<Long> requestedIds, Throwable cause) {
        return new ResourceConflictException(LOCK_TIMEOUT, requestedIds, cause);
    }

    public String getReason() {
        return reason;
    }

    public List<Long> getConflictingIds() {
        return conflictingIds;
    }

    public boolean isLockTimeout() {
        return LOCK_TIMEOUT.equals(reason);
    }
}
