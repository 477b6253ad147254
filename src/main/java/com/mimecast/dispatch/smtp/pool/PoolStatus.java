package com.mimecast.dispatch.smtp.pool;

/**
 * Point in time pool snapshot.
 *
 * @param total   Live connections, idle and leased.
 * @param idle    Idle connections.
 * @param inUse   Leased connections.
 * @param pending Callers waiting for a connection.
 * @param maxSize Configured maximum.
 */
public record PoolStatus(int total, int idle, int inUse, int pending, int maxSize) {

    /**
     * Is every connection slot taken.
     *
     * @return Boolean.
     */
    public boolean isExhausted() {
        return total >= maxSize && idle == 0;
    }
}
