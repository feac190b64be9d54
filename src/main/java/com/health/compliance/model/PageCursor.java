package com.health.compliance.model;

/**
 * Position in a newest-first listing: the timestamp and event id of the last record returned.
 * Written as {@code <timestamp>:<eventId>}; a bare timestamp is accepted and selects everything
 * strictly older.
 */
public record PageCursor(long timestamp, String eventId) {

    public static PageCursor of(long timestamp, String eventId) {
        return new PageCursor(timestamp, eventId);
    }

    /**
     * @return the parsed cursor, or null for a null or blank value
     * @throws IllegalArgumentException if the value is not a cursor this service issued
     */
    public static PageCursor parse(String value) {
        if (value == null || value.isBlank()) return null;
        String trimmed = value.trim();
        int sep = trimmed.indexOf(':');
        String ts = sep < 0 ? trimmed : trimmed.substring(0, sep);
        String id = sep < 0 ? null : trimmed.substring(sep + 1);
        try {
            return new PageCursor(Long.parseLong(ts), id != null && !id.isEmpty() ? id : null);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid 'before' cursor '" + value
                    + "'; pass the nextCursor of the previous page");
        }
    }

    /**
     * True if a record at this position sorts after the cursor, i.e. belongs on a later page.
     */
    public boolean precedes(long recordTimestamp, String recordId) {
        if (recordTimestamp != timestamp) return recordTimestamp < timestamp;
        return eventId != null && recordId != null && recordId.compareTo(eventId) < 0;
    }

    @Override
    public String toString() {
        return eventId != null ? timestamp + ":" + eventId : String.valueOf(timestamp);
    }
}
