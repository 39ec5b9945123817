package com.bbthechange.eventhub.model;

/**
 * Attendance state of a roster entry.
 * Registration only ever writes REGISTERED; the other values are kept for stored data compatibility.
 */
public enum AttendanceStatus {
    REGISTERED,
    ATTENDED,
    CANCELLED
}
