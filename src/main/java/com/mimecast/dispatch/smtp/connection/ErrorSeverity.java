package com.mimecast.dispatch.smtp.connection;

/**
 * Error severity levels.
 */
public enum ErrorSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
