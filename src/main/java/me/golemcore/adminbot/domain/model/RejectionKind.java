package me.golemcore.adminbot.domain.model;

/**
 * Classification of platform rejections. The executor treats every kind the
 * same way (a failed outcome); the kind is kept for logging.
 */
public enum RejectionKind {
    PERMISSION_DENIED, NOT_FOUND, DUPLICATE, RATE_LIMITED, INVALID, UNAVAILABLE
}
