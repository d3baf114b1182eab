package me.golemcore.adminbot.domain.model;

/**
 * Published when a pending action list is evicted without being confirmed or
 * declined, so the confirmation prompt can be marked expired.
 */
public record PendingActionExpiredEvent(PendingEntry entry) {
}
