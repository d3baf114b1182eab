package me.golemcore.adminbot.domain.model;

/**
 * Lifecycle of one translated action list. {@link #EXECUTED},
 * {@link #DISCARDED} and {@link #REJECTED} are terminal. A list is
 * {@link #REJECTED} when it cannot be shown in full in one confirmation
 * prompt.
 */
public enum ConfirmationState {
    PROPOSED, AWAITING_CONFIRMATION, EXECUTED, DISCARDED, REJECTED
}
