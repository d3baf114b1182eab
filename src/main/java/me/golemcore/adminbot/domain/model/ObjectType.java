package me.golemcore.adminbot.domain.model;

/**
 * Kinds of guild objects an action can reference.
 */
public enum ObjectType {
    TEXT_CHANNEL, VOICE_CHANNEL, CATEGORY, OTHER_CHANNEL, ROLE, MEMBER;

    public boolean isChannel() {
        return this == TEXT_CHANNEL || this == VOICE_CHANNEL || this == CATEGORY || this == OTHER_CHANNEL;
    }
}
