package me.golemcore.adminbot.domain.model;

/**
 * Reference to a guild object returned by the platform.
 */
public record ObjectRef(String id, String name, ObjectType type) {

    public String describe() {
        return name + " (" + id + ")";
    }
}
