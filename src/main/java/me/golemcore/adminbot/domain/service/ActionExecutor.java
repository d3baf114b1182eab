package me.golemcore.adminbot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.domain.model.ActionOutcome;
import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.model.ChannelPermission;
import me.golemcore.adminbot.domain.model.ObjectRef;
import me.golemcore.adminbot.domain.model.ObjectType;
import me.golemcore.adminbot.domain.model.RejectionKind;
import me.golemcore.adminbot.domain.schema.ActionSchema;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import me.golemcore.adminbot.port.outbound.GuildAccess;
import me.golemcore.adminbot.port.outbound.GuildOperationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Applies action lists to a guild.
 *
 * <p>
 * Actions run strictly in order; each one finishes before the next starts.
 * Every action yields exactly one {@link ActionOutcome}: a platform rejection
 * or an unexpected failure is recorded and execution continues with the next
 * action. Nothing is rolled back.
 *
 * <p>
 * Objects created earlier in the same list are remembered by name and
 * resolved before the guild is asked, so a channel can be placed in a category
 * created two actions before it.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionExecutor {

    private static final String EVERYONE = "everyone";

    private final MessageService messageService;

    public List<ActionOutcome> execute(List<AdminAction> actions, GuildAccess access) {
        Batch batch = new Batch(access);
        List<ActionOutcome> outcomes = new ArrayList<>(actions.size());
        int total = actions.size();

        for (int i = 0; i < total; i++) {
            AdminAction action = actions.get(i);
            log.debug("[Exec] Action {}/{}: {} '{}'", i + 1, total, action.kind().getWireName(), action.target());
            try {
                ActionOutcome outcome = apply(action, batch);
                log.info("[Exec] Action {}/{} succeeded: {}", i + 1, total, outcome.detail());
                outcomes.add(outcome);
            } catch (GuildOperationException e) {
                log.warn("[Exec] Action {}/{} {} rejected ({}): {}", i + 1, total,
                        action.kind().getWireName(), e.getKind(), e.getMessage());
                outcomes.add(ActionOutcome.failure(action, e.getMessage()));
            } catch (Exception e) { // NOSONAR - isolate per-action failures
                log.error("[Exec] Action {}/{} {} failed unexpectedly", i + 1, total,
                        action.kind().getWireName(), e);
                outcomes.add(ActionOutcome.failure(action, messageService.getMessage("error.unexpected",
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())));
            }
        }

        long succeeded = outcomes.stream().filter(ActionOutcome::succeeded).count();
        log.info("[Exec] Executed {} action(s) in guild {}: {} succeeded, {} failed", total,
                access.getGuildId(), succeeded, total - succeeded);
        return List.copyOf(outcomes);
    }

    private ActionOutcome apply(AdminAction action, Batch batch) {
        return switch (action.kind()) {
        case CREATE_CHANNEL -> createChannel(action, batch);
        case DELETE_CHANNEL -> deleteChannel(action, batch);
        case CREATE_ROLE -> createRole(action, batch);
        case DELETE_ROLE -> deleteRole(action, batch);
        case ASSIGN_ROLE -> changeMemberRole(action, batch, true);
        case REMOVE_ROLE -> changeMemberRole(action, batch, false);
        case LOCK_CHANNEL -> setChannelLock(action, batch, true);
        case UNLOCK_CHANNEL -> setChannelLock(action, batch, false);
        case CREATE_CATEGORY -> createCategory(action, batch);
        case SET_CHANNEL_PERMISSIONS -> setChannelPermissions(action, batch);
        };
    }

    private ActionOutcome createChannel(AdminAction action, Batch batch) {
        String channelType = action.stringParam(ActionSchema.TYPE).orElse(ActionSchema.CHANNEL_TYPE_TEXT);
        ObjectType type = ActionSchema.CHANNEL_TYPE_VOICE.equals(channelType)
                ? ObjectType.VOICE_CHANNEL
                : ObjectType.TEXT_CHANNEL;

        ObjectRef category = null;
        Optional<String> categoryName = action.stringParam(ActionSchema.CATEGORY);
        if (categoryName.isPresent()) {
            category = batch.findCategory(categoryName.get()).orElse(null);
            if (category == null) {
                log.info("[Exec] Category '{}' does not exist, creating it", categoryName.get());
                category = batch.register(batch.access.createCategory(categoryName.get()), categoryName.get());
            }
        }

        ObjectRef channel = batch.register(batch.access.createChannel(action.target(), type, category),
                action.target());
        String detail = category != null
                ? message("outcome.channel.created-in", channelType, channel.describe(), category.name())
                : message("outcome.channel.created", channelType, channel.describe());
        return ActionOutcome.success(action, channel.id(), detail);
    }

    private ActionOutcome deleteChannel(AdminAction action, Batch batch) {
        ObjectRef channel = batch.findChannel(action.target())
                .orElseThrow(() -> notFound("error.channel.not-found", action.target()));
        batch.access.deleteChannel(channel);
        batch.forget(channel);
        return ActionOutcome.success(action, channel.id(), message("outcome.channel.deleted", channel.name()));
    }

    private ActionOutcome createRole(AdminAction action, Batch batch) {
        String color = action.stringParam(ActionSchema.COLOR).orElse(null);
        ObjectRef role = batch.register(
                batch.access.createRole(action.target(), color, action.rolePermissions()), action.target());
        return ActionOutcome.success(action, role.id(), message("outcome.role.created", role.describe()));
    }

    private ActionOutcome deleteRole(AdminAction action, Batch batch) {
        ObjectRef role = batch.findRole(action.target())
                .orElseThrow(() -> notFound("error.role.not-found", action.target()));
        batch.access.deleteRole(role);
        batch.forget(role);
        return ActionOutcome.success(action, role.id(), message("outcome.role.deleted", role.name()));
    }

    private ActionOutcome changeMemberRole(AdminAction action, Batch batch, boolean add) {
        ObjectRef member = batch.access.findMember(action.target())
                .orElseThrow(() -> notFound("error.member.not-found", action.target()));
        String roleName = action.stringParam(ActionSchema.ROLE).orElseThrow();
        ObjectRef role = batch.findRole(roleName)
                .orElseThrow(() -> notFound("error.role.not-found", roleName));

        if (add) {
            batch.access.addMemberRole(member, role);
            return ActionOutcome.success(action, member.id(),
                    message("outcome.role.assigned", role.name(), member.name()));
        }
        batch.access.removeMemberRole(member, role);
        return ActionOutcome.success(action, member.id(), message("outcome.role.removed", role.name(), member.name()));
    }

    private ActionOutcome setChannelLock(AdminAction action, Batch batch, boolean lock) {
        ObjectRef channel = batch.findChannel(action.target())
                .orElseThrow(() -> notFound("error.channel.not-found", action.target()));
        if (channel.type() != ObjectType.TEXT_CHANNEL) {
            throw new GuildOperationException(RejectionKind.INVALID,
                    message(lock ? "error.channel.lock-not-text" : "error.channel.unlock-not-text", action.target()));
        }

        Map<ChannelPermission, Boolean> change = new HashMap<>();
        change.put(ChannelPermission.SEND_MESSAGES, !lock);
        batch.access.editPermissionOverwrite(channel, batch.access.everyoneRole(), change);
        return ActionOutcome.success(action, channel.id(),
                message(lock ? "outcome.channel.locked" : "outcome.channel.unlocked", channel.name()));
    }

    private ActionOutcome createCategory(AdminAction action, Batch batch) {
        ObjectRef category = batch.register(batch.access.createCategory(action.target()), action.target());
        return ActionOutcome.success(action, category.id(), message("outcome.category.created", category.describe()));
    }

    private ActionOutcome setChannelPermissions(AdminAction action, Batch batch) {
        ObjectRef channel = batch.findChannel(action.target())
                .orElseThrow(() -> notFound("error.channel.not-found", action.target()));
        if (channel.type() != ObjectType.TEXT_CHANNEL && channel.type() != ObjectType.VOICE_CHANNEL) {
            throw new GuildOperationException(RejectionKind.INVALID,
                    message("error.channel.permissions-type", action.target()));
        }

        String subjectName = action.stringParam(ActionSchema.SUBJECT).orElseThrow();
        String subjectType = action.stringParam(ActionSchema.SUBJECT_TYPE).orElse(null);
        ObjectRef subject = resolveSubject(subjectName, subjectType, batch)
                .orElseThrow(() -> notFound("error.subject.not-found", subjectName));

        batch.access.editPermissionOverwrite(channel, subject, action.permissionChanges());
        String subjectLabel = subject.type() == ObjectType.ROLE
                ? ActionSchema.SUBJECT_TYPE_ROLE
                : ActionSchema.SUBJECT_TYPE_USER;
        return ActionOutcome.success(action, channel.id(),
                message("outcome.permissions.set", subjectLabel, subject.name(), channel.name()));
    }

    /**
     * Resolves the subject of a permission overwrite: a role first, then a
     * member, unless the subject type pins one of them.
     */
    private Optional<ObjectRef> resolveSubject(String name, String subjectType, Batch batch) {
        String normalized = name.startsWith("@") ? name.substring(1) : name;
        if (EVERYONE.equals(normalized.toLowerCase(Locale.ROOT))
                && !ActionSchema.SUBJECT_TYPE_USER.equals(subjectType)) {
            return Optional.of(batch.access.everyoneRole());
        }
        if (ActionSchema.SUBJECT_TYPE_USER.equals(subjectType)) {
            return batch.access.findMember(name);
        }
        Optional<ObjectRef> role = batch.findRole(name);
        if (role.isPresent() || ActionSchema.SUBJECT_TYPE_ROLE.equals(subjectType)) {
            return role;
        }
        return batch.access.findMember(name);
    }

    private GuildOperationException notFound(String key, String reference) {
        return new GuildOperationException(RejectionKind.NOT_FOUND, message(key, reference));
    }

    private String message(String key, Object... args) {
        return messageService.getMessage(key, args);
    }

    /**
     * Guild access plus the objects created so far in one list.
     */
    private static final class Batch {

        private final GuildAccess access;
        private final Map<String, ObjectRef> created = new HashMap<>();

        private Batch(GuildAccess access) {
            this.access = access;
        }

        /**
         * Remembers a created object under the name the platform returned, the
         * name it was requested with (the platform may normalize it) and its id.
         */
        ObjectRef register(ObjectRef ref, String requestedName) {
            created.put(key(ref.type(), ref.name()), ref);
            created.put(key(ref.type(), requestedName), ref);
            created.put(key(ref.type(), ref.id()), ref);
            return ref;
        }

        void forget(ObjectRef ref) {
            created.values().removeIf(known -> known.id().equals(ref.id()));
        }

        Optional<ObjectRef> findCategory(String name) {
            ObjectRef known = created.get(key(ObjectType.CATEGORY, name));
            return known != null ? Optional.of(known) : access.findCategory(name);
        }

        Optional<ObjectRef> findChannel(String nameOrId) {
            for (ObjectType type : List.of(ObjectType.TEXT_CHANNEL, ObjectType.VOICE_CHANNEL, ObjectType.CATEGORY)) {
                ObjectRef known = created.get(key(type, nameOrId));
                if (known != null) {
                    return Optional.of(known);
                }
            }
            return access.findChannel(nameOrId);
        }

        Optional<ObjectRef> findRole(String nameOrId) {
            ObjectRef known = created.get(key(ObjectType.ROLE, nameOrId));
            return known != null ? Optional.of(known) : access.findRole(nameOrId);
        }

        private static String key(ObjectType type, String name) {
            return type + ":" + name.trim();
        }
    }
}
