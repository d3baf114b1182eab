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

import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.model.AdminCapability;
import me.golemcore.adminbot.domain.model.AuthorizationDecision;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;

/**
 * Decides whether a requester may run an action list.
 *
 * <p>
 * Administrators may run anything. Everybody else needs Manage Server to use
 * the bot at all, plus the capability each action kind requires.
 */
@Component
public class AdminAuthorizationGuard {

    /**
     * Checks the entry capability alone, before the action list is known.
     */
    public AuthorizationDecision checkEntry(Set<AdminCapability> capabilities) {
        if (capabilities.contains(AdminCapability.ADMINISTRATOR)
                || capabilities.contains(AdminCapability.MANAGE_GUILD)) {
            return AuthorizationDecision.allow();
        }
        return AuthorizationDecision.deny(AdminCapability.MANAGE_GUILD);
    }

    public AuthorizationDecision check(Set<AdminCapability> capabilities, Collection<AdminAction> actions) {
        AuthorizationDecision entry = checkEntry(capabilities);
        if (!entry.allowed() || capabilities.contains(AdminCapability.ADMINISTRATOR)) {
            return entry;
        }
        for (AdminAction action : actions) {
            AdminCapability required = action.kind().getRequiredCapability();
            if (!capabilities.contains(required)) {
                return AuthorizationDecision.deny(required);
            }
        }
        return AuthorizationDecision.allow();
    }
}
