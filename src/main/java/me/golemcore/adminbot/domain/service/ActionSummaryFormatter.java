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
import me.golemcore.adminbot.domain.model.ActionOutcome;
import me.golemcore.adminbot.domain.model.AdminAction;
import me.golemcore.adminbot.domain.model.AdminCapability;
import me.golemcore.adminbot.domain.model.TranslationError;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders action lists, outcomes and errors as Discord message text.
 */
@Component
@RequiredArgsConstructor
public class ActionSummaryFormatter {

    static final int MAX_MESSAGE_LENGTH = 2000;
    private static final String TRUNCATION_SUFFIX = "\n...";

    private final MessageService messageService;

    /**
     * Renders the confirmation prompt for {@code actions}. Every action and the
     * expiry footer must be visible, so a prompt longer than one Discord
     * message is not produced at all.
     *
     * @return the prompt, or empty when it does not fit in one message
     */
    public Optional<String> formatProposal(List<AdminAction> actions, long ttlSeconds) {
        StringBuilder sb = new StringBuilder();
        sb.append(messageService.getMessage("confirmation.header", actions.size())).append('\n');
        for (int i = 0; i < actions.size(); i++) {
            AdminAction action = actions.get(i);
            sb.append(i + 1).append(". ");
            if (action.isDestructive()) {
                sb.append("⚠️ ");
            }
            sb.append(describe(action)).append('\n');
        }
        sb.append(messageService.getMessage("confirmation.footer", ttlSeconds));
        return sb.length() <= MAX_MESSAGE_LENGTH ? Optional.of(sb.toString()) : Optional.empty();
    }

    public String formatProposalTooLarge(int actionCount) {
        return messageService.getMessage("confirmation.too-large", actionCount);
    }

    /**
     * Summary line followed by one line per outcome, in execution order.
     */
    public String formatResults(List<ActionOutcome> outcomes) {
        long succeeded = outcomes.stream().filter(ActionOutcome::succeeded).count();
        StringBuilder sb = new StringBuilder();
        sb.append(messageService.getMessage("results.summary", outcomes.size(), succeeded,
                outcomes.size() - succeeded));
        for (ActionOutcome outcome : outcomes) {
            sb.append('\n');
            if (outcome.succeeded()) {
                sb.append("✅ ").append(outcome.detail());
            } else {
                sb.append("❌ ").append(describe(outcome.action())).append(": ").append(outcome.errorReason());
            }
        }
        return limit(sb.toString());
    }

    public String formatConfirmed(List<ActionOutcome> outcomes) {
        return limit(messageService.getMessage("confirmation.confirmed") + "\n" + formatResults(outcomes));
    }

    public String formatTranslationError(TranslationError error) {
        return switch (error.kind()) {
        case INFERENCE_UNAVAILABLE -> messageService.getMessage("translate.unavailable");
        case MALFORMED_RESPONSE -> messageService.getMessage("translate.malformed");
        case EMPTY_PLAN -> messageService.getMessage("translate.empty");
        case UNKNOWN_ACTION_KIND -> messageService.getMessage("translate.unknown-kind", position(error),
                error.reason());
        case INVALID_ACTION -> messageService.getMessage("translate.invalid", position(error), error.reason());
        };
    }

    public String formatDenied(AdminCapability missing) {
        return messageService.getMessage("auth.denied",
                messageService.getMessage("capability." + missing.name().toLowerCase(Locale.ROOT)));
    }

    /**
     * One-line description of an action such as
     * {@code create_channel "Lobby" (type: voice, category: Gaming)}.
     */
    public String describe(AdminAction action) {
        StringBuilder sb = new StringBuilder();
        sb.append(action.kind().getWireName()).append(" \"").append(action.target()).append('"');
        if (!action.params().isEmpty()) {
            sb.append(" (").append(action.params().entrySet().stream()
                    .map(entry -> entry.getKey() + ": " + render(entry.getValue()))
                    .collect(Collectors.joining(", "))).append(')');
        }
        return sb.toString();
    }

    private static String render(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining(" ", "{", "}"));
        }
        return String.valueOf(value);
    }

    private static int position(TranslationError error) {
        return error.index() != null ? error.index() + 1 : 0;
    }

    private static String limit(String text) {
        if (text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH - TRUNCATION_SUFFIX.length()) + TRUNCATION_SUFFIX;
    }
}
