package me.golemcore.adminbot.infrastructure.i18n;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageServiceTest {

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    @Test
    void shouldFormatArguments() {
        assertEquals("Executed 3 action(s): 2 succeeded, 1 failed",
                messageService.getMessage("results.summary", 3, 2, 1));
    }

    @Test
    void shouldFormatSingleTextArgument() {
        assertEquals("Unexpected error: boom", messageService.getMessage("error.unexpected", "boom"));
        assertEquals("Channel not found: general", messageService.getMessage("error.channel.not-found", "general"));
    }

    @Test
    void shouldUseRussianWhenSelected() {
        messageService.setLanguage(MessageService.LANG_RU);

        assertEquals(MessageService.LANG_RU, messageService.getLanguage());
        assertNotEquals(messageService.getMessageForLanguage("confirmation.cancelled", MessageService.LANG_EN),
                messageService.getMessage("confirmation.cancelled"));
    }

    @Test
    void shouldIgnoreUnsupportedLanguage() {
        messageService.setLanguage("xx");

        assertEquals(MessageService.DEFAULT_LANG, messageService.getLanguage());
        assertFalse(messageService.isSupported("xx"));
    }

    @Test
    void shouldReturnKeyWhenMissing() {
        assertEquals("no.such.key", messageService.getMessage("no.such.key"));
    }
}
