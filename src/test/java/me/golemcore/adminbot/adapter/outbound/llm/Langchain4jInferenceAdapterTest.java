package me.golemcore.adminbot.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.adminbot.infrastructure.config.AppConfiguration;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import me.golemcore.adminbot.infrastructure.i18n.MessageService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class Langchain4jInferenceAdapterTest {

    private BotProperties properties;
    private ChatModel chatModel;
    private AtomicInteger modelsCreated;
    private ExecutorService inferenceExecutor;
    private Langchain4jInferenceAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getLlm().setApiKey("hf_test");
        chatModel = mock(ChatModel.class);
        modelsCreated = new AtomicInteger();
        inferenceExecutor = new AppConfiguration(properties, new MessageService()).inferenceExecutor();
        adapter = new Langchain4jInferenceAdapter(properties, inferenceExecutor) {
            @Override
            ChatModel createModel() {
                modelsCreated.incrementAndGet();
                return chatModel;
            }
        };
    }

    @AfterEach
    void tearDown() {
        inferenceExecutor.shutdownNow();
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertTrue(adapter.isAvailable());

        properties.getLlm().setApiKey(" ");

        assertFalse(adapter.isAvailable());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendSystemAndUserMessages() throws Exception {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("[]"))
                .build());

        String text = adapter.complete("system prompt", "lock general").get(5, TimeUnit.SECONDS);

        assertEquals("[]", text);
        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(messages.capture());
        assertEquals(2, messages.getValue().size());
        assertEquals("system prompt", ((SystemMessage) messages.getValue().get(0)).text());
        assertEquals("lock general", ((UserMessage) messages.getValue().get(1)).singleText());
    }

    @Test
    void shouldBuildModelOnce() throws Exception {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());

        adapter.complete("s", "a").get(5, TimeUnit.SECONDS);
        adapter.complete("s", "b").get(5, TimeUnit.SECONDS);

        assertEquals(1, modelsCreated.get());
    }

    @Test
    void shouldWrapProviderFailure() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("401 Unauthorized"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.complete("s", "a").get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("401 Unauthorized"));
    }

    @Test
    void shouldFailWhenNotConfigured() {
        properties.getLlm().setApiKey(null);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.complete("s", "a").get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(0, modelsCreated.get());
    }

    // ===== concurrency =====

    @Test
    void shouldStartEveryConcurrentCallWithoutQueueing() throws Exception {
        int calls = 2 * Runtime.getRuntime().availableProcessors() + 4;
        Set<String> threads = ConcurrentHashMap.newKeySet();
        when(chatModel.chat(anyList())).thenAnswer(invocation -> {
            threads.add(Thread.currentThread().getName());
            Thread.sleep(400);
            return ChatResponse.builder().aiMessage(AiMessage.from("[]")).build();
        });

        List<CompletableFuture<String>> results = new ArrayList<>();
        for (int i = 0; i < calls; i++) {
            results.add(adapter.complete("s", "instruction " + i).orTimeout(3, TimeUnit.SECONDS));
        }

        for (CompletableFuture<String> result : results) {
            assertEquals("[]", result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(calls, threads.size());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("llm-call-")));
    }
}
