package me.golemcore.oracle.domain.system.divination;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.oracle.domain.model.AssembledContext;
import me.golemcore.oracle.domain.model.ExtraContext;
import me.golemcore.oracle.domain.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DivinationMessageComposerTest {

    private DivinationMessageComposer composer;

    @BeforeEach
    void setUp() {
        composer = new DivinationMessageComposer(new SystemPromptProvider("sys", "reason"), new ObjectMapper(),
                "brief");
    }

    @Test
    void shouldComposeMessagesInOrder() {
        ExtraContext extra = ExtraContext.builder()
                .projectFiles(List.of("lib/a.rb"))
                .manifest("PROJECT MANIFEST ...")
                .build();
        List<Message> history = List.of(Message.user("earlier"), Message.assistant("reply"));
        DivinationSession session = DivinationSession.builder()
                .prompt("now")
                .context(new AssembledContext(history, extra))
                .build();

        List<Message> messages = composer.compose(session);

        assertEquals(7, messages.size());
        assertEquals(Message.system("sys"), messages.get(0));
        assertEquals(Message.user("earlier"), messages.get(1));
        assertEquals(Message.assistant("reply"), messages.get(2));
        assertEquals(Message.system("PROJECT MANIFEST ..."), messages.get(3));
        assertTrue(messages.get(4).getContent().startsWith(DivinationMessageComposer.CONTEXT_PREFIX));
        assertTrue(messages.get(4).getContent().contains("lib/a.rb"));
        assertFalse(messages.get(4).getContent().contains("PROJECT MANIFEST"));
        assertEquals(Message.system("brief"), messages.get(5));
        assertEquals(Message.user("now"), messages.get(6));
    }

    @Test
    void shouldUseCustomMessagesInsteadOfPrompt() {
        List<Message> custom = List.of(Message.user("step 1 of the plan"), Message.assistant("ack"));
        DivinationSession session = DivinationSession.builder()
                .prompt("ignored")
                .customMessages(custom)
                .build();

        List<Message> messages = composer.compose(session);

        assertEquals(custom, messages.subList(messages.size() - 2, messages.size()));
        assertFalse(messages.contains(Message.user("ignored")));
    }

    @Test
    void shouldSkipBriefingInReasoningMode() {
        DivinationSession session = DivinationSession.builder()
                .prompt("why")
                .reasoning(true)
                .build();

        List<Message> messages = composer.compose(session);

        assertEquals(Message.system("reason"), messages.get(0));
        assertFalse(messages.contains(Message.system("brief")));
    }

    @Test
    void shouldRenderCallerContextAsJson() throws Exception {
        ExtraContext extra = ExtraContext.builder()
                .callerContext(new LinkedHashMap<>(Map.of("task_id", 7)))
                .build();
        DivinationSession session = DivinationSession.builder()
                .prompt("go")
                .context(new AssembledContext(List.of(), extra))
                .build();

        String rendered = composer.compose(session).get(1).getContent();
        Map<?, ?> json = new ObjectMapper().readValue(
                rendered.substring(DivinationMessageComposer.CONTEXT_PREFIX.length()), Map.class);

        assertEquals(Map.of("task_id", 7), json.get("callerContext"));
    }

    // ==================== Prompts ====================

    @Test
    void shouldLoadPromptsFromClasspath() {
        SystemPromptProvider provider = new SystemPromptProvider(new DefaultResourceLoader(),
                "classpath:prompts/system.md", "classpath:prompts/reasoning.md");

        assertTrue(provider.promptFor(false).startsWith("You are the oracle"));
        assertTrue(provider.promptFor(true).contains("reasoning mode"));
    }

    @Test
    void shouldFallBackToBuiltInPromptWhenResourceMissing() {
        SystemPromptProvider provider = new SystemPromptProvider(new DefaultResourceLoader(),
                "classpath:prompts/missing.md", "");

        assertEquals(SystemPromptProvider.DEFAULT_SYSTEM_PROMPT, provider.promptFor(false));
        assertEquals(SystemPromptProvider.DEFAULT_REASONING_PROMPT, provider.promptFor(true));
    }
}
