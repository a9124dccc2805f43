package com.openforge.agentcore.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openforge.agentcore.history.ToolResult;
import com.openforge.agentcore.llm.model.ToolCall;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ExecutorService executor;
    private ToolRegistry    registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new ToolRegistry(objectMapper, executor, Duration.ofSeconds(2), 1, Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldDescribeToolsInRegistrationOrder() {
        for (String name : List.of("search_faq", "create_ticket", "update_ticket", "escalate")) {
            registry.register(spec(name), args -> null);
        }
        registry.seal();

        assertEquals(List.of("search_faq", "create_ticket", "update_ticket", "escalate"),
                registry.describeAll().stream().map(ToolSpec::name).toList());
        assertEquals("function", registry.toTools().get(0).type());
    }

    @Test
    void shouldRejectDuplicateNames() {
        registry.register(spec("lookup"), args -> null);

        DuplicateToolNameException e = assertThrows(DuplicateToolNameException.class,
                () -> registry.register(spec("lookup"), args -> null));
        assertEquals("Tool already registered: lookup", e.getMessage());
    }

    @Test
    void shouldRejectRegistrationAfterSeal() {
        registry.seal();

        assertThrows(IllegalStateException.class, () -> registry.register(spec("late"), args -> null));
    }

    @Test
    void shouldPassParsedArgumentsToHandler() {
        registry.register(spec("echo"), args -> new TextNode("hello " + args.get("name").asText()));
        registry.seal();

        ToolResult result = registry.dispatch(ToolCall.function("call_1", "echo", "{\"name\":\"Ada\"}"));

        assertTrue(result.isSuccess());
        assertEquals("call_1", result.toolCallId());
        assertEquals("hello Ada", result.modelContent());
        assertEquals("Ada", result.arguments().get("name").asText());
    }

    @Test
    void shouldTreatBlankArgumentsAsEmptyObject() {
        registry.register(spec("ping"), args -> new TextNode("size=" + args.size()));
        registry.seal();

        assertEquals("size=0", registry.dispatch(ToolCall.function("c", "ping", "")).modelContent());
    }

    @Test
    void shouldReturnErrorResultForUnknownTool() {
        registry.seal();

        ToolResult result = registry.dispatch(ToolCall.function("call_1", "missing", "{}"));

        assertFalse(result.isSuccess());
        assertEquals("Unknown tool: missing", result.error());
        assertThrows(UnknownToolException.class, () -> registry.lookup("missing"));
    }

    @Test
    void shouldReturnErrorResultForMalformedArguments() {
        registry.register(spec("echo"), args -> args);
        registry.seal();

        ToolResult notJson = registry.dispatch(ToolCall.function("c1", "echo", "{broken"));
        ToolResult notObject = registry.dispatch(ToolCall.function("c2", "echo", "[1, 2]"));

        assertTrue(notJson.error().startsWith("invalid arguments"));
        assertTrue(notObject.error().startsWith("invalid arguments"));
        assertNull(notJson.arguments());
    }

    @Test
    void shouldCaptureHandlerException() {
        registry.register(spec("boom"), args -> {
            throw new IllegalStateException("inventory service down");
        });
        registry.seal();

        ToolResult result = registry.dispatch(ToolCall.function("c1", "boom", "{}"));

        assertEquals("inventory service down", result.error());
        assertEquals("Error executing tool 'boom': inventory service down", result.modelContent());
    }

    @Test
    void shouldTimeOutSlowHandler() {
        ToolRegistry fast = new ToolRegistry(objectMapper, executor, Duration.ofMillis(100), 1, Duration.ofMillis(10));
        fast.register(spec("slow"), args -> {
            Thread.sleep(5_000);
            return new TextNode("late");
        });
        fast.seal();

        ToolResult result = fast.dispatch(ToolCall.function("c1", "slow", "{}"));

        assertEquals("timed out after 100ms", result.error());
    }

    @Test
    void shouldRetryFailingHandlerWhenConfigured() {
        ToolRegistry retrying = new ToolRegistry(objectMapper, executor, Duration.ofSeconds(1), 3, Duration.ofMillis(10));
        AtomicInteger attempts = new AtomicInteger();
        retrying.register(spec("flaky"), args -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("try again");
            }
            return new TextNode("ok");
        });
        retrying.seal();

        ToolResult result = retrying.dispatch(ToolCall.function("c1", "flaky", "{}"));

        assertTrue(result.isSuccess());
        assertEquals(3, attempts.get());
    }

    @Test
    void shouldRecordNullOutputAsJsonNull() {
        registry.register(spec("noop"), args -> null);
        registry.seal();

        ToolResult result = registry.dispatch(ToolCall.function("c1", "noop", "{}"));

        assertTrue(result.isSuccess());
        assertTrue(result.output().isNull());
    }

    @Test
    void shouldNotLetCallersChangeSealedSchema() {
        ObjectNode schema = objectMapper.createObjectNode().put("type", "object");
        registry.register(new ToolSpec("lookup", "find things", schema), args -> null);
        registry.seal();

        ((ObjectNode) registry.describeAll().get(0).parameters()).put("type", "string");
        schema.put("type", "array");

        assertEquals("object", registry.describeAll().get(0).parameters().get("type").asText());
        assertEquals("object", registry.toTools().get(0).function().parameters().get("type").asText());
    }

    @Test
    void shouldDispatchCallsConcurrentlyAndKeepCallOrder() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        registry.register(spec("slow"), args -> {
            bothStarted.countDown();
            if (!bothStarted.await(2, TimeUnit.SECONDS)) throw new IllegalStateException("ran alone");
            Thread.sleep(100);
            return new TextNode("slow done");
        });
        registry.register(spec("fast"), args -> {
            bothStarted.countDown();
            if (!bothStarted.await(2, TimeUnit.SECONDS)) throw new IllegalStateException("ran alone");
            return new TextNode("fast done");
        });
        registry.seal();

        List<ToolResult> results = registry.dispatchAll(List.of(
                ToolCall.function("c1", "slow", "{}"),
                ToolCall.function("c2", "fast", "{}"),
                ToolCall.function("c3", "missing", "{}")));

        assertEquals(List.of("c1", "c2", "c3"), results.stream().map(ToolResult::toolCallId).toList());
        assertEquals("slow done", results.get(0).modelContent());
        assertEquals("fast done", results.get(1).modelContent());
        assertFalse(results.get(2).isSuccess());
    }

    private static ToolSpec spec(String name) {
        return new ToolSpec(name, "test tool " + name, null);
    }
}
