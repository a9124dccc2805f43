package com.openforge.agentcore.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.agentcore.agent.event.OutputEvent;
import com.openforge.agentcore.config.AppConfig;
import com.openforge.agentcore.history.ConversationStats;
import com.openforge.agentcore.history.HistoryStore;
import com.openforge.agentcore.history.StorageUnavailableException;
import com.openforge.agentcore.llm.model.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AgentControllerTest {

    private static final String CHAT_BODY = """
            {"message": "Where is my order?", "chat_id": "c1", "user_id": "u1"}
            """;

    private static final String CHAT_BODY_WITH_METADATA = """
            {"message": "Where is my order?", "chat_id": "c1", "user_id": "u1",
             "extra_metadata": {"plan": "gold", "channel": "web"}}
            """;

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();

    private ExecutorService pumpExecutor;
    private AgentCache      agentCache;
    private AgentRegistry   agentRegistry;
    private HistoryStore    historyStore;
    private Agent           agent;
    private MockMvc         mockMvc;

    @BeforeEach
    void setUp() {
        pumpExecutor  = Executors.newSingleThreadExecutor();
        agentCache    = mock(AgentCache.class);
        agentRegistry = mock(AgentRegistry.class);
        historyStore  = mock(HistoryStore.class);
        agent         = mock(Agent.class);
        when(agentRegistry.availableTypes()).thenReturn(Set.of(AgentType.CUSTOMER_SERVICE));
        when(agentCache.getOrCreate(AgentType.CUSTOMER_SERVICE, "u1_c1")).thenReturn(agent);
        when(historyStore.backendName()).thenReturn("memory");
        mockMvc = mockMvc(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        pumpExecutor.shutdownNow();
    }

    @Test
    void shouldStreamTurnEventsAsSse() throws Exception {
        when(agent.processMessage("Where is my order?", "c1", null, true))
                .thenReturn(channel(OutputEvent.content("c1", "It shipped."), OutputEvent.done("c1")));

        MvcResult result = mockMvc.perform(post("/api/agents/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT_BODY))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(5_000);

        String body = result.getResponse().getContentAsString();
        assertTrue(body.contains("event:content"));
        assertTrue(body.contains("\"content\":\"It shipped.\""));
        assertTrue(body.contains("event:done"));
    }

    @Test
    void shouldCollectNonStreamingReply() throws Exception {
        when(agent.processMessage("Where is my order?", "c1", null, false))
                .thenReturn(channel(OutputEvent.content("c1", "It "), OutputEvent.content("c1", "shipped."),
                        OutputEvent.done("c1")));

        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("It shipped."))
                .andExpect(jsonPath("$.chat_id").value("c1"))
                .andExpect(jsonPath("$.user_id").value("u1"))
                .andExpect(jsonPath("$.agent_type").value("customer_service"));
    }

    @Test
    void shouldMapTurnErrorToBadGateway() throws Exception {
        when(agent.processMessage(anyString(), anyString(), any(), eq(false)))
                .thenReturn(channel(OutputEvent.error("c1", "Model call failed: provider down")));

        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT_BODY))
                .andExpect(status().isBadGateway());
    }

    @Test
    void shouldMapMissingReplyToGatewayTimeout() throws Exception {
        mockMvc = mockMvc(Duration.ofMillis(200));
        when(agent.processMessage(anyString(), anyString(), any(), eq(false)))
                .thenReturn(new OutputChannel("c1", 4));

        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT_BODY))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void shouldRejectBusyConversation() throws Exception {
        when(agent.processMessage(anyString(), anyString(), any(), anyBoolean()))
                .thenThrow(new ConversationBusyException("c1"));

        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT_BODY))
                .andExpect(status().isConflict());
    }

    @Test
    void shouldRejectUnknownAgentType() throws Exception {
        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message": "hi", "chat_id": "c1", "user_id": "u1", "agent_type": "sales"}
                                """))
                .andExpect(status().isBadRequest());
        verify(agentCache, never()).getOrCreate(any(), any());
    }

    @Test
    void shouldValidateRequestBody() throws Exception {
        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message": " ", "chat_id": "c1", "user_id": "u1"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldDescribeService() throws Exception {
        when(agentCache.size()).thenReturn(3L);

        mockMvc.perform(get("/api/agents/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available_agent_types[0]").value("customer_service"))
                .andExpect(jsonPath("$.history_store").value("memory"))
                .andExpect(jsonPath("$.cached_agents").value(3));
        mockMvc.perform(get("/api/agents/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void shouldExposeConversationHistory() throws Exception {
        when(historyStore.getContext("c1", 2)).thenReturn(List.of(Message.user("hi"), Message.assistantText("hello")));
        when(historyStore.stats("c1")).thenReturn(new ConversationStats("c1", 2, 0));

        mockMvc.perform(get("/api/agents/conversations/c1/messages").param("turns", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].role").value("user"))
                .andExpect(jsonPath("$[1].content").value("hello"));
        mockMvc.perform(get("/api/agents/conversations/c1/stats"))
                .andExpect(jsonPath("$.message_count").value(2));
    }

    @Test
    void shouldEvictCachedAgent() throws Exception {
        when(agentCache.evict(AgentType.CUSTOMER_SERVICE, "u1_c1")).thenReturn(true);

        mockMvc.perform(delete("/api/agents/cache/customer_service/u1_c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.evicted").value(true));
    }

    @Test
    void shouldRecordExtraMetadataInConversationState() throws Exception {
        when(agent.processMessage(anyString(), anyString(), any(), eq(false)))
                .thenReturn(channel(OutputEvent.content("c1", "It shipped."), OutputEvent.done("c1")));

        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT_BODY_WITH_METADATA))
                .andExpect(status().isOk());

        ArgumentCaptor<ObjectNode> update = ArgumentCaptor.forClass(ObjectNode.class);
        verify(historyStore).mergeState(eq("c1"), update.capture());
        assertEquals("u1", update.getValue().get("user_id").asText());
        assertEquals("gold", update.getValue().get("extra_metadata").get("plan").asText());
        assertEquals("web", update.getValue().get("extra_metadata").get("channel").asText());
    }

    @Test
    void shouldLeaveStateAloneWithoutMetadata() throws Exception {
        when(agent.processMessage(anyString(), anyString(), any(), eq(false)))
                .thenReturn(channel(OutputEvent.done("c1")));

        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT_BODY))
                .andExpect(status().isOk());

        verify(historyStore, never()).mergeState(anyString(), any());
    }

    @Test
    void shouldAnswerEvenWhenMetadataCannotBeStored() throws Exception {
        when(agent.processMessage(anyString(), anyString(), any(), eq(false)))
                .thenReturn(channel(OutputEvent.content("c1", "It shipped."), OutputEvent.done("c1")));
        when(historyStore.mergeState(anyString(), any()))
                .thenThrow(new StorageUnavailableException("redis down", null));

        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT_BODY_WITH_METADATA))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("It shipped."));
    }

    @Test
    void shouldNotRecordMetadataForBusyConversation() throws Exception {
        when(agent.processMessage(anyString(), anyString(), any(), anyBoolean()))
                .thenThrow(new ConversationBusyException("c1"));

        mockMvc.perform(post("/api/agents/chat/non-streaming")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT_BODY_WITH_METADATA))
                .andExpect(status().isConflict());

        verify(historyStore, never()).mergeState(anyString(), any());
    }

    @Test
    void shouldExposeConversationState() throws Exception {
        ObjectNode state = objectMapper.createObjectNode().put("chat_id", "c1").put("user_id", "u1");
        state.putObject("extra_metadata").put("plan", "gold");
        when(historyStore.getState("c1")).thenReturn(state);

        mockMvc.perform(get("/api/agents/conversations/c1/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chat_id").value("c1"))
                .andExpect(jsonPath("$.extra_metadata.plan").value("gold"));
    }

    @Test
    void shouldMapStorageFailureToServiceUnavailable() throws Exception {
        when(historyStore.getContext("c1", 0))
                .thenThrow(new StorageUnavailableException("Database unavailable for conversation c1", null));

        mockMvc.perform(get("/api/agents/conversations/c1/messages"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("storage_unavailable"));
    }

    private MockMvc mockMvc(Duration streamTimeout) {
        AgentController controller = new AgentController(agentCache, agentRegistry, historyStore,
                AgentTestSupport.properties(streamTimeout), pumpExecutor);
        return MockMvcBuilders.standaloneSetup(controller)
                .setMessageConverters(new StringHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    private static OutputChannel channel(OutputEvent... events) {
        OutputChannel channel = new OutputChannel("c1", 8);
        for (OutputEvent event : events) {
            channel.emit(event);
        }
        return channel;
    }
}
