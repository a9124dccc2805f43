package com.openforge.agentcore.customerservice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentcore.agent.AgentKind;
import com.openforge.agentcore.agent.AgentType;
import com.openforge.agentcore.tool.ToolRegistry;
import com.openforge.agentcore.tool.ToolSpec;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Support desk agent: answers from the FAQ catalog and opens or updates
 * tickets when a question needs follow-up.
 */
@Component
public class CustomerServiceAgentKind implements AgentKind {

    static final String PERSONA_LOCATION = "prompts/customer-service.md";

    private static final String CREATE_TICKET_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "customer_name":  {"type": "string", "description": "Full name of the customer"},
                "customer_email": {"type": "string", "description": "Email address of the customer"},
                "issue_type": {
                  "type": "string",
                  "enum": ["billing", "technical", "product", "account", "order", "refund", "general"],
                  "description": "Category of the issue"
                },
                "priority": {
                  "type": "string",
                  "enum": ["low", "medium", "high", "urgent"],
                  "description": "Priority level of the ticket"
                },
                "subject":      {"type": "string", "description": "One-line summary of the issue"},
                "description":  {"type": "string", "description": "What happened and what the customer needs"},
                "order_number": {"type": "string", "description": "Related order number, if any"},
                "product_name": {"type": "string", "description": "Related product, if any"}
              },
              "required": ["customer_name", "customer_email", "issue_type", "priority", "subject", "description"]
            }
            """;

    private static final String UPDATE_TICKET_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "ticket_id": {"type": "string", "description": "Identifier returned by create_ticket"},
                "status": {
                  "type": "string",
                  "enum": ["open", "in_progress", "waiting_for_customer", "resolved", "closed"],
                  "description": "New status of the ticket"
                },
                "update_message":   {"type": "string", "description": "Note to add to the ticket"},
                "assigned_to":      {"type": "string", "description": "Support agent now handling the ticket"},
                "resolution_notes": {"type": "string", "description": "How the issue was resolved"}
              },
              "required": ["ticket_id", "status", "update_message"]
            }
            """;

    private static final String SEARCH_FAQ_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "query": {"type": "string", "description": "The customer's question or search terms"},
                "category": {
                  "type": "string",
                  "enum": ["billing", "technical", "product", "account", "order", "refund", "all"],
                  "description": "Category to search, or 'all'"
                },
                "max_results": {"type": "integer", "description": "Maximum entries to return", "default": 3}
              },
              "required": ["query"]
            }
            """;

    private final ObjectMapper objectMapper;
    private final TicketDesk   ticketDesk;
    private final FaqCatalog   faqCatalog;
    private final String       persona;

    public CustomerServiceAgentKind(ObjectMapper objectMapper, TicketDesk ticketDesk, FaqCatalog faqCatalog) {
        this.objectMapper = objectMapper;
        this.ticketDesk   = ticketDesk;
        this.faqCatalog   = faqCatalog;
        this.persona      = loadPersona();
    }

    @Override
    public AgentType type() {
        return AgentType.CUSTOMER_SERVICE;
    }

    @Override
    public String persona() {
        return persona;
    }

    @Override
    public void registerTools(ToolRegistry registry) {
        registry.register(new ToolSpec("create_ticket",
                "Open a support ticket for an issue that needs tracking or escalation.",
                schema(CREATE_TICKET_SCHEMA)), ticketDesk::createTicket);
        registry.register(new ToolSpec("update_ticket",
                "Change the status of an existing support ticket and add a note to it.",
                schema(UPDATE_TICKET_SCHEMA)), ticketDesk::updateTicket);
        registry.register(new ToolSpec("search_faq",
                "Search the FAQ for answers to common customer questions.",
                schema(SEARCH_FAQ_SCHEMA)), faqCatalog::search);
    }

    private JsonNode schema(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid tool schema", e);
        }
    }

    private static String loadPersona() {
        try (InputStream in = new ClassPathResource(PERSONA_LOCATION).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load persona from " + PERSONA_LOCATION, e);
        }
    }
}
