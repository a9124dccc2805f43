package com.openforge.agentcore.customerservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process support ticket book behind the create_ticket and update_ticket
 * tools. Tickets live as long as the process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketDesk {

    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    static final Set<String> PRIORITIES = Set.of("low", "medium", "high", "urgent");
    static final Set<String> STATUSES   = Set.of("open", "in_progress", "waiting_for_customer", "resolved", "closed");

    private final ObjectMapper        objectMapper;
    private final Map<String, Ticket> tickets = new ConcurrentHashMap<>();

    // ── Tool handlers ────────────────────────────────────────────────────────

    public ObjectNode createTicket(ObjectNode args) {
        String priority = required(args, "priority").toLowerCase(Locale.ROOT);
        if (!PRIORITIES.contains(priority)) {
            throw new IllegalArgumentException("priority must be one of " + PRIORITIES);
        }
        String ticketId = "TKT-%s-%s".formatted(LocalDate.now().format(ID_DATE),
                UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT));

        Ticket ticket = new Ticket(ticketId,
                required(args, "customer_name"),
                required(args, "customer_email"),
                required(args, "issue_type"),
                priority,
                required(args, "subject"),
                required(args, "description"),
                optional(args, "order_number"),
                optional(args, "product_name"));
        tickets.put(ticketId, ticket);
        log.info("[TicketDesk] Created ticket {} ({}) for {}", ticketId, priority, ticket.getCustomerName());

        ObjectNode result = objectMapper.createObjectNode();
        result.put("success", true);
        result.put("ticket_id", ticketId);
        result.put("message", "Support ticket %s has been created successfully.".formatted(ticketId));
        ObjectNode details = result.putObject("ticket_details");
        details.put("id", ticketId);
        details.put("status", ticket.getStatus());
        details.put("priority", priority);
        details.put("issue_type", ticket.getIssueType());
        details.put("subject", ticket.getSubject());
        details.put("estimated_response_time", estimatedResponseTime(priority));
        return result;
    }

    public ObjectNode updateTicket(ObjectNode args) {
        String ticketId = required(args, "ticket_id");
        String status   = required(args, "status").toLowerCase(Locale.ROOT);
        String message  = required(args, "update_message");
        if (!STATUSES.contains(status)) {
            throw new IllegalArgumentException("status must be one of " + STATUSES);
        }

        ObjectNode result = objectMapper.createObjectNode();
        Ticket ticket = tickets.get(ticketId);
        if (ticket == null) {
            result.put("success", false);
            result.put("error", "Ticket not found");
            result.put("message", "Ticket %s was not found in our system.".formatted(ticketId));
            return result;
        }

        Instant now = Instant.now();
        ticket.update(new TicketUpdate(now, message, status,
                optional(args, "assigned_to"), optional(args, "resolution_notes")));
        log.info("[TicketDesk] Updated ticket {} to status {}", ticketId, status);

        result.put("success", true);
        result.put("ticket_id", ticketId);
        result.put("message", "Ticket %s has been updated successfully.".formatted(ticketId));
        ObjectNode details = result.putObject("updated_details");
        details.put("id", ticketId);
        details.put("new_status", status);
        details.put("update_message", message);
        details.put("last_updated", now.toString());
        return result;
    }

    public Optional<Ticket> find(String ticketId) {
        return Optional.ofNullable(tickets.get(ticketId));
    }

    static String estimatedResponseTime(String priority) {
        return "high".equals(priority) || "urgent".equals(priority) ? "2-4 hours" : "24 hours";
    }

    // ── Argument helpers ─────────────────────────────────────────────────────

    private static String required(ObjectNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException("missing required field '%s'".formatted(field));
        }
        return value.asText().trim();
    }

    private static String optional(ObjectNode args, String field) {
        JsonNode value = args.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    // ── Model ────────────────────────────────────────────────────────────────

    public record TicketUpdate(Instant timestamp, String message, String status,
                               String assignedTo, String resolutionNotes) {}

    @Getter
    public static final class Ticket {
        private final String ticketId;
        private final String customerName;
        private final String customerEmail;
        private final String issueType;
        private final String priority;
        private final String subject;
        private final String description;
        private final String orderNumber;
        private final String productName;
        private final List<TicketUpdate> updates = new ArrayList<>();
        private String status = "open";

        Ticket(String ticketId, String customerName, String customerEmail, String issueType,
               String priority, String subject, String description,
               String orderNumber, String productName) {
            this.ticketId      = ticketId;
            this.customerName  = customerName;
            this.customerEmail = customerEmail;
            this.issueType     = issueType;
            this.priority      = priority;
            this.subject       = subject;
            this.description   = description;
            this.orderNumber   = orderNumber;
            this.productName   = productName;
            updates.add(new TicketUpdate(Instant.now(), "Ticket created: " + description, status, null, null));
        }

        synchronized void update(TicketUpdate update) {
            status = update.status();
            updates.add(update);
        }

        public synchronized String getStatus() {
            return status;
        }

        public synchronized List<TicketUpdate> getUpdates() {
            return List.copyOf(updates);
        }
    }
}
