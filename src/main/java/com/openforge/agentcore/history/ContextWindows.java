package com.openforge.agentcore.history;

import com.openforge.agentcore.llm.model.Message;
import com.openforge.agentcore.llm.model.Role;
import com.openforge.agentcore.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a model context from a raw message log. Shared by every
 * {@link HistoryStore} backend so they slice identically.
 */
@Slf4j
public final class ContextWindows {

    private ContextWindows() {}

    /**
     * Repairs the message log, then keeps the last {@code maxTurns} turns.
     *
     * @param maxTurns turn limit; zero or negative keeps every turn
     */
    public static List<Message> lastTurns(List<Message> entries, int maxTurns) {
        List<List<Message>> turns = splitIntoTurns(repair(entries));
        int from = (maxTurns > 0 && turns.size() > maxTurns) ? turns.size() - maxTurns : 0;

        List<Message> context = new ArrayList<>();
        for (List<Message> turn : turns.subList(from, turns.size())) {
            context.addAll(turn);
        }
        return context;
    }

    /**
     * Keeps an assistant tool-call message only when every call it makes is
     * answered by the tool messages that directly follow it, and keeps a tool
     * message only as such an answer. Incomplete groups are dropped whole.
     * System messages are dropped; the persona is supplied per call.
     */
    static List<Message> repair(List<Message> entries) {
        List<Message> repaired = new ArrayList<>(entries.size());
        int i = 0;
        while (i < entries.size()) {
            Message message = entries.get(i);
            if (message.role() == Role.SYSTEM) {
                i++;
            } else if (message.role() == Role.TOOL) {
                log.debug("[Context] Dropping orphan tool message {}", message.toolCallId());
                i++;
            } else if (message.requestsTools()) {
                Map<String, Message> answers = new LinkedHashMap<>();
                Set<String> expected = new HashSet<>();
                for (ToolCall call : message.toolCalls()) {
                    expected.add(call.id());
                }
                int j = i + 1;
                while (j < entries.size() && entries.get(j).role() == Role.TOOL) {
                    Message toolMessage = entries.get(j);
                    if (expected.contains(toolMessage.toolCallId())) {
                        answers.putIfAbsent(toolMessage.toolCallId(), toolMessage);
                    }
                    j++;
                }
                if (answers.keySet().containsAll(expected)) {
                    repaired.add(message);
                    repaired.addAll(answers.values());
                } else {
                    log.warn("[Context] Dropping assistant tool-call message with {}/{} results",
                            answers.size(), expected.size());
                }
                i = j;
            } else {
                repaired.add(message);
                i++;
            }
        }
        return repaired;
    }

    private static List<List<Message>> splitIntoTurns(List<Message> messages) {
        List<List<Message>> turns = new ArrayList<>();
        List<Message> current = null;
        for (Message message : messages) {
            if (message.role() == Role.USER) {
                current = new ArrayList<>();
                turns.add(current);
            }
            // anything before the first user message belongs to no turn
            if (current != null) {
                current.add(message);
            }
        }
        return turns;
    }
}
