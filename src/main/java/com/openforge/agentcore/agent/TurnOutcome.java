package com.openforge.agentcore.agent;

/**
 * Summary of a finished turn.
 *
 * @param finalContent    the persisted final assistant text; null when FAILED
 * @param budgetExhausted true when the tool-iteration limit forced the fallback reply
 */
public record TurnOutcome(
        TurnState state,
        int       modelCalls,
        int       toolIterations,
        String    finalContent,
        boolean   budgetExhausted
) {}
