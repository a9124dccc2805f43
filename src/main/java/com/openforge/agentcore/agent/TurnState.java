package com.openforge.agentcore.agent;

/**
 * States of one conversation turn.
 *
 * BUILD_CONTEXT → AWAIT_MODEL → (DISPATCH_TOOLS → BUILD_CONTEXT → AWAIT_MODEL)*
 *   → EMIT_FINAL → DONE
 *
 * FAILED is absorbing and reachable from every non-terminal state.
 */
public enum TurnState {
    BUILD_CONTEXT,
    AWAIT_MODEL,
    DISPATCH_TOOLS,
    EMIT_FINAL,
    DONE,
    FAILED
}
