package com.openforge.agentcore.agent;

import java.time.Duration;

/**
 * Limits applied to every turn an engine runs.
 *
 * @param maxToolIterations tool-resolution cycles allowed per turn; also the
 *                          maximum number of model calls
 * @param contextTurns      past turns (the current one included) sent to the model
 * @param completionTimeout bound on one model call, from request to terminal event
 */
public record TurnSettings(
        int      maxToolIterations,
        int      contextTurns,
        Duration completionTimeout
) {

    public TurnSettings {
        if (maxToolIterations < 1) {
            throw new IllegalArgumentException("maxToolIterations must be at least 1");
        }
    }
}
