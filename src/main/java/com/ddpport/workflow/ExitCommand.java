package com.ddpport.workflow;

import org.json.JSONObject;

/**
 * Signals that the session is complete.
 */
public record ExitCommand(int code, String message) implements Command {

    @Override
    public JSONObject toJson() {
        return new JSONObject()
                .put("__type__", "CommandSystemExit")
                .put("code", code)
                .put("info", message);
    }
}
