package com.ddpport.workflow;

import org.json.JSONObject;

/**
 * Machine-readable progress event, e.g. {@code DONATED}. Best effort: losing one does not affect the workflow.
 */
public record StatusCommand(String key, String status) implements Command {

    public String payload() {
        return new JSONObject().put("status", status).toString();
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject()
                .put("__type__", "CommandSystemDonate")
                .put("key", key)
                .put("json_string", payload());
    }
}
