package com.ddpport.workflow;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Fire-and-forget request to store {@code payload} (a JSON string) under {@code key}.
 */
public record DonateCommand(String key, String payload) implements Command {

    public DonateCommand {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject()
                .put("__type__", "CommandSystemDonate")
                .put("key", key)
                .put("json_string", payload);
    }
}
