package com.ddpport.workflow;

import org.json.JSONObject;

/**
 * Final page of a session; needs no response.
 */
public record EndPage() implements PromptBody {

    @Override
    public JSONObject toJson() {
        return new JSONObject().put("__type__", "PropsUIPageEnd");
    }
}
