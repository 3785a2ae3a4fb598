package com.ddpport.workflow;

import com.ddpport.core.table.Translatable;
import org.json.JSONObject;

import java.util.Objects;

/**
 * Shows a page to the participant. Every render command except the end page must be answered with
 * exactly one {@link HostResponse} before the workflow continues.
 *
 * @param platform platform the page belongs to, {@code null} for the end page
 */
public record RenderCommand(String platform, Translatable header, PromptBody body) implements Command {

    public RenderCommand {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
    }

    public boolean expectsResponse() {
        return !(body instanceof EndPage);
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject()
                .put("__type__", "CommandUIRender")
                .put("platform", platform == null ? JSONObject.NULL : platform)
                .put("header", header.toJson())
                .put("body", body.toJson());
    }
}
