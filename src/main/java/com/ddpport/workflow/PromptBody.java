package com.ddpport.workflow;

import org.json.JSONObject;

/**
 * Content of a rendered page.
 */
public interface PromptBody {

    JSONObject toJson();
}
