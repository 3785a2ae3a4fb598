package com.ddpport.workflow;

import org.json.JSONObject;

/**
 * Instruction emitted by the workflow to its host.
 */
public interface Command {

    JSONObject toJson();
}
