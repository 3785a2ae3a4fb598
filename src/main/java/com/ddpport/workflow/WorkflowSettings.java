package com.ddpport.workflow;

import com.ddpport.config.ConfigService;

import java.util.Objects;

/**
 * Session-independent options of a {@link DonationWorkflow}.
 *
 * @param fileExtensions accepted file types shown in the file prompt
 * @param donateLogs     whether the session log is donated at each step
 */
public record WorkflowSettings(String fileExtensions, boolean donateLogs) {

    public WorkflowSettings {
        Objects.requireNonNull(fileExtensions, "fileExtensions");
    }

    public static WorkflowSettings from(ConfigService config) {
        return new WorkflowSettings(config.getFileExtensions(), config.isDonateLogs());
    }
}
