package com.ddpport.workflow;

/**
 * States of the per-platform donation flow. {@link #DONATED}, {@link #SKIPPED} and
 * {@link #SKIPPED_AFTER_REVIEW} end a platform; {@link #FINISHED} ends the session.
 */
public enum WorkflowState {
    PROMPT_FILE,
    VALIDATING,
    EXTRACTING,
    RETRY_CONFIRM,
    REVIEW_CONSENT,
    DONATED,
    SKIPPED,
    SKIPPED_AFTER_REVIEW,
    FINISHED
}
