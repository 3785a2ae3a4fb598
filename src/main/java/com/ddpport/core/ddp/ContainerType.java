package com.ddpport.core.ddp;

/**
 * Payload format of the files inside an export; selects the parser used during extraction.
 */
public enum ContainerType {
    JSON,
    HTML,
    CSV
}
