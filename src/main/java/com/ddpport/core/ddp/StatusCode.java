package com.ddpport.core.ddp;

/**
 * Outcome of validating a submitted file. Id {@code 0} always means "recognized, proceed".
 */
public record StatusCode(int id, String description, String message) {

    public boolean isRecognized() {
        return id == 0;
    }
}
