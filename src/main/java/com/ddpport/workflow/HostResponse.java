package com.ddpport.workflow;

import java.util.Objects;

/**
 * Answer the host gives to a render command.
 *
 * @param kind  what the participant did
 * @param value file reference for {@link Kind#STRING}, consent payload for {@link Kind#JSON}, otherwise empty
 */
public record HostResponse(Kind kind, String value) {

    public enum Kind {
        /** A string value, e.g. the path of the chosen file. */
        STRING,
        /** Confirmation ("try again"). */
        TRUE,
        FALSE,
        /** Structured value: the accepted consent form. */
        JSON,
        /** The participant skipped this step. */
        NONE
    }

    public HostResponse {
        Objects.requireNonNull(kind, "kind");
        value = value == null ? "" : value;
    }

    public static HostResponse string(String value) {
        return new HostResponse(Kind.STRING, Objects.requireNonNull(value, "value"));
    }

    public static HostResponse ofTrue() {
        return new HostResponse(Kind.TRUE, "");
    }

    public static HostResponse ofFalse() {
        return new HostResponse(Kind.FALSE, "");
    }

    public static HostResponse json(String value) {
        return new HostResponse(Kind.JSON, value);
    }

    public static HostResponse none() {
        return new HostResponse(Kind.NONE, "");
    }
}
