package com.ddpport.core.ddp;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Fixed, ordered set of status codes a platform's validation can produce.
 */
public final class StatusCatalogue {
    public static final int VALID = 0;
    public static final int UNHANDLED_FORMAT = 1;
    public static final int NOT_VALID = 2;
    public static final int BAD_ARCHIVE = 3;

    private static final StatusCatalogue STANDARD = new StatusCatalogue(List.of(
            new StatusCode(VALID, "Valid DDP", ""),
            new StatusCode(UNHANDLED_FORMAT, "Valid DDP unhandled format", ""),
            new StatusCode(NOT_VALID, "Not a valid DDP", ""),
            new StatusCode(BAD_ARCHIVE, "Bad zipfile", "")
    ));

    private final List<StatusCode> codes;

    public StatusCatalogue(List<StatusCode> codes) {
        this.codes = List.copyOf(Objects.requireNonNull(codes, "codes"));
    }

    public static StatusCatalogue standard() {
        return STANDARD;
    }

    public List<StatusCode> codes() {
        return codes;
    }

    public StatusCode get(int id) {
        for (StatusCode code : codes) {
            if (code.id() == id) {
                return code;
            }
        }
        throw new NoSuchElementException("Unknown status code " + id);
    }
}
