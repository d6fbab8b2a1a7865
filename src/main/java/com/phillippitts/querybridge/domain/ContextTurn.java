package com.phillippitts.querybridge.domain;

import java.util.Objects;

/**
 * One prior conversation turn passed to the worker as context.
 *
 * @param role speaker role, e.g. {@code user} or {@code assistant}
 * @param content turn text
 */
public record ContextTurn(String role, String content) {

    public ContextTurn {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
