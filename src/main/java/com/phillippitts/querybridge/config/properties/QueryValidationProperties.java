package com.phillippitts.querybridge.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Input limits enforced before a query can reach the worker.
 *
 * @param maxLength maximum query length in characters
 * @param maxContextTurns maximum number of prior turns passed as context
 */
@ConfigurationProperties(prefix = "query.validation")
@Validated
public record QueryValidationProperties(
        @DefaultValue("2000")
        @Positive(message = "Max length must be positive")
        int maxLength,

        @DefaultValue("20")
        @PositiveOrZero(message = "Max context turns must not be negative")
        int maxContextTurns
) {
    public static QueryValidationProperties defaults() {
        return new QueryValidationProperties(2000, 20);
    }
}
