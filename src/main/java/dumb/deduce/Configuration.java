package dumb.deduce;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import static dumb.deduce.prop.Semantics.MAX_VARIABLES;

/**
 * Settings of a {@link Deduce} instance. Keys missing from a JSON document
 * take their defaults.
 */
public record Configuration(
        @JsonProperty("freshNamePrefix") String freshNamePrefix,
        @JsonProperty("truthTableLimit") int truthTableLimit,
        @JsonProperty("verifyProofs") boolean verifyProofs
) {
    public static final String DEFAULT_FRESH_NAME_PREFIX = "z";
    public static final int DEFAULT_TRUTH_TABLE_LIMIT = 16;
    public static final boolean DEFAULT_VERIFY_PROOFS = true;

    public Configuration {
        if (!Names.isPropVariable(freshNamePrefix) || freshNamePrefix.length() != 1)
            throw new IllegalArgumentException("freshNamePrefix must be a single letter in [p-z]: " + freshNamePrefix);
        if (truthTableLimit < 0 || truthTableLimit > MAX_VARIABLES)
            throw new IllegalArgumentException("truthTableLimit must be within [0, " + MAX_VARIABLES + "]: " + truthTableLimit);
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("freshNamePrefix") String freshNamePrefix,
            @JsonProperty("truthTableLimit") Integer truthTableLimit,
            @JsonProperty("verifyProofs") Boolean verifyProofs
    ) {
        this(
                freshNamePrefix != null ? freshNamePrefix : DEFAULT_FRESH_NAME_PREFIX,
                truthTableLimit != null ? truthTableLimit.intValue() : DEFAULT_TRUTH_TABLE_LIMIT,
                verifyProofs != null ? verifyProofs.booleanValue() : DEFAULT_VERIFY_PROOFS
        );
    }

    public Configuration() {
        this(DEFAULT_FRESH_NAME_PREFIX, DEFAULT_TRUTH_TABLE_LIMIT, DEFAULT_VERIFY_PROOFS);
    }
}
