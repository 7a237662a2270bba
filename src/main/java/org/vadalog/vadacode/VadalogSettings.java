package org.vadalog.vadacode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Immutable configuration of the analysis, passed to every
 * {@link VadalogDocument} at construction.
 */
public final class VadalogSettings {
    private static final Logger log = LoggerFactory.getLogger(VadalogSettings.class);

    public static final String RESOURCE = "vadacode.properties";
    public static final String DEFAULT_FRAGMENT = "vadacode.defaultFragment";
    public static final String REASONER_ENDPOINT = "vadacode.reasonerEndpoint";
    public static final String STRICT = "vadacode.strict";

    private final Fragment defaultFragment;
    private final String reasonerEndpoint;
    private final boolean strict;

    private VadalogSettings(Builder builder) {
        this.defaultFragment = builder.defaultFragment;
        this.reasonerEndpoint = builder.reasonerEndpoint;
        this.strict = builder.strict;
    }

    public Fragment getDefaultFragment() { return defaultFragment; }

    /** Endpoint of the reasoner service. Only carried for the editor layer. */
    public String getReasonerEndpoint() { return reasonerEndpoint; }

    /** Whether analysis failures are rethrown instead of degrading to fewer diagnostics. */
    public boolean isStrict() { return strict; }

    public static VadalogSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the known keys. Missing keys keep their default.
     *
     * @throws IllegalArgumentException on an unknown fragment label
     */
    public static VadalogSettings fromProperties(Properties properties) {
        Builder builder = builder();
        String fragment = properties.getProperty(DEFAULT_FRAGMENT);
        if (fragment != null && !fragment.isBlank()) {
            builder.defaultFragment(Fragment.fromLabel(fragment));
        }
        String endpoint = properties.getProperty(REASONER_ENDPOINT);
        if (endpoint != null && !endpoint.isBlank()) {
            builder.reasonerEndpoint(endpoint.trim());
        }
        String strict = properties.getProperty(STRICT);
        if (strict != null) {
            builder.strict(Boolean.parseBoolean(strict.trim()));
        }
        return builder.build();
    }

    /**
     * Loads {@value #RESOURCE} from the classpath, when present, then applies
     * system properties with the same keys on top.
     */
    public static VadalogSettings load() {
        Properties properties = new Properties();
        try (InputStream in = VadalogSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                log.debug("No {} on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        for (String key : List.of(DEFAULT_FRAGMENT, REASONER_ENDPOINT, STRICT)) {
            String value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return fromProperties(properties);
    }

    @Override
    public String toString() {
        return "VadalogSettings{defaultFragment=" + defaultFragment + ", reasonerEndpoint=" + reasonerEndpoint
                + ", strict=" + strict + "}";
    }

    public static final class Builder {
        private Fragment defaultFragment = Fragment.DATALOG_EXISTENTIAL;
        private String reasonerEndpoint = "http://127.0.0.1:8080";
        private boolean strict = false;

        private Builder() {
        }

        public Builder defaultFragment(Fragment defaultFragment) {
            this.defaultFragment = Objects.requireNonNull(defaultFragment, "defaultFragment");
            return this;
        }

        public Builder reasonerEndpoint(String reasonerEndpoint) {
            this.reasonerEndpoint = Objects.requireNonNull(reasonerEndpoint, "reasonerEndpoint");
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public VadalogSettings build() {
            return new VadalogSettings(this);
        }
    }
}
