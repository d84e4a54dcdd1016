package dev.dettmer.vnitype.core;

import java.util.Properties;

/**
 * Engine options.
 *
 * <p>This is an immutable value type. Use {@link #defaults()},
 * {@link #builder()} or {@link #fromProperties(Properties)}.</p>
 */
public final class VniOptions {

    /** Property key for {@link #hostCommitsTriggerKey}. */
    public static final String HOST_COMMITS_TRIGGER_KEY = "vnitype.hostCommitsTriggerKey";

    /**
     * Contract with the host about trigger keys.
     *
     * <p>{@code true}: the host commits every printable key, trigger digits
     * included, to the field before the engine's operations are applied, so
     * the first rewrite of a trigger also deletes the digit.
     * {@code false}: the host suppresses keys the engine consumes, and no
     * extra character is deleted.</p>
     */
    public final boolean hostCommitsTriggerKey;

    private VniOptions(Builder builder) {
        this.hostCommitsTriggerKey = builder.hostCommitsTriggerKey;
    }

    /** @return options with the host committing trigger keys. */
    public static VniOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read options from properties. Missing keys keep their defaults.
     *
     * @param properties Source properties. Must not be null.
     */
    public static VniOptions fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("Properties must not be null");
        }
        Builder builder = builder();
        String commits = properties.getProperty(HOST_COMMITS_TRIGGER_KEY);
        if (commits != null) {
            builder.hostCommitsTriggerKey(Boolean.parseBoolean(commits.trim()));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "VniOptions{hostCommitsTriggerKey=" + hostCommitsTriggerKey + "}";
    }

    /** Builder for {@link VniOptions}. */
    public static final class Builder {

        private boolean hostCommitsTriggerKey = true;

        private Builder() {
        }

        public Builder hostCommitsTriggerKey(boolean value) {
            this.hostCommitsTriggerKey = value;
            return this;
        }

        public VniOptions build() {
            return new VniOptions(this);
        }
    }
}
