package org.trypticon.termfst.search;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Immutable settings for a {@link CompositeQuery}. Empty strings are treated as unset.
 */
public final class QueryOptions {
    private final String prefix;
    private final String startKey;
    private final String endKey;
    private final String regexPattern;
    private final String fuzzyPattern;
    private final int fuzzyMaxDistance;
    private final int limit;

    private QueryOptions(Builder builder) {
        this.prefix = builder.prefix;
        this.startKey = builder.startKey;
        this.endKey = builder.endKey;
        this.regexPattern = builder.regexPattern;
        this.fuzzyPattern = builder.fuzzyPattern;
        this.fuzzyMaxDistance = builder.fuzzyMaxDistance;
        this.limit = builder.limit;
    }

    /**
     * Creates a new builder with nothing set.
     *
     * @return the builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options which select every key.
     *
     * @return the options.
     */
    public static QueryOptions all() {
        return new Builder().build();
    }

    @Nullable
    public String getPrefix() {
        return prefix;
    }

    @Nullable
    public String getStartKey() {
        return startKey;
    }

    @Nullable
    public String getEndKey() {
        return endKey;
    }

    @Nullable
    public String getRegexPattern() {
        return regexPattern;
    }

    @Nullable
    public String getFuzzyPattern() {
        return fuzzyPattern;
    }

    public int getFuzzyMaxDistance() {
        return fuzzyMaxDistance;
    }

    /**
     * Gets the maximum number of keys returned.
     *
     * @return the limit, 0 meaning unlimited.
     */
    public int getLimit() {
        return limit;
    }

    boolean hasPrefix() {
        return prefix != null;
    }

    boolean hasRange() {
        return startKey != null || endKey != null;
    }

    @Override
    public String toString() {
        return "QueryOptions{prefix=" + prefix + ", startKey=" + startKey + ", endKey=" + endKey
                + ", regexPattern=" + regexPattern + ", fuzzyPattern=" + fuzzyPattern
                + ", fuzzyMaxDistance=" + fuzzyMaxDistance + ", limit=" + limit + '}';
    }

    /**
     * Builder for {@link QueryOptions}.
     */
    public static final class Builder {
        private String prefix;
        private String startKey;
        private String endKey;
        private String regexPattern;
        private String fuzzyPattern;
        private int fuzzyMaxDistance;
        private int limit;

        private Builder() {
        }

        @Nonnull
        public Builder prefix(@Nullable String prefix) {
            this.prefix = emptyToNull(prefix);
            return this;
        }

        /**
         * Restricts to the keys in {@code [startKey, endKey)}. Either end may be unset.
         *
         * @param startKey inclusive lower bound.
         * @param endKey exclusive upper bound.
         * @return this builder.
         */
        @Nonnull
        public Builder range(@Nullable String startKey, @Nullable String endKey) {
            this.startKey = emptyToNull(startKey);
            this.endKey = emptyToNull(endKey);
            return this;
        }

        @Nonnull
        public Builder regex(@Nullable String regexPattern) {
            this.regexPattern = emptyToNull(regexPattern);
            return this;
        }

        @Nonnull
        public Builder fuzzy(@Nullable String fuzzyPattern, int maxDistance) {
            if (maxDistance < 0) {
                throw new IllegalArgumentException("Fuzzy distance must be >= 0: " + maxDistance);
            }
            this.fuzzyPattern = emptyToNull(fuzzyPattern);
            this.fuzzyMaxDistance = maxDistance;
            return this;
        }

        @Nonnull
        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("Limit must be >= 0: " + limit);
            }
            this.limit = limit;
            return this;
        }

        @Nonnull
        public QueryOptions build() {
            return new QueryOptions(this);
        }

        private static String emptyToNull(String value) {
            return value == null || value.isEmpty() ? null : value;
        }
    }
}
