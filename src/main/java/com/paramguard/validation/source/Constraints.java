package com.paramguard.validation.source;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import com.paramguard.validation.error.ConstraintViolationException;

/**
 * Semantic rules attached to a source binding. Type conformance is checked before these
 * run, so each rule only applies to values of the kind it understands.
 */
public final class Constraints {
    private static final Constraints NONE = builder().build();

    private final Integer minStrLength;
    private final Integer maxStrLength;
    private final Integer minListLength;
    private final Integer maxListLength;
    private final Number minValue;
    private final Number maxValue;
    private final String whitelist;
    private final String blacklist;
    private final Pattern pattern;
    private final Set<String> contentTypes;
    private final Long minBytes;
    private final Long maxBytes;
    private final Predicate<Object> check;

    private Constraints(final Builder b) {
        this.minStrLength = b.minStrLength;
        this.maxStrLength = b.maxStrLength;
        this.minListLength = b.minListLength;
        this.maxListLength = b.maxListLength;
        this.minValue = b.minValue;
        this.maxValue = b.maxValue;
        this.whitelist = b.whitelist;
        this.blacklist = b.blacklist;
        this.pattern = b.pattern;
        this.contentTypes = b.contentTypes == null ? null : Set.copyOf(b.contentTypes);
        this.minBytes = b.minBytes;
        this.maxBytes = b.maxBytes;
        this.check = b.check;
    }

    public static Constraints none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check a converted value. Lists are checked for length, then element by element.
     *
     * @throws ConstraintViolationException with a reason such as "must be at least 18"
     */
    public void check(final Object value) throws ConstraintViolationException {
        if (value instanceof List<?> list) {
            if (minListLength != null && list.size() < minListLength) {
                throw new ConstraintViolationException("must have at least " + minListLength + " items");
            }
            if (maxListLength != null && list.size() > maxListLength) {
                throw new ConstraintViolationException("must have at most " + maxListLength + " items");
            }
            for (final Object element : list) {
                checkSingle(element);
            }
        } else {
            checkSingle(value);
        }
    }

    private void checkSingle(final Object value) throws ConstraintViolationException {
        if (value instanceof String s) {
            checkString(s);
        } else if (value instanceof Number n) {
            checkNumber(n);
        } else if (value instanceof UploadedFile f) {
            checkFile(f);
        }

        if (check != null && !check.test(value)) {
            throw new ConstraintViolationException("failed custom validation");
        }
    }

    private void checkString(final String s) throws ConstraintViolationException {
        if (minStrLength != null && s.length() < minStrLength) {
            throw new ConstraintViolationException("must have at least " + minStrLength + " characters");
        }
        if (maxStrLength != null && s.length() > maxStrLength) {
            throw new ConstraintViolationException("must have at most " + maxStrLength + " characters");
        }
        if (whitelist != null && s.chars().anyMatch(c -> whitelist.indexOf(c) < 0)) {
            throw new ConstraintViolationException("must contain only characters from '" + whitelist + "'");
        }
        if (blacklist != null && s.chars().anyMatch(c -> blacklist.indexOf(c) >= 0)) {
            throw new ConstraintViolationException("must not contain any of '" + blacklist + "'");
        }
        if (pattern != null && !pattern.matcher(s).matches()) {
            throw new ConstraintViolationException("must match pattern '" + pattern.pattern() + "'");
        }
    }

    private void checkNumber(final Number n) throws ConstraintViolationException {
        if (minValue != null && compare(n, minValue) < 0) {
            throw new ConstraintViolationException("must be at least " + minValue);
        }
        if (maxValue != null && compare(n, maxValue) > 0) {
            throw new ConstraintViolationException("must be at most " + maxValue);
        }
    }

    private void checkFile(final UploadedFile f) throws ConstraintViolationException {
        if (contentTypes != null && !contentTypes.isEmpty()
                && (f.contentType() == null || !contentTypes.contains(f.contentType()))) {
            throw new ConstraintViolationException("must have a content type in " + contentTypes.stream().sorted().toList());
        }
        if (minBytes != null && f.size() < minBytes) {
            throw new ConstraintViolationException("must be at least " + minBytes + " bytes");
        }
        if (maxBytes != null && f.size() > maxBytes) {
            throw new ConstraintViolationException("must be at most " + maxBytes + " bytes");
        }
    }

    private static int compare(final Number a, final Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean isIntegral(final Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
            || (n instanceof BigInteger big && big.bitLength() < 64);
    }

    public boolean isEmpty() {
        return minStrLength == null && maxStrLength == null && minListLength == null && maxListLength == null
            && minValue == null && maxValue == null && whitelist == null && blacklist == null && pattern == null
            && contentTypes == null && minBytes == null && maxBytes == null && check == null;
    }

    public Integer minStrLength() { return minStrLength; }
    public Integer maxStrLength() { return maxStrLength; }
    public Integer minListLength() { return minListLength; }
    public Integer maxListLength() { return maxListLength; }
    public Number minValue() { return minValue; }
    public Number maxValue() { return maxValue; }
    public String whitelist() { return whitelist; }
    public String blacklist() { return blacklist; }
    public Pattern pattern() { return pattern; }
    public Set<String> contentTypes() { return contentTypes; }
    public Long minBytes() { return minBytes; }
    public Long maxBytes() { return maxBytes; }

    public static final class Builder {
        private Integer minStrLength;
        private Integer maxStrLength;
        private Integer minListLength;
        private Integer maxListLength;
        private Number minValue;
        private Number maxValue;
        private String whitelist;
        private String blacklist;
        private Pattern pattern;
        private Set<String> contentTypes;
        private Long minBytes;
        private Long maxBytes;
        private Predicate<Object> check;

        private Builder() {}

        public Builder minStrLength(final int value) { this.minStrLength = value; return this; }
        public Builder maxStrLength(final int value) { this.maxStrLength = value; return this; }
        public Builder minListLength(final int value) { this.minListLength = value; return this; }
        public Builder maxListLength(final int value) { this.maxListLength = value; return this; }
        public Builder minValue(final Number value) { this.minValue = value; return this; }
        public Builder maxValue(final Number value) { this.maxValue = value; return this; }
        public Builder whitelist(final String chars) { this.whitelist = chars; return this; }
        public Builder blacklist(final String chars) { this.blacklist = chars; return this; }
        public Builder pattern(final String regex) { this.pattern = Pattern.compile(regex); return this; }
        public Builder contentTypes(final Set<String> types) { this.contentTypes = types; return this; }
        public Builder minBytes(final long value) { this.minBytes = value; return this; }
        public Builder maxBytes(final long value) { this.maxBytes = value; return this; }
        public Builder check(final Predicate<Object> predicate) { this.check = predicate; return this; }

        public Constraints build() {
            return new Constraints(this);
        }
    }
}
