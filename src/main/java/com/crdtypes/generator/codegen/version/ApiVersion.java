package com.crdtypes.generator.codegen.version;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A Kubernetes API version label such as {@code v1}, {@code v2beta3} or
 * {@code v1alpha}, ordered by stability then number.
 *
 * Stable versions outrank beta, beta outranks alpha, and anything that does
 * not follow the convention ranks lowest and is compared lexically.
 */
@Getter
@EqualsAndHashCode
public final class ApiVersion implements Comparable<ApiVersion> {

    private static final Pattern LABEL = Pattern.compile("^v(\\d+)(?:(alpha|beta)(\\d*))?$");

    private static final Comparator<ApiVersion> ORDER = Comparator
            .comparing(ApiVersion::getStability)
            .thenComparingLong(ApiVersion::getMajor)
            .thenComparing(v -> v.minor, Comparator.nullsFirst(Comparator.<Long>naturalOrder()))
            .thenComparing(ApiVersion::getLabel, Comparator.reverseOrder());

    public enum Stability {
        OTHER,
        ALPHA,
        BETA,
        GA
    }

    private final String label;
    private final Stability stability;
    private final long major;
    private final Long minor;

    private ApiVersion(String label, Stability stability, long major, Long minor) {
        this.label = label;
        this.stability = stability;
        this.major = major;
        this.minor = minor;
    }

    public static ApiVersion parse(String label) {
        Matcher matcher = LABEL.matcher(label);
        if (!matcher.matches()) {
            return new ApiVersion(label, Stability.OTHER, 0, null);
        }
        try {
            long major = Long.parseLong(matcher.group(1));
            if (matcher.group(2) == null) {
                return new ApiVersion(label, Stability.GA, major, null);
            }
            Long minor = matcher.group(3).isEmpty() ? null : Long.valueOf(matcher.group(3));
            Stability stability = "alpha".equals(matcher.group(2)) ? Stability.ALPHA : Stability.BETA;
            return new ApiVersion(label, stability, major, minor);
        } catch (NumberFormatException e) {
            // too many digits for a version number
            return new ApiVersion(label, Stability.OTHER, 0, null);
        }
    }

    @Override
    public int compareTo(ApiVersion other) {
        return ORDER.compare(this, other);
    }

    /**
     * Highest priority first.
     */
    public static Comparator<String> priorityOrder() {
        return Comparator.comparing(ApiVersion::parse).reversed();
    }

    @Override
    public String toString() {
        return label;
    }
}
