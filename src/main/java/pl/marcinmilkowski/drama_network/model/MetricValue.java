package pl.marcinmilkowski.drama_network.model;

/**
 * A numeric statistic that is either defined or undefined for a play.
 *
 * Undefined values carry the condition that made them undefined (empty graph,
 * disconnected graph, division by zero, ...) and render as {@code NaN} in
 * exported tables. Counts render without a fractional part.
 */
public record MetricValue(
    double value,              // Only meaningful when undefinedReason is null
    String undefinedReason,    // null for defined values
    boolean integral           // A whole-number count, e.g. a degree
) {

    public static final String NAN = "NaN";

    public static MetricValue of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return undefined("not a finite number");
        }
        return new MetricValue(value, null, false);
    }

    public static MetricValue ofCount(long count) {
        return new MetricValue(count, null, true);
    }

    public static MetricValue undefined(String reason) {
        return new MetricValue(Double.NaN, reason != null ? reason : "undefined", false);
    }

    public boolean isDefined() {
        return undefinedReason == null;
    }

    /**
     * Get the value, or {@link Double#NaN} when undefined.
     */
    public double orNaN() {
        return isDefined() ? value : Double.NaN;
    }

    /**
     * Value for JSON output: a number, or the string "NaN".
     */
    public Object toJsonValue() {
        if (!isDefined()) {
            return NAN;
        }
        return integral ? (Object) (long) value : (Object) value;
    }

    @Override
    public String toString() {
        if (!isDefined()) {
            return NAN;
        }
        return integral ? Long.toString((long) value) : String.valueOf(value);
    }
}
