package xrl.core.model;

/**
 * A granted but not yet settled admission.
 * The burst windows only record it once the caller commits.
 *
 * @param group the group the slot was reserved in
 * @param reservedAtNanos clock reading at grant time
 * @param secondaryLeg true if the per-minute leg holds a pending slot as well
 */
public record Reservation(
    RateLimitGroup group,
    long reservedAtNanos,
    boolean secondaryLeg
) {
}
