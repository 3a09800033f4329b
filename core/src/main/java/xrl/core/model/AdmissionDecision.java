package xrl.core.model;

/**
 * Result of one admission check against a group.
 *
 * @param decision GRANT or DENY
 * @param waitNanos time to wait before re-checking (0 on grant)
 * @param reservation the reserved slot, present only on grant
 */
public record AdmissionDecision(
    Decision decision,
    long waitNanos,
    Reservation reservation
) {
    public static AdmissionDecision grant(Reservation reservation) {
        if (reservation == null) throw new IllegalArgumentException("reservation cannot be null");
        return new AdmissionDecision(Decision.GRANT, 0L, reservation);
    }

    public static AdmissionDecision deny(long waitNanos) {
        return new AdmissionDecision(Decision.DENY, Math.max(0L, waitNanos), null);
    }

    public boolean granted() {
        return decision == Decision.GRANT;
    }
}
