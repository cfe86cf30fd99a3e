package personal.hatchery.reservation.booking.domain.model;

/**
 * Decision Value Object
 * 충돌 판정 결과: Admit 또는 Reject(reason)
 */
public record Decision(
        boolean admitted,
        RejectionReason reason
) {
    private static final Decision ADMIT = new Decision(true, null);

    public Decision {
        if (admitted && reason != null) {
            throw new IllegalArgumentException("Admitted decision cannot carry a rejection reason");
        }
        if (!admitted && reason == null) {
            throw new IllegalArgumentException("Rejected decision requires a reason");
        }
    }

    public static Decision admit() {
        return ADMIT;
    }

    public static Decision reject(RejectionReason reason) {
        return new Decision(false, reason);
    }

    public boolean isRejected() {
        return !admitted;
    }
}
