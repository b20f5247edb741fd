package sh.harold.warden.api.platform;

public enum PlatformFailure {
    /** Target message, member, role or guild no longer exists. */
    NOT_FOUND(false),
    /** The platform refused the call for the acting identity. */
    FORBIDDEN(false),
    RATE_LIMITED(true),
    UNAVAILABLE(true);

    private final boolean transientFailure;

    PlatformFailure(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
