package sh.harold.warden.api.messagebus;

/**
 * Channel identifiers used on the moderation message bus.
 */
public final class ChannelConstants {

    /** A sanction (warn, timeout, kick, ban, temp role) was applied to a member. */
    public static final String SANCTION_APPLIED = "warden.moderation.sanction.applied";

    /** A temporary sanction expired and was reversed (or dropped after a failed reversal). */
    public static final String SANCTION_REVERSED = "warden.moderation.sanction.reversed";

    private ChannelConstants() {
    }
}
