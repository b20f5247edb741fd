package sh.harold.warden.moderation.interaction;

/**
 * Slash command and option names shared by the gateway adapter and the router.
 */
public final class SlashCommands {

    public static final String WARN = "warn";
    public static final String KICK = "kick";
    public static final String BAN = "ban";
    public static final String TEMP_ROLE = "temprole";
    public static final String VIOLATIONS = "violations";
    public static final String CLEAR_VIOLATIONS = "clearviolations";
    public static final String APPEAL = "appeal";

    public static final String OPTION_USER = "user";
    public static final String OPTION_REASON = "reason";
    public static final String OPTION_DURATION = "duration";
    public static final String OPTION_ROLE = "role";

    private SlashCommands() {
    }
}
