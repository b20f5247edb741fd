package sh.harold.warden.moderation.platform.jda;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.guild.GuildJoinEvent;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.platform.InboundMessage;
import sh.harold.warden.moderation.automod.AutoModerationPipeline;
import sh.harold.warden.moderation.interaction.SlashCommandRouter;
import sh.harold.warden.moderation.interaction.SlashCommands;
import sh.harold.warden.moderation.interaction.SlashRequest;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Translates gateway events into pipeline and router calls. Work is handed to the service
 * executor so blocking platform calls stay off the gateway thread.
 */
public final class JdaGatewayListener extends ListenerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdaGatewayListener.class);

    private final AutoModerationPipeline pipeline;
    private final SlashCommandRouter router;
    private final Executor executor;

    public JdaGatewayListener(AutoModerationPipeline pipeline, SlashCommandRouter router, Executor executor) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.router = Objects.requireNonNull(router, "router");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    static List<SlashCommandData> commandDefinitions() {
        return List.of(
                Commands.slash(SlashCommands.WARN, "Warn a member")
                        .addOption(OptionType.USER, SlashCommands.OPTION_USER, "Member to warn", true)
                        .addOption(OptionType.STRING, SlashCommands.OPTION_REASON, "Reason for the warning", true),
                Commands.slash(SlashCommands.KICK, "Kick a member")
                        .addOption(OptionType.USER, SlashCommands.OPTION_USER, "Member to kick", true)
                        .addOption(OptionType.STRING, SlashCommands.OPTION_REASON, "Reason for the kick", false),
                Commands.slash(SlashCommands.BAN, "Ban a member")
                        .addOption(OptionType.USER, SlashCommands.OPTION_USER, "Member to ban", true)
                        .addOption(OptionType.STRING, SlashCommands.OPTION_DURATION, "Ban length such as 7d; permanent if omitted", false)
                        .addOption(OptionType.STRING, SlashCommands.OPTION_REASON, "Reason for the ban", false),
                Commands.slash(SlashCommands.TEMP_ROLE, "Give a member a role for a limited time")
                        .addOption(OptionType.USER, SlashCommands.OPTION_USER, "Member to receive the role", true)
                        .addOption(OptionType.ROLE, SlashCommands.OPTION_ROLE, "Role to grant", true)
                        .addOption(OptionType.STRING, SlashCommands.OPTION_DURATION, "How long, such as 2h", true),
                Commands.slash(SlashCommands.VIOLATIONS, "Show a member's active violations")
                        .addOption(OptionType.USER, SlashCommands.OPTION_USER, "Member to inspect", true),
                Commands.slash(SlashCommands.CLEAR_VIOLATIONS, "Erase a member's violation history")
                        .addOption(OptionType.USER, SlashCommands.OPTION_USER, "Member to clear", true),
                Commands.slash(SlashCommands.APPEAL, "Appeal a sanction")
                        .addOption(OptionType.STRING, SlashCommands.OPTION_REASON, "Why the sanction should be lifted", true)
        );
    }

    /**
     * Replaces the application's global slash commands with the moderation set.
     */
    public static void registerCommands(JDA jda) {
        jda.updateCommands().addCommands(commandDefinitions()).queue(
                commands -> LOGGER.info("Registered {} slash commands", commands.size()),
                failure -> LOGGER.error("Failed to register slash commands", failure));
    }

    @Override
    public void onGuildJoin(GuildJoinEvent event) {
        long guildId = event.getGuild().getIdLong();
        dispatch("guild join " + guildId, () -> pipeline.onGuildJoin(guildId));
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        if (!event.isFromGuild() || event.isWebhookMessage()) {
            return;
        }
        InboundMessage message = toInbound(event);
        dispatch("message " + message.messageId(), () -> pipeline.onMessage(message));
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        if (!event.isFromGuild() || event.getGuild() == null) {
            event.reply("This command can only be used in a server.").setEphemeral(true).queue();
            return;
        }

        Map<String, String> options = new HashMap<>();
        for (OptionMapping option : event.getOptions()) {
            options.put(option.getName(), switch (option.getType()) {
                case USER -> option.getAsUser().getId();
                case ROLE -> option.getAsRole().getId();
                default -> option.getAsString();
            });
        }
        SlashRequest request = new SlashRequest(event.getName(), event.getGuild().getIdLong(),
                event.getUser().getIdLong(), options);

        event.deferReply(true).queue();
        dispatch("/" + request.command(), () -> {
            String reply = router.handle(request);
            event.getHook().editOriginal(reply).queue(
                    ignored -> {
                    },
                    failure -> LOGGER.warn("Failed to answer /{}: {}", request.command(), failure.getMessage()));
        });
    }

    private void dispatch(String description, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOGGER.error("Unhandled failure while processing {}", description, e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Dropped {}: service is shutting down", description);
        }
    }

    static InboundMessage toInbound(MessageReceivedEvent event) {
        Message message = event.getMessage();
        User author = event.getAuthor();
        Member member = event.getMember();
        Set<Long> roleIds = member == null
                ? Set.of()
                : member.getRoles().stream().map(Role::getIdLong).collect(Collectors.toSet());
        List<Long> mentions = message.getMentions().getUsers().stream()
                .map(User::getIdLong)
                .collect(Collectors.toList());
        return new InboundMessage(
                event.getGuild().getIdLong(),
                event.getChannel().getIdLong(),
                message.getIdLong(),
                author.getIdLong(),
                author.isBot(),
                roleIds,
                message.getContentRaw(),
                mentions,
                message.getTimeCreated().toInstant());
    }
}
