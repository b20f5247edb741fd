package sh.harold.warden.moderation;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.fusesource.jansi.AnsiConsole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.data.DocumentStore;
import sh.harold.warden.api.data.impl.json.JsonFileDocumentStore;
import sh.harold.warden.api.data.impl.memory.InMemoryDocumentStore;
import sh.harold.warden.api.data.impl.redis.RedisDocumentStore;
import sh.harold.warden.api.messagebus.MessageBus;
import sh.harold.warden.api.messagebus.impl.InMemoryMessageBus;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.util.ObjectMappers;
import sh.harold.warden.moderation.appeal.AppealStore;
import sh.harold.warden.moderation.automod.AutoModerationPipeline;
import sh.harold.warden.moderation.config.ServiceSettings;
import sh.harold.warden.moderation.config.ServiceSettingsLoader;
import sh.harold.warden.moderation.console.CommandRegistry;
import sh.harold.warden.moderation.console.InteractiveConsole;
import sh.harold.warden.moderation.console.commands.AppealsCommand;
import sh.harold.warden.moderation.console.commands.AutoModCommand;
import sh.harold.warden.moderation.console.commands.BanCommand;
import sh.harold.warden.moderation.console.commands.ClearViolationsCommand;
import sh.harold.warden.moderation.console.commands.HelpCommand;
import sh.harold.warden.moderation.console.commands.KickCommand;
import sh.harold.warden.moderation.console.commands.StatusCommand;
import sh.harold.warden.moderation.console.commands.StopCommand;
import sh.harold.warden.moderation.console.commands.TempRoleCommand;
import sh.harold.warden.moderation.console.commands.ViolationsCommand;
import sh.harold.warden.moderation.console.commands.WarnCommand;
import sh.harold.warden.moderation.console.commands.WarningsCommand;
import sh.harold.warden.moderation.console.commands.WhitelistCommand;
import sh.harold.warden.moderation.detection.RoleWhitelist;
import sh.harold.warden.moderation.detection.RuleDetector;
import sh.harold.warden.moderation.detection.SpamTracker;
import sh.harold.warden.moderation.effects.AuditLogSubscriber;
import sh.harold.warden.moderation.effects.ReputationLedger;
import sh.harold.warden.moderation.effects.ReputationSubscriber;
import sh.harold.warden.moderation.guild.GuildConfigStore;
import sh.harold.warden.moderation.interaction.SlashCommandRouter;
import sh.harold.warden.moderation.ledger.ViolationLedger;
import sh.harold.warden.moderation.ledger.WarningLedger;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;
import sh.harold.warden.moderation.platform.jda.JdaChatPlatform;
import sh.harold.warden.moderation.platform.jda.JdaGatewayListener;
import sh.harold.warden.moderation.sanction.ModerationActions;
import sh.harold.warden.moderation.sanction.SanctionExecutor;
import sh.harold.warden.moderation.schedule.RetentionSweeper;
import sh.harold.warden.moderation.schedule.TemporalSanctionScheduler;
import sh.harold.warden.moderation.schedule.TemporarySanctionRegistry;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Standalone moderation service. Wires storage, the moderation core and the Discord gateway,
 * then blocks until shutdown.
 */
public class ModerationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModerationService.class);
    private static final String SENDER_ID = "warden-moderation";

    private final ServiceSettings settings;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final DocumentStore documentStore;
    private final ResourceLockRegistry locks;
    private final GuildConfigStore guildConfigStore;
    private final RoleWhitelist roleWhitelist;
    private final ViolationLedger violationLedger;
    private final WarningLedger warningLedger;
    private final TemporarySanctionRegistry temporarySanctions;
    private final ReputationLedger reputationLedger;
    private final AppealStore appealStore;
    private final SpamTracker spamTracker;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final MessageBus messageBus;

    private JDA jda;
    private TemporalSanctionScheduler sanctionScheduler;
    private RetentionSweeper retentionSweeper;
    private InteractiveConsole console;

    public ModerationService(ServiceSettings settings) {
        this.settings = settings;
        this.clock = Clock.systemUTC();
        this.objectMapper = ObjectMappers.create();
        this.scheduler = Executors.newScheduledThreadPool(2);
        this.workers = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()));

        ServiceSettings.ModerationSettings moderation = settings.moderation();
        this.documentStore = createDocumentStore(settings.storage());
        this.locks = new ResourceLockRegistry(moderation.lockTimeout());
        this.guildConfigStore = new GuildConfigStore(documentStore, objectMapper, locks);
        this.roleWhitelist = new RoleWhitelist(documentStore, locks);
        this.violationLedger = new ViolationLedger(documentStore, locks, moderation.escalation(), moderation.retention());
        this.warningLedger = new WarningLedger(documentStore, locks);
        this.temporarySanctions = new TemporarySanctionRegistry(documentStore, locks);
        this.reputationLedger = new ReputationLedger(documentStore);
        this.appealStore = new AppealStore(documentStore, locks, clock);
        this.spamTracker = new SpamTracker(locks);
        this.messageBus = new InMemoryMessageBus(SENDER_ID, objectMapper, Executors.newSingleThreadExecutor(), clock);
    }

    public static void main(String[] args) {
        AnsiConsole.systemInstall();
        ServiceSettings settings;
        try {
            settings = new ServiceSettingsLoader().load(args.length > 0 ? Path.of(args[0]) : null);
        } catch (ValidationException e) {
            LOGGER.error("Refusing to start with invalid configuration:");
            e.getErrors().forEach(error -> LOGGER.error("  - {}", error));
            AnsiConsole.systemUninstall();
            System.exit(1);
            return;
        }
        new ModerationService(settings).start();
    }

    public void start() {
        displayBanner();
        LOGGER.info("Starting Warden moderation service (storage: {})", settings.storage().type().getId());

        try {
            loadDocuments();

            if (!settings.discord().hasToken()) {
                throw new IllegalStateException("discord.token is not configured (set DISCORD_TOKEN)");
            }
            jda = JDABuilder.createDefault(settings.discord().token())
                    .enableIntents(GatewayIntent.MESSAGE_CONTENT, GatewayIntent.GUILD_MEMBERS)
                    .build();
            jda.awaitReady();
            ChatPlatform platform = new JdaChatPlatform(jda, settings.moderation().auditChannel());

            SanctionExecutor sanctionExecutor = new SanctionExecutor(platform, violationLedger, warningLedger,
                    settings.moderation().escalation(), locks, messageBus, clock);
            ModerationActions actions = new ModerationActions(platform, sanctionExecutor, violationLedger,
                    warningLedger, temporarySanctions, locks, messageBus, clock);
            AutoModerationPipeline pipeline = new AutoModerationPipeline(guildConfigStore, roleWhitelist,
                    new RuleDetector(spamTracker), sanctionExecutor, platform);

            new ReputationSubscriber(reputationLedger, objectMapper, settings.moderation().reputationPenaltyPerSeverity())
                    .register(messageBus);
            new AuditLogSubscriber(platform, objectMapper).register(messageBus);

            sanctionScheduler = new TemporalSanctionScheduler(temporarySanctions, platform, locks, messageBus,
                    scheduler, clock, settings.moderation().schedulerInterval());
            sanctionScheduler.start();
            retentionSweeper = new RetentionSweeper(violationLedger, spamTracker, scheduler, clock,
                    settings.moderation().retentionSweepInterval());
            retentionSweeper.start();

            jda.addEventListener(new JdaGatewayListener(pipeline, new SlashCommandRouter(actions, appealStore, platform), workers));
            JdaGatewayListener.registerCommands(jda);

            if (settings.consoleEnabled()) {
                initializeConsole(actions, platform);
            }

            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "Warden-ShutdownHook"));
            LOGGER.info("Warden moderation service started in {} guild(s)", jda.getGuilds().size());

            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while running, shutting down");
            shutdown();
        } catch (Exception e) {
            LOGGER.error("Failed to start moderation service", e);
            shutdown();
            System.exit(1);
        }
    }

    private void loadDocuments() {
        guildConfigStore.load();
        roleWhitelist.load();
        violationLedger.load();
        warningLedger.load();
        temporarySanctions.load();
        reputationLedger.load();
        appealStore.load();
        LOGGER.info("Loaded {} guild configuration(s) and {} pending temporary sanction(s)",
                guildConfigStore.size(), temporarySanctions.size());
    }

    private void initializeConsole(ModerationActions actions, ChatPlatform platform) {
        CommandRegistry commandRegistry = new CommandRegistry();
        commandRegistry.register(new HelpCommand(commandRegistry));
        commandRegistry.register(new StatusCommand(this::statusCounters, clock));
        commandRegistry.register(new WarnCommand(actions, platform));
        commandRegistry.register(new KickCommand(actions, platform));
        commandRegistry.register(new BanCommand(actions, platform));
        commandRegistry.register(new TempRoleCommand(actions, platform));
        commandRegistry.register(new ViolationsCommand(actions));
        commandRegistry.register(new WarningsCommand(actions));
        commandRegistry.register(new ClearViolationsCommand(actions, platform));
        commandRegistry.register(new WhitelistCommand(roleWhitelist));
        commandRegistry.register(new AutoModCommand(guildConfigStore));
        commandRegistry.register(new AppealsCommand(appealStore));
        commandRegistry.register(new StopCommand(this::shutdown));

        console = new InteractiveConsole(commandRegistry);
        console.start();
        LOGGER.info("Type 'help' for available commands");
    }

    private Map<String, Object> statusCounters() {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("Storage", settings.storage().type().getId());
        counters.put("Guilds connected", jda == null ? 0 : jda.getGuilds().size());
        counters.put("Guild configurations", guildConfigStore.size());
        counters.put("Pending temporary sanctions", temporarySanctions.size());
        counters.put("Tracked spam windows", spamTracker.trackedMembers());
        counters.put("Resource locks", locks.size());
        counters.put("Violation retention", settings.moderation().retention().toDays() + "d");
        return counters;
    }

    private DocumentStore createDocumentStore(ServiceSettings.StorageSettings storage) {
        return switch (storage.type()) {
            case JSON -> new JsonFileDocumentStore(storage.jsonDirectory(), objectMapper, clock);
            case REDIS -> new RedisDocumentStore(storage.redis(), objectMapper, clock);
            case MEMORY -> {
                LOGGER.warn("Using in-memory storage; moderation state will not survive a restart");
                yield new InMemoryDocumentStore(objectMapper);
            }
        };
    }

    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Shutting down Warden moderation service...");

        try {
            if (console != null) {
                console.stop();
            }
            if (sanctionScheduler != null) {
                sanctionScheduler.close();
            }
            if (retentionSweeper != null) {
                retentionSweeper.close();
            }
            if (jda != null) {
                jda.shutdown();
            }

            workers.shutdown();
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
            scheduler.shutdown();
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }

            messageBus.close();
            documentStore.close();
            LOGGER.info("Warden moderation service shut down");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while shutting down");
        } catch (Exception e) {
            LOGGER.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
            AnsiConsole.systemUninstall();
        }
    }

    private void displayBanner() {
        System.out.println();
        System.out.println("  #     #    #    ######  ######  ####### #     #");
        System.out.println("  #  #  #   # #   #     # #     # #       ##    #");
        System.out.println("  #  #  #  #   #  ######  #     # #####   # #   #");
        System.out.println("  #  #  # ####### #   #   #     # #       #  #  #");
        System.out.println("   ## ##  #     # #    #  ######  ####### #   ###");
        System.out.println();
        System.out.println("           Discord Moderation Service");
        System.out.println();
    }
}
