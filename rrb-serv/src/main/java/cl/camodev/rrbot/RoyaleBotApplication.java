package cl.camodev.rrbot;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.device.ActionExecutor;
import cl.camodev.rrbot.device.AdbExecutableLocator;
import cl.camodev.rrbot.device.AdbProcessRunner;
import cl.camodev.rrbot.device.BridgeCommandRunner;
import cl.camodev.rrbot.device.DdmlibServerSession;
import cl.camodev.rrbot.device.DeviceBridge;
import cl.camodev.rrbot.device.ServerSession;
import cl.camodev.rrbot.device.UnavailableBridgeRunner;
import cl.camodev.rrbot.ot.DTOBotEvent;
import cl.camodev.rrbot.ot.DTOCommandResult;
import cl.camodev.rrbot.serv.bot.BotCommandHandler;
import cl.camodev.rrbot.serv.bot.BotOrchestrator;
import cl.camodev.rrbot.serv.config.BotConfig;
import cl.camodev.rrbot.serv.config.BotConfigLoader;
import cl.camodev.rrbot.serv.impl.ServConfig;
import cl.camodev.rrbot.serv.impl.ServEvents;
import cl.camodev.rrbot.serv.impl.ServLogs;
import cl.camodev.rrbot.vision.PerceptionPipeline;

/**
 * Builds every service once and wires them together. Reads JSON commands from standard input, one
 * per line, and writes results and events to standard output as JSON lines.
 */
public class RoyaleBotApplication {
	private static final Logger logger = LoggerFactory.getLogger(RoyaleBotApplication.class);

	private final ServConfig servConfig;
	private final ServLogs servLogs;
	private final ServEvents servEvents;
	private final DeviceBridge deviceBridge;
	private final BotOrchestrator orchestrator;
	private final BotCommandHandler commandHandler;

	public RoyaleBotApplication(BotConfig config) {
		this(config, locateBridge(config));
	}

	private RoyaleBotApplication(BotConfig config, BridgeSetup bridge) {
		this(config, bridge.runner, bridge.session);
	}

	RoyaleBotApplication(BotConfig config, BridgeCommandRunner runner, ServerSession session) {
		this.servConfig = new ServConfig(config);
		this.servLogs = new ServLogs();
		this.servEvents = new ServEvents();

		this.deviceBridge = new DeviceBridge(runner, session, servConfig);
		ActionExecutor actionExecutor = new ActionExecutor(deviceBridge);
		PerceptionPipeline perception = PerceptionPipeline.fromConfig(config);
		this.orchestrator = new BotOrchestrator(deviceBridge, actionExecutor, perception, servConfig, servEvents,
				servLogs);
		this.commandHandler = new BotCommandHandler(orchestrator, deviceBridge, perception, servLogs, servEvents);
	}

	private static BridgeSetup locateBridge(BotConfig config) {
		Optional<Path> adb = new AdbExecutableLocator().locate(config.getAdbPath());
		if (adb.isPresent()) {
			logger.info("Using ADB at {}", adb.get());
			return new BridgeSetup(new AdbProcessRunner(adb.get(), config.getScanConcurrency()),
					new DdmlibServerSession(adb.get()));
		}
		logger.warn("ADB executable not found, device features are disabled");
		return new BridgeSetup(new UnavailableBridgeRunner("ADB executable not found"), ServerSession.NONE);
	}

	private static final class BridgeSetup {
		private final BridgeCommandRunner runner;
		private final ServerSession session;

		private BridgeSetup(BridgeCommandRunner runner, ServerSession session) {
			this.runner = runner;
			this.session = session;
		}
	}

	public void start() {
		deviceBridge.initialize();
		if (servConfig.getConfig().isAutoStart()) {
			DTOCommandResult result = orchestrator.start(null);
			logger.info("Auto start: {}", result);
		}
	}

	/**
	 * Subscribes to the event bus before starting, so the events of an automatic start are delivered.
	 */
	public ServEvents.Subscription startWithEvents() {
		ServEvents.Subscription subscription = servEvents.subscribe();
		start();
		return subscription;
	}

	public void shutdown() {
		logger.info("Shutting down");
		orchestrator.shutdown();
		deviceBridge.shutdown();
	}

	public BotCommandHandler getCommandHandler() {
		return commandHandler;
	}

	public ServEvents getServEvents() {
		return servEvents;
	}

	public static void main(String[] args) throws IOException {
		BotConfigLoader loader = new BotConfigLoader();
		BotConfig config = args.length > 0 ? loader.load(Path.of(args[0])) : loader.load();

		RoyaleBotApplication application = new RoyaleBotApplication(config);
		Runtime.getRuntime().addShutdownHook(new Thread(application::shutdown, "rrbot-shutdown"));
		ServEvents.Subscription subscription = application.startWithEvents();
		Thread printer = new Thread(() -> {
			try {
				while (!Thread.currentThread().isInterrupted()) {
					DTOBotEvent event = subscription.poll(Duration.ofSeconds(1));
					if (event != null) {
						System.out.println(ServEvents.toJson(event));
					}
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}, "rrbot-events");
		printer.setDaemon(true);
		printer.start();

		try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
			String line;
			while ((line = in.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				if ("exit".equalsIgnoreCase(line.trim())) {
					break;
				}
				System.out.println(BotCommandHandler.toJson(application.getCommandHandler().handle(line)));
			}
		} finally {
			subscription.close();
			printer.interrupt();
		}
	}
}
