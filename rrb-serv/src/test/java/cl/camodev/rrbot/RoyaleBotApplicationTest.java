package cl.camodev.rrbot;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import cl.camodev.rrbot.console.enumerable.EnumBotEvent;
import cl.camodev.rrbot.device.FakeBridgeRunner;
import cl.camodev.rrbot.device.ServerSession;
import cl.camodev.rrbot.ot.DTOBotEvent;
import cl.camodev.rrbot.serv.config.BotConfig;
import cl.camodev.rrbot.serv.impl.ServEvents;

class RoyaleBotApplicationTest {
	private RoyaleBotApplication application;

	@AfterEach
	void tearDown() {
		if (application != null) {
			application.shutdown();
		}
	}

	@Test
	@DisplayName("Events published by an automatic start reach the startup subscriber")
	void autoStartEventsAreDelivered() throws InterruptedException {
		FakeBridgeRunner runner = new FakeBridgeRunner();
		runner.onText("devices", "List of devices attached\nemulator-5554\tdevice\n\n");
		BotConfig config = BotConfig.builder()
				.autoStart(true)
				.launchGameOnStart(false)
				.cycleInterval(0.05)
				.actionDelay(0)
				.stopGraceSeconds(2)
				.build();
		application = new RoyaleBotApplication(config, runner, ServerSession.NONE);

		Set<EnumBotEvent> seen = EnumSet.noneOf(EnumBotEvent.class);
		try (ServEvents.Subscription subscription = application.startWithEvents()) {
			long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
			while (!seen.contains(EnumBotEvent.BOT_STARTED) && System.nanoTime() < deadline) {
				DTOBotEvent event = subscription.poll(Duration.ofMillis(100));
				if (event != null) {
					seen.add(event.getType());
				}
			}
		}

		assertTrue(seen.contains(EnumBotEvent.DEVICE_CONNECTED));
		assertTrue(seen.contains(EnumBotEvent.BOT_STARTED));
	}
}
