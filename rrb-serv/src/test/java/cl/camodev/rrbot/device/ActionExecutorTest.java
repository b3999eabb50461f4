package cl.camodev.rrbot.device;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import cl.camodev.rrbot.ex.BridgeTimeoutException;
import cl.camodev.rrbot.ex.BridgeUnavailableException;
import cl.camodev.rrbot.serv.config.BotConfig;
import cl.camodev.rrbot.serv.impl.ServConfig;

class ActionExecutorTest {
	private static final String DEVICE = "emulator-5554";

	private FakeBridgeRunner runner;
	private ActionExecutor executor;

	@BeforeEach
	void setUp() {
		runner = new FakeBridgeRunner();
		executor = new ActionExecutor(new DeviceBridge(runner, ServerSession.NONE, new ServConfig(BotConfig.defaults())),
				60_000);
	}

	@Test
	@DisplayName("Text is escaped for adb input text")
	void escapesText() {
		assertEquals("hello%sworld", ActionExecutor.escapeTextForShell("hello world"));
		assertEquals("a%sb", ActionExecutor.escapeTextForShell("a\tb"));
		assertEquals("line", ActionExecutor.escapeTextForShell("li\nne"));
		assertEquals("\\$5\\&\\(x\\)", ActionExecutor.escapeTextForShell("$5&(x)"));
		assertEquals("", ActionExecutor.escapeTextForShell(""));
	}

	@Test
	@DisplayName("Sending empty text is a successful no-op")
	void emptyTextSendsNothing() {
		assertTrue(executor.sendText(DEVICE, ""));
		assertTrue(runner.getCalls().isEmpty());
	}

	@Test
	@DisplayName("Input commands are issued through adb shell input")
	void issuesInputCommands() {
		runner.onText("shell input", "");

		assertTrue(executor.tap(DEVICE, 120, 340));
		assertTrue(executor.swipe(DEVICE, 1, 2, 3, 4, 250));
		assertTrue(executor.sendText(DEVICE, "hi there"));
		assertTrue(executor.pressBack(DEVICE));

		assertEquals("shell input tap 120 340", runner.getCalls().get(0));
		assertEquals("shell input swipe 1 2 3 4 250", runner.getCalls().get(1));
		assertEquals("shell input text hi%sthere", runner.getCalls().get(2));
		assertEquals("shell input keyevent 4", runner.getCalls().get(3));
	}

	@Test
	@DisplayName("A failing or timed out command returns false instead of throwing")
	void failuresReturnFalse() {
		runner.onFailure("shell input tap", "error: device offline");
		runner.on("shell input swipe", (args, device) -> {
			throw new BridgeTimeoutException(args, Duration.ofSeconds(10));
		});

		assertFalse(executor.tap(DEVICE, 10, 10));
		assertFalse(executor.swipe(DEVICE, 0, 0, 10, 10, 100));
		assertTrue(executor.screenshot(DEVICE).isEmpty());
	}

	@Test
	@DisplayName("A missing bridge escalates as an exception")
	void unavailableBridgeIsRaised() {
		ActionExecutor unavailable = new ActionExecutor(new DeviceBridge(new UnavailableBridgeRunner("adb not found"),
				ServerSession.NONE, new ServConfig(BotConfig.defaults())));

		assertThrows(BridgeUnavailableException.class, () -> unavailable.tap(DEVICE, 1, 1));
		assertThrows(BridgeUnavailableException.class, () -> unavailable.screenshot(DEVICE));
	}

	@Test
	@DisplayName("Screenshots are cached until an input invalidates them")
	void cachesScreenshots() {
		byte[] frame = { (byte) 0x89, 'P', 'N', 'G', 1, 2, 3 };
		runner.onBytes("exec-out screencap -p", frame);
		runner.onText("shell input", "");

		assertArrayEquals(frame, executor.screenshot(DEVICE).get());
		assertArrayEquals(frame, executor.screenshot(DEVICE).get());
		assertEquals(1, runner.count("exec-out screencap"));

		executor.tap(DEVICE, 5, 5);
		executor.screenshot(DEVICE);
		assertEquals(2, runner.count("exec-out screencap"));
	}

	@Test
	@DisplayName("The game is launched through the launcher intent")
	void launchesApp() {
		runner.onText("shell monkey", "Events injected: 1");

		assertTrue(executor.launchApp(DEVICE, "com.my.defense"));
		assertEquals("shell monkey -p com.my.defense -c android.intent.category.LAUNCHER 1", runner.getCalls().get(0));
	}
}
