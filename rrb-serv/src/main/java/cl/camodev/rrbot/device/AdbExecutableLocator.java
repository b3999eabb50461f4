package cl.camodev.rrbot.device;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the adb executable.
 * <p>
 * Search order: the configured path (file or directory), {@code lib/adb} under the working directory,
 * every {@code PATH} entry, the SDK pointed to by {@code ANDROID_HOME}/{@code ANDROID_SDK_ROOT}, and
 * finally the usual SDK install locations.
 */
public class AdbExecutableLocator {
	private static final Logger logger = LoggerFactory.getLogger(AdbExecutableLocator.class);

	private final Map<String, String> environment;
	private final String userDir;
	private final String userHome;
	private final boolean windows;

	public AdbExecutableLocator() {
		this(System.getenv(), System.getProperty("user.dir"), System.getProperty("user.home"),
				System.getProperty("os.name", "").toLowerCase().contains("win"));
	}

	AdbExecutableLocator(Map<String, String> environment, String userDir, String userHome, boolean windows) {
		this.environment = environment;
		this.userDir = userDir;
		this.userHome = userHome;
		this.windows = windows;
	}

	private String executableName() {
		return windows ? "adb.exe" : "adb";
	}

	public Optional<Path> locate(String configuredPath) {
		for (Path candidate : candidates(configuredPath)) {
			if (Files.isRegularFile(candidate)) {
				logger.info("Using adb executable at {}", candidate);
				return Optional.of(candidate.toAbsolutePath());
			}
		}
		logger.warn("No adb executable found (configured path: '{}')", configuredPath);
		return Optional.empty();
	}

	List<Path> candidates(String configuredPath) {
		List<Path> candidates = new ArrayList<>();
		String exe = executableName();

		if (configuredPath != null && !configuredPath.isBlank()) {
			Path configured = Path.of(configuredPath.trim());
			candidates.add(configured);
			candidates.add(configured.resolve(exe));
		}

		if (userDir != null) {
			candidates.add(Path.of(userDir, "lib", "adb", exe));
		}

		String path = environment.get("PATH");
		if (path != null) {
			for (String entry : path.split(File.pathSeparator)) {
				if (!entry.isBlank()) {
					candidates.add(Path.of(entry, exe));
				}
			}
		}

		for (String variable : new String[] { "ANDROID_HOME", "ANDROID_SDK_ROOT" }) {
			String sdk = environment.get(variable);
			if (sdk != null && !sdk.isBlank()) {
				candidates.add(Path.of(sdk, "platform-tools", exe));
			}
		}

		if (userHome != null) {
			candidates.add(Path.of(userHome, "Android", "Sdk", "platform-tools", exe));
			candidates.add(Path.of(userHome, "Library", "Android", "sdk", "platform-tools", exe));
			candidates.add(Path.of(userHome, "AppData", "Local", "Android", "Sdk", "platform-tools", exe));
		}
		if (windows) {
			candidates.add(Path.of("C:\\platform-tools", exe));
		} else {
			candidates.add(Path.of("/usr/bin", exe));
			candidates.add(Path.of("/usr/local/bin", exe));
			candidates.add(Path.of("/opt/homebrew/bin", exe));
		}
		return candidates;
	}
}
