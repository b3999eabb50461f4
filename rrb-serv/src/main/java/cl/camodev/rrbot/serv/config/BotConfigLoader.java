package cl.camodev.rrbot.serv.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.console.enumerable.EnumConfigurationKey;
import cl.camodev.rrbot.ex.InvalidConfigException;

/**
 * Reads the startup configuration from {@code rrbot.properties}.
 * <p>
 * Lookup order: an explicit path, {@code rrbot.properties} in the working directory, then the classpath.
 * Keys may be written either as enum names ({@code CYCLE_INTERVAL_DOUBLE}) or option names
 * ({@code cycleInterval}). A file that fails validation is reported and the defaults are used instead.
 */
public class BotConfigLoader {
	public static final String FILE_NAME = "rrbot.properties";
	private static final Logger logger = LoggerFactory.getLogger(BotConfigLoader.class);

	public BotConfig load() {
		Path local = Path.of(System.getProperty("user.dir"), FILE_NAME);
		if (Files.isRegularFile(local)) {
			return load(local);
		}
		try (InputStream in = BotConfigLoader.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
			if (in == null) {
				logger.info("No {} found, using defaults", FILE_NAME);
				return BotConfig.defaults();
			}
			Properties properties = new Properties();
			properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
			return fromProperties(properties, "classpath:" + FILE_NAME);
		} catch (IOException e) {
			logger.error("Could not read {} from classpath, using defaults", FILE_NAME, e);
			return BotConfig.defaults();
		}
	}

	public BotConfig load(Path file) {
		Properties properties = new Properties();
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			properties.load(reader);
		} catch (IOException e) {
			logger.error("Could not read configuration file {}, using defaults", file, e);
			return BotConfig.defaults();
		}
		return fromProperties(properties, file.toString());
	}

	BotConfig fromProperties(Properties properties, String origin) {
		BotConfig.Builder builder = BotConfig.builder();
		for (String name : properties.stringPropertyNames()) {
			EnumConfigurationKey key = EnumConfigurationKey.fromName(name);
			if (key == null) {
				logger.warn("Ignoring unknown configuration key '{}' in {}", name, origin);
				continue;
			}
			builder.set(key, properties.getProperty(name));
		}
		try {
			BotConfig config = builder.build();
			logger.info("Configuration loaded from {}", origin);
			return config;
		} catch (InvalidConfigException e) {
			logger.error("Configuration in {} is invalid ({}), using defaults", origin, e.getMessage());
			return BotConfig.defaults();
		}
	}
}
