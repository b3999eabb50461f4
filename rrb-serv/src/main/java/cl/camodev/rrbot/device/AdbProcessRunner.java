package cl.camodev.rrbot.device;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.ex.BridgeException;
import cl.camodev.rrbot.ex.BridgeTimeoutException;
import cl.camodev.rrbot.ex.BridgeUnavailableException;
import cl.camodev.rrbot.ot.DTOBridgeResult;

/**
 * Runs adb as a child process. Output streams are drained on a bounded worker pool so the calling thread
 * only waits on the process deadline, and a hung adb is killed when that deadline passes.
 */
public class AdbProcessRunner implements BridgeCommandRunner {
	private static final Logger logger = LoggerFactory.getLogger(AdbProcessRunner.class);
	private static final long DRAIN_GRACE_MS = 1000;

	private final Path adbExecutable;
	private final ExecutorService streamPool;

	public AdbProcessRunner(Path adbExecutable, int workerThreads) {
		this.adbExecutable = adbExecutable;
		this.streamPool = Executors.newFixedThreadPool(Math.max(2, workerThreads), new ThreadFactory() {
			private final AtomicInteger counter = new AtomicInteger();

			@Override
			public Thread newThread(Runnable r) {
				Thread thread = new Thread(r, "adb-io-" + counter.incrementAndGet());
				thread.setDaemon(true);
				return thread;
			}
		});
	}

	public Path getAdbExecutable() {
		return adbExecutable;
	}

	@Override
	public DTOBridgeResult run(List<String> args, String deviceId, Duration timeout) {
		List<String> command = new ArrayList<>();
		command.add(adbExecutable.toString());
		if (deviceId != null && !deviceId.isBlank()) {
			command.add("-s");
			command.add(deviceId);
		}
		command.addAll(args);

		Process process;
		try {
			ProcessBuilder pb = new ProcessBuilder(command);
			if (adbExecutable.getParent() != null) {
				pb.directory(adbExecutable.getParent().toFile());
			}
			process = pb.start();
		} catch (IOException e) {
			throw new BridgeUnavailableException("Could not start adb at " + adbExecutable + ": " + e.getMessage(), e);
		}

		Future<byte[]> stdout = streamPool.submit(() -> readAll(process.getInputStream()));
		Future<byte[]> stderr = streamPool.submit(() -> readAll(process.getErrorStream()));

		try {
			if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				process.destroyForcibly();
				stdout.cancel(true);
				stderr.cancel(true);
				logger.warn("adb {} timed out after {} ms", args, timeout.toMillis());
				throw new BridgeTimeoutException(args, timeout);
			}
			byte[] out = stdout.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
			byte[] err = stderr.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
			return new DTOBridgeResult(process.exitValue(), out, new String(err, StandardCharsets.UTF_8));
		} catch (InterruptedException e) {
			process.destroyForcibly();
			Thread.currentThread().interrupt();
			throw new BridgeException("Interrupted while running adb " + args, e);
		} catch (TimeoutException e) {
			process.destroyForcibly();
			throw new BridgeTimeoutException(args, timeout);
		} catch (ExecutionException e) {
			throw new BridgeException("Could not read adb output for " + args, e.getCause());
		}
	}

	private static byte[] readAll(InputStream in) throws IOException {
		try (InputStream stream = in; ByteArrayOutputStream buffer = new ByteArrayOutputStream()) {
			stream.transferTo(buffer);
			return buffer.toByteArray();
		}
	}

	@Override
	public boolean isAvailable() {
		return true;
	}

	@Override
	public void shutdown() {
		streamPool.shutdownNow();
	}
}
