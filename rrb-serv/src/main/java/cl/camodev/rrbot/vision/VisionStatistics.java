package cl.camodev.rrbot.vision;

import java.util.ArrayDeque;
import java.util.Deque;

import cl.camodev.rrbot.ot.DTOVisionStats;

/**
 * Run counters of the perception pipeline with a rolling average over the last 100 timings.
 */
public class VisionStatistics {
	public static final int LATENCY_WINDOW = 100;

	private long totalAnalyses;
	private long gridAnalyses;
	private long manaAnalyses;
	private long rankPredictions;
	private long templateMatches;
	private long decodeFailures;
	private final Deque<Long> latencies = new ArrayDeque<>();

	public synchronized void recordGrid(long millis) {
		gridAnalyses++;
		record(millis);
	}

	public synchronized void recordMana(long millis) {
		manaAnalyses++;
		record(millis);
	}

	private void record(long millis) {
		totalAnalyses++;
		latencies.addLast(millis);
		while (latencies.size() > LATENCY_WINDOW) {
			latencies.removeFirst();
		}
	}

	public synchronized void recordRankPrediction() {
		rankPredictions++;
	}

	public synchronized void recordTemplateMatch() {
		templateMatches++;
	}

	public synchronized void recordDecodeFailure() {
		decodeFailures++;
	}

	public synchronized double averageLatencyMs() {
		if (latencies.isEmpty()) {
			return 0.0;
		}
		long sum = 0;
		for (long value : latencies) {
			sum += value;
		}
		return (double) sum / latencies.size();
	}

	public synchronized DTOVisionStats snapshot(int referenceColors, int templates, boolean rankModelLoaded) {
		return new DTOVisionStats(totalAnalyses, gridAnalyses, manaAnalyses, rankPredictions, templateMatches,
				decodeFailures, averageLatencyMs(), referenceColors, templates, rankModelLoaded);
	}
}
