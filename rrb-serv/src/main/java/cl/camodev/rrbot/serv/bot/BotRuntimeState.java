package cl.camodev.rrbot.serv.bot;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import cl.camodev.rrbot.console.enumerable.EnumBotState;
import cl.camodev.rrbot.ot.DTOBotStats;
import cl.camodev.rrbot.ot.DTOBotStatus;
import cl.camodev.rrbot.ot.DTOManaReading;

/**
 * Mutable state of one orchestrator. Written by the control and loop threads, read through
 * {@link #snapshot()}.
 */
public class BotRuntimeState {
	private volatile EnumBotState state = EnumBotState.STOPPED;
	private volatile LocalDateTime startedAt;
	private volatile String lastAction;
	private volatile String connectedDeviceId;
	private volatile String errorMessage;
	private volatile DTOManaReading lastMana;
	private volatile boolean inGame;

	private final AtomicInteger errorCount = new AtomicInteger();
	private final AtomicInteger gamesPlayed = new AtomicInteger();
	private final AtomicInteger actionsPerformed = new AtomicInteger();
	private final AtomicInteger errors = new AtomicInteger();
	private final AtomicInteger unitsPlaced = new AtomicInteger();
	private final AtomicInteger unitsMerged = new AtomicInteger();
	private final AtomicLong cycles = new AtomicLong();

	public void resetSession(String deviceId) {
		startedAt = LocalDateTime.now();
		connectedDeviceId = deviceId;
		errorMessage = null;
		lastAction = null;
		lastMana = null;
		inGame = false;
		errorCount.set(0);
		gamesPlayed.set(0);
		actionsPerformed.set(0);
		errors.set(0);
		unitsPlaced.set(0);
		unitsMerged.set(0);
		cycles.set(0);
	}

	public EnumBotState getState() {
		return state;
	}

	public synchronized void setState(EnumBotState state) {
		this.state = state;
	}

	public synchronized boolean compareAndSetState(EnumBotState expected, EnumBotState next) {
		if (state != expected) {
			return false;
		}
		state = next;
		return true;
	}

	public String getConnectedDeviceId() {
		return connectedDeviceId;
	}

	public void setConnectedDeviceId(String connectedDeviceId) {
		this.connectedDeviceId = connectedDeviceId;
	}

	public void setErrorMessage(String errorMessage) {
		this.errorMessage = errorMessage;
	}

	public void setLastAction(String lastAction) {
		this.lastAction = lastAction;
	}

	public void setLastMana(DTOManaReading lastMana) {
		this.lastMana = lastMana;
	}

	public boolean isInGame() {
		return inGame;
	}

	/**
	 * Records whether the last frame showed a game in progress.
	 *
	 * @return true if this frame entered a new game
	 */
	public boolean updateInGame(boolean nowInGame) {
		boolean entered = nowInGame && !inGame;
		inGame = nowInGame;
		if (entered) {
			gamesPlayed.incrementAndGet();
		}
		return entered;
	}

	public int recordFailure(String message) {
		errorMessage = message;
		errors.incrementAndGet();
		return errorCount.incrementAndGet();
	}

	public void clearConsecutiveErrors() {
		errorCount.set(0);
	}

	public int getErrorCount() {
		return errorCount.get();
	}

	public void recordCycle() {
		cycles.incrementAndGet();
	}

	public void recordAction(String description) {
		lastAction = description;
		actionsPerformed.incrementAndGet();
	}

	public void recordPlacement() {
		unitsPlaced.incrementAndGet();
	}

	public void recordMerge() {
		unitsMerged.incrementAndGet();
	}

	public DTOBotStats stats() {
		return new DTOBotStats(gamesPlayed.get(), actionsPerformed.get(), errors.get(), unitsPlaced.get(),
				unitsMerged.get(), cycles.get());
	}

	public DTOBotStatus snapshot() {
		return new DTOBotStatus(state, startedAt, errorCount.get(), lastAction, connectedDeviceId, errorMessage,
				stats(), lastMana);
	}
}
