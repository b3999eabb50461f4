package cl.camodev.rrbot.serv.bot;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import cl.camodev.rrbot.ot.DTOGameState;
import cl.camodev.rrbot.ot.DTOGridCell;
import cl.camodev.rrbot.ot.DTOMergePair;
import cl.camodev.rrbot.serv.config.BotConfig;

/**
 * Chooses at most one placement and one merge per frame.
 */
public class DecisionEngine {
	private final Random random;

	public DecisionEngine() {
		this(new Random());
	}

	public DecisionEngine(Random random) {
		this.random = random;
	}

	public List<BotAction> decide(DTOGameState state, BotConfig config) {
		List<BotAction> actions = new ArrayList<>(2);
		if (!state.getGrid().isDecoded()) {
			return actions;
		}

		if (config.isAutoUpgrade() && state.getMana().getCurrent() >= config.getMinUnitCost()) {
			List<DTOGridCell> empty = state.getGrid().getEmptyCells();
			if (!empty.isEmpty()) {
				actions.add(BotAction.place(empty.get(random.nextInt(empty.size()))));
			}
		}

		if (config.isAutoMerge()) {
			for (DTOMergePair pair : state.getGrid().getMergeablePairs()) {
				if (pair.minConfidence() >= config.getVisionConfidenceThreshold()) {
					actions.add(BotAction.merge(pair));
					break;
				}
			}
		}
		return actions;
	}
}
