package cl.camodev.rrbot.serv.bot;

import org.jetbrains.annotations.NotNull;

import cl.camodev.rrbot.ot.DTOGridCell;
import cl.camodev.rrbot.ot.DTOMergePair;
import cl.camodev.rrbot.ot.DTOPoint;

/**
 * One input decided for the current frame: a tap that places a unit or a swipe that merges two.
 */
public class BotAction {

	public enum Kind {
		PLACE_UNIT, MERGE_UNITS
	}

	public static final int MERGE_SWIPE_MS = 300;

	private final Kind kind;
	private final DTOPoint from;
	private final DTOPoint to;
	private final String description;

	private BotAction(Kind kind, DTOPoint from, DTOPoint to, String description) {
		this.kind = kind;
		this.from = from;
		this.to = to;
		this.description = description;
	}

	public static BotAction place(DTOGridCell cell) {
		DTOPoint center = cell.center();
		return new BotAction(Kind.PLACE_UNIT, center, center,
				"place unit at [" + cell.getRow() + "," + cell.getCol() + "]");
	}

	public static BotAction merge(DTOMergePair pair) {
		DTOGridCell source = pair.getSource();
		DTOGridCell target = pair.getTarget();
		return new BotAction(Kind.MERGE_UNITS, source.center(), target.center(),
				"merge " + pair.getUnitLabel() + " [" + source.getRow() + "," + source.getCol() + "] -> ["
						+ target.getRow() + "," + target.getCol() + "]");
	}

	public Kind getKind() {
		return kind;
	}

	public DTOPoint getFrom() {
		return from;
	}

	public DTOPoint getTo() {
		return to;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public @NotNull String toString() {
		return description;
	}
}
