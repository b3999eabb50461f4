package cl.camodev.rrbot.ot;

import java.time.LocalDateTime;

/**
 * Everything perceived from one frame.
 */
public class DTOGameState {
    private final DTOGridAnalysis grid;
    private final DTOManaReading mana;
    private final LocalDateTime capturedAt;

    public DTOGameState(DTOGridAnalysis grid, DTOManaReading mana, LocalDateTime capturedAt) {
        this.grid = grid;
        this.mana = mana;
        this.capturedAt = capturedAt;
    }

    public DTOGridAnalysis getGrid() { return grid; }
    public DTOManaReading getMana() { return mana; }
    public LocalDateTime getCapturedAt() { return capturedAt; }

    public boolean isInGame() {
        return grid.isDecoded() && (!grid.getOccupiedCells().isEmpty() || mana.getCurrent() > 0);
    }
}
