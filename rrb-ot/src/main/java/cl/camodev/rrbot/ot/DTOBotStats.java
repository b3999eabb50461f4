package cl.camodev.rrbot.ot;

public class DTOBotStats {
    private final int gamesPlayed;
    private final int actionsPerformed;
    private final int errors;
    private final int unitsPlaced;
    private final int unitsMerged;
    private final long cycles;

    public DTOBotStats(int gamesPlayed, int actionsPerformed, int errors, int unitsPlaced, int unitsMerged,
            long cycles) {
        this.gamesPlayed = gamesPlayed;
        this.actionsPerformed = actionsPerformed;
        this.errors = errors;
        this.unitsPlaced = unitsPlaced;
        this.unitsMerged = unitsMerged;
        this.cycles = cycles;
    }

    public int getGamesPlayed() { return gamesPlayed; }
    public int getActionsPerformed() { return actionsPerformed; }
    public int getErrors() { return errors; }
    public int getUnitsPlaced() { return unitsPlaced; }
    public int getUnitsMerged() { return unitsMerged; }
    public long getCycles() { return cycles; }
}
