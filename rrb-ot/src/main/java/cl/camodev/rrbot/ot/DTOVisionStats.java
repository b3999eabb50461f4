package cl.camodev.rrbot.ot;

public class DTOVisionStats {
    private final long totalAnalyses;
    private final long gridAnalyses;
    private final long manaAnalyses;
    private final long rankPredictions;
    private final long templateMatches;
    private final long decodeFailures;
    private final double averageProcessingTimeMs;
    private final int referenceColors;
    private final int templates;
    private final boolean rankModelLoaded;

    public DTOVisionStats(long totalAnalyses, long gridAnalyses, long manaAnalyses, long rankPredictions,
            long templateMatches, long decodeFailures, double averageProcessingTimeMs, int referenceColors,
            int templates, boolean rankModelLoaded) {
        this.totalAnalyses = totalAnalyses;
        this.gridAnalyses = gridAnalyses;
        this.manaAnalyses = manaAnalyses;
        this.rankPredictions = rankPredictions;
        this.templateMatches = templateMatches;
        this.decodeFailures = decodeFailures;
        this.averageProcessingTimeMs = averageProcessingTimeMs;
        this.referenceColors = referenceColors;
        this.templates = templates;
        this.rankModelLoaded = rankModelLoaded;
    }

    public long getTotalAnalyses() { return totalAnalyses; }
    public long getGridAnalyses() { return gridAnalyses; }
    public long getManaAnalyses() { return manaAnalyses; }
    public long getRankPredictions() { return rankPredictions; }
    public long getTemplateMatches() { return templateMatches; }
    public long getDecodeFailures() { return decodeFailures; }
    public double getAverageProcessingTimeMs() { return averageProcessingTimeMs; }
    public int getReferenceColors() { return referenceColors; }
    public int getTemplates() { return templates; }
    public boolean isRankModelLoaded() { return rankModelLoaded; }
}
