package cl.camodev.rrbot.ot;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class DTOGridAnalysis {
    private final DTOGridConfig gridConfig;
    private final List<DTOGridCell> cells;
    private final List<DTOMergePair> mergeablePairs;
    private final boolean decoded;
    private final long processingTimeMs;

    public DTOGridAnalysis(DTOGridConfig gridConfig, List<DTOGridCell> cells, List<DTOMergePair> mergeablePairs,
            boolean decoded, long processingTimeMs) {
        this.gridConfig = gridConfig;
        this.cells = Collections.unmodifiableList(cells);
        this.mergeablePairs = Collections.unmodifiableList(mergeablePairs);
        this.decoded = decoded;
        this.processingTimeMs = processingTimeMs;
    }

    public DTOGridConfig getGridConfig() { return gridConfig; }
    public List<DTOGridCell> getCells() { return cells; }
    public List<DTOMergePair> getMergeablePairs() { return mergeablePairs; }
    public boolean isDecoded() { return decoded; }
    public long getProcessingTimeMs() { return processingTimeMs; }

    public DTOGridCell getCell(int row, int col) {
        return cells.get(row * gridConfig.getCols() + col);
    }

    public List<DTOGridCell> getEmptyCells() {
        return cells.stream().filter(c -> !c.isOccupied()).collect(Collectors.toList());
    }

    public List<DTOGridCell> getOccupiedCells() {
        return cells.stream().filter(DTOGridCell::isOccupied).collect(Collectors.toList());
    }
}
