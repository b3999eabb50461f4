package cl.camodev.rrbot.ot;

import org.jetbrains.annotations.NotNull;

public class DTOMergePair {
    private final DTOGridCell source;
    private final DTOGridCell target;

    public DTOMergePair(DTOGridCell source, DTOGridCell target) {
        this.source = source;
        this.target = target;
    }

    public DTOGridCell getSource() {
        return source;
    }

    public DTOGridCell getTarget() {
        return target;
    }

    public String getUnitLabel() {
        return source.getUnitLabel();
    }

    public double minConfidence() {
        return Math.min(source.getConfidence(), target.getConfidence());
    }

    @Override
    public @NotNull String toString() {
        return source.getUnitLabel() + " " + source.center() + " -> " + target.center();
    }
}
