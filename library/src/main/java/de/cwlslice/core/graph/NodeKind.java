package de.cwlslice.core.graph;

public enum NodeKind {
    INPUT,
    OUTPUT,
    STEP,
    // intermediate data link, e.g. a step output port consumed by another step
    UNCLASSIFIED;

    public boolean isConcrete() {
        return this != UNCLASSIFIED;
    }
}
