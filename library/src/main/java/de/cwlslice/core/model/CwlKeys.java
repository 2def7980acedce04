package de.cwlslice.core.model;

/**
 * Field names of a pipeline document.
 */
public final class CwlKeys {

    public static final String ID = "id";
    public static final String CLASS = "class";
    public static final String INPUTS = "inputs";
    public static final String OUTPUTS = "outputs";
    public static final String STEPS = "steps";
    public static final String IN = "in";
    public static final String OUT = "out";
    public static final String RUN = "run";
    public static final String SOURCE = "source";
    public static final String OUTPUT_SOURCE = "outputSource";
    public static final String LINK_MERGE = "linkMerge";
    public static final String TYPE = "type";
    public static final String DEFAULT = "default";

    public static final String WORKFLOW_CLASS = "Workflow";

    private CwlKeys() {}
}
