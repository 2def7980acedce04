package de.cwlslice.core.model;

public record ProcessResolution(Process process, WorkflowStep step) {}
