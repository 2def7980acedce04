package de.cwlslice.core.extraction;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExtractionOptions {

    // type of ports synthesized by single-step extraction and fallback type of rewired inputs
    @Builder.Default
    private final String defaultType = "Any";
    @Builder.Default
    private final String versionField = "cwlVersion";
    // load external run references while loading a document so the identifier index is complete
    @Builder.Default
    private final boolean eagerLoading = true;

    public static ExtractionOptions ofDefault() {
        return ExtractionOptions.builder().build();
    }
}
