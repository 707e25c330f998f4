package com.storyweave.flowsync.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunables for entry-point previews in the flow graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphBuilderSettings {

    @Builder.Default
    private int previewLines = 3;

    @Builder.Default
    private int previewTextLength = 30;

    @Builder.Default
    private String narratorName = "narrator";

    public static GraphBuilderSettings defaults() {
        return GraphBuilderSettings.builder().build();
    }
}
