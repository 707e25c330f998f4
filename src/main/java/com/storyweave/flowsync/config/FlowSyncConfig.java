package com.storyweave.flowsync.config;

import com.storyweave.flowsync.service.history.ScriptHistory;
import com.storyweave.flowsync.service.sync.ScriptCloner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the synchronization core.
 * Reads tunables from application.yml properties under the {@code flowsync} prefix.
 */
@Configuration
@Slf4j
public class FlowSyncConfig {

    @Value("${flowsync.history.capacity:100}")
    private int historyCapacity;

    @Value("${flowsync.graph.preview-lines:3}")
    private int previewLines;

    @Value("${flowsync.graph.preview-text-length:30}")
    private int previewTextLength;

    @Value("${flowsync.graph.narrator-name:narrator}")
    private String narratorName;

    @Value("${flowsync.layout.node-width:280}")
    private double nodeWidth;

    @Value("${flowsync.layout.node-height:150}")
    private double nodeHeight;

    @Value("${flowsync.layout.horizontal-spacing:50}")
    private double horizontalSpacing;

    @Value("${flowsync.layout.vertical-spacing:100}")
    private double verticalSpacing;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public GraphBuilderSettings graphBuilderSettings() {
        return GraphBuilderSettings.builder()
                .previewLines(previewLines)
                .previewTextLength(previewTextLength)
                .narratorName(narratorName)
                .build();
    }

    @Bean
    public LayoutSettings layoutSettings() {
        return LayoutSettings.builder()
                .nodeWidth(nodeWidth)
                .nodeHeight(nodeHeight)
                .horizontalSpacing(horizontalSpacing)
                .verticalSpacing(verticalSpacing)
                .build();
    }

    /**
     * Undo/redo history of script snapshots, bounded by {@code flowsync.history.capacity}.
     */
    @Bean
    public ScriptHistory scriptHistory(ScriptCloner scriptCloner, Clock clock) {
        log.info("[FlowSync Config] Initializing script history with capacity: {}", historyCapacity);
        return new ScriptHistory(scriptCloner, clock, historyCapacity);
    }
}
