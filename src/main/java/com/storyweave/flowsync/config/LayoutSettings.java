package com.storyweave.flowsync.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutSettings {

    @Builder.Default
    private double nodeWidth = 280;

    @Builder.Default
    private double nodeHeight = 150;

    @Builder.Default
    private double horizontalSpacing = 50;  // between nodes of one rank

    @Builder.Default
    private double verticalSpacing = 100;   // between ranks

    @Builder.Default
    private double margin = 20;

    public static LayoutSettings defaults() {
        return LayoutSettings.builder().build();
    }
}
