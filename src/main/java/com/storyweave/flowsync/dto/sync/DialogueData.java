package com.storyweave.flowsync.dto.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DialogueData {
    private String speaker;     // null for narration
    private String text;

    @Builder.Default
    private List<String> attributes = new ArrayList<>();
}
