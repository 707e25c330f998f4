package com.storyweave.flowsync.model.script;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScriptMetadata {
    private String filePath;
    private LocalDateTime parseTime;
    private String version;
}
