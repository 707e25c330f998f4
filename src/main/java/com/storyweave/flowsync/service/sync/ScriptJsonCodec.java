package com.storyweave.flowsync.service.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyweave.flowsync.dto.graph.FlowGraph;
import com.storyweave.flowsync.exception.ScriptCodecException;
import com.storyweave.flowsync.model.script.Script;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON form of scripts and flow graphs, as exchanged with the editor front end.
 * Statements carry their kind in a {@code type} property.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScriptJsonCodec {

    private final ObjectMapper objectMapper;

    public Script readScript(String json) {
        try {
            return objectMapper.readValue(json, Script.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to read script JSON: {}", e.getOriginalMessage());
            throw new ScriptCodecException("Invalid script JSON", e);
        }
    }

    public String writeScript(Script script) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(script);
        } catch (JsonProcessingException e) {
            log.error("Failed to write script JSON: {}", e.getOriginalMessage());
            throw new ScriptCodecException("Could not serialize script", e);
        }
    }

    public FlowGraph readGraph(String json) {
        try {
            return objectMapper.readValue(json, FlowGraph.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to read flow graph JSON: {}", e.getOriginalMessage());
            throw new ScriptCodecException("Invalid flow graph JSON", e);
        }
    }

    public String writeGraph(FlowGraph graph) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            log.error("Failed to write flow graph JSON: {}", e.getOriginalMessage());
            throw new ScriptCodecException("Could not serialize flow graph", e);
        }
    }
}
