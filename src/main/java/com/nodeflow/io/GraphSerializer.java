package com.nodeflow.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.nodeflow.model.NodeGraph;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON persistence of node graphs through {@link GraphSaveData}.
 *
 * Saving names every node by its registry type key; loading recreates nodes
 * through the same registry and relinks the graph.
 */
@Log4j2
public final class GraphSerializer {

    private static final ObjectMapper DEFAULT_MAPPER = newMapper();

    private final NodeRegistry registry;
    private final ObjectMapper mapper;

    public GraphSerializer(NodeRegistry registry) {
        this(registry, newMapper());
    }

    public GraphSerializer(NodeRegistry registry, ObjectMapper mapper) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    static ObjectMapper defaultMapper() {
        return DEFAULT_MAPPER;
    }

    private static ObjectMapper newMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String serialize(GraphSaveData data) {
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize graph " + data.getName(), e);
        }
    }

    /**
     * Parses the persisted form.
     *
     * @throws IllegalArgumentException if the JSON is malformed.
     */
    public GraphSaveData deserialize(String json) {
        try {
            return mapper.readValue(json, GraphSaveData.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed graph JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String save(NodeGraph graph) {
        return serialize(GraphSaveData.fromModel(graph, registry));
    }

    public NodeGraph load(String json) {
        GraphSaveData data = deserialize(json);
        NodeGraph graph = data.toModel(registry, mapper);
        log.debug("Loaded graph '{}': {} nodes, {} connections", graph.getName(), graph.getNodes().size(),
                graph.getConnections().size());
        return graph;
    }

    public void write(NodeGraph graph, Path path) throws IOException {
        Files.writeString(path, save(graph));
    }

    public NodeGraph read(Path path) throws IOException {
        return load(Files.readString(path));
    }

    public NodeRegistry registry() {
        return registry;
    }
}
