package com.kicad.extractor.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kicad.extractor.model.Component;
import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.ParsedSchematic;
import com.kicad.extractor.model.PinReference;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the interchange layout written by {@link ModelExporter} back into a model.
 *
 * Lenient: missing arrays and fields default to empty,
 * a missing net code defaults to the net's 1-based position.
 */
public class ModelReader {

    private final ObjectMapper mapper;

    public ModelReader() {
        this(new ObjectMapper());
    }

    public ModelReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ParsedSchematic read(Path file) throws IOException {
        return read(Files.readString(file, StandardCharsets.UTF_8));
    }

    public ParsedSchematic read(String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Parsed schematic must be a JSON object");
        }

        List<Component> components = new ArrayList<>();
        for (JsonNode node : root.path("components")) {
            components.add(Component.builder()
                    .ref(text(node, "ref"))
                    .value(text(node, "value"))
                    .footprint(text(node, "footprint"))
                    .libId(text(node, "lib_id"))
                    .build());
        }

        Map<String, String> suggestions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("footprint_suggestions").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            suggestions.put(entry.getKey(), entry.getValue().asText(""));
        }

        return ParsedSchematic.builder()
                .components(components)
                .nets(readNets(root.path("nets")))
                .footprintSuggestions(suggestions)
                .build();
    }

    /**
     * Nets from a JSON array of {@code {name, code?, nodes:[{ref, pin}]}}.
     */
    public static List<Net> readNets(JsonNode array) {
        List<Net> nets = new ArrayList<>();
        int position = 0;
        for (JsonNode node : array) {
            position++;
            Net.NetBuilder net = Net.builder()
                    .name(text(node, "name"))
                    .code(node.path("code").asInt(position));
            for (JsonNode pin : node.path("nodes")) {
                net.node(PinReference.of(text(pin, "ref"), text(pin, "pin")));
            }
            nets.add(net.build());
        }
        return nets;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText("");
    }
}
