package com.kicad.extractor.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.PinReference;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the free-text answer of a language model into nets.
 *
 * <p>Accepted shapes, optionally wrapped in a markdown code fence:
 * <ul>
 *   <li>a JSON array of {@code {"name": ..., "nodes": [{"ref": ..., "pin": ...}]}}</li>
 *   <li>an object with such an array under {@code "nets"}</li>
 * </ul>
 * Codes in the answer are ignored; nets are numbered by position.
 */
public class InferenceResponseParser {

    private static final String FENCE = "```";

    private final ObjectMapper mapper;

    public InferenceResponseParser() {
        this(new ObjectMapper());
    }

    public InferenceResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Net> parse(String text) throws NetInferenceException {
        if (text == null || text.isBlank()) {
            throw new NetInferenceException("Empty inference response");
        }

        JsonNode root;
        try {
            root = mapper.readTree(stripFence(text));
        } catch (JsonProcessingException e) {
            throw new NetInferenceException("Inference response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (root != null && root.isObject() && root.path("nets").isArray()) {
            root = root.get("nets");
        }
        if (root == null || !root.isArray()) {
            throw new NetInferenceException("Inference response is not a JSON array of nets");
        }

        List<Net> nets = new ArrayList<>();
        int position = 0;
        for (JsonNode element : root) {
            position++;
            nets.add(toNet(element, position));
        }
        return nets;
    }

    private static Net toNet(JsonNode element, int position) throws NetInferenceException {
        if (!element.isObject()) {
            throw new NetInferenceException("Net #" + position + " is not an object");
        }
        JsonNode name = element.get("name");
        if (name == null || !name.isValueNode() || name.asText().isBlank()) {
            throw new NetInferenceException("Net #" + position + " has no name");
        }

        Net.NetBuilder net = Net.builder().name(name.asText()).code(position);
        JsonNode nodes = element.path("nodes");
        if (!nodes.isMissingNode() && !nodes.isArray()) {
            throw new NetInferenceException("Nodes of net '" + name.asText() + "' are not an array");
        }
        for (JsonNode node : nodes) {
            JsonNode ref = node.get("ref");
            JsonNode pin = node.get("pin");
            if (ref == null || pin == null || !ref.isValueNode() || !pin.isValueNode()) {
                throw new NetInferenceException("Net '" + name.asText() + "' has a node without ref or pin");
            }
            net.node(PinReference.of(ref.asText(), pin.asText()));
        }
        return net.build();
    }

    /**
     * Content of the first markdown code fence, without its language tag.
     * Text without a fence is returned trimmed.
     */
    static String stripFence(String text) {
        String trimmed = text.strip();
        int open = trimmed.indexOf(FENCE);
        if (open < 0) {
            return trimmed;
        }
        String rest = trimmed.substring(open + FENCE.length());
        int close = rest.indexOf(FENCE);
        String body = close < 0 ? rest : rest.substring(0, close);

        int tagEnd = 0;
        while (tagEnd < body.length() && Character.isLetter(body.charAt(tagEnd))) {
            tagEnd++;
        }
        return body.substring(tagEnd).strip();
    }
}
