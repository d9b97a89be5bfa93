package com.kicad.extractor.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.ParsedSchematic;
import com.kicad.extractor.util.TemplateRenderer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the net inference prompt from {@code templates/net-inference-prompt.ftl}.
 *
 * The prompt carries the components and the names of all candidate nets.
 */
public class InferencePromptBuilder {

    static final String TEMPLATE = "net-inference-prompt.ftl";

    private final TemplateRenderer renderer;
    private final ObjectMapper mapper;

    public InferencePromptBuilder() {
        this(new TemplateRenderer(), new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public InferencePromptBuilder(TemplateRenderer renderer, ObjectMapper mapper) {
        this.renderer = renderer;
        this.mapper = mapper;
    }

    public String build(ParsedSchematic schematic) throws NetInferenceException {
        try {
            return renderer.render(TEMPLATE, Map.of(
                    "componentsJson", mapper.writeValueAsString(schematic.getComponents()),
                    "labelsJson", mapper.writeValueAsString(labelsOf(schematic))));
        } catch (JsonProcessingException e) {
            throw new NetInferenceException("Failed to serialize prompt data", e);
        } catch (IOException e) {
            throw new NetInferenceException("Failed to render inference prompt", e);
        }
    }

    static List<String> labelsOf(ParsedSchematic schematic) {
        List<String> labels = new ArrayList<>();
        for (Net net : schematic.getNets()) {
            if (!net.getName().isBlank()) {
                labels.add(net.getName());
            }
        }
        return labels;
    }
}
