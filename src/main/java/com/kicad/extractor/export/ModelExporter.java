package com.kicad.extractor.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.kicad.extractor.model.Component;
import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.ParsedSchematic;
import com.kicad.extractor.model.PinReference;
import com.kicad.extractor.util.FileWriteUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link ParsedSchematic} to the JSON interchange layout:
 *
 * <pre>
 * {
 *   "components": [ {"ref", "value", "footprint", "lib_id"} ],
 *   "nets": [ {"name", "code", "nodes": [ {"ref", "pin"} ]} ],
 *   "footprint_suggestions": { "&lt;ref&gt;": "&lt;footprint&gt;" }
 * }
 * </pre>
 *
 * Order of arrays and of the suggestion table is written exactly as held by the model.
 */
public class ModelExporter {
    private static final Logger log = LoggerFactory.getLogger(ModelExporter.class);

    private static final String LINE_FEED = "\n";

    private final ObjectWriter writer;

    public ModelExporter() {
        this(new ObjectMapper());
    }

    public ModelExporter(ObjectMapper mapper) {
        DefaultIndenter indenter = new DefaultIndenter("  ", LINE_FEED);
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentArraysWith(indenter);
        printer.indentObjectsWith(indenter);
        this.writer = mapper.writer(printer);
    }

    /**
     * @throws ExportException if the model violates its structural invariants
     */
    public String export(ParsedSchematic schematic) {
        List<String> problems = validate(schematic);
        if (!problems.isEmpty()) {
            throw new ExportException("Cannot export malformed model: " + String.join("; ", problems));
        }
        try {
            return writer.writeValueAsString(schematic) + LINE_FEED;
        } catch (JsonProcessingException e) {
            throw new ExportException("Failed to serialize model", e);
        }
    }

    public void write(ParsedSchematic schematic, Path target) throws IOException {
        String json = export(schematic);
        FileWriteUtil.safeWriteString(target, json);
        log.debug("Wrote {} bytes to {}", json.length(), target);
    }

    List<String> validate(ParsedSchematic schematic) {
        List<String> problems = new ArrayList<>();
        if (schematic == null) {
            problems.add("model is null");
            return problems;
        }
        if (schematic.getComponents() == null || schematic.getNets() == null
                || schematic.getFootprintSuggestions() == null) {
            problems.add("model collections must not be null");
            return problems;
        }

        for (Component component : schematic.getComponents()) {
            if (component.getRef().isEmpty()) {
                problems.add("component with empty reference");
            }
        }

        List<Net> nets = schematic.getNets();
        for (int i = 0; i < nets.size(); i++) {
            Net net = nets.get(i);
            if (net.getCode() != i + 1) {
                problems.add("net '" + net.getName() + "' at position " + (i + 1) + " has code " + net.getCode());
            }
            for (PinReference node : net.getNodes()) {
                if (node.getRef().isEmpty() || node.getPin().isEmpty()) {
                    problems.add("net '" + net.getName() + "' has an incomplete node " + node);
                }
            }
        }

        for (Map.Entry<String, String> entry : schematic.getFootprintSuggestions().entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                problems.add("footprint suggestion with null key or value");
            }
        }
        return problems;
    }
}
