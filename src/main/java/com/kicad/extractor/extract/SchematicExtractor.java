package com.kicad.extractor.extract;

import com.kicad.extractor.config.ExtractorConfig;
import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.ParsedSchematic;
import com.kicad.extractor.sexpr.SexprList;
import com.kicad.extractor.sexpr.SexprParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the full extraction pipeline on one schematic:
 * parse, extract components, label nets, pin nets, assemble.
 *
 * Each call is independent; the net code counter lives only for the duration of
 * one call, so identical text always yields an identical model.
 */
public class SchematicExtractor {
    private static final Logger log = LoggerFactory.getLogger(SchematicExtractor.class);

    private final SexprParser parser;
    private final ComponentExtractor componentExtractor;
    private final NetSynthesizer netSynthesizer;

    public SchematicExtractor(ExtractorConfig config) {
        PropertyResolver resolver = new PropertyResolver(config.getPropertyScope());
        this.parser = new SexprParser();
        this.componentExtractor = new ComponentExtractor(resolver, new FootprintSuggester());
        this.netSynthesizer = new NetSynthesizer(resolver, config.isIncludeGlobalLabels());
    }

    public SchematicExtractor() {
        this(ExtractorConfig.defaults());
    }

    public ExtractionResult extract(Path schematicFile) throws IOException {
        log.info("Parsing schematic: {}", schematicFile.getFileName());
        return extract(Files.readString(schematicFile, StandardCharsets.UTF_8));
    }

    /**
     * @throws com.kicad.extractor.sexpr.GrammarException if the text is malformed
     */
    public ExtractionResult extract(String schematicText) {
        SexprList root = parser.parse(schematicText);
        return extract(root);
    }

    public ExtractionResult extract(SexprList root) {
        ComponentExtraction components = componentExtractor.extract(root);

        NetCodeSequence codes = new NetCodeSequence();
        List<Net> labelNets = netSynthesizer.labelNets(root, codes);
        List<Net> pinNets = netSynthesizer.pinNets(root, codes);

        List<Net> nets = new ArrayList<>(labelNets.size() + pinNets.size());
        nets.addAll(labelNets);
        nets.addAll(pinNets);

        ParsedSchematic schematic = ParsedSchematic.builder()
                .components(components.getComponents())
                .nets(nets)
                .footprintSuggestions(components.getFootprintSuggestions())
                .build();

        log.debug("Extraction finished: {} components, {} label nets, {} pin nets",
                schematic.getComponents().size(), labelNets.size(), pinNets.size());

        return ExtractionResult.builder()
                .schematic(schematic)
                .symbolsVisited(components.getSymbolsVisited())
                .symbolsFiltered(components.getSymbolsFiltered())
                .labelNets(labelNets.size())
                .pinNets(pinNets.size())
                .build();
    }
}
