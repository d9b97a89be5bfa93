package com.kicad.extractor.board;

import com.kicad.extractor.util.FileWriteUtil;
import com.kicad.extractor.util.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Writes a plain-text board summary. Used when no board-capable backend is wanted.
 */
public class TextSummaryBoardGenerator implements BoardGenerator {
    private static final Logger log = LoggerFactory.getLogger(TextSummaryBoardGenerator.class);

    static final String TEMPLATE = "board-summary.ftl";

    private final TemplateRenderer renderer;
    private final FootprintAssignment footprintAssignment;

    public TextSummaryBoardGenerator(FootprintChooser chooser) {
        this(new TemplateRenderer(), chooser);
    }

    public TextSummaryBoardGenerator(TemplateRenderer renderer, FootprintChooser chooser) {
        this.renderer = renderer;
        this.footprintAssignment = new FootprintAssignment(chooser);
    }

    @Override
    public BoardFormat format() {
        return BoardFormat.TEXT;
    }

    @Override
    public BoardResult generate(BoardRequest request) throws IOException {
        Map<String, String> footprints = footprintAssignment.assign(request);

        Map<String, Object> model = new HashMap<>();
        model.put("components", request.getComponents());
        model.put("nets", request.getNets());
        model.put("footprints", footprints);

        Path output = request.getOutputDir().resolve(format().getFileName());
        FileWriteUtil.safeWriteString(output, renderer.render(TEMPLATE, model));
        log.info("Board summary written to {}", output);

        return BoardResult.builder()
                .artifact(output)
                .format(format())
                .componentsPlaced(footprints.size())
                .componentsSkipped(request.getComponents().size() - footprints.size())
                .netsWritten(request.getNets().size())
                .build();
    }
}
