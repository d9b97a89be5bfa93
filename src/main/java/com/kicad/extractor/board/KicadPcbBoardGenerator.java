package com.kicad.extractor.board;

import com.kicad.extractor.model.Component;
import com.kicad.extractor.model.Net;
import com.kicad.extractor.sexpr.SexprAtom;
import com.kicad.extractor.sexpr.SexprList;
import com.kicad.extractor.sexpr.SexprNode;
import com.kicad.extractor.sexpr.SexprWriter;
import com.kicad.extractor.util.FileWriteUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@code .kicad_pcb} board: 100 x 80 mm outline on Edge.Cuts, one net
 * entry per net, one footprint per component on a 20 mm grid and a short demo
 * track for every net that connects at least two pins.
 *
 * Footprints are referenced by library identifier only; their pads are pulled in
 * when the board is updated from the libraries inside KiCad.
 */
public class KicadPcbBoardGenerator implements BoardGenerator {
    private static final Logger log = LoggerFactory.getLogger(KicadPcbBoardGenerator.class);

    static final String FILE_VERSION = "20240108";
    static final String TITLE = "AI_Generated_PCB";

    static final double BOARD_WIDTH_MM = 100;
    static final double BOARD_HEIGHT_MM = 80;
    static final double OUTLINE_WIDTH_MM = 0.15;
    static final double TRACK_WIDTH_MM = 0.25;

    static final double GRID_ORIGIN_MM = 10;
    static final double GRID_STEP_MM = 20;
    static final double GRID_MAX_X_MM = 80;

    private final FootprintAssignment footprintAssignment;

    public KicadPcbBoardGenerator(FootprintChooser chooser) {
        this.footprintAssignment = new FootprintAssignment(chooser);
    }

    @Override
    public BoardFormat format() {
        return BoardFormat.KICAD_PCB;
    }

    @Override
    public BoardResult generate(BoardRequest request) throws IOException {
        Map<String, String> footprints = footprintAssignment.assign(request);

        List<SexprNode> board = new ArrayList<>();
        board.add(symbol("kicad_pcb"));
        board.add(list(symbol("version"), symbol(FILE_VERSION)));
        board.add(list(symbol("generator"), string("kicad-schematic-extractor")));
        board.add(list(symbol("general"), list(symbol("thickness"), number(1.6))));
        board.add(list(symbol("paper"), string("A4")));
        board.add(list(symbol("title_block"),
                list(symbol("title"), string(TITLE)),
                list(symbol("comment"), symbol("1"), string("Auto-generated via net inference"))));
        board.add(layers());

        board.add(list(symbol("net"), symbol("0"), string("")));
        List<Net> nets = request.getNets();
        for (int i = 0; i < nets.size(); i++) {
            board.add(list(symbol("net"), symbol(Integer.toString(i + 1)), string(nets.get(i).getName())));
        }

        board.add(outline());

        int placed = addFootprints(board, request.getComponents(), footprints);
        addDemoTracks(board, nets);

        Path output = request.getOutputDir().resolve(format().getFileName());
        FileWriteUtil.safeWriteString(output, SexprWriter.pretty(new SexprList(board, 0, 0)));
        log.info("KiCad board written to {}", output);

        return BoardResult.builder()
                .artifact(output)
                .format(format())
                .componentsPlaced(placed)
                .componentsSkipped(request.getComponents().size() - placed)
                .netsWritten(nets.size())
                .build();
    }

    private int addFootprints(List<SexprNode> board, List<Component> components, Map<String, String> footprints) {
        double gridX = 0;
        double gridY = 0;
        int placed = 0;

        for (Component component : components) {
            String footprint = footprints.get(component.getRef());
            if (footprint == null) {
                continue;
            }

            board.add(list(symbol("footprint"), string(footprint),
                    list(symbol("layer"), string("F.Cu")),
                    list(symbol("at"), number(GRID_ORIGIN_MM + gridX), number(GRID_ORIGIN_MM + gridY)),
                    list(symbol("property"), string("Reference"), string(component.getRef()),
                            list(symbol("at"), number(0), number(-1.5), number(0)),
                            list(symbol("layer"), string("F.SilkS"))),
                    list(symbol("property"), string("Value"), string(component.getValue()),
                            list(symbol("at"), number(0), number(1.5), number(0)),
                            list(symbol("layer"), string("F.Fab")))));
            placed++;
            log.debug("Placed {} ({}) at ({}, {})", component.getRef(), footprint,
                    GRID_ORIGIN_MM + gridX, GRID_ORIGIN_MM + gridY);

            gridX += GRID_STEP_MM;
            if (gridX > GRID_MAX_X_MM) {
                gridX = 0;
                gridY += GRID_STEP_MM;
            }
        }
        return placed;
    }

    private void addDemoTracks(List<SexprNode> board, List<Net> nets) {
        for (int i = 0; i < nets.size(); i++) {
            if (nets.get(i).getNodes().size() < 2) {
                continue;
            }
            double start = 20 + i;
            board.add(list(symbol("segment"),
                    list(symbol("start"), number(start), number(start)),
                    list(symbol("end"), number(start + 10), number(start + 10)),
                    list(symbol("width"), number(TRACK_WIDTH_MM)),
                    list(symbol("layer"), string("F.Cu")),
                    list(symbol("net"), symbol(Integer.toString(i + 1)))));
        }
    }

    private static SexprList layers() {
        return list(symbol("layers"),
                list(symbol("0"), string("F.Cu"), symbol("signal")),
                list(symbol("31"), string("B.Cu"), symbol("signal")),
                list(symbol("37"), string("F.SilkS"), symbol("user")),
                list(symbol("49"), string("F.Fab"), symbol("user")),
                list(symbol("44"), string("Edge.Cuts"), symbol("user")));
    }

    private static SexprList outline() {
        return list(symbol("gr_rect"),
                list(symbol("start"), number(0), number(0)),
                list(symbol("end"), number(BOARD_WIDTH_MM), number(BOARD_HEIGHT_MM)),
                list(symbol("stroke"), list(symbol("width"), number(OUTLINE_WIDTH_MM)), list(symbol("type"), symbol("default"))),
                list(symbol("fill"), symbol("none")),
                list(symbol("layer"), string("Edge.Cuts")));
    }

    private static SexprList list(SexprNode... children) {
        return SexprList.of(children);
    }

    private static SexprAtom symbol(String text) {
        return SexprAtom.symbol(text);
    }

    private static SexprAtom string(String text) {
        return SexprAtom.string(text);
    }

    static SexprAtom number(double millimetres) {
        return SexprAtom.symbol(BigDecimal.valueOf(millimetres).stripTrailingZeros().toPlainString());
    }
}
