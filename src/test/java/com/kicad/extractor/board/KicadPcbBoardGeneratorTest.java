package com.kicad.extractor.board;

import com.kicad.extractor.extract.TreeSearch;
import com.kicad.extractor.model.Component;
import com.kicad.extractor.sexpr.SexprList;
import com.kicad.extractor.sexpr.SexprParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the KiCad board writer. The output is read back with the schematic parser.
 */
class KicadPcbBoardGeneratorTest {

    @TempDir
    Path tempDir;

    private final SexprParser parser = new SexprParser();

    private SexprList generate(BoardRequest request, FootprintChooser chooser) throws IOException {
        BoardResult result = new KicadPcbBoardGenerator(chooser).generate(request);
        assertThat(result.getArtifact().getFileName().toString()).isEqualTo("ai_generated_board.kicad_pcb");
        return parser.parse(Files.readString(result.getArtifact(), StandardCharsets.UTF_8));
    }

    @Test
    void testBoardHeaderAndOutline() throws IOException {
        SexprList board = generate(BoardFixtures.timerRequest(tempDir), new SuggestedFootprintChooser());

        assertThat(board.keyword()).contains("kicad_pcb");
        assertThat(TreeSearch.findChild("version", board).flatMap(v -> v.atomText(1))).contains("20240108");

        SexprList title = TreeSearch.findAll("title", board).get(0);
        assertThat(title.atomText(1)).contains("AI_Generated_PCB");

        SexprList outline = TreeSearch.findChild("gr_rect", board).orElseThrow();
        assertThat(TreeSearch.findChild("end", outline).orElseThrow().getChildren().toString())
                .isEqualTo("[end, 100, 80]");
        assertThat(TreeSearch.findChild("layer", outline).flatMap(l -> l.atomText(1))).contains("Edge.Cuts");
        assertThat(TreeSearch.findAll("width", outline).get(0).atomText(1)).contains("0.15");
    }

    @Test
    void testNetTableReservesCodeZero() throws IOException {
        SexprList board = generate(BoardFixtures.timerRequest(tempDir), new SuggestedFootprintChooser());

        List<SexprList> nets = TreeSearch.findChildren("net", board);

        assertThat(nets).extracting(n -> n.atomText(1).orElse("") + "=" + n.atomText(2).orElse(""))
                .containsExactly("0=", "1=VDD", "2=OUT", "3=SIG_IN");
    }

    @Test
    void testFootprintsArePlacedOnGrid() throws IOException {
        SexprList board = generate(BoardFixtures.timerRequest(tempDir), new SuggestedFootprintChooser());

        List<SexprList> footprints = TreeSearch.findChildren("footprint", board);

        assertThat(footprints).extracting(f -> f.atomText(1).orElse(""))
                .containsExactly("Package_SO:SOIC-8_3.9x4.9mm_P1.27mm", "Resistor_SMD:R_0603", "Resistor_SMD:R_0603");
        assertThat(footprints).extracting(KicadPcbBoardGeneratorTest::position)
                .containsExactly("10,10", "30,10", "50,10");

        SexprList reference = TreeSearch.findChildren("property", footprints.get(0)).get(0);
        assertThat(reference.atomText(1)).contains("Reference");
        assertThat(reference.atomText(2)).contains("U1");
    }

    @Test
    void testGridWrapsAfterFiveColumns() throws IOException {
        BoardRequest.BoardRequestBuilder request = BoardRequest.builder().outputDir(tempDir);
        for (int i = 1; i <= 6; i++) {
            request.component(Component.builder().ref("R" + i).build());
        }

        SexprList board = generate(request.build(), new SuggestedFootprintChooser());

        assertThat(TreeSearch.findChildren("footprint", board))
                .extracting(KicadPcbBoardGeneratorTest::position)
                .containsExactly("10,10", "30,10", "50,10", "70,10", "90,10", "10,30");
    }

    @Test
    void testDemoTracksOnlyForMultiPinNets() throws IOException {
        SexprList board = generate(BoardFixtures.timerRequest(tempDir), new SuggestedFootprintChooser());

        List<SexprList> segments = TreeSearch.findChildren("segment", board);

        assertThat(segments).hasSize(1);
        SexprList segment = segments.get(0);
        assertThat(TreeSearch.findChild("start", segment).orElseThrow().getChildren().toString()).isEqualTo("[start, 20, 20]");
        assertThat(TreeSearch.findChild("end", segment).orElseThrow().getChildren().toString()).isEqualTo("[end, 30, 30]");
        assertThat(TreeSearch.findChild("width", segment).flatMap(w -> w.atomText(1))).contains("0.25");
        assertThat(TreeSearch.findChild("net", segment).flatMap(n -> n.atomText(1))).contains("1");
    }

    @Test
    void testBlankChoiceSkipsFootprint() throws IOException {
        FootprintChooser chooser = (component, suggested) -> component.getRef().equals("R1") ? "" : suggested;

        BoardResult result = new KicadPcbBoardGenerator(chooser).generate(BoardFixtures.timerRequest(tempDir));

        assertThat(result.getComponentsPlaced()).isEqualTo(2);
        assertThat(result.getComponentsSkipped()).isEqualTo(1);
        SexprList board = parser.parse(Files.readString(result.getArtifact(), StandardCharsets.UTF_8));
        assertThat(TreeSearch.findChildren("footprint", board)).extracting(KicadPcbBoardGeneratorTest::position)
                .containsExactly("10,10", "30,10");
    }

    @Test
    void testNumberFormatting() {
        assertThat(KicadPcbBoardGenerator.number(10).getText()).isEqualTo("10");
        assertThat(KicadPcbBoardGenerator.number(0).getText()).isEqualTo("0");
        assertThat(KicadPcbBoardGenerator.number(-1.5).getText()).isEqualTo("-1.5");
        assertThat(KicadPcbBoardGenerator.number(0.15).getText()).isEqualTo("0.15");
    }

    private static String position(SexprList footprint) {
        SexprList at = TreeSearch.findChild("at", footprint).orElseThrow();
        return at.atomText(1).orElse("") + "," + at.atomText(2).orElse("");
    }
}
