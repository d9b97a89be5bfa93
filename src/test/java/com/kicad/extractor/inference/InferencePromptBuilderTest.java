package com.kicad.extractor.inference;

import com.kicad.extractor.model.Component;
import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.ParsedSchematic;
import com.kicad.extractor.model.PinReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InferencePromptBuilderTest {

    private static final ParsedSchematic SCHEMATIC = ParsedSchematic.builder()
            .components(List.of(Component.builder().ref("U1").value("NE555P").libId("Timer:NE555P").build()))
            .nets(List.of(
                    Net.label("VDD", 1),
                    Net.pin("NET_U1_4", 2, PinReference.of("U1", "4"))))
            .build();

    @Test
    void testPromptCarriesComponentsAndLabels() throws NetInferenceException {
        String prompt = new InferencePromptBuilder().build(SCHEMATIC);

        assertThat(prompt).startsWith("You are an expert electrical engineer.");
        assertThat(prompt).contains("\"ref\" : \"U1\"");
        assertThat(prompt).contains("\"lib_id\" : \"Timer:NE555P\"");
        assertThat(prompt).contains("Labels:");
        assertThat(prompt).contains("\"VDD\"").contains("\"NET_U1_4\"");
    }

    @Test
    void testLabelsSkipBlankNames() {
        ParsedSchematic schematic = SCHEMATIC.withNets(List.of(Net.label("", 1), Net.label("GND", 2)));

        assertThat(InferencePromptBuilder.labelsOf(schematic)).containsExactly("GND");
    }
}
