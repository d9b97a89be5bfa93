package com.kicad.extractor.inference;

import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.ParsedSchematic;

import java.util.List;

/**
 * A backend that turns a candidate netlist into a reconciled one.
 */
public interface NetInferenceClient {

    /**
     * @param schematic extracted model with candidate nets
     * @return inferred nets
     * @throws NetInferenceException on transport failure, timeout or an unusable response
     */
    List<Net> infer(ParsedSchematic schematic) throws NetInferenceException;

    /**
     * Short backend description for log output.
     */
    String describe();
}
