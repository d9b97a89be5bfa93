package com.kicad.extractor.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.NonNull;
import lombok.Value;

/**
 * One pin of one component instance.
 */
@Value(staticConstructor = "of")
@JsonPropertyOrder({"ref", "pin"})
public class PinReference {
    @NonNull
    String ref;
    @NonNull
    String pin;

    @Override
    public String toString() {
        return ref + ":" + pin;
    }
}
