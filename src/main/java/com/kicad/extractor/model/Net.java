package com.kicad.extractor.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A named net with the pins it connects.
 *
 * Label nets carry no nodes; nets synthesized from a pin carry exactly that pin.
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"name", "code", "nodes"})
public class Net {

    @NonNull
    String name;

    /**
     * 1-based position of the net in its netlist.
     */
    int code;

    @NonNull
    @Singular
    List<PinReference> nodes;

    public static Net label(String name, int code) {
        return Net.builder().name(name).code(code).build();
    }

    public static Net pin(String name, int code, PinReference pin) {
        return Net.builder().name(name).code(code).node(pin).build();
    }
}
