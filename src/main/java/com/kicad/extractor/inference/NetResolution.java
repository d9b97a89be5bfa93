package com.kicad.extractor.inference;

import com.kicad.extractor.model.Net;
import lombok.Value;

import java.util.List;

/**
 * Nets to use downstream and where they came from.
 */
@Value
public class NetResolution {
    List<Net> nets;

    /**
     * {@code true} when the nets came from the inference backend, {@code false}
     * when the candidate nets were kept.
     */
    boolean inferred;

    /**
     * Why the candidate nets were kept; {@code null} when inferred.
     */
    String fallbackReason;

    public static NetResolution inferred(List<Net> nets) {
        return new NetResolution(nets, true, null);
    }

    public static NetResolution fallback(List<Net> candidates, String reason) {
        return new NetResolution(candidates, false, reason);
    }
}
