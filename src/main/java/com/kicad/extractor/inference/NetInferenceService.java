package com.kicad.extractor.inference;

import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.ParsedSchematic;
import com.kicad.extractor.model.PinReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the inference backend for refined nets and falls back to the candidate
 * nets whenever that fails.
 *
 * The fallback is unconditional: a missing backend, an exception, an empty answer
 * or a malformed net all yield the candidate nets of the schematic unchanged.
 * Inferred nets are renumbered so that codes equal their 1-based position.
 */
public class NetInferenceService {
    private static final Logger log = LoggerFactory.getLogger(NetInferenceService.class);

    private final NetInferenceClient client;

    /**
     * @param client backend to use, or {@code null} to always keep candidate nets
     */
    public NetInferenceService(NetInferenceClient client) {
        this.client = client;
    }

    public NetResolution resolveNets(ParsedSchematic schematic) {
        List<Net> candidates = schematic.getNets();

        if (client == null) {
            return fallback(candidates, "no inference backend configured");
        }

        log.info("Requesting net inference from {}", client.describe());
        List<Net> inferred;
        try {
            inferred = client.infer(schematic);
        } catch (NetInferenceException e) {
            return fallback(candidates, e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Unexpected inference failure", e);
            return fallback(candidates, "unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (inferred == null || inferred.isEmpty()) {
            return fallback(candidates, "backend returned no nets");
        }
        String problem = findProblem(inferred);
        if (problem != null) {
            return fallback(candidates, problem);
        }

        List<Net> renumbered = new ArrayList<>(inferred.size());
        for (int i = 0; i < inferred.size(); i++) {
            renumbered.add(inferred.get(i).toBuilder().code(i + 1).build());
        }
        log.info("Net inference returned {} nets", renumbered.size());
        return NetResolution.inferred(List.copyOf(renumbered));
    }

    private NetResolution fallback(List<Net> candidates, String reason) {
        log.warn("Net inference unavailable ({}), using {} candidate nets", reason, candidates.size());
        return NetResolution.fallback(candidates, reason);
    }

    private static String findProblem(List<Net> nets) {
        for (Net net : nets) {
            if (net == null) {
                return "backend returned a null net";
            }
            if (net.getName().isBlank()) {
                return "backend returned a net without name";
            }
            for (PinReference node : net.getNodes()) {
                if (node.getRef().isBlank() || node.getPin().isBlank()) {
                    return "net '" + net.getName() + "' has an incomplete node";
                }
            }
        }
        return null;
    }
}
