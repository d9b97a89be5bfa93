package com.kicad.extractor.extract;

import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.PinReference;
import com.kicad.extractor.sexpr.SexprList;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the candidate netlist of a schematic.
 *
 * <p>Two phases, always in this order:
 * <ol>
 *   <li>labels: one net without nodes per label, named after the label text;</li>
 *   <li>pins: one net per numbered pin of every placed symbol, named
 *       {@code NET_<ref>_<pin>} and holding that single pin.</li>
 * </ol>
 * Nets are never merged. Codes come from the {@link NetCodeSequence} passed in.
 */
@RequiredArgsConstructor
public class NetSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(NetSynthesizer.class);

    static final String LABEL = "label";
    static final Set<String> LABEL_KEYWORDS = Set.of(LABEL, "global_label", "hierarchical_label");
    static final String PIN = "pin";
    static final String NUMBER = "number";

    private final PropertyResolver propertyResolver;

    /**
     * Also treat {@code global_label} and {@code hierarchical_label} as label nets.
     */
    private final boolean includeGlobalLabels;

    public NetSynthesizer() {
        this(new PropertyResolver(), false);
    }

    /**
     * Phase A: label nets in label document order.
     */
    public List<Net> labelNets(SexprList root, NetCodeSequence codes) {
        List<SexprList> labels = includeGlobalLabels
                ? TreeSearch.findAny(LABEL_KEYWORDS, root)
                : TreeSearch.findAll(LABEL, root);

        List<Net> nets = new ArrayList<>();
        for (SexprList label : labels) {
            Optional<String> name = label.atomText(1);
            if (name.isEmpty()) {
                log.debug("Skipping label without name at line {}", label.getLine());
                continue;
            }
            nets.add(Net.label(name.get(), codes.next()));
        }
        return nets;
    }

    /**
     * Phase B: one single-node net per numbered pin of each placed symbol.
     */
    public List<Net> pinNets(SexprList root, NetCodeSequence codes) {
        List<Net> nets = new ArrayList<>();

        for (SexprList symbol : TreeSearch.findAll(ComponentExtractor.SYMBOL, root)) {
            String ref = propertyResolver.propertiesOf(symbol).getOrDefault(PropertyResolver.REFERENCE, "");
            if (!ReferenceFilter.isPlacedReference(ref)) {
                continue;
            }

            for (SexprList pin : TreeSearch.findAll(PIN, symbol)) {
                String number = pinNumberOf(pin);
                if (number.isEmpty()) {
                    log.debug("Pin of {} at line {} has no number, skipped", ref, pin.getLine());
                    continue;
                }
                nets.add(Net.pin(netName(ref, number), codes.next(), PinReference.of(ref, number)));
            }
        }
        return nets;
    }

    static String netName(String ref, String pin) {
        return "NET_" + ref + "_" + pin;
    }

    /**
     * Pin number from an immediate {@code (number "N" ...)} child. When a pin
     * carries several, the last one wins. Empty when there is none.
     */
    static String pinNumberOf(SexprList pin) {
        String number = "";
        for (SexprList child : TreeSearch.findChildren(NUMBER, pin)) {
            if (child.size() >= 2) {
                number = child.atomText(1).orElse(number);
            }
        }
        return number;
    }
}
