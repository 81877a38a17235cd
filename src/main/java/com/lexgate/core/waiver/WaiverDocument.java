package com.lexgate.core.waiver;

import com.lexgate.core.model.Waiver;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed waiver document.
 *
 * @param warnings one line per unparseable waiver line, prefixed with its location
 */
public record WaiverDocument(List<Waiver> waivers, List<String> warnings) {

    public WaiverDocument {
        waivers = List.copyOf(waivers);
        warnings = List.copyOf(warnings);
    }

    public static WaiverDocument empty() {
        return new WaiverDocument(List.of(), List.of());
    }

    public WaiverDocument plus(WaiverDocument other) {
        var allWaivers = new ArrayList<>(waivers);
        allWaivers.addAll(other.waivers);
        var allWarnings = new ArrayList<>(warnings);
        allWarnings.addAll(other.warnings);
        return new WaiverDocument(allWaivers, allWarnings);
    }
}
