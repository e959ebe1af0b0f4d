package org.l5xst.fidelity;

import java.util.*;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Outcome of comparing two IR programs. {@code details} lists every unmatched item.
 */
public record FidelityReport(int matched, int mismatched, int missing, int extra, List<String> details) {
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public FidelityReport {
        details = List.copyOf(details);
    }

    public int total() {
        return matched + mismatched + missing + extra;
    }

    /** Matched share of all compared items; two empty programs agree completely. */
    public double ratio() {
        return total() == 0 ? 1.0 : (double) matched / total();
    }

    public double percent() {
        return ratio() * 100.0;
    }

    public boolean meets(double threshold) {
        return ratio() >= threshold;
    }

    public String summary() {
        return String.format(Locale.ROOT, "fidelity %.2f%% (matched %d, mismatched %d, missing %d, extra %d)",
            percent(), matched, mismatched, missing, extra);
    }

    public String toJson() {
        var json = gson.toJsonTree(this).getAsJsonObject();
        json.addProperty("score", ratio());
        return gson.toJson(json);
    }
}
