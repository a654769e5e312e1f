package org.depscope.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link LoadOrder} into the lines printed by the {@code order} command.
 */
public final class LoadOrderFormatter {

    public static final String SEPARATOR = "-> ";
    public static final String CYCLE_NOTE_PREFIX = "Note: cyclic dependencies detected at: ";
    public static final String EMPTY = "(empty)";

    private LoadOrderFormatter() {}

    public static List<String> format(LoadOrder loadOrder) {
        List<String> lines = new ArrayList<>(2);
        if (loadOrder.order().isEmpty()) {
            lines.add(EMPTY);
            return lines;
        }
        lines.add(String.join(SEPARATOR, loadOrder.order()));
        List<String> reported = loadOrder.reportedCycles();
        if (!reported.isEmpty()) {
            lines.add(CYCLE_NOTE_PREFIX + String.join(", ", reported));
        }
        return lines;
    }
}
