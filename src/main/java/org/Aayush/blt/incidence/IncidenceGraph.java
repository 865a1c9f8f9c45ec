package org.Aayush.blt.incidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable bipartite incidence structure: equation rows to the unknowns they reference.
 *
 * <p>Derived per analysis run, never stored on the model.</p>
 */
public final class IncidenceGraph {
    private final List<IncidenceRow> rows;

    IncidenceGraph(List<IncidenceRow> rows) {
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
        for (int i = 0; i < this.rows.size(); i++) {
            if (this.rows.get(i).position() != i) {
                throw new IllegalArgumentException("row positions must be dense and ordered, found "
                        + this.rows.get(i).position() + " at " + i);
            }
        }
    }

    public List<IncidenceRow> rows() {
        return rows;
    }

    public IncidenceRow row(int position) {
        return rows.get(position);
    }

    public int size() {
        return rows.size();
    }

    /**
     * Returns the incidence entries as row id to referenced unknown names.
     *
     * <p>Derivative occurrences are listed under the variable name itself.</p>
     */
    public Map<String, Set<String>> entries() {
        Map<String, Set<String>> entries = new LinkedHashMap<>();
        for (IncidenceRow row : rows) {
            Set<String> names = new LinkedHashSet<>();
            for (Occurrence occurrence : row.occurrences()) {
                names.add(occurrence.variable());
            }
            entries.put(row.id(), Collections.unmodifiableSet(names));
        }
        return Collections.unmodifiableMap(entries);
    }
}
