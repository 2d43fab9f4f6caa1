package org.spinflip.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Assigns every variable label a dense index in {@code [0, size)}.
 * <p>
 * The engine works on int-indexed arrays; this class is the only place where labels
 * are translated. Indices follow the order in which labels were supplied.
 *
 * @param <V> The variable label type.
 */
public final class VariableIndex<V> {

    private final List<V> labels;
    private final Object2IntMap<V> indexOf;

    /**
     * @param labels The distinct labels, in index order. Repeated labels are kept once.
     */
    public VariableIndex(Collection<? extends V> labels) {
        this.labels = new ArrayList<>(labels.size());
        this.indexOf = new Object2IntOpenHashMap<>(labels.size());
        this.indexOf.defaultReturnValue(-1);
        for (V label : labels) {
            if (!indexOf.containsKey(label)) {
                indexOf.put(label, this.labels.size());
                this.labels.add(label);
            }
        }
    }

    public int size() {
        return labels.size();
    }

    public V label(int index) {
        return labels.get(index);
    }

    /**
     * @return The index of the label, or -1 if it is unknown.
     */
    public int indexOf(V label) {
        return indexOf.getInt(label);
    }

    public boolean contains(V label) {
        return indexOf.containsKey(label);
    }

    /**
     * @return The labels in index order, as an unmodifiable list.
     */
    public List<V> labels() {
        return Collections.unmodifiableList(labels);
    }
}
