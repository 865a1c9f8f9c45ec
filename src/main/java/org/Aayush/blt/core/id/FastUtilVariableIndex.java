package org.Aayush.blt.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable {@link VariableIndex} backed by a fastutil open hash map.
 *
 * <p>Safe for concurrent reads.</p>
 */
public class FastUtilVariableIndex implements VariableIndex {

    // name -> index without boxing
    private final Object2IntOpenHashMap<String> forward;
    // index -> name
    private final String[] reverse;

    /**
     * Builds the index from names in declaration order.
     *
     * @param names declared names; duplicates and nulls are rejected.
     */
    public FastUtilVariableIndex(List<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("Names cannot be null");
        }
        int size = names.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1); // Sentinel value
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String name = names.get(i);
            if (name == null) {
                throw new IllegalArgumentException("Variable name at index " + i + " is null");
            }
            if (forward.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate variable name: " + name);
            }
            forward.put(name, i);
            reverse[i] = name;
        }
        this.forward.trim();
    }

    @Override
    public int indexOf(String name) throws UnknownVariableException {
        int index = forward.getInt(name);
        if (index == -1) {
            throw new UnknownVariableException("Variable not declared: " + name);
        }
        return index;
    }

    @Override
    public String nameOf(int index) {
        if (index < 0 || index >= reverse.length) {
            throw new IndexOutOfBoundsException("Variable index out of bounds: " + index);
        }
        return reverse[index];
    }

    @Override
    public boolean contains(String name) {
        return name != null && forward.containsKey(name);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
