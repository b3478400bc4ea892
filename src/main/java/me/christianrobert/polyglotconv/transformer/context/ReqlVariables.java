package me.christianrobert.polyglotconv.transformer.context;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Insertion-ordered set of variable names known to hold ReQL terms.
 *
 * <p>Immutable: {@link #with(String)} returns a new instance, so the converter can thread
 * the set from one test item to the next while classifiers and builders only ever see a
 * read-only snapshot.</p>
 */
public final class ReqlVariables implements Iterable<String> {

    private static final ReqlVariables EMPTY = new ReqlVariables(new LinkedHashSet<>());

    private final Set<String> names;

    private ReqlVariables(LinkedHashSet<String> names) {
        this.names = Collections.unmodifiableSet(names);
    }

    public static ReqlVariables empty() {
        return EMPTY;
    }

    public static ReqlVariables of(String... names) {
        LinkedHashSet<String> set = new LinkedHashSet<>();
        Collections.addAll(set, names);
        return new ReqlVariables(set);
    }

    public static ReqlVariables of(Collection<String> names) {
        return new ReqlVariables(new LinkedHashSet<>(names));
    }

    /**
     * Returns a set containing the current names plus {@code name}; this instance is unchanged.
     */
    public ReqlVariables with(String name) {
        if (names.contains(name)) {
            return this;
        }
        LinkedHashSet<String> copy = new LinkedHashSet<>(names);
        copy.add(name);
        return new ReqlVariables(copy);
    }

    public ReqlVariables withAll(Collection<String> additional) {
        if (names.containsAll(additional)) {
            return this;
        }
        LinkedHashSet<String> copy = new LinkedHashSet<>(names);
        copy.addAll(additional);
        return new ReqlVariables(copy);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public int size() {
        return names.size();
    }

    public Set<String> asSet() {
        return names;
    }

    @Override
    public Iterator<String> iterator() {
        return names.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReqlVariables)) {
            return false;
        }
        return names.equals(((ReqlVariables) o).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "ReqlVariables" + names;
    }
}
