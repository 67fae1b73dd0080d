package org.satpath.encoding;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Nodi che devono (o non devono) comparire in una posizione intermedia del percorso.
 *
 * Gli insiemi sono ordinati, così la codifica produce sempre le clausole nello stesso ordine.
 */
public record ViaConstraint(SortedSet<Integer> required, SortedSet<Integer> forbidden) {

    private static final ViaConstraint NONE = new ViaConstraint(new TreeSet<>(), new TreeSet<>());

    public ViaConstraint {
        required = Collections.unmodifiableSortedSet(new TreeSet<>(required));
        forbidden = Collections.unmodifiableSortedSet(new TreeSet<>(forbidden));
    }

    public static ViaConstraint none() {
        return NONE;
    }

    public static ViaConstraint of(Collection<Integer> required, Collection<Integer> forbidden) {
        return new ViaConstraint(new TreeSet<>(required), new TreeSet<>(forbidden));
    }

    public static ViaConstraint requiring(Collection<Integer> required) {
        return of(required, Collections.emptyList());
    }

    public boolean isEmpty() {
        return required.isEmpty() && forbidden.isEmpty();
    }
}
