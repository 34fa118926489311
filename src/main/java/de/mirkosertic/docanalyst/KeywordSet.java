package de.mirkosertic.docanalyst;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Immutable set of normalized terms used as relevance signal.
 */
public final class KeywordSet {

    private static final KeywordSet EMPTY = new KeywordSet(Set.of());

    private final Set<String> terms;

    private KeywordSet(final Set<String> terms) {
        this.terms = terms;
    }

    public static KeywordSet of(final Collection<String> terms) {
        if (terms.isEmpty()) {
            return EMPTY;
        }
        return new KeywordSet(Set.copyOf(terms));
    }

    public static KeywordSet empty() {
        return EMPTY;
    }

    public KeywordSet union(final KeywordSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        final Set<String> combined = new HashSet<>(terms);
        combined.addAll(other.terms);
        return new KeywordSet(Set.copyOf(combined));
    }

    public boolean contains(final String term) {
        return terms.contains(term);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public int size() {
        return terms.size();
    }

    public Set<String> terms() {
        return terms;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeywordSet)) {
            return false;
        }
        return terms.equals(((KeywordSet) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return "KeywordSet" + terms;
    }
}
