package org.physlang.dsl.analysis;

import org.physlang.dsl.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered collection of diagnostics produced by the pipeline stages.
 */
public final class Diagnostics implements Iterable<Diagnostic> {

    private final List<Diagnostic> items = new ArrayList<>();

    public void error(String message, Span span) {
        items.add(Diagnostic.error(message, span));
    }

    public void warning(String message, Span span) {
        items.add(Diagnostic.warning(message, span));
    }

    public void add(Diagnostic diagnostic) {
        items.add(diagnostic);
    }

    /**
     * Appends the diagnostics of {@code other} that are not already present.
     */
    public void merge(Diagnostics other) {
        for (Diagnostic diagnostic : other.items) {
            if (!items.contains(diagnostic)) {
                items.add(diagnostic);
            }
        }
    }

    public boolean hasErrors() {
        return items.stream().anyMatch(Diagnostic::isError);
    }

    public List<Diagnostic> errors() {
        return items.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return items.stream().filter(d -> !d.isError()).toList();
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    @Override
    public Iterator<Diagnostic> iterator() {
        return all().iterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic diagnostic : items) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append(diagnostic);
        }
        return sb.toString();
    }
}
