package com.launchpad.core.context;

import java.util.List;
import java.util.Optional;

/**
 * Read-only "context so far" handed to the next handler's prompt builder: the outputs of every
 * completed handler of a launch, in registry order.
 */
public final class ContextView {

    static final String EMPTY_MARKER = "No previous context available.";

    private static final ContextView EMPTY = new ContextView(List.of());

    private final List<ContextEntry> entries;

    public ContextView(List<ContextEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static ContextView empty() {
        return EMPTY;
    }

    public List<ContextEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<String> agentNames() {
        return entries.stream().map(ContextEntry::agentName).toList();
    }

    public Optional<String> outputOf(String agentName) {
        return entries.stream()
                .filter(e -> e.agentName().equals(agentName))
                .map(ContextEntry::output)
                .findFirst();
    }

    /**
     * Renders the full ordered history as prompt text. Same entries always render to the same
     * bytes, so a context rebuilt after a restart is indistinguishable from the original.
     */
    public String render() {
        if (entries.isEmpty()) {
            return EMPTY_MARKER;
        }
        var sb = new StringBuilder();
        for (int i = 0; i < entries.size(); i++) {
            var entry = entries.get(i);
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append("### ").append(i + 1).append(". ").append(entry.agentName()).append('\n');
            sb.append(entry.output());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContextView other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ContextView" + agentNames();
    }
}
