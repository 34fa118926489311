package de.mirkosertic.docanalyst.batch;

import java.util.List;

/**
 * Outcomes of all documents of a batch, in discovery order.
 */
public record BatchReport(List<DocumentOutcome> outcomes, long durationMs) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public static BatchReport empty() {
        return new BatchReport(List.of(), 0);
    }

    public long count(final DocumentOutcome.Status status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }

    public long successCount() {
        return count(DocumentOutcome.Status.WRITTEN);
    }

    public long failureCount() {
        return outcomes.size() - successCount();
    }

    public List<DocumentOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).toList();
    }
}
