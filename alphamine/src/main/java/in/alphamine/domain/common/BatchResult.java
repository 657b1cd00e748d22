package in.alphamine.domain.common;

import java.util.List;

/**
 * All entries of a batch, in input order. Every input appears exactly once.
 */
public record BatchResult<I, R>(List<BatchEntry<I, R>> entries) {

    public BatchResult {
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public long successCount() {
        return entries.stream().filter(BatchEntry::isSuccess).count();
    }

    public List<BatchEntry<I, R>> failures() {
        return entries.stream().filter(e -> !e.isSuccess()).toList();
    }

    public List<R> successes() {
        return entries.stream()
            .filter(BatchEntry::isSuccess)
            .map(e -> e.outcome().value())
            .toList();
    }
}
