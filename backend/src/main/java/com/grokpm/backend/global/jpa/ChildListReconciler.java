package com.grokpm.backend.global.jpa;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reconciles a persistent child collection against a client-submitted list, matching rows by id.
 *
 * <p>A submitted entry whose id matches a current child updates that child. An entry without an id, or whose id
 * matches no current child, becomes a new child. Current children absent from the submission are removed from the
 * collection; with {@code orphanRemoval} on the mapping they are deleted at flush. The collection ends up in
 * submission order.</p>
 */
public final class ChildListReconciler {

    private ChildListReconciler() {
    }

    public static <E, I> Result<E> reconcile(
            List<E> current,
            List<I> submitted,
            Function<E, Long> childId,
            Function<I, Long> submittedId,
            Supplier<E> factory,
            BiConsumer<E, I> apply
    ) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(submitted, "submitted");

        Map<Long, E> byId = new LinkedHashMap<>();
        for (E child : current) {
            Long id = childId.apply(child);
            if (id != null) {
                byId.put(id, child);
            }
        }

        List<E> ordered = new ArrayList<>(submitted.size());
        List<E> inserted = new ArrayList<>();
        List<E> updated = new ArrayList<>();
        for (I input : submitted) {
            Long id = submittedId.apply(input);
            E child = id != null ? byId.remove(id) : null;
            if (child == null) {
                child = factory.get();
                inserted.add(child);
            } else {
                updated.add(child);
            }
            apply.accept(child, input);
            ordered.add(child);
        }

        List<E> removed = new ArrayList<>(byId.values());
        current.clear();
        current.addAll(ordered);
        return new Result<>(ordered, inserted, updated, removed);
    }

    public record Result<E>(List<E> ordered, List<E> inserted, List<E> updated, List<E> removed) {
    }
}
