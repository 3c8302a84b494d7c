package eu.virtualparadox.docalign.util;

import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.Function;

/**
 * Lazy k-way merge of iterators that are each sorted by the same comparator.
 * <p>
 * Every {@link #next()} yields the smallest current head over all sources and then pulls
 * one more element from that source only. Equal heads are emitted in source order. The
 * merge is finite iff every source is finite and, being an iterator, cannot be restarted.
 * </p>
 *
 * @param <T> element type
 */
public final class Interleaved<T> implements Iterator<T> {

    private final PriorityQueue<Head<T>> heads;

    public Interleaved(final Comparator<? super T> order, final List<? extends Iterator<? extends T>> sources) {
        Objects.requireNonNull(order, "order must not be null");
        Objects.requireNonNull(sources, "sources must not be null");

        final Comparator<Head<T>> byElement = (a, b) -> order.compare(a.element, b.element);
        this.heads = new PriorityQueue<>(Math.max(1, sources.size()),
                byElement.thenComparingInt(head -> head.source));

        for (int i = 0; i < sources.size(); i++) {
            final Iterator<? extends T> source = Objects.requireNonNull(sources.get(i), "source must not be null");
            if (source.hasNext()) {
                heads.add(new Head<>(i, source, source.next()));
            }
        }
    }

    /**
     * Merge ordered by a key extracted from each element.
     */
    public static <T, K extends Comparable<? super K>> Interleaved<T> byKey(
            final Function<? super T, ? extends K> key,
            final List<? extends Iterator<? extends T>> sources) {
        return new Interleaved<>(Comparator.comparing(key), sources);
    }

    /**
     * Total number of elements the merge of these collections yields.
     */
    public static int size(final Collection<?>... collections) {
        int size = 0;
        for (final Collection<?> collection : collections) {
            size += collection.size();
        }
        return size;
    }

    @Override
    public boolean hasNext() {
        return !heads.isEmpty();
    }

    @Override
    public T next() {
        final Head<T> head = heads.poll();
        if (head == null) {
            throw new NoSuchElementException();
        }
        if (head.iterator.hasNext()) {
            heads.add(new Head<>(head.source, head.iterator, head.iterator.next()));
        }
        return head.element;
    }

    private static final class Head<T> {
        private final int source;
        private final Iterator<? extends T> iterator;
        private final T element;

        private Head(final int source, final Iterator<? extends T> iterator, final T element) {
            this.source = source;
            this.iterator = iterator;
            this.element = element;
        }
    }
}
