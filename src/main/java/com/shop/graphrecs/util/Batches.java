package com.shop.graphrecs.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Splits a sequence into fixed-size batches, lazily and in order.
 */
public final class Batches {

    private Batches() {
    }

    /**
     * Group {@code source} into lists of {@code size} elements; the last list holds the remainder
     * and is never empty. The source is read once, as the returned batches are consumed.
     *
     * @throws IllegalArgumentException if size is not positive
     */
    public static <T> Iterable<List<T>> chunk(Iterable<T> source, int size) {
        Objects.requireNonNull(source, "source");
        if (size <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + size);
        }
        return () -> new ChunkIterator<>(source.iterator(), size);
    }

    private static final class ChunkIterator<T> implements Iterator<List<T>> {

        private final Iterator<T> source;
        private final int size;

        ChunkIterator(Iterator<T> source, int size) {
            this.source = source;
            this.size = size;
        }

        @Override
        public boolean hasNext() {
            return source.hasNext();
        }

        @Override
        public List<T> next() {
            if (!source.hasNext()) {
                throw new NoSuchElementException();
            }
            List<T> buffer = new ArrayList<>(size);
            while (buffer.size() < size && source.hasNext()) {
                buffer.add(source.next());
            }
            return buffer;
        }
    }
}
