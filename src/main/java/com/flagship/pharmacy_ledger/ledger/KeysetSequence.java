package com.flagship.pharmacy_ledger.ledger;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite and restartable sequence backed by keyset-paged queries.
 *
 * Nothing is read until iteration starts; every call to {@link #iterator()} starts from the
 * first page again. Each page is one statement, so a page is internally consistent.
 *
 * @param <T> element type; the last element of a page is the key for the next page
 */
public class KeysetSequence<T> implements Iterable<T> {

    private final Function<T, List<T>> pageLoader;
    private final int pageSize;

    /**
     * @param pageLoader loads the page after the given element ({@code null} for the first page)
     * @param pageSize   page size the loader uses; a shorter page ends the sequence
     */
    public KeysetSequence(Function<T, List<T>> pageLoader, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive");
        }
        this.pageLoader = pageLoader;
        this.pageSize = pageSize;
    }

    @Override
    public Iterator<T> iterator() {
        return new PageIterator();
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private class PageIterator implements Iterator<T> {
        private List<T> page;
        private int index;
        private T last;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (page != null && index < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            if (page != null && page.size() < pageSize) {
                exhausted = true;
                return false;
            }
            page = pageLoader.apply(last);
            index = 0;
            if (page.isEmpty()) {
                exhausted = true;
                return false;
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            last = page.get(index++);
            return last;
        }
    }
}
