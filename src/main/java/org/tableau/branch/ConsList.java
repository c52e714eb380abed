package org.tableau.branch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * Lista concatenata immutabile con condivisione strutturale della coda.
 *
 * L'aggiunta in testa costa O(1) e non modifica la lista di partenza: due estensioni
 * diverse della stessa lista condividono i nodi comuni. Base di {@link Branch} e
 * {@link PendingQueue}.
 *
 * @param <E> tipo degli elementi (non null)
 */
final class ConsList<E> implements Iterable<E> {

    private final E head;
    private final ConsList<E> tail;
    private final int size;

    private ConsList(E head, ConsList<E> tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    /** Lista vuota, nodo terminale senza elemento. */
    static <E> ConsList<E> empty() {
        return new ConsList<>(null, null, 0);
    }

    ConsList<E> prepend(E element) {
        if (element == null) {
            throw new IllegalArgumentException("Elemento null non ammesso");
        }
        return new ConsList<>(element, this, size + 1);
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    boolean contains(Object element) {
        for (E current : this) {
            if (current.equals(element)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Nuova lista senza gli elementi che soddisfano il filtro, ordine relativo preservato.
     * Il suffisso successivo all'ultimo elemento rimosso viene condiviso.
     */
    ConsList<E> removeIf(Predicate<? super E> filter) {
        List<E> kept = new ArrayList<>();
        ConsList<E> lastRemovedTail = null;
        List<E> keptBeforeSuffix = null;

        for (ConsList<E> node = this; !node.isEmpty(); node = node.tail) {
            if (filter.test(node.head)) {
                lastRemovedTail = node.tail;
                keptBeforeSuffix = new ArrayList<>(kept);
            } else {
                kept.add(node.head);
            }
        }

        if (lastRemovedTail == null) {
            return this;
        }

        ConsList<E> result = lastRemovedTail;
        for (int i = keptBeforeSuffix.size() - 1; i >= 0; i--) {
            result = result.prepend(keptBeforeSuffix.get(i));
        }
        return result;
    }

    /** Elementi dalla testa alla fine. */
    List<E> toList() {
        List<E> elements = new ArrayList<>(size);
        for (E element : this) {
            elements.add(element);
        }
        return elements;
    }

    /** Elementi dalla fine alla testa. */
    List<E> toReversedList() {
        List<E> elements = toList();
        Collections.reverse(elements);
        return elements;
    }

    @Override
    public Iterator<E> iterator() {
        return new Iterator<>() {
            private ConsList<E> current = ConsList.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public E next() {
                if (current.isEmpty()) {
                    throw new NoSuchElementException();
                }
                E value = current.head;
                current = current.tail;
                return value;
            }
        };
    }
}
