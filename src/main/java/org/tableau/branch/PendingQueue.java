package org.tableau.branch;

import org.tableau.formula.Expression;

import java.util.Collections;
import java.util.List;

/**
 * Formule composte ancora da espandere sul ramo corrente.
 *
 * Multinsieme persistente: i duplicati sono ammessi e l'ordine influenza solo quale
 * formula viene scelta per prima. Ogni operazione restituisce una nuova coda.
 */
public final class PendingQueue {

    private static final PendingQueue EMPTY = new PendingQueue(ConsList.empty());

    private final ConsList<Expression> elements;

    private PendingQueue(ConsList<Expression> elements) {
        this.elements = elements;
    }

    public static PendingQueue empty() {
        return EMPTY;
    }

    /**
     * Coda con gli elementi nell'ordine dato (il primo argomento è in testa).
     */
    public static PendingQueue of(Expression... formulas) {
        ConsList<Expression> list = ConsList.empty();
        for (int i = formulas.length - 1; i >= 0; i--) {
            list = list.prepend(formulas[i]);
        }
        return new PendingQueue(list);
    }

    /** Inserisce in testa. */
    public PendingQueue push(Expression formula) {
        return new PendingQueue(elements.prepend(formula));
    }

    /** Rimuove tutte le occorrenze strutturalmente uguali alla formula data. */
    public PendingQueue removeAll(Expression formula) {
        ConsList<Expression> remaining = elements.removeIf(formula::equals);
        return remaining == elements ? this : new PendingQueue(remaining);
    }

    public boolean contains(Expression formula) {
        return elements.contains(formula);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    /** Elementi dalla testa alla fine della coda. */
    public List<Expression> formulas() {
        return Collections.unmodifiableList(elements.toList());
    }

    @Override
    public String toString() {
        return "Pending" + formulas();
    }
}
