package org.tableau.branch;

import org.tableau.formula.Expression;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Ramo corrente del tableau: formule assunte vere lungo il cammino, in ordine di aggiunta.
 *
 * Il ramo è persistente: {@link #extend} restituisce un nuovo ramo e lascia intatto quello
 * di partenza. Un'alternativa fallita viene semplicemente abbandonata e l'alternativa
 * successiva riparte dallo stesso prefisso, senza alcuna operazione di annullamento.
 */
public final class Branch {

    private static final Branch EMPTY = new Branch(ConsList.empty());

    /** Formule con la più recente in testa */
    private final ConsList<Expression> newestFirst;

    private Branch(ConsList<Expression> newestFirst) {
        this.newestFirst = newestFirst;
    }

    public static Branch empty() {
        return EMPTY;
    }

    public static Branch of(Expression... formulas) {
        Branch branch = EMPTY;
        for (Expression formula : formulas) {
            branch = branch.extend(formula);
        }
        return branch;
    }

    public Branch extend(Expression formula) {
        return new Branch(newestFirst.prepend(formula));
    }

    public Branch extend(Collection<Expression> formulas) {
        ConsList<Expression> extended = newestFirst;
        for (Expression formula : formulas) {
            extended = extended.prepend(formula);
        }
        return new Branch(extended);
    }

    public boolean contains(Expression formula) {
        return newestFirst.contains(formula);
    }

    public int size() {
        return newestFirst.size();
    }

    public boolean isEmpty() {
        return newestFirst.isEmpty();
    }

    /** Formule nell'ordine in cui sono state aggiunte al ramo. */
    public List<Expression> formulas() {
        return Collections.unmodifiableList(newestFirst.toReversedList());
    }

    @Override
    public String toString() {
        return "Branch" + formulas();
    }
}
