package org.tableau.branch;

import org.tableau.classifier.FormulaTypes;
import org.tableau.formula.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Modello trovato su un ramo aperto: atomi e atomi negati, senza duplicati.
 *
 * Un atomo nudo nel modello è assegnato a vero, un atomo negato a falso. Le variabili
 * della formula che non compaiono nel modello sono irrilevanti per la sua verità.
 */
public final class Model {

    /** Ordine canonico: per nome dell'atomo, un atomo negato usa il nome interno */
    public static final Comparator<Expression> CANONICAL_ORDER = Comparator.comparing(Model::atomName);

    private final List<Expression> literals;

    /**
     * @param literals atomi (eventualmente negati), nell'ordine desiderato
     * @throws IllegalArgumentException se un elemento non è un atomo
     */
    public Model(List<Expression> literals) {
        if (literals == null) {
            throw new IllegalArgumentException("Lista letterali non può essere null");
        }
        for (Expression literal : literals) {
            if (literal == null || !FormulaTypes.isAtom(literal)) {
                throw new IllegalArgumentException("Il modello ammette solo atomi, trovato: " + literal);
            }
        }
        this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
    }

    /**
     * Nuovo modello con i letterali in ordine canonico (ordinamento stabile).
     */
    public Model sorted() {
        List<Expression> ordered = new ArrayList<>(literals);
        ordered.sort(CANONICAL_ORDER);
        return new Model(ordered);
    }

    public List<Expression> getLiterals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    public boolean contains(Expression literal) {
        return literals.contains(literal);
    }

    /**
     * @return true se l'atomo con questo nome compare non negato
     */
    public boolean isTrue(String name) {
        return literals.contains(Expression.atom(name));
    }

    /**
     * Assegnamento nome -> valore nell'ordine del modello.
     */
    public Map<String, Boolean> getAssignment() {
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (Expression literal : literals) {
            assignment.put(atomName(literal), literal.isAtomic());
        }
        return assignment;
    }

    /** Nome della variabile di un atomo, anche se negato. */
    static String atomName(Expression literal) {
        return literal.isAtomic() ? literal.getName() : literal.getOperand(0).getName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return literals.equals(((Model) obj).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        return literals.toString();
    }
}
