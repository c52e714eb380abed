package org.tableau.branch;

import org.tableau.classifier.FormulaTypes;
import org.tableau.classifier.TypeClassifier;
import org.tableau.formula.Expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;

/**
 * OPERAZIONI SUL RAMO - Rilevamento conflitti, raccolta atomi e selezione della prossima formula
 *
 * Funzioni pure sullo stato di un ramo, consultate dal dispatcher e da tutte le regole.
 * Il classificatore fornito determina cosa è un atomo e con quale rango viene scelta
 * ciascuna formula in attesa.
 */
public class BranchOperations {

    private static final Logger LOGGER = Logger.getLogger(BranchOperations.class.getName());

    /** Ranghi provati in ordine: prima le regole che non ramificano */
    private static final int[] SELECTION_RANKS = {0, 1, 2};

    private final TypeClassifier classifier;

    public BranchOperations(TypeClassifier classifier) {
        if (classifier == null) {
            throw new IllegalArgumentException("Classificatore non può essere null");
        }
        this.classifier = classifier;
    }

    public TypeClassifier getClassifier() {
        return classifier;
    }

    //region RILEVAMENTO CONFLITTI

    /**
     * Verifica se il ramo contiene già la negazione del candidato.
     *
     * Conflitto se il ramo contiene NOT(candidate), oppure se il candidato è NOT(x)
     * e il ramo contiene x. Il confronto è strutturale.
     */
    public boolean hasConflict(Expression candidate, Branch branch) {
        if (branch.contains(candidate.negate())) {
            return true;
        }
        return FormulaTypes.isNot(candidate) && branch.contains(candidate.getOperand(0));
    }

    /**
     * Verifica se almeno un candidato è in conflitto con il ramo.
     * I candidati sono controllati nell'ordine dato, con uscita al primo conflitto.
     */
    public boolean anyConflict(Collection<Expression> candidates, Branch branch) {
        for (Expression candidate : candidates) {
            if (hasConflict(candidate, branch)) {
                LOGGER.finest(() -> "Conflitto: " + candidate + " contraddice il ramo");
                return true;
            }
        }
        return false;
    }

    //endregion

    //region RACCOLTA ATOMI

    /**
     * Atomi (anche negati) senza duplicati, nell'ordine della prima occorrenza.
     */
    public List<Expression> collectAtoms(Iterable<Expression> exprs) {
        Set<Expression> atoms = new LinkedHashSet<>();
        for (Expression expr : exprs) {
            if (isAtom(expr)) {
                atoms.add(expr);
            }
        }
        return new ArrayList<>(atoms);
    }

    /**
     * Formule non atomiche, nell'ordine dato (duplicati preservati).
     */
    public List<Expression> collectNonAtoms(Iterable<Expression> exprs) {
        List<Expression> compounds = new ArrayList<>();
        for (Expression expr : exprs) {
            if (!isAtom(expr)) {
                compounds.add(expr);
            }
        }
        return compounds;
    }

    public boolean isAtom(Expression expr) {
        return classifier.classify(FormulaTypes.ATOM, expr);
    }

    //endregion

    //region CODA DELLE FORMULE IN ATTESA

    /**
     * Accoda in testa la formula se composta; gli atomi non richiedono espansione.
     */
    public PendingQueue enqueueIfCompound(Expression expr, PendingQueue queue) {
        return isAtom(expr) ? queue : queue.push(expr);
    }

    /**
     * Accoda tutte le formule composte nell'ordine dato.
     */
    public PendingQueue enqueueAllCompound(Collection<Expression> exprs, PendingQueue queue) {
        PendingQueue result = queue;
        for (Expression expr : exprs) {
            result = enqueueIfCompound(expr, result);
        }
        return result;
    }

    /**
     * Sceglie la prossima formula da espandere.
     *
     * ALGORITMO:
     * 1. Per i ranghi 0, 1, 2 in quest'ordine cerca il primo elemento con quel rango
     * 2. La prima corrispondenza trovata viene scelta (alpha prima di beta)
     * 3. Dalla coda residua sono rimosse tutte le copie strutturalmente uguali
     *
     * @param queue coda non vuota
     * @return formula scelta e coda residua
     * @throws IllegalStateException se la coda è vuota
     * @throws UnrankedFormulaException se nessun elemento ha rango tra 0 e 2
     */
    public Selection pickNext(PendingQueue queue) {
        if (queue.isEmpty()) {
            throw new IllegalStateException("Nessuna formula da selezionare: coda vuota");
        }

        List<Expression> pending = queue.formulas();
        for (int rank : SELECTION_RANKS) {
            for (Expression candidate : pending) {
                OptionalInt candidateRank = classifier.rankOf(candidate);
                if (candidateRank.isPresent() && candidateRank.getAsInt() == rank) {
                    return new Selection(candidate, queue.removeAll(candidate));
                }
            }
        }

        throw new UnrankedFormulaException("Nessuna formula in coda ha rango 0-2: " + pending);
    }

    //endregion
}
