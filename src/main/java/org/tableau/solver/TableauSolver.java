package org.tableau.solver;

import org.tableau.branch.Branch;
import org.tableau.branch.BranchOperations;
import org.tableau.branch.Model;
import org.tableau.branch.PendingQueue;
import org.tableau.classifier.FormulaTypes;
import org.tableau.classifier.TypeClassifier;
import org.tableau.formula.Expression;
import org.tableau.formula.InvalidFormulaException;
import org.tableau.search.RuleDispatcher;
import org.tableau.search.RuleRegistry;
import org.tableau.search.TableauRules;
import org.tableau.search.TableauStatistics;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * SOLUTORE TABLEAU - Punto di ingresso per la verifica di soddisfacibilità
 *
 * Decide se una formula proposizionale è soddisfacibile con il metodo dei tableau
 * semantici: la formula viene espansa lungo un ramo nelle sue conseguenze logiche,
 * le contraddizioni chiudono il ramo e la ricerca prosegue sulle alternative fino a
 * trovare un ramo aperto (modello) o ad esaurirle tutte (UNSAT).
 *
 * PIPELINE:
 * 1. Inizializzazione: ramo = [formula], coda = formula se composta
 * 2. Ricerca in profondità tramite {@link RuleDispatcher}
 * 3. Ordinamento canonico degli atomi del modello trovato
 *
 * Il solutore non ha stato mutabile condiviso: ogni chiamata crea il proprio dispatcher
 * e le proprie statistiche, i registri sono in sola lettura. La stessa istanza può
 * essere usata da più thread.
 */
public class TableauSolver {

    private static final Logger LOGGER = Logger.getLogger(TableauSolver.class.getName());

    private final TypeClassifier classifier;
    private final RuleRegistry rules;

    /**
     * Solutore con classificatore e regole predefiniti.
     */
    public TableauSolver() {
        this(FormulaTypes.defaultClassifier(), TableauRules.defaultRegistry());
    }

    /**
     * Solutore con registri personalizzati.
     *
     * @param classifier registro dei tipi (deve contenere il tag "atom" e i tag delle regole)
     * @param rules registro delle regole di espansione
     */
    public TableauSolver(TypeClassifier classifier, RuleRegistry rules) {
        if (classifier == null || rules == null) {
            throw new IllegalArgumentException("Classificatore e registro regole non possono essere null");
        }
        this.classifier = classifier;
        this.rules = rules;
    }

    /**
     * Cerca un modello della formula.
     *
     * @param formula formula da verificare (non null)
     * @return modello con atomi in ordine canonico, null se la formula è insoddisfacibile
     */
    public Model solve(Expression formula) {
        return check(formula).getModel();
    }

    /**
     * Verifica la formula restituendo esito, modello e statistiche.
     *
     * @param formula formula da verificare (non null)
     * @return risultato SAT con modello ordinato oppure UNSAT
     * @throws InvalidFormulaException se la formula è null
     */
    public TableauResult check(Expression formula) {
        if (formula == null) {
            throw new InvalidFormulaException("Formula da verificare non può essere null");
        }

        LOGGER.fine(() -> "Inizio ricerca tableau per: " + formula);

        TableauStatistics statistics = new TableauStatistics();
        BranchOperations operations = new BranchOperations(classifier);
        RuleDispatcher dispatcher = new RuleDispatcher(operations, rules, statistics);

        Branch branch = Branch.of(formula);
        PendingQueue queue = operations.enqueueIfCompound(formula, PendingQueue.empty());

        Optional<Model> model;
        try {
            model = dispatcher.expand(queue, branch);
        } finally {
            statistics.stopTimer();
        }

        TableauResult result = model
                .map(found -> TableauResult.satisfiable(found.sorted(), statistics))
                .orElseGet(() -> TableauResult.unsatisfiable(statistics));

        LOGGER.fine(() -> "Ricerca completata: " + result);
        return result;
    }
}
