package org.tableau.search;

import org.tableau.branch.Branch;
import org.tableau.branch.BranchOperations;
import org.tableau.branch.Model;
import org.tableau.branch.PendingQueue;
import org.tableau.branch.Selection;
import org.tableau.formula.Expression;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DISPATCHER - Ciclo di ricerca del tableau
 *
 * Sceglie la prossima formula in attesa, individua la regola che la espande e la invoca.
 * Le regole rientrano nel dispatcher con la coda e il ramo aggiornati: la ricerca è in
 * profondità, da sinistra a destra, e si ferma al primo ramo completato.
 *
 * FLUSSO:
 * 1. Coda vuota: il ramo è completo, il modello sono i suoi atomi
 * 2. Selezione della formula con {@link BranchOperations#pickNext}
 * 3. Prima regola del registro il cui tag riconosce la formula
 * 4. Il risultato della regola è restituito senza modifiche
 *
 * Un'istanza serve una sola ricerca: le statistiche e la profondità corrente sono
 * stato locale della chiamata. I registri sono condivisi in sola lettura.
 */
public class RuleDispatcher {

    private static final Logger LOGGER = Logger.getLogger(RuleDispatcher.class.getName());

    private final BranchOperations operations;
    private final RuleRegistry rules;
    private final TableauStatistics statistics;

    /** Profondità corrente della ricorsione */
    private int depth = 0;

    public RuleDispatcher(BranchOperations operations, RuleRegistry rules, TableauStatistics statistics) {
        if (operations == null || rules == null || statistics == null) {
            throw new IllegalArgumentException("Operazioni, registro regole e statistiche sono obbligatori");
        }
        this.operations = operations;
        this.rules = rules;
        this.statistics = statistics;
    }

    public TableauStatistics getStatistics() {
        return statistics;
    }

    //region CICLO PRINCIPALE

    /**
     * Espande le formule in attesa sul ramo fino a trovare un modello o esaurire le alternative.
     *
     * @param queue formule composte ancora da espandere
     * @param branch ramo corrente
     * @return atomi del primo ramo completato, vuoto se il ramo non ha modelli
     * @throws NoApplicableRuleException se nessuna regola riconosce la formula scelta
     * @throws SearchInterruptedException se il thread corrente è stato interrotto
     */
    public Optional<Model> expand(PendingQueue queue, Branch branch) {
        checkInterrupted();

        if (queue.isEmpty()) {
            statistics.recordOpenBranch();
            List<Expression> atoms = operations.collectAtoms(branch.formulas());
            LOGGER.fine(() -> "Ramo completato con " + atoms.size() + " atomi: " + atoms);
            return Optional.of(new Model(atoms));
        }

        Selection selection = operations.pickNext(queue);
        Expression formula = selection.chosen();

        RuleRegistry.RuleEntry entry = rules.findRule(formula, operations.getClassifier())
                .orElseThrow(() -> new NoApplicableRuleException(formula));

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(String.format("[%d] %s -> %s (in attesa: %d)",
                    depth, entry.tag(), formula, selection.remainder().size()));
        }
        statistics.recordRuleApplication(entry.tag());

        depth++;
        statistics.recordDepth(depth);
        try {
            return entry.rule().apply(formula, selection.remainder(), branch, this);
        } finally {
            depth--;
        }
    }

    //endregion

    //region SUPPORTO ALLE REGOLE

    /**
     * Prova un'alternativa: aggiunge i candidati al ramo e prosegue la ricerca.
     *
     * I candidati sono controllati contro il ramo già esteso con tutti loro, così un
     * insieme che contiene una formula e la sua negazione viene scartato subito.
     * Un'alternativa in conflitto viene potata senza ricorsione.
     *
     * @param candidates nuove formule del ramo, nell'ordine di aggiunta
     * @param rest coda residua
     * @param branch ramo di partenza (non modificato)
     * @return modello trovato, vuoto se l'alternativa fallisce
     */
    public Optional<Model> tryAlternative(List<Expression> candidates, PendingQueue rest, Branch branch) {
        statistics.recordAlternative();

        Branch extended = branch.extend(candidates);
        if (operations.anyConflict(candidates, extended)) {
            statistics.recordClosedBranch();
            LOGGER.finest(() -> "Ramo chiuso da " + candidates);
            return Optional.empty();
        }

        PendingQueue queue = operations.enqueueAllCompound(candidates, rest);
        return expand(queue, extended);
    }

    /**
     * Prova le alternative nell'ordine dato e si ferma alla prima che produce un modello.
     */
    public Optional<Model> tryFirstSuccessful(List<List<Expression>> alternatives, PendingQueue rest, Branch branch) {
        for (List<Expression> alternative : alternatives) {
            Optional<Model> model = tryAlternative(alternative, rest, branch);
            if (model.isPresent()) {
                return model;
            }
        }
        return Optional.empty();
    }

    //endregion

    private void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new SearchInterruptedException("Ricerca interrotta dopo "
                    + statistics.getRuleApplications() + " applicazioni di regole");
        }
    }
}
