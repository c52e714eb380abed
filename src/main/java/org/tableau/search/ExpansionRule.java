package org.tableau.search;

import org.tableau.branch.Branch;
import org.tableau.branch.Model;
import org.tableau.branch.PendingQueue;
import org.tableau.formula.Expression;

import java.util.Optional;

/**
 * Regola di espansione del tableau per un tipo di formula.
 *
 * Riceve la formula scelta, la coda residua e il ramo corrente, e prosegue la ricerca
 * rientrando nel dispatcher con coda e ramo aggiornati.
 */
@FunctionalInterface
public interface ExpansionRule {

    /**
     * @param formula formula da espandere, già rimossa dalla coda
     * @param rest formule ancora in attesa sul ramo
     * @param branch ramo corrente (contiene già la formula)
     * @param dispatcher dispatcher per le chiamate ricorsive
     * @return modello trovato sotto questo nodo, vuoto se tutte le alternative falliscono
     */
    Optional<Model> apply(Expression formula, PendingQueue rest, Branch branch, RuleDispatcher dispatcher);
}
