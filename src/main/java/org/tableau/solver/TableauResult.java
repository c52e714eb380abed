package org.tableau.solver;

import org.tableau.branch.Model;
import org.tableau.search.TableauStatistics;

/**
 * RISULTATO TABLEAU - Contenitore immutabile dell'esito di una ricerca
 *
 * COMPONENTI:
 * • Esito: SAT (esiste un ramo aperto) oppure UNSAT (tutti i rami chiusi)
 * • Modello: atomi del ramo aperto in ordine canonico, solo per SAT
 * • Statistiche: metriche della ricerca, sempre presenti
 */
public final class TableauResult {

    private final boolean satisfiable;
    private final Model model;
    private final TableauStatistics statistics;

    private TableauResult(boolean satisfiable, Model model, TableauStatistics statistics) {
        if (satisfiable && model == null) {
            throw new IllegalArgumentException("Risultato SAT richiede un modello");
        }
        if (!satisfiable && model != null) {
            throw new IllegalArgumentException("Risultato UNSAT non può avere un modello");
        }
        this.satisfiable = satisfiable;
        this.model = model;
        this.statistics = statistics != null ? statistics : new TableauStatistics();
    }

    //region FACTORY METHODS

    public static TableauResult satisfiable(Model model, TableauStatistics statistics) {
        if (model == null) {
            throw new IllegalArgumentException("Modello SAT non può essere null");
        }
        return new TableauResult(true, model, statistics);
    }

    public static TableauResult unsatisfiable(TableauStatistics statistics) {
        return new TableauResult(false, null, statistics);
    }

    //endregion

    //region ACCESSORS

    public boolean isSatisfiable() {
        return satisfiable;
    }

    public boolean isUnsatisfiable() {
        return !satisfiable;
    }

    /**
     * @return modello ordinato per SAT, null per UNSAT
     */
    public Model getModel() {
        return model;
    }

    public TableauStatistics getStatistics() {
        return statistics;
    }

    //endregion

    @Override
    public String toString() {
        if (satisfiable) {
            return "SAT " + model + " (" + statistics.getRuleApplications() + " regole, "
                    + statistics.getExecutionTimeMs() + " ms)";
        }
        return "UNSAT (" + statistics.getRuleApplications() + " regole, "
                + statistics.getClosedBranches() + " rami chiusi, "
                + statistics.getExecutionTimeMs() + " ms)";
    }
}
