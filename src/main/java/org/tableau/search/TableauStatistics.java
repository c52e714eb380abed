package org.tableau.search;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * STATISTICHE TABLEAU - Metriche raccolte durante una singola ricerca
 *
 * Conta le applicazioni di regole, le alternative tentate dalle regole, i rami chiusi
 * per conflitto e i rami completati, oltre alla profondità massima raggiunta e al tempo
 * di esecuzione. Un'istanza appartiene a una sola chiamata di ricerca.
 */
public class TableauStatistics {

    //region CONTATORI

    /** Formule espanse (una per ogni ingresso in una regola) */
    private int ruleApplications = 0;

    /** Alternative valutate dalle regole, comprese quelle potate */
    private int alternativesTried = 0;

    /** Alternative scartate perché in conflitto con il ramo */
    private int closedBranches = 0;

    /** Rami arrivati a coda vuota (al più uno per ricerca) */
    private int openBranches = 0;

    /** Profondità massima delle chiamate ricorsive del dispatcher */
    private int maxDepth = 0;

    /** Applicazioni per tag di regola, in ordine di prima applicazione */
    private final Map<String, Integer> applicationsByRule = new LinkedHashMap<>();

    //endregion

    //region TIMING

    private long executionTimeMs = 0;
    private final long startTime;
    private boolean timerStopped = false;

    //endregion

    /**
     * Avvia immediatamente la misurazione del tempo.
     */
    public TableauStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region AGGIORNAMENTO

    public void recordRuleApplication(String tag) {
        ruleApplications++;
        applicationsByRule.merge(tag, 1, Integer::sum);
    }

    public void recordAlternative() {
        alternativesTried++;
    }

    public void recordClosedBranch() {
        closedBranches++;
    }

    public void recordOpenBranch() {
        openBranches++;
    }

    public void recordDepth(int depth) {
        if (depth > maxDepth) {
            maxDepth = depth;
        }
    }

    /**
     * Ferma il timer. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public int getRuleApplications() {
        return ruleApplications;
    }

    public int getAlternativesTried() {
        return alternativesTried;
    }

    public int getClosedBranches() {
        return closedBranches;
    }

    public int getOpenBranches() {
        return openBranches;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getApplications(String tag) {
        return applicationsByRule.getOrDefault(tag, 0);
    }

    /**
     * Tempo trascorso: definitivo se il timer è fermo, parziale altrimenti.
     */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder report = new StringBuilder();
        report.append("=== STATISTICHE TABLEAU ===\n");
        report.append("Regole applicate: ").append(ruleApplications).append("\n");
        report.append("Alternative tentate: ").append(alternativesTried).append("\n");
        report.append("Rami chiusi: ").append(closedBranches).append("\n");
        report.append("Rami aperti: ").append(openBranches).append("\n");
        report.append("Profondità massima: ").append(maxDepth).append("\n");
        report.append("Tempo: ").append(getExecutionTimeMs()).append(" ms\n");

        if (!applicationsByRule.isEmpty()) {
            report.append("Dettaglio regole:\n");
            applicationsByRule.forEach((tag, count) ->
                    report.append("  ").append(tag).append(": ").append(count).append("\n"));
        }
        return report.toString();
    }
}
