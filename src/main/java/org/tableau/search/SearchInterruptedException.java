package org.tableau.search;

import org.tableau.formula.TableauException;

/**
 * Ricerca abbandonata perché il thread che la esegue è stato interrotto (ad esempio
 * allo scadere del timeout impostato da linea di comando).
 */
public class SearchInterruptedException extends TableauException {

    public SearchInterruptedException(String message) {
        super(message);
    }
}
