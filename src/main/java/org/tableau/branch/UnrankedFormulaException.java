package org.tableau.branch;

import org.tableau.formula.TableauException;

/**
 * La coda contiene solo formule il cui rango non è tra 0 e 2: nessuna può essere scelta
 * senza perdere stato della ricerca.
 */
public class UnrankedFormulaException extends TableauException {

    public UnrankedFormulaException(String message) {
        super(message);
    }
}
