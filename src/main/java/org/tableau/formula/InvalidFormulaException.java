package org.tableau.formula;

/**
 * Formula malformata: operandi null, nome atomo vuoto o arità non ammessa per l'operatore.
 */
public class InvalidFormulaException extends TableauException {

    public InvalidFormulaException(String message) {
        super(message);
    }
}
