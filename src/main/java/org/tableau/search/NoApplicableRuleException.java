package org.tableau.search;

import org.tableau.formula.Expression;
import org.tableau.formula.TableauException;

/**
 * Nessuna regola registrata riconosce la formula scelta per l'espansione.
 */
public class NoApplicableRuleException extends TableauException {

    private final transient Expression formula;

    public NoApplicableRuleException(Expression formula) {
        super("Nessuna regola di espansione applicabile a: " + formula);
        this.formula = formula;
    }

    public Expression getFormula() {
        return formula;
    }
}
