package org.tableau.optionalfeatures;

import org.tableau.formula.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.tableau.formula.Expression.and;
import static org.tableau.formula.Expression.atom;
import static org.tableau.formula.Expression.iff;
import static org.tableau.formula.Expression.implies;
import static org.tableau.formula.Expression.not;
import static org.tableau.formula.Expression.or;

/**
 * Formule di esempio con esito noto, usate dalla modalità -examples della linea di comando.
 */
public final class ExampleFormulas {

    private ExampleFormulas() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Formule in ordine di presentazione, nome -> formula.
     */
    public static Map<String, Expression> all() {
        Expression p = atom("p");
        Expression q = atom("q");
        Expression r = atom("r");

        Map<String, Expression> examples = new LinkedHashMap<>();
        examples.put("congiunzione", and(p, q));
        examples.put("biimplicazione", iff(p, q));
        examples.put("contraddizione", and(p, not(p)));
        examples.put("terzo-escluso", or(p, not(p)));
        examples.put("tautologia-implicazione", implies(p, implies(q, p)));
        examples.put("negazione-identita", not(iff(p, p)));
        examples.put("de-morgan", not(and(p, q)));
        examples.put("sillogismo", and(implies(p, q), implies(q, r), p, not(r)));
        examples.put("doppia-negazione", not(not(p)));
        examples.put("quadrupla-negazione-conflitto", and(not(p), not(not(not(not(p))))));
        return Collections.unmodifiableMap(examples);
    }
}
