package org.tableau.classifier;

import org.tableau.formula.TableauException;

/**
 * Richiesta di classificazione per un tag mai registrato nel {@link TypeClassifier}.
 */
public class UnknownTagException extends TableauException {

    private final String tag;

    public UnknownTagException(String tag) {
        super("Tag di tipo non registrato: " + tag);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
