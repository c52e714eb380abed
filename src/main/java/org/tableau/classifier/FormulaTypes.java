package org.tableau.classifier;

import org.tableau.formula.Expression;
import org.tableau.formula.Expression.Type;

/**
 * Tipi di formula riconosciuti dal tableau e relativi predicati di riconoscimento.
 *
 * Ogni predicato è indipendente dagli altri: le sovrapposizioni (ad esempio !!p riconosciuto
 * sia da SENTENTIAL_NOT sia da DOUBLE_NOT) sono attese e vengono risolte dall'ordine di
 * registrazione nel classificatore e nel registro delle regole.
 *
 * RANGHI DI BRANCHINESS:
 * • -1: atomi (mai accodati)
 * •  0: doppia negazione
 * •  1: regole alpha (and, not-or, not-implication)
 * •  2: regole beta (not-and, or, implication, biconditional, not-biconditional)
 * •  5: negazione generica, registrata per ultima
 */
public final class FormulaTypes {

    //region TAG

    public static final String SENTENTIAL_NOT = "sentential-not";
    public static final String DOUBLE_NOT = "double-not";
    public static final String SENTENTIAL_AND = "sentential-and";
    public static final String NOT_AND = "not-and";
    public static final String SENTENTIAL_OR = "sentential-or";
    public static final String NOT_OR = "not-or";
    public static final String SENTENTIAL_IMPLICATION = "sentential-implication";
    public static final String NOT_IMPLICATION = "not-implication";
    public static final String SENTENTIAL_BICONDITIONAL = "sentential-biconditional";
    public static final String NOT_BICONDITIONAL = "not-biconditional";
    public static final String ATOM = "atom";

    //endregion

    //region RANGHI

    public static final int ATOM_RANK = -1;
    public static final int DOUBLE_NOT_RANK = 0;
    public static final int ALPHA_RANK = 1;
    public static final int BETA_RANK = 2;
    public static final int SENTENTIAL_NOT_RANK = 5;

    //endregion

    /** Classificatore predefinito, immutabile e condiviso */
    private static final TypeClassifier DEFAULT_CLASSIFIER = createDefaultClassifier();

    private FormulaTypes() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Classificatore con tutti i tipi registrati nell'ordine che governa la selezione.
     */
    public static TypeClassifier defaultClassifier() {
        return DEFAULT_CLASSIFIER;
    }

    /**
     * Costruisce il registro dei tipi. SENTENTIAL_NOT è registrato dopo ATOM e dopo tutte le
     * negazioni specifiche: rankOf restituisce il rango del primo tag che riconosce la formula,
     * e il rango 5 non deve mai oscurare una negazione che una regola sa espandere.
     */
    private static TypeClassifier createDefaultClassifier() {
        return TypeClassifier.builder()
                .register(DOUBLE_NOT, FormulaTypes::isDoubleNot, DOUBLE_NOT_RANK)
                .register(SENTENTIAL_AND, FormulaTypes::isAnd, ALPHA_RANK)
                .register(NOT_OR, FormulaTypes::isNotOr, ALPHA_RANK)
                .register(NOT_IMPLICATION, FormulaTypes::isNotImplication, ALPHA_RANK)
                .register(NOT_AND, FormulaTypes::isNotAnd, BETA_RANK)
                .register(SENTENTIAL_OR, FormulaTypes::isOr, BETA_RANK)
                .register(SENTENTIAL_IMPLICATION, FormulaTypes::isImplication, BETA_RANK)
                .register(SENTENTIAL_BICONDITIONAL, FormulaTypes::isBiconditional, BETA_RANK)
                .register(NOT_BICONDITIONAL, FormulaTypes::isNotBiconditional, BETA_RANK)
                .register(ATOM, FormulaTypes::isAtom, ATOM_RANK)
                .register(SENTENTIAL_NOT, FormulaTypes::isNot, SENTENTIAL_NOT_RANK)
                .build();
    }

    //region PREDICATI DI RICONOSCIMENTO

    /** NOT con esattamente un operando. */
    public static boolean isNot(Expression expr) {
        return expr.is(Type.NOT) && expr.arity() == 1;
    }

    /** Negazione il cui operando è a sua volta una negazione. */
    public static boolean isDoubleNot(Expression expr) {
        return isNot(expr) && isNot(expr.getOperand(0));
    }

    public static boolean isAnd(Expression expr) {
        return expr.is(Type.AND) && expr.arity() >= 2;
    }

    public static boolean isOr(Expression expr) {
        return expr.is(Type.OR) && expr.arity() >= 2;
    }

    public static boolean isImplication(Expression expr) {
        return expr.is(Type.IMPLIES) && expr.arity() == 2;
    }

    public static boolean isBiconditional(Expression expr) {
        return expr.is(Type.IFF) && expr.arity() == 2;
    }

    public static boolean isNotAnd(Expression expr) {
        return isNot(expr) && isAnd(expr.getOperand(0));
    }

    public static boolean isNotOr(Expression expr) {
        return isNot(expr) && isOr(expr.getOperand(0));
    }

    public static boolean isNotImplication(Expression expr) {
        return isNot(expr) && isImplication(expr.getOperand(0));
    }

    public static boolean isNotBiconditional(Expression expr) {
        return isNot(expr) && isBiconditional(expr.getOperand(0));
    }

    /** Variabile proposizionale, eventualmente sotto una singola negazione. */
    public static boolean isAtom(Expression expr) {
        return expr.isAtomic() || (isNot(expr) && expr.getOperand(0).isAtomic());
    }

    //endregion
}
