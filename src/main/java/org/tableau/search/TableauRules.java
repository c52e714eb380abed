package org.tableau.search;

import org.tableau.branch.Branch;
import org.tableau.branch.Model;
import org.tableau.branch.PendingQueue;
import org.tableau.classifier.FormulaTypes;
import org.tableau.formula.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * REGOLE DI ESPANSIONE - Un gestore per ciascun tipo di formula composta
 *
 * REGOLE NON RAMIFICANTI (alpha):
 * • !!p                -> p
 * • p1 & ... & pn      -> {p1, ..., pn}
 * • !(p1 | ... | pn)   -> {!p1, ..., !pn}
 * • !(p -> q)          -> {p, !q}
 *
 * REGOLE RAMIFICANTI (beta), alternative provate in ordine:
 * • !(p1 & ... & pn)   -> !p1 | ... | !pn
 * • p1 | ... | pn      -> p1 | ... | pn
 * • p -> q             -> !p | q
 * • p <-> q            -> {p, q} | {!p, !q}
 * • !(p <-> q)         -> {p, !q} | {!p, q}
 *
 * Ogni alternativa è controllata contro il ramo prima della ricorsione; la prima che
 * produce un modello vince e le successive non vengono esplorate.
 */
public final class TableauRules {

    /** Registro predefinito nell'ordine di dispatch */
    private static final RuleRegistry DEFAULT_REGISTRY = RuleRegistry.builder()
            .register(FormulaTypes.DOUBLE_NOT, TableauRules::doubleNegation)
            .register(FormulaTypes.SENTENTIAL_AND, TableauRules::conjunction)
            .register(FormulaTypes.NOT_AND, TableauRules::negatedConjunction)
            .register(FormulaTypes.SENTENTIAL_OR, TableauRules::disjunction)
            .register(FormulaTypes.NOT_OR, TableauRules::negatedDisjunction)
            .register(FormulaTypes.SENTENTIAL_IMPLICATION, TableauRules::implication)
            .register(FormulaTypes.NOT_IMPLICATION, TableauRules::negatedImplication)
            .register(FormulaTypes.SENTENTIAL_BICONDITIONAL, TableauRules::biconditional)
            .register(FormulaTypes.NOT_BICONDITIONAL, TableauRules::negatedBiconditional)
            .build();

    private TableauRules() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static RuleRegistry defaultRegistry() {
        return DEFAULT_REGISTRY;
    }

    //region REGOLE NON RAMIFICANTI

    /**
     * !!p: aggiunge p.
     */
    public static Optional<Model> doubleNegation(Expression formula, PendingQueue rest, Branch branch,
                                                 RuleDispatcher dispatcher) {
        Expression inner = formula.getOperand(0).getOperand(0);
        // Controllata anche qui: senza, !!!!p porterebbe p su un ramo che contiene già !p
        return dispatcher.tryAlternative(Collections.singletonList(inner), rest, branch);
    }

    /**
     * p1 & ... & pn: aggiunge tutti gli operandi insieme, fallisce se uno è in conflitto.
     */
    public static Optional<Model> conjunction(Expression formula, PendingQueue rest, Branch branch,
                                              RuleDispatcher dispatcher) {
        return dispatcher.tryAlternative(formula.getOperands(), rest, branch);
    }

    /**
     * !(p1 | ... | pn): aggiunge tutte le negazioni insieme.
     */
    public static Optional<Model> negatedDisjunction(Expression formula, PendingQueue rest, Branch branch,
                                                     RuleDispatcher dispatcher) {
        return dispatcher.tryAlternative(negateAll(formula.getOperand(0).getOperands()), rest, branch);
    }

    /**
     * !(p -> q): aggiunge p e !q.
     */
    public static Optional<Model> negatedImplication(Expression formula, PendingQueue rest, Branch branch,
                                                     RuleDispatcher dispatcher) {
        Expression implication = formula.getOperand(0);
        List<Expression> candidates = List.of(implication.getOperand(0), implication.getOperand(1).negate());
        return dispatcher.tryAlternative(candidates, rest, branch);
    }

    //endregion

    //region REGOLE RAMIFICANTI

    /**
     * !(p1 & ... & pn): prova !p1, poi !p2, ...
     */
    public static Optional<Model> negatedConjunction(Expression formula, PendingQueue rest, Branch branch,
                                                     RuleDispatcher dispatcher) {
        return dispatcher.tryFirstSuccessful(singletons(negateAll(formula.getOperand(0).getOperands())), rest, branch);
    }

    /**
     * p1 | ... | pn: prova p1, poi p2, ...
     */
    public static Optional<Model> disjunction(Expression formula, PendingQueue rest, Branch branch,
                                              RuleDispatcher dispatcher) {
        return dispatcher.tryFirstSuccessful(singletons(formula.getOperands()), rest, branch);
    }

    /**
     * p -> q: prova !p, poi q.
     */
    public static Optional<Model> implication(Expression formula, PendingQueue rest, Branch branch,
                                              RuleDispatcher dispatcher) {
        Expression antecedent = formula.getOperand(0);
        Expression consequent = formula.getOperand(1);
        return dispatcher.tryFirstSuccessful(
                List.of(List.of(antecedent.negate()), List.of(consequent)), rest, branch);
    }

    /**
     * p <-> q: prova {p, q}, poi {!p, !q}.
     */
    public static Optional<Model> biconditional(Expression formula, PendingQueue rest, Branch branch,
                                                RuleDispatcher dispatcher) {
        Expression left = formula.getOperand(0);
        Expression right = formula.getOperand(1);
        return dispatcher.tryFirstSuccessful(List.of(
                List.of(left, right),
                List.of(left.negate(), right.negate())), rest, branch);
    }

    /**
     * !(p <-> q): prova {p, !q}, poi {!p, q}.
     */
    public static Optional<Model> negatedBiconditional(Expression formula, PendingQueue rest, Branch branch,
                                                       RuleDispatcher dispatcher) {
        Expression biconditional = formula.getOperand(0);
        Expression left = biconditional.getOperand(0);
        Expression right = biconditional.getOperand(1);
        return dispatcher.tryFirstSuccessful(List.of(
                List.of(left, right.negate()),
                List.of(left.negate(), right)), rest, branch);
    }

    //endregion

    //region SUPPORTO

    private static List<Expression> negateAll(List<Expression> operands) {
        List<Expression> negated = new ArrayList<>(operands.size());
        for (Expression operand : operands) {
            negated.add(operand.negate());
        }
        return negated;
    }

    /** Un'alternativa di un solo elemento per ciascuna formula. */
    private static List<List<Expression>> singletons(List<Expression> formulas) {
        List<List<Expression>> alternatives = new ArrayList<>(formulas.size());
        for (Expression formula : formulas) {
            alternatives.add(Collections.singletonList(formula));
        }
        return alternatives;
    }

    //endregion
}
