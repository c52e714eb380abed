package org.tableau.search;

import org.junit.jupiter.api.Test;
import org.tableau.branch.Branch;
import org.tableau.branch.BranchOperations;
import org.tableau.branch.Model;
import org.tableau.branch.PendingQueue;
import org.tableau.classifier.FormulaTypes;
import org.tableau.formula.Expression;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.tableau.formula.Expression.and;
import static org.tableau.formula.Expression.atom;
import static org.tableau.formula.Expression.iff;
import static org.tableau.formula.Expression.implies;
import static org.tableau.formula.Expression.not;
import static org.tableau.formula.Expression.or;

class TableauRulesTest {

    private final Expression p = atom("p");
    private final Expression q = atom("q");
    private final Expression r = atom("r");

    private final RuleDispatcher dispatcher = new RuleDispatcher(
            new BranchOperations(FormulaTypes.defaultClassifier()), TableauRules.defaultRegistry(),
            new TableauStatistics());

    private List<Expression> literals(Optional<Model> model) {
        return model.orElseThrow().getLiterals();
    }

    @Test
    void defaultRegistryOrder() {
        assertEquals(List.of(
                FormulaTypes.DOUBLE_NOT,
                FormulaTypes.SENTENTIAL_AND,
                FormulaTypes.NOT_AND,
                FormulaTypes.SENTENTIAL_OR,
                FormulaTypes.NOT_OR,
                FormulaTypes.SENTENTIAL_IMPLICATION,
                FormulaTypes.NOT_IMPLICATION,
                FormulaTypes.SENTENTIAL_BICONDITIONAL,
                FormulaTypes.NOT_BICONDITIONAL), TableauRules.defaultRegistry().tags());
    }

    @Test
    void doubleNegationAddsInnerFormula() {
        Expression formula = not(not(p));
        assertEquals(List.of(p), literals(TableauRules.doubleNegation(formula, PendingQueue.empty(),
                Branch.of(formula), dispatcher)));
    }

    @Test
    void doubleNegationClosesOnComplement() {
        Expression formula = not(not(p));
        assertFalse(TableauRules.doubleNegation(formula, PendingQueue.empty(),
                Branch.of(not(p), formula), dispatcher).isPresent());
    }

    @Test
    void conjunctionAddsAllOperands() {
        Expression formula = and(p, not(q), r);
        assertEquals(List.of(p, not(q), r), literals(TableauRules.conjunction(formula, PendingQueue.empty(),
                Branch.of(formula), dispatcher)));
    }

    @Test
    void negatedDisjunctionAddsAllNegations() {
        Expression formula = not(or(p, q, r));
        assertEquals(List.of(not(p), not(q), not(r)), literals(TableauRules.negatedDisjunction(formula,
                PendingQueue.empty(), Branch.of(formula), dispatcher)));
    }

    @Test
    void negatedImplicationAddsAntecedentAndNegatedConsequent() {
        Expression formula = not(implies(p, q));
        assertEquals(List.of(p, not(q)), literals(TableauRules.negatedImplication(formula,
                PendingQueue.empty(), Branch.of(formula), dispatcher)));
    }

    @Test
    void disjunctionTriesOperandsInOrder() {
        Expression formula = or(p, q, r);
        assertEquals(List.of(p), literals(TableauRules.disjunction(formula, PendingQueue.empty(),
                Branch.of(formula), dispatcher)));
        assertEquals(List.of(not(p), q), literals(TableauRules.disjunction(formula, PendingQueue.empty(),
                Branch.of(formula, not(p)), dispatcher)));
        assertFalse(TableauRules.disjunction(formula, PendingQueue.empty(),
                Branch.of(formula, not(p), not(q), not(r)), dispatcher).isPresent());
    }

    @Test
    void negatedConjunctionTriesNegationsInOrder() {
        Expression formula = not(and(p, q));
        assertEquals(List.of(not(p)), literals(TableauRules.negatedConjunction(formula, PendingQueue.empty(),
                Branch.of(formula), dispatcher)));
        assertEquals(List.of(p, not(q)), literals(TableauRules.negatedConjunction(formula, PendingQueue.empty(),
                Branch.of(formula, p), dispatcher)));
    }

    @Test
    void implicationPrefersNegatedAntecedent() {
        Expression formula = implies(p, q);
        assertEquals(List.of(not(p)), literals(TableauRules.implication(formula, PendingQueue.empty(),
                Branch.of(formula), dispatcher)));
        assertEquals(List.of(p, q), literals(TableauRules.implication(formula, PendingQueue.empty(),
                Branch.of(formula, p), dispatcher)));
    }

    @Test
    void biconditionalTriesBothTrueThenBothFalse() {
        Expression formula = iff(p, q);
        assertEquals(List.of(p, q), literals(TableauRules.biconditional(formula, PendingQueue.empty(),
                Branch.of(formula), dispatcher)));
        assertEquals(List.of(not(q), not(p)), literals(TableauRules.biconditional(formula, PendingQueue.empty(),
                Branch.of(formula, not(q)), dispatcher)));
    }

    @Test
    void negatedBiconditionalTriesMixedAssignments() {
        Expression formula = not(iff(p, q));
        assertEquals(List.of(p, not(q)), literals(TableauRules.negatedBiconditional(formula, PendingQueue.empty(),
                Branch.of(formula), dispatcher)));
        assertEquals(List.of(not(p), q), literals(TableauRules.negatedBiconditional(formula, PendingQueue.empty(),
                Branch.of(formula, not(p)), dispatcher)));
    }

    @Test
    void pendingFormulasAreExpandedAfterRule() {
        Expression pending = or(not(p), r);
        Expression formula = and(p, q);
        assertEquals(List.of(p, q, r), literals(TableauRules.conjunction(formula, PendingQueue.of(pending),
                Branch.of(pending, formula), dispatcher)));
    }
}
