package org.tableau.solver;

import org.junit.jupiter.api.Test;
import org.tableau.branch.Model;
import org.tableau.classifier.FormulaTypes;
import org.tableau.formula.Expression;
import org.tableau.formula.InvalidFormulaException;
import org.tableau.search.RuleRegistry;
import org.tableau.search.TableauRules;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.tableau.formula.Expression.and;
import static org.tableau.formula.Expression.atom;
import static org.tableau.formula.Expression.iff;
import static org.tableau.formula.Expression.implies;
import static org.tableau.formula.Expression.not;
import static org.tableau.formula.Expression.or;

class TableauSolverTest {

    private final TableauSolver solver = new TableauSolver();
    private final Expression p = atom("p");
    private final Expression q = atom("q");
    private final Expression r = atom("r");

    //region SCENARI

    @Test
    void singleLiterals() {
        assertEquals(List.of(p), solver.solve(p).getLiterals());
        assertEquals(List.of(not(p)), solver.solve(not(p)).getLiterals());
    }

    @Test
    void conjunctionOfAtoms() {
        assertEquals(List.of(p, q), solver.solve(and(p, q)).getLiterals());
    }

    @Test
    void modelIsSortedByAtomName() {
        assertEquals(List.of(p, not(q), r), solver.solve(and(r, not(q), p)).getLiterals());
    }

    @Test
    void contradictionIsUnsatisfiable() {
        assertNull(solver.solve(and(p, not(p))));
        assertTrue(solver.check(and(p, not(p))).isUnsatisfiable());
    }

    @Test
    void excludedMiddleTakesOneSide() {
        Model model = solver.solve(or(p, not(p)));
        assertEquals(1, model.size());
        assertTrue(model.contains(p) ^ model.contains(not(p)));
    }

    @Test
    void doubleNegationBehavesLikeInnerFormula() {
        assertEquals(solver.solve(p), solver.solve(not(not(p))));
        assertEquals(solver.solve(and(p, q)), solver.solve(not(not(and(p, q)))));
    }

    @Test
    void biconditionalAssignsSamePolarity() {
        Model model = solver.solve(iff(p, q));
        assertEquals(model.isTrue("p"), model.isTrue("q"));
        assertEquals(2, model.size());
    }

    @Test
    void nestedImplicationIsSatisfiable() {
        assertNotNull(solver.solve(implies(p, implies(q, p))));
    }

    @Test
    void negatedSelfBiconditionalIsUnsatisfiable() {
        assertNull(solver.solve(not(iff(p, p))));
    }

    @Test
    void syllogismWithNegatedConclusionIsUnsatisfiable() {
        assertNull(solver.solve(and(implies(p, q), implies(q, r), p, not(r))));
    }

    @Test
    void quadrupleNegationConflictsWithLiteral() {
        // !!!!p produce p su un ramo che contiene !p
        assertNull(solver.solve(and(not(p), not(not(not(not(p)))))));
        assertEquals(List.of(p), solver.solve(and(p, not(not(not(not(p)))))).getLiterals());
    }

    @Test
    void nullFormulaIsRejected() {
        assertThrows(InvalidFormulaException.class, () -> solver.check(null));
    }

    //endregion

    //region PROPRIETÀ

    @Test
    void deMorganPreservesSatisfiability() {
        List<Expression> samples = List.of(p, not(q), and(p, q), or(p, not(r)), iff(q, r), and(p, not(p)));
        for (Expression a : samples) {
            for (Expression b : samples) {
                assertEquals(solver.check(not(and(a, b))).isSatisfiable(),
                        solver.check(or(not(a), not(b))).isSatisfiable(), "!(" + a + " & " + b + ")");
                assertEquals(solver.check(not(or(a, b))).isSatisfiable(),
                        solver.check(and(not(a), not(b))).isSatisfiable(), "!(" + a + " | " + b + ")");
            }
        }
    }

    @Test
    void implicationMatchesDisjunction() {
        List<Expression> samples = List.of(p, not(p), and(p, q), or(q, r), not(iff(p, p)));
        for (Expression a : samples) {
            for (Expression b : samples) {
                assertEquals(solver.check(implies(a, b)).isSatisfiable(),
                        solver.check(or(not(a), b)).isSatisfiable(), a + " -> " + b);
            }
        }
    }

    @Test
    void agreesWithTruthTableOnRandomFormulas() {
        Random random = new Random(42);
        List<String> names = List.of("p", "q", "r");

        for (int i = 0; i < 300; i++) {
            Expression formula = randomFormula(random, 3, names);
            TableauResult result = solver.check(formula);

            assertEquals(satisfiableByTruthTable(formula, names), result.isSatisfiable(), formula.toString());
            if (result.isSatisfiable()) {
                Model model = result.getModel();
                assertTrue(evaluate(formula, model.getAssignment()), formula + " con " + model);
                assertConsistent(model);
            }
        }
    }

    @Test
    void modelLiteralsAreConsistentAndDistinct() {
        Model model = solver.solve(and(or(p, q), or(not(p), r), implies(q, not(r)), or(p, p)));
        assertNotNull(model);
        assertConsistent(model);
        assertEquals(model.getLiterals().size(), Set.copyOf(model.getLiterals()).size());
    }

    //endregion

    //region RISULTATO E REGISTRI

    @Test
    void resultCarriesStatistics() {
        TableauResult sat = solver.check(or(p, q));
        assertTrue(sat.isSatisfiable());
        assertEquals(1, sat.getStatistics().getRuleApplications());
        assertEquals(1, sat.getStatistics().getOpenBranches());
        assertEquals(1, sat.getStatistics().getApplications(FormulaTypes.SENTENTIAL_OR));

        TableauResult unsat = solver.check(and(p, not(p)));
        assertNull(unsat.getModel());
        assertEquals(1, unsat.getStatistics().getClosedBranches());
        assertEquals(0, unsat.getStatistics().getOpenBranches());
        assertTrue(unsat.toString().startsWith("UNSAT"));
    }

    @Test
    void customRegistryChangesAlternativeOrder() {
        RuleRegistry reversedOr = RuleRegistry.builder()
                .register(FormulaTypes.SENTENTIAL_OR, (formula, rest, branch, dispatcher) ->
                        dispatcher.tryFirstSuccessful(List.of(List.of(formula.getOperand(1)),
                                List.of(formula.getOperand(0))), rest, branch))
                .build();
        TableauSolver custom = new TableauSolver(FormulaTypes.defaultClassifier(), reversedOr);

        assertEquals(List.of(q), custom.solve(or(p, q)).getLiterals());
        assertEquals(List.of(p), solver.solve(or(p, q)).getLiterals());
    }

    @Test
    void solverIsReusable() {
        assertNull(solver.solve(and(p, not(p))));
        assertEquals(List.of(p, q), solver.solve(and(p, q)).getLiterals());
        TableauSolver explicit = new TableauSolver(FormulaTypes.defaultClassifier(), TableauRules.defaultRegistry());
        assertEquals(List.of(not(p), q), explicit.solve(and(q, implies(p, q), not(p))).getLiterals());
    }

    //endregion

    //region SUPPORTO

    private static void assertConsistent(Model model) {
        for (Expression literal : model.getLiterals()) {
            assertFalse(model.contains(literal.negate()), "letterale complementare in " + model);
        }
    }

    private static Expression randomFormula(Random random, int depth, List<String> names) {
        if (depth == 0 || random.nextInt(4) == 0) {
            Expression leaf = atom(names.get(random.nextInt(names.size())));
            return random.nextBoolean() ? leaf : not(leaf);
        }
        Expression left = randomFormula(random, depth - 1, names);
        Expression right = randomFormula(random, depth - 1, names);
        switch (random.nextInt(6)) {
            case 0:
                return not(left);
            case 1:
                return and(left, right);
            case 2:
                return or(left, right);
            case 3:
                return implies(left, right);
            case 4:
                return iff(left, right);
            default:
                return not(not(left));
        }
    }

    private static boolean satisfiableByTruthTable(Expression formula, List<String> names) {
        for (int mask = 0; mask < (1 << names.size()); mask++) {
            Map<String, Boolean> assignment = new HashMap<>();
            for (int i = 0; i < names.size(); i++) {
                assignment.put(names.get(i), (mask & (1 << i)) != 0);
            }
            if (evaluate(formula, assignment)) {
                return true;
            }
        }
        return false;
    }

    /** Valutazione di riferimento, le variabili non assegnate valgono false. */
    private static boolean evaluate(Expression formula, Map<String, Boolean> assignment) {
        List<Boolean> values = new ArrayList<>();
        for (Expression operand : formula.getOperands()) {
            values.add(evaluate(operand, assignment));
        }
        switch (formula.getType()) {
            case ATOM:
                return assignment.getOrDefault(formula.getName(), false);
            case NOT:
                return !values.get(0);
            case AND:
                return !values.contains(false);
            case OR:
                return values.contains(true);
            case IMPLIES:
                return !values.get(0) || values.get(1);
            default:
                return values.get(0).equals(values.get(1));
        }
    }

    //endregion
}
