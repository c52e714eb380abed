package org.tableau.search;

import org.junit.jupiter.api.Test;
import org.tableau.branch.Branch;
import org.tableau.branch.BranchOperations;
import org.tableau.branch.Model;
import org.tableau.branch.PendingQueue;
import org.tableau.classifier.FormulaTypes;
import org.tableau.classifier.UnknownTagException;
import org.tableau.formula.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.tableau.formula.Expression.and;
import static org.tableau.formula.Expression.atom;
import static org.tableau.formula.Expression.not;
import static org.tableau.formula.Expression.or;

class RuleDispatcherTest {

    private final Expression p = atom("p");
    private final Expression q = atom("q");

    private RuleDispatcher dispatcher(RuleRegistry registry) {
        return new RuleDispatcher(new BranchOperations(FormulaTypes.defaultClassifier()), registry,
                new TableauStatistics());
    }

    @Test
    void emptyQueueReturnsAtomsOfBranch() {
        RuleDispatcher dispatcher = dispatcher(TableauRules.defaultRegistry());

        Optional<Model> model = dispatcher.expand(PendingQueue.empty(), Branch.of(or(p, q), q, not(p), q));

        assertTrue(model.isPresent());
        assertEquals(List.of(q, not(p)), model.get().getLiterals());
        assertEquals(1, dispatcher.getStatistics().getOpenBranches());
        assertEquals(0, dispatcher.getStatistics().getRuleApplications());
    }

    @Test
    void firstMatchingRuleInRegistryOrderWins() {
        List<String> invoked = new ArrayList<>();
        RuleRegistry registry = RuleRegistry.builder()
                .register(FormulaTypes.SENTENTIAL_OR, (formula, rest, branch, d) -> {
                    invoked.add("or");
                    return Optional.empty();
                })
                .register("*", (formula, rest, branch, d) -> {
                    invoked.add("any");
                    return Optional.empty();
                })
                .build();
        RuleDispatcher dispatcher = dispatcher(registry);

        dispatcher.expand(PendingQueue.of(and(p, q)), Branch.of(and(p, q)));
        dispatcher.expand(PendingQueue.of(or(p, q)), Branch.of(or(p, q)));

        assertEquals(List.of("any", "or"), invoked);
        assertEquals(1, dispatcher.getStatistics().getApplications("*"));
        assertEquals(1, dispatcher.getStatistics().getApplications(FormulaTypes.SENTENTIAL_OR));
    }

    @Test
    void ruleReceivesQueueWithoutChosenFormula() {
        List<PendingQueue> seen = new ArrayList<>();
        RuleRegistry registry = RuleRegistry.builder()
                .register("*", (formula, rest, branch, d) -> {
                    seen.add(rest);
                    return Optional.empty();
                })
                .build();

        dispatcher(registry).expand(PendingQueue.of(or(p, q), and(p, q), and(p, q)), Branch.of(p));

        assertEquals(List.of(or(p, q)), seen.get(0).formulas());
    }

    @Test
    void missingRuleIsReported() {
        RuleDispatcher dispatcher = dispatcher(RuleRegistry.builder().build());

        NoApplicableRuleException error = assertThrows(NoApplicableRuleException.class,
                () -> dispatcher.expand(PendingQueue.of(and(p, q)), Branch.of(and(p, q))));
        assertEquals(and(p, q), error.getFormula());
    }

    @Test
    void ruleTagUnknownToClassifierIsReported() {
        RuleRegistry registry = RuleRegistry.builder()
                .register("mystery", (formula, rest, branch, d) -> Optional.empty())
                .build();
        RuleDispatcher dispatcher = dispatcher(registry);

        assertThrows(UnknownTagException.class,
                () -> dispatcher.expand(PendingQueue.of(and(p, q)), Branch.of(and(p, q))));
    }

    @Test
    void interruptedThreadStopsSearch() {
        RuleDispatcher dispatcher = dispatcher(TableauRules.defaultRegistry());
        Thread.currentThread().interrupt();
        try {
            assertThrows(SearchInterruptedException.class,
                    () -> dispatcher.expand(PendingQueue.of(and(p, q)), Branch.of(and(p, q))));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void alternativeWithInternalConflictIsPruned() {
        RuleDispatcher dispatcher = dispatcher(TableauRules.defaultRegistry());

        Optional<Model> model = dispatcher.tryAlternative(List.of(p, not(p)), PendingQueue.empty(), Branch.empty());

        assertFalse(model.isPresent());
        assertEquals(1, dispatcher.getStatistics().getAlternativesTried());
        assertEquals(1, dispatcher.getStatistics().getClosedBranches());
    }

    @Test
    void firstSuccessfulAlternativeStopsExploration() {
        RuleDispatcher dispatcher = dispatcher(TableauRules.defaultRegistry());
        Branch branch = Branch.of(not(p));

        Optional<Model> model = dispatcher.tryFirstSuccessful(
                List.of(List.of(p), List.of(q), List.of(not(q))), PendingQueue.empty(), branch);

        assertEquals(List.of(not(p), q), model.orElseThrow().getLiterals());
        assertEquals(2, dispatcher.getStatistics().getAlternativesTried());
        assertEquals(1, dispatcher.getStatistics().getClosedBranches());
    }

    @Test
    void compoundCandidatesAreExpandedLater() {
        RuleDispatcher dispatcher = dispatcher(TableauRules.defaultRegistry());

        Optional<Model> model = dispatcher.tryAlternative(List.of(and(p, q)), PendingQueue.empty(), Branch.empty());

        assertEquals(List.of(p, q), model.orElseThrow().getLiterals());
        assertEquals(1, dispatcher.getStatistics().getApplications(FormulaTypes.SENTENTIAL_AND));
        assertEquals(1, dispatcher.getStatistics().getMaxDepth());
    }
}
