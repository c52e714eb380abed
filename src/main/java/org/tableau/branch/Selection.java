package org.tableau.branch;

import org.tableau.formula.Expression;

/**
 * Formula scelta per la prossima espansione e coda residua senza le sue occorrenze.
 */
public record Selection(Expression chosen, PendingQueue remainder) {}
