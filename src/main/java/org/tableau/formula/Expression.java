package org.tableau.formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rappresentazione ad albero di una formula della logica proposizionale
 *
 * Una formula è un atomo (variabile proposizionale con nome) oppure un nodo composto
 * formato da un operatore e da una lista ordinata di operandi. Le istanze sono valori
 * immutabili confrontati per uguaglianza strutturale: due formule con la stessa
 * struttura sono indistinguibili.
 *
 * ARITÀ AMMESSE:
 * • NOT: esattamente 1 operando
 * • AND, OR: almeno 2 operandi
 * • IMPLIES, IFF: esattamente 2 operandi
 *
 * Le formule non devono essere in alcuna forma normale: il metodo dei tableau lavora
 * direttamente su annidamenti arbitrari dei cinque connettivi.
 */
public final class Expression {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     */
    public enum Type {
        ATOM,       // Variabile atomica: P, Q, R, ...
        NOT,        // Negazione: !A
        AND,        // Congiunzione: A & B & ...
        OR,         // Disgiunzione: A | B | ...
        IMPLIES,    // Implicazione: A -> B
        IFF         // Biimplicazione: A <-> B
    }

    /** Tipo del nodo corrente nell'albero */
    private final Type type;

    /** Nome della variabile atomica (solo per nodi ATOM, null altrimenti) */
    private final String name;

    /** Operandi in ordine (lista vuota per nodi ATOM) */
    private final List<Expression> operands;

    /** Hash precalcolato: le formule sono immutabili e usate come chiavi nei confronti */
    private final int hash;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    private Expression(Type type, String name, List<Expression> operands) {
        this.type = type;
        this.name = name;
        this.operands = operands;
        this.hash = computeHash();
    }

    /**
     * Costruisce nodo foglia per variabile atomica.
     *
     * @param name nome della variabile proposizionale (non null, non vuoto)
     * @return atomo con nome normalizzato (spazi esterni rimossi)
     * @throws InvalidFormulaException se il nome è null o vuoto
     */
    public static Expression atom(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidFormulaException("Nome variabile atomica non può essere null o vuoto");
        }
        return new Expression(Type.ATOM, name.trim(), Collections.emptyList());
    }

    /**
     * Costruisce la negazione di una formula.
     *
     * @param operand formula da negare (non null)
     * @throws InvalidFormulaException se operand null
     */
    public static Expression not(Expression operand) {
        return compound(Type.NOT, Collections.singletonList(operand));
    }

    /**
     * Costruisce una congiunzione n-aria (almeno 2 operandi).
     */
    public static Expression and(Expression... operands) {
        return compound(Type.AND, operandList(operands));
    }

    public static Expression and(List<Expression> operands) {
        return compound(Type.AND, operands);
    }

    /**
     * Costruisce una disgiunzione n-aria (almeno 2 operandi).
     */
    public static Expression or(Expression... operands) {
        return compound(Type.OR, operandList(operands));
    }

    public static Expression or(List<Expression> operands) {
        return compound(Type.OR, operands);
    }

    /**
     * Costruisce l'implicazione antecedent -> consequent.
     */
    public static Expression implies(Expression antecedent, Expression consequent) {
        return compound(Type.IMPLIES, Arrays.asList(antecedent, consequent));
    }

    /**
     * Costruisce la biimplicazione left <-> right.
     */
    public static Expression iff(Expression left, Expression right) {
        return compound(Type.IFF, Arrays.asList(left, right));
    }

    /**
     * Costruisce un nodo composto generico validando l'arità dell'operatore.
     *
     * @param type operatore del nodo (non ATOM)
     * @param operands operandi nell'ordine dato (copiati)
     * @return nuovo nodo immutabile
     * @throws InvalidFormulaException se tipo, numero o contenuto degli operandi non validi
     */
    public static Expression compound(Type type, List<Expression> operands) {
        if (type == null || type == Type.ATOM) {
            throw new InvalidFormulaException("Tipo non valido per nodo composto: " + type);
        }
        if (operands == null) {
            throw new InvalidFormulaException("Lista operandi null per operatore " + type);
        }
        for (Expression operand : operands) {
            if (operand == null) {
                throw new InvalidFormulaException("Operandi null trovati per operatore " + type);
            }
        }
        validateArity(type, operands.size());

        return new Expression(type, null, Collections.unmodifiableList(new ArrayList<>(operands)));
    }

    private static List<Expression> operandList(Expression[] operands) {
        if (operands == null) {
            throw new InvalidFormulaException("Array operandi null");
        }
        return Arrays.asList(operands);
    }

    /**
     * Verifica che il numero di operandi sia ammesso per l'operatore.
     */
    private static void validateArity(Type type, int count) {
        boolean valid = switch (type) {
            case NOT -> count == 1;
            case AND, OR -> count >= 2;
            case IMPLIES, IFF -> count == 2;
            case ATOM -> count == 0;
        };

        if (!valid) {
            throw new InvalidFormulaException("Numero operandi non valido per " + type + ": " + count);
        }
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    /**
     * Nome della variabile per nodi ATOM.
     *
     * @return nome dell'atomo, null per nodi composti
     */
    public String getName() {
        return name;
    }

    /** Operandi in sola lettura, nell'ordine di costruzione. */
    public List<Expression> getOperands() {
        return operands;
    }

    public Expression getOperand(int index) {
        return operands.get(index);
    }

    public int arity() {
        return operands.size();
    }

    public boolean isAtomic() {
        return type == Type.ATOM;
    }

    public boolean is(Type expectedType) {
        return type == expectedType;
    }

    //endregion

    //region COSTRUZIONI DERIVATE

    /**
     * Restituisce la negazione di questa formula (sempre un nuovo nodo NOT, senza semplificazioni).
     */
    public Expression negate() {
        return not(this);
    }

    //endregion

    //region UTILITÀ E ANALISI

    /**
     * Conta i connettivi presenti nella formula (misura usata per statistiche e log).
     */
    public int countConnectives() {
        if (type == Type.ATOM) {
            return 0;
        }
        int count = 1;
        for (Expression operand : operands) {
            count += operand.countConnectives();
        }
        return count;
    }

    /**
     * Raccoglie i nomi di tutte le variabili atomiche distinte.
     */
    public Set<String> variables() {
        Set<String> variables = new HashSet<>();
        collectVariables(variables);
        return variables;
    }

    private void collectVariables(Set<String> variables) {
        if (type == Type.ATOM) {
            variables.add(name);
            return;
        }
        for (Expression operand : operands) {
            operand.collectVariables(variables);
        }
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale: stesso tipo, stesso nome e stessi operandi nello stesso ordine.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Expression other = (Expression) obj;
        if (this.hash != other.hash || this.type != other.type) return false;

        return switch (this.type) {
            case ATOM -> this.name.equals(other.name);
            default -> this.operands.equals(other.operands);
        };
    }

    @Override
    public int hashCode() {
        return hash;
    }

    private int computeHash() {
        int result = type.hashCode();
        if (type == Type.ATOM) {
            return 31 * result + name.hashCode();
        }
        return 31 * result + operands.hashCode();
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione testuale completamente parentesizzata.
     *
     * FORMATO OUTPUT:
     * • Atomi: nome variabile (p, q, r)
     * • Negazioni: !p, !(p & q)
     * • Congiunzioni: (a & b & c)
     * • Disgiunzioni: (a | b)
     * • Implicazioni: (a -> b)
     * • Biimplicazioni: (a <-> b)
     */
    @Override
    public String toString() {
        return switch (type) {
            case ATOM -> name;
            case NOT -> "!" + operands.get(0);
            case AND -> joinOperands(" & ");
            case OR -> joinOperands(" | ");
            case IMPLIES -> joinOperands(" -> ");
            case IFF -> joinOperands(" <-> ");
        };
    }

    private String joinOperands(String separator) {
        StringBuilder result = new StringBuilder("(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                result.append(separator);
            }
            result.append(operands.get(i));
        }
        return result.append(")").toString();
    }

    //endregion
}
