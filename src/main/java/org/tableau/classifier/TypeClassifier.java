package org.tableau.classifier;

import org.tableau.formula.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * CLASSIFICATORE DI TIPO - Registro ordinato tag -> (predicato di riconoscimento, rango)
 *
 * Determina a quale tipo appartiene una formula e con quale priorità va espansa.
 * La classificazione non è mutuamente esclusiva: una formula può soddisfare più tag
 * (ad esempio !!p è sia "sentential-not" sia "double-not"). Le sovrapposizioni sono
 * risolte dall'ordine di registrazione, che fa quindi parte della semantica.
 *
 * PROPRIETÀ:
 * • Immutabile dopo la costruzione tramite {@link Builder}
 * • Ordine di registrazione preservato (primo inserimento di ciascun tag)
 * • Il tag jolly "*" riconosce qualunque formula e non è registrabile
 */
public final class TypeClassifier {

    private static final Logger LOGGER = Logger.getLogger(TypeClassifier.class.getName());

    /** Tag jolly: riconosce qualunque formula */
    public static final String WILDCARD = "*";

    /**
     * Voce del registro: predicato di riconoscimento e rango di "branchiness".
     */
    public record TypeEntry(String tag, Predicate<Expression> predicate, int rank) {}

    /** Voci in ordine di registrazione */
    private final List<TypeEntry> entries;

    /** Accesso diretto per tag, stesso contenuto di entries */
    private final Map<String, TypeEntry> entriesByTag;

    private TypeClassifier(Map<String, TypeEntry> registered) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(registered.values()));
        this.entriesByTag = Collections.unmodifiableMap(new LinkedHashMap<>(registered));
        LOGGER.fine("Classificatore creato con " + entries.size() + " tipi: " + entriesByTag.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    //region INTERROGAZIONI

    /**
     * Verifica se la formula appartiene al tipo indicato.
     *
     * @param tag tag registrato oppure "*"
     * @param expr formula da classificare
     * @return true se il predicato del tag riconosce la formula
     * @throws UnknownTagException se il tag non è mai stato registrato
     */
    public boolean classify(String tag, Expression expr) {
        if (WILDCARD.equals(tag)) {
            return true;
        }
        TypeEntry entry = entriesByTag.get(tag);
        if (entry == null) {
            throw new UnknownTagException(tag);
        }
        return entry.predicate().test(expr);
    }

    /**
     * Rango del primo tag, in ordine di registrazione, che riconosce la formula.
     *
     * @return rango trovato, vuoto se nessun tag riconosce la formula
     */
    public OptionalInt rankOf(Expression expr) {
        for (TypeEntry entry : entries) {
            if (entry.predicate().test(expr)) {
                return OptionalInt.of(entry.rank());
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Primo tag, in ordine di registrazione, che riconosce la formula.
     */
    public Optional<String> typeOf(Expression expr) {
        for (TypeEntry entry : entries) {
            if (entry.predicate().test(expr)) {
                return Optional.of(entry.tag());
            }
        }
        return Optional.empty();
    }

    /** Tag registrati in ordine di registrazione. */
    public List<String> tags() {
        List<String> tags = new ArrayList<>(entries.size());
        for (TypeEntry entry : entries) {
            tags.add(entry.tag());
        }
        return Collections.unmodifiableList(tags);
    }

    //endregion

    /**
     * Costruttore del registro. La registrazione è idempotente per tag: registrare di nuovo
     * lo stesso tag sostituisce predicato e rango mantenendo la posizione originale.
     */
    public static final class Builder {

        private final Map<String, TypeEntry> registered = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registra (o ridefinisce) un tipo.
         *
         * @param tag nome del tipo (non null, non vuoto, diverso da "*")
         * @param predicate predicato di riconoscimento (non null)
         * @param rank rango di branchiness usato dall'euristica di selezione
         * @return questo builder
         * @throws IllegalArgumentException se tag o predicato non validi
         */
        public Builder register(String tag, Predicate<Expression> predicate, int rank) {
            if (tag == null || tag.trim().isEmpty()) {
                throw new IllegalArgumentException("Tag non può essere null o vuoto");
            }
            if (WILDCARD.equals(tag)) {
                throw new IllegalArgumentException("Il tag jolly " + WILDCARD + " non è registrabile");
            }
            if (predicate == null) {
                throw new IllegalArgumentException("Predicato null per tag " + tag);
            }

            // LinkedHashMap.put su chiave esistente non altera l'ordine di inserimento
            registered.put(tag, new TypeEntry(tag, predicate, rank));
            return this;
        }

        public TypeClassifier build() {
            return new TypeClassifier(registered);
        }
    }
}
