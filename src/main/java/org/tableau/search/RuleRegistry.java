package org.tableau.search;

import org.tableau.classifier.TypeClassifier;
import org.tableau.formula.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registro ordinato tag di tipo -> regola di espansione.
 *
 * La prima regola, in ordine di registrazione, il cui tag riconosce la formula viene
 * applicata. Il registro è immutabile dopo la costruzione; registrare di nuovo un tag
 * sostituisce la regola mantenendo la posizione originale.
 */
public final class RuleRegistry {

    /**
     * Voce del registro.
     */
    public record RuleEntry(String tag, ExpansionRule rule) {}

    private final List<RuleEntry> entries;

    private RuleRegistry(Map<String, ExpansionRule> rules) {
        List<RuleEntry> list = new ArrayList<>(rules.size());
        rules.forEach((tag, rule) -> list.add(new RuleEntry(tag, rule)));
        this.entries = Collections.unmodifiableList(list);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Prima voce il cui tag riconosce la formula secondo il classificatore.
     *
     * @throws org.tableau.classifier.UnknownTagException se un tag del registro non è
     *         registrato nel classificatore
     */
    public Optional<RuleEntry> findRule(Expression formula, TypeClassifier classifier) {
        for (RuleEntry entry : entries) {
            if (classifier.classify(entry.tag(), formula)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public List<String> tags() {
        List<String> tags = new ArrayList<>(entries.size());
        for (RuleEntry entry : entries) {
            tags.add(entry.tag());
        }
        return Collections.unmodifiableList(tags);
    }

    public static final class Builder {

        private final Map<String, ExpansionRule> rules = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String tag, ExpansionRule rule) {
            if (tag == null || tag.trim().isEmpty()) {
                throw new IllegalArgumentException("Tag non può essere null o vuoto");
            }
            if (rule == null) {
                throw new IllegalArgumentException("Regola null per tag " + tag);
            }
            rules.put(tag, rule);
            return this;
        }

        public RuleRegistry build() {
            return new RuleRegistry(rules);
        }
    }
}
