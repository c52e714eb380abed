package org.tableau.formula;

/**
 * Radice della gerarchia di errori del solutore tableau.
 *
 * Tutti gli errori sono di programmazione o di configurazione (formula malformata,
 * registri incoerenti, ricerca interrotta) e vengono propagati al chiamante senza
 * tentativi di recupero. L'insoddisfacibilità di una formula non è un errore.
 */
public class TableauException extends RuntimeException {

    public TableauException(String message) {
        super(message);
    }
}
