package org.tableau.optionalfeatures;

import org.tableau.formula.Expression;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * GENERATORE PIGEONHOLE PROBLEM - Istanze di test per il solutore tableau
 *
 * Codifica l'impossibilità di inserire n+1 piccioni in n buche quando ogni buca
 * contiene al più un piccione. Le istanze crescono rapidamente in difficoltà e sono
 * utili per misurare il costo della ricerca con ramificazione.
 *
 * FORMULAZIONE LOGICA:
 * - Variabili: p{i}_{j} rappresenta "il piccione i è nella buca j"
 * - Vincoli positivi: ogni piccione è in almeno una buca
 * - Vincoli negativi: ogni buca contiene al più un piccione
 *
 * Le istanze con n+1 piccioni sono UNSAT per costruzione; la variante con n piccioni
 * ({@link #buildSatisfiable}) è SAT.
 */
public class PigeonholeProblem {

    private static final Logger LOGGER = Logger.getLogger(PigeonholeProblem.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    /** Nome directory contenitore per istanze salvate */
    public static final String PIGEONHOLE_DIR = "PIGEONHOLE";

    private static final String FILE_PREFIX = "pigeonhole_";
    private static final String FILE_EXTENSION = ".txt";

    public static final int MIN_HOLES = 1;
    public static final int MAX_HOLES = 8;

    //endregion

    private PigeonholeProblem() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region COSTRUZIONE FORMULE

    /**
     * Istanza insoddisfacibile: n+1 piccioni in n buche.
     *
     * @param holes numero di buche (1 ≤ n ≤ 8)
     * @return congiunzione di tutti i vincoli
     * @throws IllegalArgumentException se n fuori intervallo
     */
    public static Expression build(int holes) {
        validateHoles(holes);
        return buildFormula(holes + 1, holes);
    }

    /**
     * Istanza soddisfacibile: n piccioni in n buche.
     */
    public static Expression buildSatisfiable(int holes) {
        validateHoles(holes);
        return buildFormula(holes, holes);
    }

    /**
     * Costruisce la congiunzione dei vincoli positivi e negativi.
     *
     * - Vincoli positivi: ∀i: (p_i1 ∨ ... ∨ p_in)
     * - Vincoli negativi: ∀j, ∀i<h: (¬p_ij ∨ ¬p_hj)
     */
    private static Expression buildFormula(int pigeons, int holes) {
        List<Expression> clauses = new ArrayList<>();

        // PARTE 1: ogni piccione in almeno una buca
        for (int pigeon = 1; pigeon <= pigeons; pigeon++) {
            List<Expression> placements = new ArrayList<>();
            for (int hole = 1; hole <= holes; hole++) {
                placements.add(variable(pigeon, hole));
            }
            clauses.add(disjunction(placements));
        }

        // PARTE 2: ogni buca al più un piccione
        for (int hole = 1; hole <= holes; hole++) {
            for (int first = 1; first <= pigeons; first++) {
                for (int second = first + 1; second <= pigeons; second++) {
                    clauses.add(Expression.or(variable(first, hole).negate(), variable(second, hole).negate()));
                }
            }
        }

        LOGGER.fine("Pigeonhole " + pigeons + " piccioni / " + holes + " buche: " + clauses.size() + " clausole");

        // Caso degenere 1 piccione / 1 buca: una sola clausola
        return clauses.size() == 1 ? clauses.get(0) : Expression.and(clauses);
    }

    /** Una disgiunzione di un solo elemento è l'elemento stesso. */
    private static Expression disjunction(List<Expression> literals) {
        return literals.size() == 1 ? literals.get(0) : Expression.or(literals);
    }

    public static Expression variable(int pigeon, int hole) {
        return Expression.atom("p" + pigeon + "_" + hole);
    }

    private static void validateHoles(int holes) {
        if (holes < MIN_HOLES || holes > MAX_HOLES) {
            throw new IllegalArgumentException("Numero buche deve essere tra " + MIN_HOLES + " e "
                    + MAX_HOLES + ", ricevuto: " + holes);
        }
    }

    //endregion

    //region DESCRIZIONE ISTANZE

    /** Variabili dell'istanza UNSAT con n buche: (n+1) * n. */
    public static int countVariables(int holes) {
        return (holes + 1) * holes;
    }

    /** Clausole dell'istanza UNSAT con n buche: (n+1) positive + n * C(n+1, 2) negative. */
    public static int countClauses(int holes) {
        int pigeons = holes + 1;
        return pigeons + holes * (pigeons * (pigeons - 1) / 2);
    }

    //endregion

    //region SALVATAGGIO FILE

    /**
     * Salva la formula UNSAT con n buche in outputDirectory/PIGEONHOLE/pigeonhole_n.txt.
     *
     * @return percorso del file scritto
     * @throws IOException se la directory o il file non possono essere creati
     */
    public static Path writeInstance(Path outputDirectory, int holes) throws IOException {
        Expression formula = build(holes);

        Path pigeonholePath = outputDirectory.resolve(PIGEONHOLE_DIR);
        Files.createDirectories(pigeonholePath);
        Path filePath = pigeonholePath.resolve(FILE_PREFIX + holes + FILE_EXTENSION);

        try (FileWriter writer = new FileWriter(filePath.toFile())) {
            writer.write(formula.toString());
            writer.write("\n");
        }

        LOGGER.finest("Istanza n=" + holes + " salvata: " + filePath);
        return filePath;
    }

    //endregion
}
