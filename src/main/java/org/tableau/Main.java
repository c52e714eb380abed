package org.tableau;

import org.tableau.formula.Expression;
import org.tableau.optionalfeatures.ExampleFormulas;
import org.tableau.optionalfeatures.PigeonholeProblem;
import org.tableau.solver.TableauResult;
import org.tableau.solver.TableauSolver;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * SOLUTORE TABLEAU - Interfaccia a linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: insieme di formule costruite in memoria (esempi predefiniti o Pigeonhole Problem)
 * 2. RISOLUZIONE: metodo dei tableau semantici con timeout per formula
 * 3. OUTPUT: esito SAT/UNSAT con modello e statistiche, opzionalmente salvato su file
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Esempi (-examples): formule con esito noto
 * - Generazione (-gen=pigeonhole n): istanze Pigeonhole da 1 a n buche
 * - Timeout configurabile per formula (-t secondi)
 * - Directory di output opzionale (-o)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    /** Logger radice del progetto, riferimento mantenuto per non perdere il livello impostato */
    private static final Logger PROJECT_LOGGER = Logger.getLogger("org.tableau");

    //region PARAMETRI LINEA DI COMANDO

    private static final String HELP_PARAM = "-h";
    private static final String EXAMPLES_PARAM = "-examples";
    private static final String GEN_PARAM = "-gen=";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String VERBOSE_PARAM = "-v";

    private static final String GEN_PIGEONHOLE = "pigeonhole";

    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private static final String FORMULAS_DIR = "FORMULAS";
    private static final String RESULT_DIR = "RESULT";

    private static final String LOGGING_CONFIG = "/logging.properties";

    //endregion

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO SOLUTORE TABLEAU <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            SolverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            if (config.verbose) {
                PROJECT_LOGGER.setLevel(Level.FINE);
            }

            displayConfigurationSummary(config);
            BatchResult result = solveAll(selectFormulas(config), config);
            displayBatchSummary(result);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE SOLUTORE TABLEAU <---");
        }
    }

    /**
     * Carica la configurazione di java.util.logging dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @return configurazione validata o null se help/errore
     */
    static SolverConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(SolverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE SOLUTORE TABLEAU <<--");
        if (config.isGenerationMode) {
            System.out.println("Modalità: Pigeonhole Problem (1-" + config.generationCount + " buche)");
        } else {
            System.out.println("Modalità: Formule di esempio");
        }
        System.out.println("Timeout: " + config.timeoutSeconds + "s per formula");
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "solo console"));
        System.out.println("-->> <<--\n");
    }

    //endregion

    //region ELABORAZIONE FORMULE

    /**
     * Formule da risolvere secondo la modalità, nome -> formula.
     */
    static Map<String, Expression> selectFormulas(SolverConfiguration config) {
        if (!config.isGenerationMode) {
            return ExampleFormulas.all();
        }

        Map<String, Expression> formulas = new LinkedHashMap<>();
        for (int holes = 1; holes <= config.generationCount; holes++) {
            formulas.put("pigeonhole_" + holes, PigeonholeProblem.build(holes));
        }
        return formulas;
    }

    private static BatchResult solveAll(Map<String, Expression> formulas, SolverConfiguration config) throws IOException {
        BatchResult batch = new BatchResult(formulas.size());
        TableauSolver solver = new TableauSolver();

        int index = 0;
        for (Map.Entry<String, Expression> entry : formulas.entrySet()) {
            index++;
            String name = entry.getKey();
            Expression formula = entry.getValue();

            System.out.println("[I] " + name + ": " + formula.countConnectives() + " connettivi, "
                    + formula.variables().size() + " variabili");

            TableauResult result = solveWithTimeout(solver, formula, config.timeoutSeconds);
            if (result == null) {
                batch.incrementTimeout();
                System.out.println("[W] " + name + ": timeout dopo " + config.timeoutSeconds + " secondi");
            } else {
                batch.record(result);
                System.out.println("[I] " + name + ": " + result);
                LOGGER.fine(() -> name + "\n" + result.getStatistics());
            }

            if (config.outputPath != null) {
                Path outputDir = Path.of(config.outputPath);
                if (config.isGenerationMode) {
                    // L'istanza i-esima ha i buche
                    PigeonholeProblem.writeInstance(outputDir, index);
                } else {
                    saveFormula(outputDir, name, formula);
                }
                saveResult(outputDir, name, formula, result);
            }
        }
        return batch;
    }

    /**
     * Risolve la formula su un thread dedicato con limite di tempo.
     *
     * Allo scadere del timeout il thread viene interrotto e il dispatcher abbandona
     * la ricerca al passo successivo.
     *
     * @return risultato della ricerca, null se timeout
     */
    private static TableauResult solveWithTimeout(TableauSolver solver, Expression formula, int timeoutSeconds) {
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Callable<TableauResult> solverTask = () -> solver.check(formula);
            Future<TableauResult> future = executor.submit(solverTask);
            return future.get(timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Attesa del risultato interrotta", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Errore nella risoluzione tableau: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    //endregion

    //region SALVATAGGIO RISULTATI

    /**
     * Salva la formula in FORMULAS/<nome>.txt.
     */
    private static void saveFormula(Path outputDir, String name, Expression formula) throws IOException {
        Path formulasDir = outputDir.resolve(FORMULAS_DIR);
        Files.createDirectories(formulasDir);
        Files.writeString(formulasDir.resolve(name + ".txt"), formula + "\n");
    }

    /**
     * Salva esito, modello e statistiche in RESULT/<nome>.txt.
     */
    private static void saveResult(Path outputDir, String name, Expression formula, TableauResult result)
            throws IOException {
        Path resultDir = outputDir.resolve(RESULT_DIR);
        Files.createDirectories(resultDir);

        try (FileWriter writer = new FileWriter(resultDir.resolve(name + ".txt").toFile())) {
            writer.write("FORMULA: " + formula + "\n\n");
            if (result == null) {
                writer.write("ESITO: TIMEOUT\n");
                return;
            }

            writer.write("ESITO: " + (result.isSatisfiable() ? "SAT" : "UNSAT") + "\n");
            if (result.isSatisfiable()) {
                writer.write("MODELLO: " + result.getModel() + "\n");
                writer.write("ASSEGNAMENTO: " + result.getModel().getAssignment() + "\n");
            }
            writer.write("\n" + result.getStatistics());
        }
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO <<--");
        System.out.println("Formule elaborate: " + result.totalFormulas);
        System.out.println("SAT: " + result.satCount + ", UNSAT: " + result.unsatCount
                + ", timeout: " + result.timeoutCount);
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> SOLUTORE TABLEAU <<::");
        System.out.println("Verifica di soddisfacibilità per la logica proposizionale");
        System.out.println("con il metodo dei tableau semantici\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar solutore-tableau.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  -examples                 Risolve le formule di esempio predefinite");
        System.out.println("  -gen=pigeonhole <numero>  Risolve le istanze Pigeonhole da 1 a <numero> buche ("
                + PigeonholeProblem.MIN_HOLES + "-" + PigeonholeProblem.MAX_HOLES + ")");
        System.out.println();
        System.out.println("OPZIONI:");
        System.out.println("  -t <secondi>    Timeout per formula (min: " + MIN_TIMEOUT_SECONDS
                + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -o <directory>  Salva formule (FORMULAS/ o PIGEONHOLE/) e risultati (RESULT/)");
        System.out.println("  -v              Log dettagliato della ricerca");
        System.out.println("  -h              Mostra questa guida\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar solutore-tableau.jar -examples");
        System.out.println("  java -jar solutore-tableau.jar -gen=pigeonhole 3 -t 30 -o ./output/\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Le modalità -examples e -gen sono mutualmente esclusive");
        System.out.println("  - Le istanze Pigeonhole sono tutte UNSAT e crescono rapidamente in difficoltà");
        System.out.println("  - Nel modello un atomo negato (!p) è falso, un atomo nudo (p) è vero\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    static final class SolverConfiguration {
        final String outputPath;
        final int timeoutSeconds;
        final boolean isGenerationMode;
        final int generationCount;
        final boolean verbose;

        SolverConfiguration(String outputPath, int timeoutSeconds, boolean isGenerationMode,
                            int generationCount, boolean verbose) {
            this.outputPath = outputPath;
            this.timeoutSeconds = timeoutSeconds;
            this.isGenerationMode = isGenerationMode;
            this.generationCount = generationCount;
            this.verbose = verbose;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    static final class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -examples: Formule di esempio (esclusivo con -gen)
         * -gen=pigeonhole <n>: Istanze Pigeonhole (esclusivo con -examples)
         * -o <dir>: Directory output
         * -t <sec>: Timeout per formula
         * -v: Log dettagliato
         *
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri non validi
         */
        SolverConfiguration parse(String[] args) {
            String outputPath = null;
            boolean isExamplesMode = false;
            boolean isGenerationMode = false;
            boolean verbose = false;
            int generationCount = 0;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case EXAMPLES_PARAM -> {
                        validateExclusiveMode(isGenerationMode, "esempi");
                        isExamplesMode = true;
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }

                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);

                    case VERBOSE_PARAM -> verbose = true;

                    default -> {
                        if (!args[i].startsWith(GEN_PARAM)) {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                        validateExclusiveMode(isExamplesMode, "generazione");
                        generationCount = parseGenerationCount(args, i);
                        isGenerationMode = true;
                        i++; // Salta il numero di istanze
                    }
                }
            }

            if (!isExamplesMode && !isGenerationMode) {
                throw new IllegalArgumentException("Specificare -examples oppure -gen=" + GEN_PIGEONHOLE + " <numero>");
            }

            return new SolverConfiguration(outputPath, timeoutSeconds, isGenerationMode, generationCount, verbose);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità (esempi/generazione sono mutualmente esclusive)");
            }
        }

        private int parseGenerationCount(String[] args, int currentIndex) {
            String genType = args[currentIndex].substring(GEN_PARAM.length());
            if (!GEN_PIGEONHOLE.equals(genType)) {
                throw new IllegalArgumentException("Tipo generazione non supportato: " + genType
                        + ". Supportati: " + GEN_PIGEONHOLE);
            }

            String countStr = getNextArgument(args, currentIndex + 1, "numero istanze");
            int count;
            try {
                count = Integer.parseInt(countStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Numero istanze non valido: " + countStr);
            }

            if (count < PigeonholeProblem.MIN_HOLES || count > PigeonholeProblem.MAX_HOLES) {
                throw new IllegalArgumentException("Numero istanze deve essere tra " + PigeonholeProblem.MIN_HOLES
                        + " e " + PigeonholeProblem.MAX_HOLES + ", ricevuto: " + count);
            }
            return count;
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

            int timeout;
            try {
                timeout = Integer.parseInt(timeoutStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
            if (timeout < MIN_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
            }
            return timeout;
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
            if (!dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
            }
        }
    }

    /**
     * Conteggio esiti dell'elaborazione.
     */
    private static final class BatchResult {
        final int totalFormulas;
        int satCount = 0;
        int unsatCount = 0;
        int timeoutCount = 0;

        BatchResult(int totalFormulas) {
            this.totalFormulas = totalFormulas;
        }

        void record(TableauResult result) {
            if (result.isSatisfiable()) {
                satCount++;
            } else {
                unsatCount++;
            }
        }

        void incrementTimeout() { timeoutCount++; }
    }

    //endregion
}
