package org.cnf;

import org.cnf.cnf.CNFConverter;
import org.cnf.cnf.ClauseAnalyzer;
import org.cnf.cnf.ClauseSummary;
import org.cnf.eval.TruthEvaluator;
import org.cnf.eval.TruthTablePrinter;
import org.cnf.formula.ComputationInterruptedException;
import org.cnf.formula.Formula;
import org.cnf.formula.FormulaException;
import org.cnf.formula.NotationConverter;
import org.cnf.parser.FormulaParser;
import org.cnf.report.DimacsBatchValidator;
import org.cnf.report.FileValidationResult;
import org.cnf.report.HtmlReportWriter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CONVERTITORE CNF E VALIDATORE DI CLAUSOLE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula da linea di comando, file di formule (una per riga) o file DIMACS
 * 2. PARSING: notazione infissa completamente parentesizzata -> albero (ANTLR)
 * 3. ANALISI: albero, notazione prefissa, altezza, valore sotto un assegnamento, tabella di verità
 * 4. CONVERSIONE IN CNF: implicazioni -> NNF -> distribuzione OR su AND
 * 5. VALIDAZIONE: conteggio clausole tautologiche e non tautologiche
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Formula (-e): elabora una singola formula passata come argomento
 * - File singolo (-f): file di formule (.txt) oppure file DIMACS (.cnf)
 * - Directory batch (-d): valida tutti i file .cnf e genera un report HTML
 * - Timeout configurabile per ogni formula o file (-t secondi)
 *
 * @version 1.0.0
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String TRUTH_TABLE_PARAM = "-tt";
    private static final String ASSIGNMENT_PARAM = "-a";
    private static final String MAX_ATOMS_PARAM = "-maxatoms";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /** Attesa massima della terminazione del worker dopo l'interruzione */
    static final int WORKER_SHUTDOWN_SECONDS = 5;

    /**
     * Estensioni dei file riconosciuti
     * */
    private static final String CNF_EXTENSION = ".cnf";
    private static final String REPORT_FILE_NAME = "report.html";
    private static final String RESULT_SUFFIX = "_cnf.txt";

    /** Righe di commento nei file di formule */
    private static final String COMMENT_PREFIX = "#";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Utilizzo della modalità appropriata (formula, file di formule, file DIMACS, directory)
     * 3. Gestione errori globali
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO CONVERTITORE CNF <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            ConverterConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE CONVERTITORE CNF <---");
        }
    }

    /**
     * Determina la modalità operativa e delega all'handler appropriato.
     */
    private static void executeMainPipeline(ConverterConfiguration config) throws IOException {
        switch (config.mode) {
            case EXPRESSION -> {
                System.out.println("[I] Modalità: Formula singola");
                processFormulas(List.of(config.expression), config);
            }
            case FORMULA_FILE -> {
                System.out.println("[I] Modalità: File di formule");
                processFormulaFile(config);
            }
            case DIMACS_FILE -> {
                System.out.println("[I] Modalità: Validazione file DIMACS");
                processDimacsFile(config);
            }
            case DIRECTORY -> {
                System.out.println("[I] Modalità: Validazione directory DIMACS");
                processDirectoryBatch(config);
            }
        }
    }

    /**
     * Gestisce errori critici dell'applicazione, terminando con codice di errore.
     */
    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static ConverterConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(ConverterConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE CONVERTITORE CNF <<--");
        System.out.println("Input: " + (config.mode == Mode.EXPRESSION ? config.expression : config.inputPath));
        System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        if (config.mode == Mode.EXPRESSION || config.mode == Mode.FORMULA_FILE) {
            System.out.println("Tabella di verità: " + (config.printTruthTable
                    ? "Sì (massimo " + config.maxAtoms + " variabili)" : "No"));
            System.out.println("Assegnamento: " + (config.assignment.isEmpty() ? "Nessuno" : config.assignment));
        }
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Solo console"));
        System.out.println("========================================\n");
    }

    //endregion

    //region ELABORAZIONE FORMULE

    /**
     * Legge un file di formule, una per riga, ignorando righe vuote e commenti.
     */
    private static void processFormulaFile(ConverterConfiguration config) throws IOException {
        System.out.println("Lettura formule da " + Paths.get(config.inputPath).getFileName() + "...");

        List<String> formulas = new ArrayList<>();
        for (String line : Files.readAllLines(Path.of(config.inputPath), StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith(COMMENT_PREFIX)) {
                formulas.add(trimmed);
            }
        }

        System.out.println("[I] Formule lette: " + formulas.size());
        processFormulas(formulas, config);
    }

    /**
     * Elabora in sequenza le formule. Gli errori su una formula non
     * interrompono l'elaborazione delle altre.
     */
    private static void processFormulas(List<String> formulas, ConverterConfiguration config) throws IOException {
        BatchResult batch = new BatchResult(formulas.size());
        StringBuilder savedResults = new StringBuilder();

        int index = 0;
        for (String text : formulas) {
            index++;
            System.out.println("-->> FORMULA " + index + " <<--");

            try {
                String report = executeWithTimeout(() -> analyzeFormula(text, config), config.timeoutSeconds);
                if (report == null) {
                    System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi per: " + text);
                    savedResults.append(text).append(" -> TIMEOUT").append(System.lineSeparator());
                    batch.incrementError();
                } else {
                    System.out.print(report);
                    savedResults.append(report).append(System.lineSeparator());
                    batch.incrementSuccess();
                }
            } catch (FormulaException e) {
                System.out.println("[E] Formula non valida '" + text + "': " + e.getMessage());
                savedResults.append(text).append(" -> ERRORE: ").append(e.getMessage()).append(System.lineSeparator());
                batch.incrementError();
            }
            System.out.println();
        }

        if (config.outputPath != null) {
            saveFormulaResults(savedResults.toString(), config);
        }
        if (formulas.size() > 1) {
            displayBatchSummary(batch, "FORMULE");
        }
    }

    /**
     * Analisi completa di una formula: albero, valutazione, tabella di verità, CNF e validazione.
     *
     * @return testo del risultato da mostrare
     */
    static String analyzeFormula(String text, ConverterConfiguration config) {
        StringBuilder out = new StringBuilder();

        // FASE 1: Parsing
        Formula formula = new FormulaParser().parse(text);
        if (formula == null) {
            out.append("[W] Formula vuota, nessuna elaborazione").append(System.lineSeparator());
            return out.toString();
        }

        line(out, "Formula: " + NotationConverter.printInfix(formula));
        line(out, "Notazione prefissa: " + NotationConverter.printPrefix(formula));
        line(out, "Altezza albero: " + NotationConverter.height(formula));

        // FASE 2: Valutazione (opzionale)
        TruthEvaluator evaluator = new TruthEvaluator(config.maxAtoms);
        if (!config.assignment.isEmpty()) {
            line(out, "Valore di verità per l'assegnamento " + config.assignment + " = "
                    + evaluator.evaluate(formula, config.assignment));
        }
        if (config.printTruthTable) {
            line(out, "Tabella di verità:");
            out.append(new TruthTablePrinter(evaluator).render(formula));
        }

        // FASE 3: Conversione CNF e validazione clausole
        Formula cnf = new CNFConverter().toCNF(formula);
        ClauseAnalyzer analyzer = new ClauseAnalyzer();
        List<String> clauses = analyzer.clauseTokens(cnf);
        ClauseSummary summary = analyzer.summarize(clauses);

        line(out, "CNF: " + NotationConverter.printInfix(cnf));
        line(out, "Clausole: " + String.join("*", clauses));
        line(out, summary.isValid() ? "Formula valida" : "Formula non valida");
        line(out, "Numero clausole valide = " + summary.tautological());
        line(out, "Numero clausole non valide = " + summary.nonTautological());
        return out.toString();
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append(System.lineSeparator());
    }

    //endregion

    //region VALIDAZIONE FILE DIMACS

    private static void processDimacsFile(ConverterConfiguration config) throws IOException {
        DimacsBatchValidator validator = new DimacsBatchValidator();
        Path file = Path.of(config.inputPath);

        FileValidationResult result = executeWithTimeout(() -> validator.validate(file), config.timeoutSeconds);
        if (result == null) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return;
        }

        displayValidationResult(result);
        if (config.outputPath != null) {
            new HtmlReportWriter().write(List.of(result), Path.of(config.outputPath, REPORT_FILE_NAME));
        }
    }

    private static void processDirectoryBatch(ConverterConfiguration config) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        DimacsBatchValidator validator = new DimacsBatchValidator();
        List<Path> files = validator.findCnfFiles(Path.of(config.inputPath));
        if (files.isEmpty()) {
            System.out.println("[W] Nessun file .cnf trovato nella directory specificata.");
            return;
        }
        System.out.println("Trovati " + files.size() + " file .cnf da elaborare.\n");

        BatchResult batch = new BatchResult(files.size());
        List<FileValidationResult> results = new ArrayList<>();

        for (Path file : files) {
            System.out.println("Elaborazione: " + file.getFileName());
            FileValidationResult result = executeWithTimeout(() -> validator.validate(file), config.timeoutSeconds);

            if (result == null) {
                System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
                result = FileValidationResult.failure(file.getFileName().toString(), "Timeout",
                        TimeUnit.SECONDS.toMillis(config.timeoutSeconds), 0);
            }

            displayValidationResult(result);
            if (result.isFailed()) {
                batch.incrementError();
            } else {
                batch.incrementSuccess();
            }
            results.add(result);
            System.out.println();
        }

        String outputDir = config.outputPath != null ? config.outputPath : config.inputPath;
        new HtmlReportWriter().write(results, Path.of(outputDir, REPORT_FILE_NAME));
        System.out.println("[I] Report salvato: " + Path.of(outputDir, REPORT_FILE_NAME));

        displayBatchSummary(batch, "DIRECTORY");
    }

    private static void displayValidationResult(FileValidationResult result) {
        if (result.isFailed()) {
            System.out.println("[E] Errore nel file " + result.fileName() + ": " + result.error());
            return;
        }
        System.out.println(result.valid() ? "Valid" : "Invalid");
        System.out.println("Numero clausole valide: " + result.validClauses());
        System.out.println("Numero clausole non valide: " + result.invalidClauses());
        System.out.println("Tempo: " + result.elapsedMillis() + " ms, memoria: "
                + result.memoryDeltaBytes() / 1024 + " KB");
    }

    //endregion

    //region ESECUZIONE CON TIMEOUT

    /**
     * Esegue un'elaborazione con limite di tempo, unico meccanismo di
     * interruzione disponibile per conversioni e tabelle di verità molto grandi.
     *
     * Allo scadere del timeout il worker viene interrotto: distribuzione CNF e
     * tabella di verità controllano il flag di interruzione e terminano con
     * {@link ComputationInterruptedException}. Il metodo ritorna solo dopo la
     * terminazione del worker (o dopo {@value #WORKER_SHUTDOWN_SECONDS} secondi di attesa).
     *
     * @return risultato dell'elaborazione, null se il timeout è scaduto
     * @throws FormulaException se l'elaborazione rifiuta l'input
     */
    static <T> T executeWithTimeout(Callable<T> task, int timeoutSeconds) {
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<T> future = executor.submit(task);
            return future.get(timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            return null;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof FormulaException formulaException) {
                throw formulaException;
            }
            if (e.getCause() instanceof ComputationInterruptedException) {
                return null;
            }
            throw new RuntimeException("Errore durante l'elaborazione", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Elaborazione interrotta", e);
        } finally {
            stopWorker(executor);
        }
    }

    /**
     * Interrompe il worker e ne attende la terminazione, così l'elaborazione
     * successiva non concorre con quella scaduta.
     */
    private static void stopWorker(ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(WORKER_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warning("Worker non terminato dopo " + WORKER_SHUTDOWN_SECONDS + " secondi dall'interruzione");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.log(Level.WARNING, "Attesa terminazione worker interrotta", e);
        }
    }

    //endregion

    //region GESTIONE DELL'OUTPUT

    private static void saveFormulaResults(String content, ConverterConfiguration config) throws IOException {
        Path outputDir = Path.of(config.outputPath);
        Files.createDirectories(outputDir);

        String baseName = config.mode == Mode.FORMULA_FILE ? getBaseFileName(config.inputPath) : "formula";
        Path outputFile = outputDir.resolve(baseName + RESULT_SUFFIX);

        try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            writer.write(content);
        }
        System.out.println("[I] Risultati salvati: " + outputFile);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static void displayBatchSummary(BatchResult result, String title) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE " + title + " <<--");
        System.out.println("Elementi elaborati: " + result.total);
        System.out.println("Elaborati con successo: " + result.successCount);
        System.out.println("Con errori o timeout: " + result.errorCount);

        if (result.total > 0) {
            double successRate = (double) result.successCount / result.total * 100;
            System.out.printf("Tasso di successo: %.1f%%\n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> CONVERTITORE CNF <<::");
        System.out.println("Conversione di formule proposizionali in CNF e validazione delle clausole\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar convertitore_CNF.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  -e <formula>      Elabora una singola formula");
        System.out.println("  -f <file.txt>     Elabora un file di formule, una per riga (# per i commenti)");
        System.out.println("  -f <file.cnf>     Valida un file DIMACS");
        System.out.println("  -d <directory>    Valida tutti i file .cnf di una directory e genera report.html");
        System.out.println();
        System.out.println("OPZIONI:");
        System.out.println("  -o <directory>    Directory di output (risultati e report)");
        System.out.println("  -t <secondi>      Timeout per formula o file (min: " + MIN_TIMEOUT_SECONDS
                + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -tt               Stampa la tabella di verità di ogni formula");
        System.out.println("  -a <p=1,q=0>      Valuta ogni formula sotto l'assegnamento indicato");
        System.out.println("  -maxatoms <n>     Variabili massime per la tabella di verità (1-"
                + TruthEvaluator.MAX_SUPPORTED_ATOMS + ", default: " + TruthEvaluator.DEFAULT_MAX_ATOMS + ")");
        System.out.println("  -h                Mostra questa guida\n");

        System.out.println("SINTASSI DELLE FORMULE:");
        System.out.println("  Variabili: lettere singole a-z, A-Z");
        System.out.println("  Connettivi: ~ (NOT), * (AND), + (OR), > (IMPLIES)");
        System.out.println("  Ogni connettivo ha le proprie parentesi: ((p+q)*(~r))");
        System.out.println("  Il connettivo binario più esterno può omettere le parentesi: (p>q)*(q>q)\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar convertitore_CNF.jar -e \"(p>q)*(q>q)\"");
        System.out.println("  java -jar convertitore_CNF.jar -e \"(a+b)\" -tt -a a=0,b=1");
        System.out.println("  java -jar convertitore_CNF.jar -f formule.txt -o ./output/");
        System.out.println("  java -jar convertitore_CNF.jar -d ./cnf_files/ -t 30\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Una formula è valida se tutte le clausole della sua CNF sono tautologiche");
        System.out.println("  - La conversione CNF può crescere esponenzialmente con la formula");
        System.out.println("  - La tabella di verità ha 2^n righe per n variabili\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Modalità operative
     */
    enum Mode {
        EXPRESSION,
        FORMULA_FILE,
        DIMACS_FILE,
        DIRECTORY
    }

    /**
     * Configurazione validata dell'applicazione.
     */
    static final class ConverterConfiguration {
        final Mode mode;
        final String expression;
        final String inputPath;
        final String outputPath;
        final int timeoutSeconds;
        final boolean printTruthTable;
        final Map<String, Boolean> assignment;
        final int maxAtoms;

        ConverterConfiguration(Mode mode, String expression, String inputPath, String outputPath,
                               int timeoutSeconds, boolean printTruthTable, Map<String, Boolean> assignment,
                               int maxAtoms) {
            this.mode = mode;
            this.expression = expression;
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.timeoutSeconds = timeoutSeconds;
            this.printTruthTable = printTruthTable;
            this.assignment = assignment;
            this.maxAtoms = maxAtoms;
        }
    }

    /**
     * Parser per parametri linea di comando.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri da linea comando
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri non validi
         */
        ConverterConfiguration parse(String[] args) {
            Mode mode = null;
            String expression = null;
            String inputPath = null;
            String outputPath = null;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            boolean printTruthTable = false;
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            int maxAtoms = TruthEvaluator.DEFAULT_MAX_ATOMS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case EXPRESSION_PARAM -> {
                        validateExclusiveMode(mode, "formula");
                        expression = getNextArgument(args, ++i, "formula");
                        mode = Mode.EXPRESSION;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(mode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        mode = inputPath.toLowerCase().endsWith(CNF_EXTENSION) ? Mode.DIMACS_FILE : Mode.FORMULA_FILE;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(mode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        mode = Mode.DIRECTORY;
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }

                    case TIMEOUT_PARAM -> timeoutSeconds = parseBoundedInt(
                            getNextArgument(args, ++i, "numero secondi"), "timeout", MIN_TIMEOUT_SECONDS, Integer.MAX_VALUE);

                    case TRUTH_TABLE_PARAM -> printTruthTable = true;

                    case ASSIGNMENT_PARAM -> assignment = parseAssignment(getNextArgument(args, ++i, "assegnamento"));

                    case MAX_ATOMS_PARAM -> maxAtoms = parseBoundedInt(
                            getNextArgument(args, ++i, "numero variabili"), "limite variabili",
                            1, TruthEvaluator.MAX_SUPPORTED_ATOMS);

                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare input con -e (formula), -f (file) o -d (directory)");
            }

            return new ConverterConfiguration(mode, expression, inputPath, outputPath, timeoutSeconds,
                    printTruthTable, assignment, maxAtoms);
        }

        private void validateExclusiveMode(Mode current, String requested) {
            if (current != null) {
                throw new IllegalArgumentException("Modalità " + requested +
                        " non può essere combinata con altre modalità (formula/file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseBoundedInt(String value, String name, int min, int max) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < min || parsed > max) {
                    throw new IllegalArgumentException("Valore " + name + " fuori intervallo [" + min + ", "
                            + (max == Integer.MAX_VALUE ? "∞" : max) + "]: " + parsed);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore " + name + " non valido: " + value);
            }
        }

        /**
         * Analizza un assegnamento nella forma "p=1,q=0".
         */
        Map<String, Boolean> parseAssignment(String text) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();

            for (String entry : text.split(",")) {
                String[] parts = entry.trim().split("=");
                if (parts.length != 2 || !Formula.isAtomName(parts[0].trim())) {
                    throw new IllegalArgumentException("Assegnamento non valido: '" + entry + "' (atteso variabile=0|1)");
                }

                String value = parts[1].trim();
                if (!value.equals("0") && !value.equals("1")) {
                    throw new IllegalArgumentException("Valore di verità non valido per " + parts[0].trim() + ": " + value);
                }
                assignment.put(parts[0].trim(), value.equals("1"));
            }
            return assignment;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
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
     * Risultato elaborazione batch con statistiche.
     */
    private static class BatchResult {
        final int total;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int total) {
            this.total = total;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    //endregion
}
