package org.cnf.report;

import org.cnf.dimacs.DimacsFormula;
import org.cnf.dimacs.DimacsReader;
import org.cnf.dimacs.DimacsValidator;
import org.cnf.formula.FormulaException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Validazione di file DIMACS singoli o di intere directory, con misura di
 * tempo e memoria per ogni file.
 *
 * Gli errori su un file vengono registrati nel relativo risultato e non
 * interrompono l'elaborazione degli altri.
 */
public class DimacsBatchValidator {

    private static final Logger LOGGER = Logger.getLogger(DimacsBatchValidator.class.getName());

    private static final String CNF_EXTENSION = ".cnf";

    private final DimacsReader reader;
    private final DimacsValidator validator;

    public DimacsBatchValidator() {
        this(new DimacsReader(), new DimacsValidator());
    }

    public DimacsBatchValidator(DimacsReader reader, DimacsValidator validator) {
        this.reader = reader;
        this.validator = validator;
    }

    /**
     * Valida un singolo file.
     *
     * @param file file DIMACS
     * @return esito, con messaggio di errore se il file non è leggibile o non valido
     */
    public FileValidationResult validate(Path file) {
        String fileName = file.getFileName().toString();
        ResourceMeter meter = ResourceMeter.start();

        try {
            DimacsFormula formula = reader.read(file);
            int valid = validator.countTautologicalClauses(formula);
            int invalid = formula.clauseCount() - valid;

            LOGGER.fine("File " + fileName + ": " + valid + " clausole tautologiche, " + invalid + " non tautologiche");
            return FileValidationResult.success(fileName, valid, invalid, meter.elapsedMillis(), meter.memoryDeltaBytes());

        } catch (IOException | FormulaException e) {
            LOGGER.log(Level.WARNING, "Validazione fallita per " + fileName, e);
            return FileValidationResult.failure(fileName, e.getMessage(), meter.elapsedMillis(), meter.memoryDeltaBytes());
        }
    }

    /**
     * Valida tutti i file .cnf di una directory, in ordine di nome.
     *
     * @param directory directory da scansionare (non ricorsiva)
     * @return un risultato per file
     * @throws IOException se la directory non è accessibile
     */
    public List<FileValidationResult> validateDirectory(Path directory) throws IOException {
        List<FileValidationResult> results = new ArrayList<>();
        for (Path file : findCnfFiles(directory)) {
            results.add(validate(file));
        }
        return results;
    }

    /**
     * Trova i file .cnf della directory, ordinati per nome.
     */
    public List<Path> findCnfFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Directory non esistente: " + directory);
        }

        try (Stream<Path> files = Files.list(directory)) {
            List<Path> cnfFiles = files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.toString().toLowerCase().endsWith(CNF_EXTENSION))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();

            LOGGER.fine("Trovati " + cnfFiles.size() + " file " + CNF_EXTENSION + " in " + directory);
            return cnfFiles;
        }
    }
}
