package org.cnf.report;

/**
 * Esito della validazione di un singolo file DIMACS.
 *
 * @param fileName nome del file
 * @param valid true se tutte le clausole sono tautologiche
 * @param validClauses clausole tautologiche
 * @param invalidClauses clausole non tautologiche
 * @param elapsedMillis tempo di elaborazione
 * @param memoryDeltaBytes variazione della memoria heap occupata
 * @param error messaggio di errore, null se il file è stato elaborato
 */
public record FileValidationResult(String fileName, boolean valid, int validClauses, int invalidClauses,
                                   long elapsedMillis, long memoryDeltaBytes, String error) {

    public static FileValidationResult success(String fileName, int validClauses, int invalidClauses,
                                               long elapsedMillis, long memoryDeltaBytes) {
        return new FileValidationResult(fileName, invalidClauses == 0, validClauses, invalidClauses,
                elapsedMillis, memoryDeltaBytes, null);
    }

    public static FileValidationResult failure(String fileName, String error,
                                               long elapsedMillis, long memoryDeltaBytes) {
        return new FileValidationResult(fileName, false, 0, 0, elapsedMillis, memoryDeltaBytes, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public int totalClauses() {
        return validClauses + invalidClauses;
    }
}
