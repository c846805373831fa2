package org.cnf.dimacs;

import org.cnf.formula.FormulaException;

/**
 * File DIMACS non conforme al formato: intestazione mancante o non valida,
 * token non numerici, letterali fuori intervallo o numero di clausole errato.
 */
public class MalformedDimacsException extends FormulaException {

    /** Riga (1-based) del problema, -1 se riferito all'intero file */
    private final int lineNumber;

    public MalformedDimacsException(String message, int lineNumber) {
        super(lineNumber > 0 ? "Riga " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public MalformedDimacsException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? "Riga " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
