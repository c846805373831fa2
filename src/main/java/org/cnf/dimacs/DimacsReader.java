package org.cnf.dimacs;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LETTORE DIMACS - Parsing di file CNF in formato DIMACS standard
 *
 * FORMATO:
 * - righe di commento che iniziano con 'c'
 * - intestazione "p cnf &lt;variabili&gt; &lt;clausole&gt;"
 * - clausole come interi con segno separati da spazi, terminate da 0;
 *   una clausola può occupare più righe o condividerne una con altre
 * - una riga '%' (usata nei benchmark SATLIB) chiude i dati
 *
 * Le righe precedenti l'intestazione vengono ignorate. La lettura termina
 * quando sono state lette tutte le clausole dichiarate.
 */
public class DimacsReader {

    private static final Logger LOGGER = Logger.getLogger(DimacsReader.class.getName());

    /** Terminatore clausola nel formato DIMACS */
    private static final int CLAUSE_TERMINATOR = 0;

    /** Carattere commento nel formato DIMACS */
    private static final char COMMENT_CHAR = 'c';

    /** Prefisso header problema nel formato DIMACS */
    private static final String PROBLEM_PREFIX = "p";

    /** Fine dati nei file SATLIB */
    private static final String END_OF_DATA = "%";

    //region INTERFACCIA PUBBLICA

    /**
     * Legge un file DIMACS.
     *
     * @param path percorso del file .cnf
     * @return formula letta
     * @throws IOException se il file non è accessibile
     * @throws MalformedDimacsException se il contenuto non rispetta il formato
     */
    public DimacsFormula read(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("Percorso file non può essere null");
        }
        if (!Files.isReadable(path)) {
            throw new IOException("File non esistente o non leggibile: " + path);
        }

        LOGGER.fine("Lettura file DIMACS: " + path);
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            return read(reader);
        }
    }

    /**
     * Legge una formula DIMACS da testo.
     */
    public DimacsFormula parse(String content) {
        try {
            return read(new StringReader(content));
        } catch (IOException e) {
            throw new IllegalStateException("Errore di lettura da stringa", e);
        }
    }

    /**
     * Legge una formula DIMACS da uno stream di caratteri.
     *
     * @throws IOException se la lettura fallisce
     * @throws MalformedDimacsException se il contenuto non rispetta il formato
     */
    public DimacsFormula read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);

        int lineNumber = 0;
        String line;
        Header header = null;

        // Fase 1: ricerca intestazione
        while (header == null && (line = reader.readLine()) != null) {
            lineNumber++;
            String cleanLine = line.trim();

            if (cleanLine.startsWith(PROBLEM_PREFIX)) {
                header = parseHeader(cleanLine, lineNumber);
            } else if (!cleanLine.isEmpty() && cleanLine.charAt(0) != COMMENT_CHAR) {
                LOGGER.warning("Riga " + lineNumber + " ignorata prima dell'intestazione: " + cleanLine);
            }
        }

        if (header == null) {
            throw new MalformedDimacsException("Intestazione 'p cnf <variabili> <clausole>' mancante", -1);
        }

        // Fase 2: estrazione clausole
        List<List<Integer>> clauses = new ArrayList<>(header.clauseCount);
        List<Integer> current = new ArrayList<>();

        while (clauses.size() < header.clauseCount && (line = reader.readLine()) != null) {
            lineNumber++;
            String cleanLine = line.trim();

            if (cleanLine.isEmpty() || cleanLine.charAt(0) == COMMENT_CHAR) {
                continue;
            }
            if (cleanLine.startsWith(END_OF_DATA)) {
                break;
            }

            for (String token : cleanLine.split("\\s+")) {
                int literal = parseLiteral(token, header.variableCount, lineNumber);

                if (literal == CLAUSE_TERMINATOR) {
                    clauses.add(current);
                    current = new ArrayList<>();
                    if (clauses.size() == header.clauseCount) {
                        break; // Eventuale contenuto successivo ignorato
                    }
                } else {
                    current.add(literal);
                }
            }

            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest("Riga " + lineNumber + " elaborata, clausole: " + clauses.size());
            }
        }

        if (!current.isEmpty()) {
            throw new MalformedDimacsException("Clausola non terminata da 0: " + current, lineNumber);
        }
        if (clauses.size() != header.clauseCount) {
            throw new MalformedDimacsException("Dichiarate " + header.clauseCount
                    + " clausole, trovate " + clauses.size(), -1);
        }

        LOGGER.fine("Lettura DIMACS completata: " + header.variableCount + " variabili, "
                + clauses.size() + " clausole");
        return new DimacsFormula(header.variableCount, clauses);
    }

    //endregion

    //region PARSING

    private Header parseHeader(String line, int lineNumber) {
        String[] tokens = line.split("\\s+");
        if (tokens.length != 4 || !PROBLEM_PREFIX.equals(tokens[0]) || !"cnf".equals(tokens[1])) {
            throw new MalformedDimacsException("Intestazione non valida: '" + line + "'", lineNumber);
        }

        try {
            int variableCount = Integer.parseInt(tokens[2]);
            int clauseCount = Integer.parseInt(tokens[3]);
            if (variableCount < 0 || clauseCount < 0) {
                throw new MalformedDimacsException("Valori negativi nell'intestazione: '" + line + "'", lineNumber);
            }
            return new Header(variableCount, clauseCount);
        } catch (NumberFormatException e) {
            throw new MalformedDimacsException("Intestazione non numerica: '" + line + "'", lineNumber, e);
        }
    }

    private int parseLiteral(String token, int variableCount, int lineNumber) {
        int literal;
        try {
            literal = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new MalformedDimacsException("Letterale non numerico '" + token + "'", lineNumber, e);
        }

        if (Math.abs((long) literal) > variableCount) {
            throw new MalformedDimacsException("Letterale " + literal + " fuori dalle "
                    + variableCount + " variabili dichiarate", lineNumber);
        }
        return literal;
    }

    private record Header(int variableCount, int clauseCount) {}

    //endregion
}
