package org.cnf.formula;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CONVERTITORE DI NOTAZIONE - Passaggio tra notazione infissa, prefissa e albero
 *
 * Gestisce le tre rappresentazioni di una formula:
 * - Infissa completamente parentesizzata: ((p+q)*(~r)), usata in input e output
 * - Prefissa lineare: *+pq~r, un simbolo per token, senza parentesi
 * - Albero {@link Formula}, su cui operano valutazione e conversione CNF
 *
 * Per ogni formula canonica s vale:
 * printInfix(buildTree(infixToPrefix(s))).equals(s)
 */
public final class NotationConverter {

    private static final Logger LOGGER = Logger.getLogger(NotationConverter.class.getName());

    private static final char OPEN = '(';
    private static final char CLOSE = ')';

    private NotationConverter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INFISSA -> PREFISSA

    /**
     * Converte una formula infissa completamente parentesizzata in notazione prefissa.
     *
     * ALGORITMO (scansione da destra verso sinistra):
     * - ')' viene impilata come sentinella (dopo l'inversione apre un gruppo)
     * - '+', '*', '>' vengono impilati
     * - '(' svuota la pila nell'output fino alla sentinella, che viene scartata
     * - '~' e le variabili passano direttamente nell'output
     * - a fine scansione gli operatori rimasti vengono svuotati nell'output
     * - l'output accumulato viene infine invertito
     *
     * Lo svuotamento finale permette di omettere le parentesi esterne di un
     * connettivo binario al livello più alto: (p>q)*(q>q) diventa *>pq>qq.
     * Gli spazi vengono ignorati.
     *
     * Ogni simbolo viene confrontato con quello che lo segue, così sequenze
     * come (pq+) o (p~+q) sono rifiutate. Il numero di connettivi per gruppo
     * invece non è verificato: (p+q+r) viene accettata, a differenza di
     * {@link org.cnf.parser.FormulaParser} che la rifiuta.
     *
     * @param infix formula in notazione infissa
     * @return formula in notazione prefissa (vuota se l'input è vuoto)
     * @throws MalformedFormulaException per simboli sconosciuti o fuori posto, o parentesi sbilanciate
     */
    public static String infixToPrefix(String infix) {
        if (infix == null) {
            throw new IllegalArgumentException("Formula infissa non può essere null");
        }

        // Posizioni nella stringa originale di sentinelle e operatori impilati
        Deque<Integer> stack = new ArrayDeque<>();
        StringBuilder reversed = new StringBuilder(infix.length());

        // Posizione del simbolo non vuoto immediatamente a destra, -1 a fine formula
        int next = -1;

        for (int i = infix.length() - 1; i >= 0; i--) {
            char c = infix.charAt(i);

            if (Character.isWhitespace(c)) {
                continue;
            }

            if (c == CLOSE || isBinarySymbol(c)) {
                checkFollower(infix, i, next);
                stack.push(i);
            } else if (c == OPEN) {
                checkFollower(infix, i, next);
                popUntilSentinel(infix, stack, reversed, i);
            } else if (c == Formula.Type.NOT.symbol() || Formula.isAtomLetter(c)) {
                checkFollower(infix, i, next);
                reversed.append(c);
            } else {
                throw new MalformedFormulaException("Simbolo sconosciuto '" + c + "' nella formula '" + infix + "'", i);
            }
            next = i;
        }

        if (next >= 0 && !startsOperand(infix.charAt(next))) {
            throw new MalformedFormulaException("Formula che inizia con '" + infix.charAt(next)
                    + "' nella formula '" + infix + "'", next);
        }

        while (!stack.isEmpty()) {
            int position = stack.pop();
            if (infix.charAt(position) == CLOSE) {
                throw new MalformedFormulaException("Parentesi ')' senza '(' corrispondente nella formula '" + infix + "'", position);
            }
            reversed.append(infix.charAt(position));
        }

        String prefix = reversed.reverse().toString();
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Conversione infissa -> prefissa: " + infix + " -> " + prefix);
        }
        return prefix;
    }

    /**
     * Chiude un gruppo: sposta nell'output gli operatori fino alla sentinella.
     */
    private static void popUntilSentinel(String infix, Deque<Integer> stack, StringBuilder out, int openPosition) {
        while (true) {
            if (stack.isEmpty()) {
                throw new MalformedFormulaException("Parentesi '(' senza ')' corrispondente nella formula '" + infix + "'", openPosition);
            }
            int position = stack.pop();
            char top = infix.charAt(position);
            if (top == CLOSE) {
                return;
            }
            out.append(top);
        }
    }

    /**
     * Verifica il simbolo che segue c: dopo un operando (variabile o ')') può
     * venire solo un connettivo binario, ')' o la fine della formula; dopo un
     * connettivo, '~' o '(' deve iniziare un operando.
     */
    private static void checkFollower(String infix, int position, int next) {
        char c = infix.charAt(position);

        if (Formula.isAtomLetter(c) || c == CLOSE) {
            if (next >= 0 && !isBinarySymbol(infix.charAt(next)) && infix.charAt(next) != CLOSE) {
                throw new MalformedFormulaException("Simbolo '" + infix.charAt(next) + "' inatteso dopo '" + c
                        + "' nella formula '" + infix + "'", next);
            }
        } else if (next < 0 || !startsOperand(infix.charAt(next))) {
            throw new MalformedFormulaException("Operando mancante dopo '" + c + "' nella formula '" + infix + "'",
                    next < 0 ? position : next);
        }
    }

    private static boolean startsOperand(char c) {
        return Formula.isAtomLetter(c) || c == OPEN || c == Formula.Type.NOT.symbol();
    }

    private static boolean isBinarySymbol(char c) {
        Formula.Type type = Formula.Type.fromSymbol(c);
        return type != null && type.isBinary();
    }

    //endregion

    //region PREFISSA -> ALBERO

    /**
     * Costruisce l'albero leggendo la formula prefissa da sinistra a destra.
     *
     * Ogni simbolo letto determina il tipo del nodo: i connettivi binari
     * consumano un sottoalbero sinistro e poi uno destro, '~' consuma solo il
     * sottoalbero destro, le lettere chiudono la ricorsione.
     *
     * @param prefix formula in notazione prefissa
     * @return radice dell'albero, null per la formula vuota
     * @throws TruncatedFormulaException se l'input termina mentre è atteso un sottoalbero
     * @throws MalformedFormulaException per simboli sconosciuti o in eccesso
     */
    public static Formula buildTree(String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("Formula prefissa non può essere null");
        }
        if (prefix.isEmpty()) {
            LOGGER.fine("Formula prefissa vuota: albero vuoto");
            return null;
        }

        PrefixCursor cursor = new PrefixCursor(prefix);
        Formula root = cursor.readSubtree();

        if (cursor.hasMore()) {
            throw new MalformedFormulaException("Simboli in eccesso dopo la fine della formula '" + prefix + "'", cursor.position);
        }
        return root;
    }

    /**
     * Cursore unico sulla stringa prefissa, con controllo dei limiti a ogni passo.
     */
    private static final class PrefixCursor {
        private final String prefix;
        private int position;

        PrefixCursor(String prefix) {
            this.prefix = prefix;
            this.position = 0;
        }

        boolean hasMore() {
            return position < prefix.length();
        }

        Formula readSubtree() {
            if (!hasMore()) {
                throw new TruncatedFormulaException(prefix, position);
            }

            int symbolPosition = position;
            char c = prefix.charAt(position++);

            if (Formula.isAtomLetter(c)) {
                return Formula.atom(String.valueOf(c));
            }

            Formula.Type type = Formula.Type.fromSymbol(c);
            if (type == null) {
                throw new MalformedFormulaException("Simbolo sconosciuto '" + c + "' nella formula prefissa '" + prefix + "'", symbolPosition);
            }

            return switch (type) {
                case NOT -> Formula.not(readSubtree());
                case AND, OR, IMPLIES -> {
                    Formula left = readSubtree();
                    Formula right = readSubtree();
                    yield Formula.binary(type, left, right);
                }
                case ATOM -> throw new IllegalStateException("Simbolo di connettivo associato ad ATOM: " + c);
            };
        }
    }

    //endregion

    //region ALBERO -> TESTO

    /**
     * Stampa l'albero in notazione infissa canonica: parentesi attorno a ogni
     * connettivo binario, (~A) per le negazioni, atomi senza parentesi.
     *
     * @param formula albero da stampare (null per la formula vuota)
     * @return formula infissa, stringa vuota per la formula vuota
     */
    public static String printInfix(Formula formula) {
        return formula == null ? "" : formula.toString();
    }

    /**
     * Serializza l'albero in notazione prefissa, inversa di {@link #buildTree(String)}
     * per alberi con variabili di una sola lettera.
     *
     * @param formula albero da serializzare (null per la formula vuota)
     * @return formula prefissa
     */
    public static String printPrefix(Formula formula) {
        StringBuilder out = new StringBuilder();
        if (formula != null) {
            appendPrefix(formula, out);
        }
        return out.toString();
    }

    private static void appendPrefix(Formula node, StringBuilder out) {
        switch (node.getType()) {
            case ATOM -> out.append(node.getAtom());
            case NOT -> {
                out.append(Formula.Type.NOT.symbol());
                appendPrefix(node.getOperand(), out);
            }
            case AND, OR, IMPLIES -> {
                out.append(node.getType().symbol());
                appendPrefix(node.getLeft(), out);
                appendPrefix(node.getRight(), out);
            }
        }
    }

    //endregion

    //region SCORCIATOIE

    /**
     * Analizza una formula infissa: equivale a buildTree(infixToPrefix(infix)).
     *
     * @return radice dell'albero, null per la formula vuota
     */
    public static Formula parse(String infix) {
        return buildTree(infixToPrefix(infix));
    }

    /**
     * Altezza dell'albero (0 per la formula vuota, 1 per un atomo).
     */
    public static int height(Formula formula) {
        return formula == null ? 0 : formula.height();
    }

    //endregion
}
