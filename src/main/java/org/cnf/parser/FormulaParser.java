package org.cnf.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.cnf.antlr.PropositionalFormulaBaseVisitor;
import org.cnf.antlr.PropositionalFormulaLexer;
import org.cnf.antlr.PropositionalFormulaParser;
import org.cnf.antlr.PropositionalFormulaParser.AtomContext;
import org.cnf.antlr.PropositionalFormulaParser.BinaryContext;
import org.cnf.antlr.PropositionalFormulaParser.EmptyFormulaContext;
import org.cnf.antlr.PropositionalFormulaParser.GroupContext;
import org.cnf.antlr.PropositionalFormulaParser.NegationContext;
import org.cnf.antlr.PropositionalFormulaParser.SingleFormulaContext;
import org.cnf.antlr.PropositionalFormulaParser.TopLevelBinaryContext;
import org.cnf.formula.Formula;
import org.cnf.formula.MalformedFormulaException;

import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Analizza la stessa notazione infissa accettata da
 * {@link org.cnf.formula.NotationConverter} ma tramite la grammatica
 * PropositionalFormula, così da riportare gli errori di sintassi con riga e
 * colonna. Per ogni formula ben formata produce lo stesso albero di
 * NotationConverter.parse.
 *
 * OPERATORI SUPPORTATI:
 * - Negazione (~): prefissa, (~A)
 * - Congiunzione (*), disgiunzione (+), implicazione (>): infisse, (A op B)
 * - Variabili: singole lettere [a-zA-Z]
 *
 * A differenza della conversione a pila, la grammatica rifiuta catene di
 * connettivi non parentesizzate come (p+q+r).
 */
public class FormulaParser extends PropositionalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Analizza una formula infissa e ne costruisce l'albero.
     *
     * @param text formula infissa
     * @return radice dell'albero, null per la formula vuota
     * @throws MalformedFormulaException se la formula non rispetta la grammatica
     */
    public Formula parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }

        ThrowingErrorListener errorListener = new ThrowingErrorListener(text);

        PropositionalFormulaLexer lexer = new PropositionalFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        PropositionalFormulaParser parser = new PropositionalFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        Formula formula = visit(parser.formula());
        LOGGER.fine("Formula analizzata: " + (formula == null ? "<vuota>" : formula.toString()));
        return formula;
    }

    //endregion

    //region LIVELLO FORMULA

    @Override
    public Formula visitEmptyFormula(EmptyFormulaContext ctx) {
        return null;
    }

    @Override
    public Formula visitSingleFormula(SingleFormulaContext ctx) {
        return visit(ctx.subformula());
    }

    /**
     * Connettivo binario più esterno scritto senza parentesi: (p>q)*(q>q).
     */
    @Override
    public Formula visitTopLevelBinary(TopLevelBinaryContext ctx) {
        return Formula.binary(connective(ctx.op), visit(ctx.subformula(0)), visit(ctx.subformula(1)));
    }

    //endregion

    //region SOTTOFORMULE

    @Override
    public Formula visitAtom(AtomContext ctx) {
        String variableName = ctx.ATOM().getText();
        LOGGER.finest("Elaborazione variabile atomica: " + variableName);
        return Formula.atom(variableName);
    }

    @Override
    public Formula visitNegation(NegationContext ctx) {
        LOGGER.finest("Elaborazione negazione");
        return Formula.not(visit(ctx.subformula()));
    }

    @Override
    public Formula visitBinary(BinaryContext ctx) {
        Formula left = visit(ctx.subformula(0));
        Formula right = visit(ctx.subformula(1));
        return Formula.binary(connective(ctx.op), left, right);
    }

    /**
     * Parentesi ridondanti attorno a una sottoformula, (p) o ((p+q)): rimosse.
     */
    @Override
    public Formula visitGroup(GroupContext ctx) {
        LOGGER.finest("Rimozione parentesi trasparente");
        return visit(ctx.subformula());
    }

    //endregion

    private static Formula.Type connective(Token op) {
        Formula.Type type = Formula.Type.fromSymbol(op.getText().charAt(0));
        if (type == null || !type.isBinary()) {
            throw new MalformedFormulaException("Connettivo binario non riconosciuto '" + op.getText() + "'",
                    op.getCharPositionInLine());
        }
        return type;
    }

    /**
     * Trasforma gli errori di lexer e parser in {@link MalformedFormulaException}.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {
        private final String text;

        ThrowingErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new MalformedFormulaException("Errore di sintassi " + line + ":" + charPositionInLine
                    + " nella formula '" + text + "': " + msg, charPositionInLine, e);
        }
    }
}
