package org.cnf.formula;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Nodo dell'albero sintattico di una formula proposizionale
 *
 * Ogni nodo è immutabile e il suo tipo ne determina esattamente l'arità:
 * gli atomi non hanno figli, le negazioni hanno un solo operando (memorizzato
 * per convenzione nel ramo destro), congiunzione, disgiunzione e implicazione
 * hanno sempre entrambi i figli. Non esistono nodi parzialmente popolati.
 *
 * Le trasformazioni (eliminazione implicazioni, NNF, distribuzione) non
 * modificano mai un albero esistente ma ne costruiscono uno nuovo, per cui
 * sottoalberi condivisi tra più formule non creano problemi di aliasing.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati, ciascuno con il proprio simbolo testuale.
     */
    public enum Type {
        ATOM('\0'),     // Variabile atomica: p, q, r, ...
        NOT('~'),       // Negazione: (~A)
        AND('*'),       // Congiunzione: (A*B)
        OR('+'),        // Disgiunzione: (A+B)
        IMPLIES('>');   // Implicazione: (A>B)

        private final char symbol;

        Type(char symbol) {
            this.symbol = symbol;
        }

        /** Simbolo del connettivo nella notazione testuale (non definito per ATOM) */
        public char symbol() {
            return symbol;
        }

        public boolean isBinary() {
            return this == AND || this == OR || this == IMPLIES;
        }

        /**
         * Riconosce il connettivo associato a un simbolo.
         *
         * @param symbol carattere da riconoscere
         * @return tipo del connettivo, null se il simbolo non è un connettivo
         */
        public static Type fromSymbol(char symbol) {
            return switch (symbol) {
                case '~' -> NOT;
                case '*' -> AND;
                case '+' -> OR;
                case '>' -> IMPLIES;
                default -> null;
            };
        }
    }

    private final Type type;

    /** Nome della variabile (solo per nodi ATOM) */
    private final String atom;

    /** Figlio sinistro (solo per nodi binari) */
    private final Formula left;

    /** Figlio destro, oppure operando unico per i nodi NOT */
    private final Formula right;

    private final int hash;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String atom, Formula left, Formula right) {
        this.type = type;
        this.atom = atom;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(type, atom, left, right);
    }

    /**
     * Costruisce una foglia per una variabile proposizionale.
     *
     * Il nome deve iniziare con una lettera e contenere solo lettere, cifre o '_'.
     * La grammatica testuale produce sempre nomi di una sola lettera, ma l'albero
     * non pone limiti al numero di variabili distinte.
     *
     * @param name nome della variabile
     * @return nodo ATOM
     * @throws IllegalArgumentException se il nome è null o non valido
     */
    public static Formula atom(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile atomica non può essere null o vuoto");
        }
        if (!isAtomName(name)) {
            throw new IllegalArgumentException("Nome variabile atomica non valido: '" + name + "'");
        }
        return new Formula(Type.ATOM, name.intern(), null, null);
    }

    /**
     * Costruisce la negazione di una sottoformula.
     *
     * @throws IllegalArgumentException se operand è null
     */
    public static Formula not(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new Formula(Type.NOT, null, null, operand);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Type.IMPLIES, left, right);
    }

    /**
     * Costruisce un nodo binario del tipo indicato.
     *
     * @param type AND, OR o IMPLIES
     * @throws IllegalArgumentException se il tipo non è binario o un figlio è null
     */
    public static Formula binary(Type type, Formula left, Formula right) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo deve essere AND, OR o IMPLIES per nodi binari: " + type);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi di " + type + " non possono essere null");
        }
        return new Formula(type, null, left, right);
    }

    /**
     * Verifica se una stringa è un nome di variabile accettabile.
     */
    public static boolean isAtomName(String name) {
        if (name == null || name.isEmpty() || !isAtomLetter(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isAtomLetter(c) && !(c >= '0' && c <= '9') && c != '_') {
                return false;
            }
        }
        return true;
    }

    /**
     * Lettere dell'alfabeto ammesse come variabili nella notazione testuale: [a-zA-Z].
     */
    public static boolean isAtomLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    //endregion

    //region ACCESSO

    public Type getType() {
        return type;
    }

    /**
     * @return nome della variabile
     * @throws IllegalStateException se il nodo non è un atomo
     */
    public String getAtom() {
        if (type != Type.ATOM) {
            throw new IllegalStateException("Il nodo " + type + " non ha un nome di variabile");
        }
        return atom;
    }

    /**
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula getLeft() {
        if (!type.isBinary()) {
            throw new IllegalStateException("Il nodo " + type + " non ha figlio sinistro");
        }
        return left;
    }

    /**
     * @throws IllegalStateException se il nodo è un atomo
     */
    public Formula getRight() {
        if (type == Type.ATOM) {
            throw new IllegalStateException("Un atomo non ha figli");
        }
        return right;
    }

    /**
     * Operando di una negazione (equivale a {@link #getRight()}).
     *
     * @throws IllegalStateException se il nodo non è NOT
     */
    public Formula getOperand() {
        if (type != Type.NOT) {
            throw new IllegalStateException("Il nodo " + type + " non è una negazione");
        }
        return right;
    }

    public boolean isAtom() {
        return type == Type.ATOM;
    }

    /**
     * Un letterale è un atomo oppure la negazione di un atomo.
     */
    public boolean isLiteral() {
        return type == Type.ATOM || (type == Type.NOT && right.type == Type.ATOM);
    }

    //endregion

    //region ANALISI STRUTTURALE

    /**
     * Raccoglie le variabili della formula in ordine lessicografico.
     */
    public Set<String> atoms() {
        Set<String> atoms = new TreeSet<>();
        collectAtoms(atoms);
        return atoms;
    }

    private void collectAtoms(Set<String> atoms) {
        switch (type) {
            case ATOM -> atoms.add(atom);
            case NOT -> right.collectAtoms(atoms);
            case AND, OR, IMPLIES -> {
                left.collectAtoms(atoms);
                right.collectAtoms(atoms);
            }
        }
    }

    /**
     * Altezza dell'albero: numero di nodi sul cammino più lungo radice-foglia.
     * Un atomo ha altezza 1.
     */
    public int height() {
        return switch (type) {
            case ATOM -> 1;
            case NOT -> 1 + right.height();
            case AND, OR, IMPLIES -> 1 + Math.max(left.height(), right.height());
        };
    }

    /**
     * Numero totale di nodi dell'albero.
     */
    public int size() {
        return switch (type) {
            case ATOM -> 1;
            case NOT -> 1 + right.size();
            case AND, OR, IMPLIES -> 1 + left.size() + right.size();
        };
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    /**
     * Uguaglianza strutturale. L'ordine dei figli conta: (p+q) e (q+p) sono
     * alberi diversi anche se equivalenti.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        if (this.type != other.type || this.hash != other.hash) return false;

        return switch (type) {
            case ATOM -> atom.equals(other.atom);
            case NOT -> right.equals(other.right);
            case AND, OR, IMPLIES -> left.equals(other.left) && right.equals(other.right);
        };
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Rappresentazione infissa canonica: atomi senza parentesi, (~A) per le
     * negazioni, (A op B) per ogni connettivo binario.
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        appendInfix(result);
        return result.toString();
    }

    void appendInfix(StringBuilder out) {
        switch (type) {
            case ATOM -> out.append(atom);
            case NOT -> {
                out.append('(').append(Type.NOT.symbol());
                right.appendInfix(out);
                out.append(')');
            }
            case AND, OR, IMPLIES -> {
                out.append('(');
                left.appendInfix(out);
                out.append(type.symbol());
                right.appendInfix(out);
                out.append(')');
            }
        }
    }

    //endregion
}
