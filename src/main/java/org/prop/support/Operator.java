package org.prop.support;

/**
 * OPERATORI PROPOSIZIONALI - Simboli, arietà e tavole di verità
 *
 * Insieme chiuso degli operatori riconosciuti dalle due notazioni (standard e polacca).
 * Ogni operatore conosce il proprio simbolo testuale, la propria arietà e, se binario,
 * la propria funzione di verità a due valori.
 *
 * SIMBOLI BINARI (lunghezza variabile):
 * • 1 carattere: &amp; | +
 * • 2 caratteri: -&gt; -&amp; -|
 * • 3 caratteri: &lt;-&gt;
 *
 * I lexer delle due notazioni scelgono sempre il simbolo più lungo, quindi &lt;-&gt; e -&gt;
 * non vengono mai spezzati.
 */
public enum Operator {

    NEGATION("~", 1),
    AND("&", 2),
    OR("|", 2),
    IMPLIES("->", 2),
    XOR("+", 2),
    IFF("<->", 2),
    NAND("-&", 2),
    NOR("-|", 2);

    private final String symbol;
    private final int arity;

    Operator(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    /**
     * @return simbolo testuale dell'operatore
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return numero di operandi (1 per la negazione, 2 per i binari)
     */
    public int arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    /**
     * Applica la tavola di verità dell'operatore binario.
     *
     * @param left valore dell'operando sinistro
     * @param right valore dell'operando destro
     * @return valore di verità risultante
     * @throws IllegalStateException se invocato sulla negazione
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case IMPLIES -> !left || right;
            case XOR -> left != right;
            case IFF -> left == right;
            case NAND -> !(left && right);
            case NOR -> !(left || right);
            case NEGATION -> throw new IllegalStateException("La negazione non è un operatore binario");
        };
    }

    /**
     * Ricerca l'operatore con il simbolo indicato.
     *
     * @param symbol simbolo testuale
     * @return operatore corrispondente o null se il simbolo non è un operatore
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
