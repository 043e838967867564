package org.prop.support;

/**
 * CLASSIFICATORI DI TOKEN - Predicati puri sui simboli del linguaggio proposizionale
 *
 * Riconoscono nomi di variabile, costanti e operatori. Non mantengono stato e non hanno
 * effetti collaterali: sono condivisi da parser, formula e motore di sostituzione.
 *
 * REGOLE LESSICALI:
 * • Variabile: primo carattere in p..z, seguito da zero o più cifre decimali (p, q76)
 * • Costante: esattamente T oppure F
 * • Operatore unario: esattamente ~
 * • Operatori binari: &amp; | -&gt; + &lt;-&gt; -&amp; -|
 */
public final class Tokens {

    //region SIMBOLI RISERVATI

    /** Costante vero */
    public static final String TRUE = "T";

    /** Costante falso */
    public static final String FALSE = "F";

    public static final char OPEN_PARENTHESIS = '(';
    public static final char CLOSE_PARENTHESIS = ')';

    //endregion

    /**
     * Previene istanziazione - classe utility
     */
    private Tokens() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PREDICATI

    /**
     * Verifica se la stringa è un nome di variabile.
     *
     * @param string stringa da verificare (può essere null)
     * @return true se la stringa è un nome di variabile valido
     */
    public static boolean isVariable(String string) {
        if (string == null || string.isEmpty()) {
            return false;
        }

        char first = string.charAt(0);
        if (first < 'p' || first > 'z') {
            return false;
        }

        for (int i = 1; i < string.length(); i++) {
            char c = string.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true se la stringa è una delle due costanti di verità
     */
    public static boolean isConstant(String string) {
        return TRUE.equals(string) || FALSE.equals(string);
    }

    /**
     * @return true se la stringa è l'operatore unario (negazione)
     */
    public static boolean isUnary(String string) {
        return Operator.NEGATION.symbol().equals(string);
    }

    /**
     * @return true se la stringa è uno dei sette operatori binari
     */
    public static boolean isBinary(String string) {
        Operator operator = Operator.fromSymbol(string);
        return operator != null && operator.isBinary();
    }

    //endregion
}
