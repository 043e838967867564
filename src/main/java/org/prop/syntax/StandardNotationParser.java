package org.prop.syntax;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

import java.util.logging.Logger;

/**
 * PARSER NOTAZIONE STANDARD - Notazione infissa parentesizzata tramite ANTLR
 *
 * GRAMMATICA (InfixFormula.g4):
 * <pre>
 * formula ::= variabile | costante | "~" formula | "(" formula binop formula ")"
 * binop   ::= "&amp;" | "|" | "-&gt;" | "+" | "&lt;-&gt;" | "-&amp;" | "-|"
 * </pre>
 * Nessuno spazio ammesso; ogni applicazione binaria è racchiusa tra parentesi. Il lexer
 * sceglie sempre il simbolo più lungo, quindi &lt;-&gt; non viene mai letto come &lt; seguito
 * da -&gt;.
 *
 * CONTRATTO A DUE LIVELLI:
 * • {@link #parsePrefix(String)}: consuma il più lungo prefisso che sia una formula e
 *   restituisce formula e suffisso residuo, oppure un messaggio di errore. Non solleva
 *   eccezioni per input malformati.
 * • {@link #parse(String)}: richiede che l'intera stringa sia una formula; in caso
 *   contrario si tratta di violazione di contratto (IllegalArgumentException).
 *
 * DIAGNOSTICA (prima anomalia da sinistra):
 * unexpected end of input, invalid variable name: &lt;nome&gt;, expected binary operator,
 * expected ')', unexpected token: &lt;token&gt;.
 */
public final class StandardNotationParser {

    private static final Logger LOGGER = Logger.getLogger(StandardNotationParser.class.getName());

    /**
     * Previene istanziazione - classe utility
     */
    private StandardNotationParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Legge il più lungo prefisso della stringa che sia una formula in notazione standard.
     *
     * Se la stringa inizia con un nome di variabile (ad esempio x12) il prefisso letto
     * include l'intero nome e non soltanto una sua parte.
     *
     * @param string stringa da leggere
     * @return formula letta con suffisso residuo, oppure esito negativo con diagnostica
     */
    public static ParseResult parsePrefix(String string) {
        if (string == null) {
            return ParseResult.failure(SyntaxErrorStrategy.UNEXPECTED_END);
        }

        InfixFormulaLexer lexer = new InfixFormulaLexer(CharStreams.fromString(string));
        InfixFormulaParser parser = new InfixFormulaParser(new CommonTokenStream(lexer));
        ParseResult result = FormulaReader.read(string, lexer, parser, InfixFormulaParser.RULE_variable,
                parser::formula, new InfixFormulaBuilder());

        if (!result.isSuccess()) {
            LOGGER.finest(() -> "Parsing standard fallito per '" + string + "': " + result.getErrorMessage());
        }
        return result;
    }

    /**
     * @param string stringa da verificare
     * @return true se l'intera stringa è una formula in notazione standard
     */
    public static boolean isFormula(String string) {
        return parsePrefix(string).isComplete();
    }

    /**
     * Legge una stringa che deve essere interamente una formula in notazione standard.
     *
     * @param string rappresentazione standard valida
     * @return formula la cui rappresentazione standard è la stringa indicata
     * @throws IllegalArgumentException se la stringa non è una formula completa
     */
    public static Formula parse(String string) {
        ParseResult result = parsePrefix(string);
        if (!result.isSuccess()) {
            throw new IllegalArgumentException("Formula non valida '" + string + "': " + result.getErrorMessage());
        }
        if (!result.isComplete()) {
            throw new IllegalArgumentException("Formula non valida '" + string
                    + "': suffisso non consumato '" + result.getRemainder() + "'");
        }

        LOGGER.fine(() -> "Formula letta in notazione standard: " + result.getFormula());
        return result.getFormula();
    }
}
