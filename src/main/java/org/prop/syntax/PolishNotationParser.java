package org.prop.syntax;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

import java.util.logging.Logger;

/**
 * PARSER NOTAZIONE POLACCA - Notazione prefissa tramite ANTLR
 *
 * Nessuna parentesi e nessun separatore: ogni operatore è seguito immediatamente dai
 * propri operandi, già autodelimitanti. La fine di ogni sottoespressione è determinata
 * soltanto dall'arietà fissa dei simboli (grammatica PolishFormula.g4):
 * • costanti e variabili: 0 operandi
 * • ~: 1 operando
 * • &amp; | -&gt; + &lt;-&gt; -&amp; -|: 2 operandi
 *
 * I simboli binari di più caratteri (-&gt;, &lt;-&gt;, -&amp;, -|) sono riconosciuti dal lexer
 * prima di quelli di un solo carattere. Le parentesi non appartengono alla notazione e
 * sono segnalate come token inattesi.
 *
 * A differenza della notazione standard, {@link #parse(String)} non è pensato per input
 * forniti dall'utente: una stringa malformata è violazione di contratto.
 */
public final class PolishNotationParser {

    private static final Logger LOGGER = Logger.getLogger(PolishNotationParser.class.getName());

    private PolishNotationParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Legge il più lungo prefisso della stringa che sia una formula in notazione polacca.
     *
     * @param string stringa da leggere
     * @return formula letta con suffisso residuo, oppure esito negativo con diagnostica
     */
    public static ParseResult parsePrefix(String string) {
        if (string == null) {
            return ParseResult.failure(SyntaxErrorStrategy.UNEXPECTED_END);
        }

        PolishFormulaLexer lexer = new PolishFormulaLexer(CharStreams.fromString(string));
        PolishFormulaParser parser = new PolishFormulaParser(new CommonTokenStream(lexer));
        ParseResult result = FormulaReader.read(string, lexer, parser, PolishFormulaParser.RULE_variable,
                parser::formula, new PolishFormulaBuilder());

        if (!result.isSuccess()) {
            LOGGER.finest(() -> "Parsing polacco fallito per '" + string + "': " + result.getErrorMessage());
        }
        return result;
    }

    /**
     * @return true se l'intera stringa è una formula in notazione polacca
     */
    public static boolean isFormula(String string) {
        return parsePrefix(string).isComplete();
    }

    /**
     * Legge una stringa che deve essere interamente una formula in notazione polacca.
     *
     * @param string rappresentazione polacca valida
     * @return formula la cui rappresentazione polacca è la stringa indicata
     * @throws IllegalArgumentException se la lettura fallisce o lascia un suffisso
     */
    public static Formula parse(String string) {
        ParseResult result = parsePrefix(string);
        if (!result.isComplete()) {
            String reason = result.isSuccess()
                    ? "suffisso non consumato '" + result.getRemainder() + "'"
                    : result.getErrorMessage();
            throw new IllegalArgumentException("Formula polacca non valida '" + string + "': " + reason);
        }

        LOGGER.fine(() -> "Formula letta in notazione polacca: " + result.getFormula());
        return result.getFormula();
    }
}
