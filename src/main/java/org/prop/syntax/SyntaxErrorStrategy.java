package org.prop.syntax;

import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;

/**
 * STRATEGIA DI ERRORE - Nessun recupero, diagnostica al primo errore
 *
 * Le grammatiche decidono ogni alternativa con un solo token di lookahead, quindi il
 * primo token rifiutato è esattamente il punto in cui la lettura fallisce. Invece di
 * tentare inserimenti o cancellazioni di token, la strategia interrompe il parsing con
 * un {@link FormulaSyntaxException} che riporta uno dei messaggi fissi:
 * • nessuna alternativa applicabile ({@link #recover}): fine dell'input oppure token inatteso
 * • token atteso mancante ({@link #recoverInline}): parentesi di chiusura oppure operatore
 *   binario
 */
final class SyntaxErrorStrategy extends DefaultErrorStrategy {

    static final String UNEXPECTED_END = "unexpected end of input";
    static final String INVALID_VARIABLE = "invalid variable name: ";
    static final String EXPECTED_BINARY_OPERATOR = "expected binary operator";
    static final String EXPECTED_CLOSE_PARENTHESIS = "expected ')'";
    static final String UNEXPECTED_TOKEN = "unexpected token: ";

    /** Nome simbolico del token di chiusura nella grammatica infissa */
    private static final String CLOSE_PARENTHESIS_TOKEN = "RPAR";

    @Override
    public void recover(Parser recognizer, RecognitionException e) {
        Token offending = e.getOffendingToken() != null ? e.getOffendingToken() : recognizer.getCurrentToken();
        throw new FormulaSyntaxException(unexpectedTokenMessage(offending));
    }

    @Override
    public Token recoverInline(Parser recognizer) {
        throw new FormulaSyntaxException(expectedTokenMessage(recognizer));
    }

    @Override
    public void sync(Parser recognizer) {
        // Le decisioni LL(1) segnalano l'errore da sole, senza risincronizzazione
    }

    private static String expectedTokenMessage(Parser recognizer) {
        int closeParenthesis = recognizer.getTokenType(CLOSE_PARENTHESIS_TOKEN);
        if (closeParenthesis != Token.INVALID_TYPE && recognizer.getExpectedTokens().contains(closeParenthesis)) {
            return EXPECTED_CLOSE_PARENTHESIS;
        }
        return EXPECTED_BINARY_OPERATOR;
    }

    private static String unexpectedTokenMessage(Token offending) {
        if (offending.getType() == Token.EOF) {
            return UNEXPECTED_END;
        }
        return UNEXPECTED_TOKEN + offending.getText();
    }
}
