package org.prop.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test del parser per la notazione polacca e della rilettura delle due notazioni.
 */
@DisplayName("PolishNotationParser")
class PolishNotationParserTest {

    @ParameterizedTest
    @CsvSource({
            "p,             p",
            "~&pq76,        ~(p&q76)",
            "->pq,          (p->q)",
            "<->~pq,        (~p<->q)",
            "-&p-|qr,       (p-&(q-|r))",
            "+TF,           (T+F)",
            "|&pq~r,        ((p&q)|~r)",
            "->->pqr,       ((p->q)->r)"
    })
    @DisplayName("Legge ogni operatore affidandosi solo all'arietà")
    void testParse(String polish, String standard) {
        Formula formula = PolishNotationParser.parse(polish);

        assertEquals(standard, formula.toString());
        assertEquals(polish, formula.toPolishString());
    }

    @Test
    @DisplayName("Il prefisso più lungo lascia il residuo")
    void testPrefix() {
        ParseResult result = PolishNotationParser.parsePrefix("&pqr");

        assertTrue(result.isSuccess());
        assertEquals("(p&q)", result.getFormula().toString());
        assertEquals("r", result.getRemainder());
    }

    @Test
    @DisplayName("Diagnostica degli errori a basso livello")
    void testErrors() {
        assertEquals("unexpected end of input", PolishNotationParser.parsePrefix("&p").getErrorMessage());
        assertEquals("unexpected end of input", PolishNotationParser.parsePrefix("").getErrorMessage());
        assertEquals("invalid variable name: b2", PolishNotationParser.parsePrefix("|pb2").getErrorMessage());
        assertEquals("unexpected token: (", PolishNotationParser.parsePrefix("(p&q)").getErrorMessage());
        assertEquals("unexpected token: -", PolishNotationParser.parsePrefix("-pq").getErrorMessage());
    }

    @Test
    @DisplayName("I caratteri fuori dal piano di base sono riportati interi")
    void testSupplementaryCharacters() {
        String italicP = "\uD835\uDC5D";
        String emoji = "\uD83D\uDE00";

        assertEquals("invalid variable name: " + italicP, PolishNotationParser.parsePrefix(italicP).getErrorMessage());
        assertEquals("unexpected token: " + emoji, PolishNotationParser.parsePrefix("&p" + emoji).getErrorMessage());

        ParseResult result = PolishNotationParser.parsePrefix("|pq" + emoji);
        assertEquals("(p|q)", result.getFormula().toString());
        assertEquals(emoji, result.getRemainder());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "&p", "pq", "~", "(&pq)", "&pqr", "<-pq", "a"})
    @DisplayName("parse su input non valido è violazione di contratto")
    void testParseContract(String polish) {
        assertFalse(PolishNotationParser.isFormula(polish));
        assertThrows(IllegalArgumentException.class, () -> PolishNotationParser.parse(polish));
    }

    @ParameterizedTest
    @ValueSource(strings = {"p", "~T", "((p->q)<->(~q->~p))", "~(p&q76)", "(((x1+x2)-&F)-|~~y)",
            "((p|(q&r))->((p|q)&(p|r)))", "~~~(z9<->(T->F))"})
    @DisplayName("Rilettura: parse(toString(f)) e parsePolish(toPolishString(f)) restituiscono f")
    void testRoundTrip(String standard) {
        Formula formula = Formula.parse(standard);

        assertEquals(formula, Formula.parse(formula.toStandardString()));
        assertEquals(formula, Formula.parsePolish(formula.toPolishString()));
    }
}
