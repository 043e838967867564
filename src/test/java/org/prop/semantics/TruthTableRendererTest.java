package org.prop.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.prop.syntax.Formula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TruthTableRenderer")
class TruthTableRendererTest {

    @Test
    @DisplayName("Tavola a larghezza fissa con variabili in ordine alfabetico")
    void testRender() {
        String expected = "| p | q76 | ~(p&q76) |\n"
                + "|---|-----|----------|\n"
                + "| F | F   | T        |\n"
                + "| F | T   | T        |\n"
                + "| T | F   | T        |\n"
                + "| T | T   | F        |\n";

        assertEquals(expected, TruthTableRenderer.render(Formula.parse("~(p&q76)")));
    }

    @Test
    @DisplayName("Le variabili sono ordinate anche se compaiono in altro ordine")
    void testSortedHeader() {
        List<String> lines = TruthTableRenderer.renderLines(Formula.parse("(q->p)"));

        assertEquals("| p | q | (q->p) |", lines.get(0));
        assertEquals("| F | T | F      |", lines.get(3));
        assertEquals(6, lines.size());
    }

    @Test
    @DisplayName("Una formula senza variabili ha una sola riga di valori")
    void testConstantFormula() {
        assertEquals("| (T->F) |\n|--------|\n| F      |\n",
                TruthTableRenderer.render(Formula.parse("(T->F)")));
    }

    @Test
    @DisplayName("La formula null è violazione di contratto")
    void testNull() {
        assertThrows(IllegalArgumentException.class, () -> TruthTableRenderer.render(null));
    }
}
