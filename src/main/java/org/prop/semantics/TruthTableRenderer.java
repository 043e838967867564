package org.prop.semantics;

import org.prop.support.Model;
import org.prop.support.Tokens;
import org.prop.syntax.Formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Tavola di verità testuale a larghezza fissa, delimitata da barre verticali.
 *
 * Intestazione: variabili in ordine alfabetico e, come ultima colonna, la formula in
 * notazione standard. Ogni colonna è larga esattamente len(intestazione)+2 caratteri.
 * <pre>
 * | p | q76 | ~(p&amp;q76) |
 * |---|-----|----------|
 * | F | F   | T        |
 * | F | T   | T        |
 * | T | F   | T        |
 * | T | T   | F        |
 * </pre>
 */
public final class TruthTableRenderer {

    private static final char SEPARATOR = '|';
    private static final char DASH = '-';

    private TruthTableRenderer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param formula formula di cui costruire la tavola
     * @return tavola di verità, ogni riga terminata da '\n'
     */
    public static String render(Formula formula) {
        StringBuilder builder = new StringBuilder();
        for (String line : renderLines(formula)) {
            builder.append(line).append('\n');
        }
        return builder.toString();
    }

    /**
     * @param formula formula di cui costruire la tavola
     * @return righe della tavola: intestazione, separatore, una riga per modello
     */
    public static List<String> renderLines(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("La formula non può essere null");
        }

        List<String> variables = Evaluator.sortedVariables(formula.variables());
        List<String> header = new ArrayList<>(variables);
        header.add(formula.toStandardString());

        List<String> lines = new ArrayList<>();
        lines.add(row(header, header));
        lines.add(separator(header));

        for (Model model : Evaluator.allModels(variables)) {
            List<String> cells = new ArrayList<>();
            for (String variable : variables) {
                cells.add(symbol(model.get(variable)));
            }
            cells.add(symbol(Evaluator.evaluate(formula, model)));
            lines.add(row(cells, header));
        }
        return lines;
    }

    private static String row(List<String> cells, List<String> header) {
        StringBuilder builder = new StringBuilder().append(SEPARATOR);
        for (int i = 0; i < cells.size(); i++) {
            String cell = cells.get(i);
            builder.append(' ').append(cell);
            builder.append(" ".repeat(header.get(i).length() - cell.length()));
            builder.append(' ').append(SEPARATOR);
        }
        return builder.toString();
    }

    private static String separator(List<String> header) {
        StringBuilder builder = new StringBuilder().append(SEPARATOR);
        for (String cell : header) {
            builder.append(String.valueOf(DASH).repeat(cell.length() + 2)).append(SEPARATOR);
        }
        return builder.toString();
    }

    private static String symbol(boolean value) {
        return value ? Tokens.TRUE : Tokens.FALSE;
    }
}
