package org.prop.syntax;

import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTreeVisitor;

import java.util.function.Supplier;

/**
 * Esecuzione comune dei parser generati: configura lexer e parser, legge il prefisso più
 * lungo e lo converte in {@link ParseResult}.
 *
 * Gli indici dei token ANTLR contano code point, non caratteri UTF-16: il suffisso
 * residuo è calcolato con {@link String#offsetByCodePoints(int, int)}.
 */
final class FormulaReader {

    private FormulaReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param string testo letto dal lexer
     * @param lexer lexer costruito sul testo
     * @param parser parser costruito sui token del lexer
     * @param variableRule indice della regola variable nella grammatica
     * @param startRule invocazione della regola formula sul parser
     * @param builder visitor che costruisce la formula dall'albero
     * @return formula con suffisso residuo, oppure esito negativo con la prima diagnostica
     */
    static ParseResult read(String string, Lexer lexer, Parser parser, int variableRule,
                            Supplier<ParserRuleContext> startRule, ParseTreeVisitor<Formula> builder) {
        lexer.removeErrorListeners();
        parser.removeErrorListeners();
        parser.setErrorHandler(new SyntaxErrorStrategy());

        VariableNameListener names = new VariableNameListener(variableRule);
        parser.addParseListener(names);

        ParserRuleContext tree;
        try {
            tree = startRule.get();
        } catch (FormulaSyntaxException e) {
            String nameError = names.firstError();
            return ParseResult.failure(nameError != null ? nameError : e.getMessage());
        }

        if (names.firstError() != null) {
            return ParseResult.failure(names.firstError());
        }

        Formula formula = builder.visit(tree);
        int consumed = tree.getStop().getStopIndex() + 1;
        return ParseResult.success(formula, string.substring(string.offsetByCodePoints(0, consumed)));
    }
}
