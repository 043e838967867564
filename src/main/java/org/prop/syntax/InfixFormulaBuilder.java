package org.prop.syntax;

import org.prop.syntax.InfixFormulaParser.AtomContext;
import org.prop.syntax.InfixFormulaParser.BinaryContext;
import org.prop.syntax.InfixFormulaParser.ConstantContext;
import org.prop.syntax.InfixFormulaParser.NegationContext;
import org.prop.syntax.InfixFormulaParser.VariableContext;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DA NOTAZIONE INFISSA - Da albero sintattico ANTLR a {@link Formula}
 *
 * Visita l'albero prodotto dalla grammatica InfixFormula dal basso verso l'alto: ogni
 * nodo dell'albero sintattico diventa esattamente un nodo della formula, le parentesi
 * spariscono perché la forma binaria ne fissa già la struttura.
 *
 * Il visitor riceve solo alberi già validati: i nomi di variabile sono controllati
 * durante il parsing da {@link VariableNameListener}.
 */
final class InfixFormulaBuilder extends InfixFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(InfixFormulaBuilder.class.getName());

    @Override
    public Formula visitNegation(NegationContext ctx) {
        return Formula.not(visit(ctx.formula()));
    }

    /**
     * (sinistro operatore destro): l'operatore è il testo del token riconosciuto dal lexer,
     * che sceglie sempre il simbolo più lungo.
     */
    @Override
    public Formula visitBinary(BinaryContext ctx) {
        Formula left = visit(ctx.formula(0));
        Formula right = visit(ctx.formula(1));
        Formula binary = new Formula(ctx.binaryOperator().getText(), left, right);

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Nodo binario costruito: " + binary);
        }
        return binary;
    }

    @Override
    public Formula visitConstant(ConstantContext ctx) {
        return new Formula(ctx.getText());
    }

    @Override
    public Formula visitAtom(AtomContext ctx) {
        return visit(ctx.variable());
    }

    @Override
    public Formula visitVariable(VariableContext ctx) {
        return Formula.variable(ctx.getText());
    }
}
