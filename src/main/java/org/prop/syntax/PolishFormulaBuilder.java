package org.prop.syntax;

import org.prop.syntax.PolishFormulaParser.AtomContext;
import org.prop.syntax.PolishFormulaParser.BinaryContext;
import org.prop.syntax.PolishFormulaParser.ConstantContext;
import org.prop.syntax.PolishFormulaParser.NegationContext;
import org.prop.syntax.PolishFormulaParser.VariableContext;

/**
 * Costruisce una {@link Formula} dall'albero della grammatica PolishFormula. L'albero ha
 * la stessa forma della formula: operatore seguito dai suoi operandi.
 */
final class PolishFormulaBuilder extends PolishFormulaBaseVisitor<Formula> {

    @Override
    public Formula visitBinary(BinaryContext ctx) {
        return new Formula(ctx.binaryOperator().getText(), visit(ctx.formula(0)), visit(ctx.formula(1)));
    }

    @Override
    public Formula visitNegation(NegationContext ctx) {
        return Formula.not(visit(ctx.formula()));
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
