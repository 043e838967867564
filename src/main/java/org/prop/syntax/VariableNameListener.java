package org.prop.syntax;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTreeListener;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.prop.support.Tokens;

/**
 * Listener di parsing che valida ogni nome letto dalla regola variable nel momento in
 * cui la regola termina.
 *
 * Il lexer accetta come nome qualsiasi lettera Unicode seguita da cifre decimali; solo
 * i nomi che iniziano con p..z sono variabili. Il listener registra il primo nome non
 * valido: poiché il parsing procede da sinistra a destra, quel nome precede qualsiasi
 * errore sintattico incontrato dopo, e la sua diagnostica ha la precedenza.
 */
final class VariableNameListener implements ParseTreeListener {

    private final int variableRule;
    private String invalidName;

    /**
     * @param variableRule indice della regola variable nella grammatica del parser
     */
    VariableNameListener(int variableRule) {
        this.variableRule = variableRule;
    }

    /**
     * @return diagnostica del primo nome non valido, null se tutti i nomi letti sono variabili
     */
    String firstError() {
        return invalidName == null ? null : SyntaxErrorStrategy.INVALID_VARIABLE + invalidName;
    }

    @Override
    public void exitEveryRule(ParserRuleContext ctx) {
        if (invalidName != null || ctx.getRuleIndex() != variableRule) {
            return;
        }

        String name = ctx.getText();
        if (!Tokens.isVariable(name)) {
            invalidName = name;
        }
    }

    @Override
    public void enterEveryRule(ParserRuleContext ctx) {
        // solo l'uscita dalla regola è rilevante
    }

    @Override
    public void visitTerminal(TerminalNode node) {
        // nessun controllo sui singoli token
    }

    @Override
    public void visitErrorNode(ErrorNode node) {
        // la strategia di errore interrompe il parsing prima di creare nodi di errore
    }
}
