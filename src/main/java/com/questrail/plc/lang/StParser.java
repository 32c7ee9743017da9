package com.questrail.plc.lang;

import com.questrail.plc.api.DataType;
import com.questrail.plc.api.Value;
import com.questrail.plc.api.VariableClass;
import com.questrail.plc.lang.ast.Expression;
import com.questrail.plc.lang.ast.Expression.ArithmeticOperator;
import com.questrail.plc.lang.ast.Expression.ComparisonOperator;
import com.questrail.plc.lang.ast.Expression.LogicalOperator;
import com.questrail.plc.lang.ast.Expression.UnaryOperator;
import com.questrail.plc.lang.ast.Program;
import com.questrail.plc.lang.ast.Statement;
import com.questrail.plc.lang.ast.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * StParser
 * =============================================================================
 * Recursive-descent parser for the Structured Text subset executed by the PLC.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   program      := "PROGRAM" name declBlock* statement+ "END_PROGRAM"
 *   declBlock    := ("VAR" | "VAR_INPUT" | "VAR_OUTPUT") decl+ "END_VAR"
 *   decl         := name ":" type [":=" literal] ";"
 *   statement    := assignment | ifStmt | functionCall ";"
 *   assignment   := name ":=" expr ";"
 *   ifStmt       := "IF" expr "THEN" statement+ ("ELSIF" expr "THEN" statement+)*
 *                   ("ELSE" statement+)? "END_IF" ";"
 *   functionCall := name "(" [expr ("," expr)*] ")"
 * </pre>
 *
 * <h2>Precedence</h2>
 * Lowest to highest: {@code OR}, {@code AND}, comparison, additive,
 * multiplicative, unary ({@code NOT}, {@code -}), primary. Binary levels are
 * left-associative.
 *
 * <p>Numeric literals always become REAL values; coercion to a declared type
 * happens when the value is stored.</p>
 *
 * <h2>Nesting limit</h2>
 * Operators, parentheses, call arguments and {@code IF} statements may nest at
 * most {@link #MAX_NESTING_DEPTH} levels. A chain of left-associative binary
 * operators counts one level per operator. Deeper sources are rejected with a
 * {@link StParseException}.
 *
 * <p>Instances are stateless and may be shared.</p>
 */
public final class StParser
{
    public static final int MAX_NESTING_DEPTH = 256;

    /**
     * Parses a complete program.
     *
     * @throws StParseException on any lexical or syntactic error; no partial
     *         program is returned
     */
    public Program parse(String source) throws StParseException {
        Objects.requireNonNull(source, "source");
        return new Cursor(StLexer.tokenize(source)).program();
    }

    /**
     * Single-use parsing state over a token list.
     */
    private static final class Cursor
    {
        private final List<Token> tokens;
        private int index;
        private int depth;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        // ---------------------------------------------------------------------
        // Program structure
        // ---------------------------------------------------------------------

        Program program() throws StParseException {
            expectKeyword("PROGRAM");
            String name = expect(TokenType.IDENTIFIER, "program name").text();

            Map<String, Variable> variables = new LinkedHashMap<>();
            while (peek().isKeyword("VAR") || peek().isKeyword("VAR_INPUT") || peek().isKeyword("VAR_OUTPUT")) {
                declarationBlock(variables);
            }

            List<Statement> statements = statementsUntil("END_PROGRAM");
            expectKeyword("END_PROGRAM");
            expect(TokenType.EOF, "end of input after END_PROGRAM");

            return new Program(name, variables, statements);
        }

        private void declarationBlock(Map<String, Variable> variables) throws StParseException {
            Token opener = advance();
            VariableClass variableClass = switch (opener.text()) {
                case "VAR_INPUT" -> VariableClass.INPUT;
                case "VAR_OUTPUT" -> VariableClass.OUTPUT;
                default -> VariableClass.INTERNAL;
            };

            if (peek().isKeyword("END_VAR")) {
                throw error("Declaration block must declare at least one variable", peek());
            }
            while (!peek().isKeyword("END_VAR")) {
                Variable v = declaration(variableClass);
                if (variables.containsKey(v.name())) {
                    throw error("Duplicate declaration of '" + v.name() + "'", previous());
                }
                variables.put(v.name(), v);
            }
            expectKeyword("END_VAR");
        }

        private Variable declaration(VariableClass variableClass) throws StParseException {
            Token name = expect(TokenType.IDENTIFIER, "variable name");
            expect(TokenType.COLON, "':'");

            Token typeToken = advance();
            DataType type = typeToken.type() == TokenType.KEYWORD ? DataType.fromKeyword(typeToken.text()) : null;
            if (type == null) {
                throw error("Expected type BOOL, INT, REAL or TIME but found " + typeToken, typeToken);
            }

            Optional<Value> initial = Optional.empty();
            if (match(TokenType.ASSIGN)) {
                initial = Optional.of(declarationLiteral());
            }
            expect(TokenType.SEMICOLON, "';'");
            return new Variable(name.text(), type, initial, variableClass);
        }

        private Value declarationLiteral() throws StParseException {
            boolean negative = match(TokenType.MINUS);
            boolean signed = negative || match(TokenType.PLUS);
            Token t = advance();
            if (t.type() == TokenType.NUMBER) {
                double v = Double.parseDouble(t.text());
                return Value.ofReal(negative ? -v : v);
            }
            if (!signed) {
                if (t.isKeyword("TRUE")) {
                    return Value.of(true);
                }
                if (t.isKeyword("FALSE")) {
                    return Value.of(false);
                }
                if (t.type() == TokenType.DURATION) {
                    return Value.ofMillis(StLexer.durationMillis(t.text(), t.line(), t.column()));
                }
            }
            throw error("Expected literal but found " + t, t);
        }

        // ---------------------------------------------------------------------
        // Statements
        // ---------------------------------------------------------------------

        /**
         * Parses one or more statements, stopping before any of the given
         * keywords.
         */
        private List<Statement> statementsUntil(String... terminators) throws StParseException {
            List<Statement> block = new ArrayList<>();
            while (!atAnyKeyword(terminators)) {
                if (peek().type() == TokenType.EOF) {
                    throw error("Expected " + String.join(" or ", terminators) + " but found end of input", peek());
                }
                block.add(statement());
            }
            if (block.isEmpty()) {
                throw error("Expected at least one statement", peek());
            }
            return block;
        }

        private Statement statement() throws StParseException {
            Token t = peek();
            if (t.isKeyword("IF")) {
                return ifStatement();
            }
            if (t.type() != TokenType.IDENTIFIER) {
                throw error("Expected statement but found " + t, t);
            }

            Token name = advance();
            if (match(TokenType.ASSIGN)) {
                Expression value = expression();
                expect(TokenType.SEMICOLON, "';'");
                return new Statement.Assignment(name.text(), value);
            }
            if (peek().type() == TokenType.LPAREN) {
                List<Expression> args = arguments();
                expect(TokenType.SEMICOLON, "';'");
                return new Statement.FunctionCall(name.text(), args);
            }
            throw error("Expected ':=' or '(' after " + name, peek());
        }

        private Statement ifStatement() throws StParseException {
            expectKeyword("IF");
            enter(previous());
            Expression condition = expression();
            expectKeyword("THEN");
            List<Statement> thenBlock = statementsUntil("ELSIF", "ELSE", "END_IF");

            List<Statement.ElsIf> elsIfs = new ArrayList<>();
            while (matchKeyword("ELSIF")) {
                Expression c = expression();
                expectKeyword("THEN");
                elsIfs.add(new Statement.ElsIf(c, statementsUntil("ELSIF", "ELSE", "END_IF")));
            }

            Optional<List<Statement>> elseBlock = Optional.empty();
            if (matchKeyword("ELSE")) {
                elseBlock = Optional.of(statementsUntil("END_IF"));
            }

            expectKeyword("END_IF");
            expect(TokenType.SEMICOLON, "';' after END_IF");
            depth--;
            return new Statement.If(condition, thenBlock, elsIfs, elseBlock);
        }

        private List<Expression> arguments() throws StParseException {
            enter(expect(TokenType.LPAREN, "'('"));
            List<Expression> args = new ArrayList<>();
            if (!match(TokenType.RPAREN)) {
                do {
                    args.add(expression());
                } while (match(TokenType.COMMA));
                expect(TokenType.RPAREN, "')'");
            }
            depth--;
            return args;
        }

        // ---------------------------------------------------------------------
        // Expressions, lowest precedence first
        // ---------------------------------------------------------------------

        private Expression expression() throws StParseException {
            return or();
        }

        private Expression or() throws StParseException {
            int mark = depth;
            Expression left = and();
            while (matchKeyword("OR")) {
                enter(previous());
                left = new Expression.Logical(LogicalOperator.OR, left, and());
            }
            depth = mark;
            return left;
        }

        private Expression and() throws StParseException {
            int mark = depth;
            Expression left = comparison();
            while (matchKeyword("AND")) {
                enter(previous());
                left = new Expression.Logical(LogicalOperator.AND, left, comparison());
            }
            depth = mark;
            return left;
        }

        private Expression comparison() throws StParseException {
            int mark = depth;
            Expression left = additive();
            while (true) {
                ComparisonOperator op = switch (peek().type()) {
                    case GREATER -> ComparisonOperator.GREATER;
                    case LESS -> ComparisonOperator.LESS;
                    case GREATER_EQUAL -> ComparisonOperator.GREATER_OR_EQUAL;
                    case LESS_EQUAL -> ComparisonOperator.LESS_OR_EQUAL;
                    case EQUAL -> ComparisonOperator.EQUAL;
                    case NOT_EQUAL -> ComparisonOperator.NOT_EQUAL;
                    default -> null;
                };
                if (op == null) {
                    depth = mark;
                    return left;
                }
                enter(advance());
                left = new Expression.Comparison(op, left, additive());
            }
        }

        private Expression additive() throws StParseException {
            int mark = depth;
            Expression left = multiplicative();
            while (true) {
                if (match(TokenType.PLUS)) {
                    enter(previous());
                    left = new Expression.BinaryArithmetic(ArithmeticOperator.ADD, left, multiplicative());
                } else if (match(TokenType.MINUS)) {
                    enter(previous());
                    left = new Expression.BinaryArithmetic(ArithmeticOperator.SUBTRACT, left, multiplicative());
                } else {
                    depth = mark;
                    return left;
                }
            }
        }

        private Expression multiplicative() throws StParseException {
            int mark = depth;
            Expression left = unary();
            while (true) {
                if (match(TokenType.STAR)) {
                    enter(previous());
                    left = new Expression.BinaryArithmetic(ArithmeticOperator.MULTIPLY, left, unary());
                } else if (match(TokenType.SLASH)) {
                    enter(previous());
                    left = new Expression.BinaryArithmetic(ArithmeticOperator.DIVIDE, left, unary());
                } else {
                    depth = mark;
                    return left;
                }
            }
        }

        private Expression unary() throws StParseException {
            UnaryOperator op = null;
            if (matchKeyword("NOT")) {
                op = UnaryOperator.NOT;
            } else if (match(TokenType.MINUS)) {
                op = UnaryOperator.NEG;
            }
            if (op == null) {
                return primary();
            }
            enter(previous());
            Expression operand = unary();
            depth--;
            return new Expression.Unary(op, operand);
        }

        private Expression primary() throws StParseException {
            Token t = advance();
            switch (t.type()) {
                case NUMBER:
                    return new Expression.Literal(Value.ofReal(Double.parseDouble(t.text())));
                case DURATION:
                    return new Expression.Literal(Value.ofMillis(StLexer.durationMillis(t.text(), t.line(), t.column())));
                case IDENTIFIER:
                    if (peek().type() == TokenType.LPAREN) {
                        return new Expression.Call(t.text(), arguments());
                    }
                    return new Expression.VariableRef(t.text());
                case LPAREN: {
                    enter(t);
                    Expression inner = expression();
                    expect(TokenType.RPAREN, "')'");
                    depth--;
                    return inner;
                }
                case KEYWORD:
                    if (t.text().equals("TRUE")) {
                        return new Expression.Literal(Value.of(true));
                    }
                    if (t.text().equals("FALSE")) {
                        return new Expression.Literal(Value.of(false));
                    }
                    break;
                default:
                    break;
            }
            throw error("Expected expression but found " + t, t);
        }

        // ---------------------------------------------------------------------
        // Token helpers
        // ---------------------------------------------------------------------

        private Token peek() {
            return tokens.get(index);
        }

        private Token previous() {
            return tokens.get(Math.max(0, index - 1));
        }

        private Token advance() {
            Token t = tokens.get(index);
            if (t.type() != TokenType.EOF) {
                index++;
            }
            return t;
        }

        private boolean match(TokenType type) {
            if (peek().type() == type) {
                advance();
                return true;
            }
            return false;
        }

        private boolean matchKeyword(String word) {
            if (peek().isKeyword(word)) {
                advance();
                return true;
            }
            return false;
        }

        private boolean atAnyKeyword(String... words) {
            for (String w : words) {
                if (peek().isKeyword(w)) {
                    return true;
                }
            }
            return false;
        }

        private Token expect(TokenType type, String what) throws StParseException {
            Token t = peek();
            if (t.type() != type) {
                throw error("Expected " + what + " but found " + t, t);
            }
            return advance();
        }

        private void expectKeyword(String word) throws StParseException {
            Token t = peek();
            if (!t.isKeyword(word)) {
                throw error("Expected " + word + " but found " + t, t);
            }
            advance();
        }

        private void enter(Token at) throws StParseException {
            if (++depth > MAX_NESTING_DEPTH) {
                throw error("Nesting deeper than " + MAX_NESTING_DEPTH + " levels", at);
            }
        }

        private static StParseException error(String message, Token at) {
            return new StParseException(message, at.line(), at.column());
        }
    }
}
