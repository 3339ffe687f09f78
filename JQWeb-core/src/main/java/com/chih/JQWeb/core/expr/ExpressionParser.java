package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 递归下降解析器，把词法单元序列构造为 {@link Expr} 语法树
 * <p>
 * 语法取 Python 表达式的子集。标识符的查找方式来自 {@link NameResolver} 的分类结果。
 * 赋值与海象运算符会被解析成对应节点，由沙箱统一拒绝。
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public class ExpressionParser {

    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "==", ">=", "<=", "!=");
    private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");
    private static final Set<String> RESERVED = Set.of(
            "and", "or", "not", "if", "else", "elif", "for", "in", "is", "as", "lambda");

    private final String source;
    private final List<Token> tokens;
    private final NameKind[] kinds;
    private int current = 0;

    public ExpressionParser(String source, List<Token> tokens, NameKind[] kinds) {
        this.source = source;
        this.tokens = tokens;
        this.kinds = kinds;
    }

    public static Expr parse(String source, boolean raiseOnMissing) {
        List<Token> tokens = ExpressionLexer.tokenize(source);
        NameKind[] kinds = NameResolver.resolve(tokens, raiseOnMissing);
        return new ExpressionParser(source, tokens, kinds).parse();
    }

    public Expr parse() {
        if (check(TokenType.END)) {
            throw error("empty expression");
        }
        Expr expr = parseTopLevel();
        if (!check(TokenType.END)) {
            throw error("unexpected '" + peek().text() + "'");
        }
        return expr;
    }

    private Expr parseTopLevel() {
        Expr expr = parseExpressionList();
        if (match(TokenType.EQUAL)) {
            return new Expr.Assignment(expr, parseTopLevel());
        }
        if (check(TokenType.OPERATOR) && AUGMENTED_ASSIGNMENTS.contains(peek().text())) {
            advance();
            return new Expr.Assignment(expr, parseTopLevel());
        }
        return expr;
    }

    private Expr parseExpressionList() {
        Expr first = parseStarredOrExpression();
        if (!check(TokenType.COMMA)) {
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA)) {
            if (check(TokenType.END) || check(TokenType.EQUAL) || peek().type().isClosing()) {
                break;
            }
            elements.add(parseStarredOrExpression());
        }
        return new Expr.TupleDisplay(elements);
    }

    private Expr parseStarredOrExpression() {
        if (checkOperator("*")) {
            advance();
            return new Expr.Starred(parseOr());
        }
        return parseExpression();
    }

    private Expr parseExpression() {
        if (checkName("lambda")) {
            return parseLambda();
        }
        if (check(TokenType.NAME) && peekAt(1).isOperator(":=")) {
            String name = advance().text();
            advance();
            return new Expr.NamedExpression(name, parseExpression());
        }
        Expr expr = parseOr();
        if (checkName("if")) {
            advance();
            Expr test = parseOr();
            expectName("else");
            Expr orElse = parseExpression();
            return new Expr.Conditional(test, expr, orElse);
        }
        return expr;
    }

    private Expr parseLambda() {
        expectName("lambda");
        List<String> parameters = new ArrayList<>();
        while (!check(TokenType.COLON)) {
            Token parameter = expect(TokenType.NAME, "lambda parameter");
            parameters.add(parameter.text());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(TokenType.COLON, "':'");
        return new Expr.Lambda(parameters, parseExpression());
    }

    private Expr parseOr() {
        Expr first = parseAnd();
        if (!checkName("or")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (checkName("or")) {
            advance();
            values.add(parseAnd());
        }
        return new Expr.BoolOp(false, values);
    }

    private Expr parseAnd() {
        Expr first = parseNot();
        if (!checkName("and")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (checkName("and")) {
            advance();
            values.add(parseNot());
        }
        return new Expr.BoolOp(true, values);
    }

    private Expr parseNot() {
        if (checkName("not")) {
            advance();
            return new Expr.UnaryOp("not", parseNot());
        }
        return parseComparison();
    }

    private Expr parseComparison() {
        Expr left = parseBinary(0);
        List<String> operators = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            String operator;
            if (check(TokenType.OPERATOR) && COMPARISON_OPERATORS.contains(peek().text())) {
                operator = advance().text();
            } else if (checkName("in")) {
                advance();
                operator = "in";
            } else if (checkName("not") && peekAt(1).isName("in")) {
                current += 2;
                operator = "not in";
            } else if (checkName("is")) {
                advance();
                operator = "is";
                if (checkName("not")) {
                    advance();
                    operator = "is not";
                }
            } else {
                break;
            }
            operators.add(operator);
            comparators.add(parseBinary(0));
        }
        return operators.isEmpty() ? left : new Expr.Compare(left, operators, comparators);
    }

    private static final String[][] BINARY_LEVELS = {
            {"|"},
            {"^"},
            {"&"},
            {"<<", ">>"},
            {"+", "-"},
            {"*", "/", "//", "%", "@"},
    };

    private Expr parseBinary(int level) {
        if (level == BINARY_LEVELS.length) {
            return parseFactor();
        }
        Expr left = parseBinary(level + 1);
        while (check(TokenType.OPERATOR) && contains(BINARY_LEVELS[level], peek().text())) {
            String operator = advance().text();
            left = new Expr.BinaryOp(operator, left, parseBinary(level + 1));
        }
        return left;
    }

    private Expr parseFactor() {
        if (checkOperator("-") || checkOperator("+") || checkOperator("~")) {
            String operator = advance().text();
            return new Expr.UnaryOp(operator, parseFactor());
        }
        return parsePower();
    }

    private Expr parsePower() {
        Expr base = parsePrimary();
        if (checkOperator("**")) {
            advance();
            return new Expr.BinaryOp("**", base, parseFactor());
        }
        return base;
    }

    private Expr parsePrimary() {
        Expr expr = parseAtom();
        while (true) {
            if (match(TokenType.DOT)) {
                Token name = expect(TokenType.NAME, "attribute name");
                expr = new Expr.Attribute(expr, name.text());
            } else if (match(TokenType.LPAR)) {
                expr = parseCall(expr);
            } else if (match(TokenType.LSQB)) {
                expr = new Expr.Subscript(expr, parseSubscript());
                expect(TokenType.RSQB, "']'");
            } else {
                return expr;
            }
        }
    }

    private Expr parseCall(Expr function) {
        List<Expr> args = new ArrayList<>();
        List<Expr.Keyword> keywords = new ArrayList<>();
        while (!check(TokenType.RPAR)) {
            if (checkOperator("*")) {
                advance();
                args.add(new Expr.Starred(parseExpression()));
            } else if (checkOperator("**")) {
                advance();
                keywords.add(new Expr.Keyword(null, parseExpression()));
            } else if (check(TokenType.NAME) && peekAt(1).type() == TokenType.EQUAL) {
                String name = advance().text();
                advance();
                keywords.add(new Expr.Keyword(name, parseExpression()));
            } else {
                Expr arg = parseExpression();
                if (checkName("for")) {
                    arg = parseComprehension(Expr.ComprehensionType.GENERATOR, arg, null);
                }
                args.add(arg);
            }
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(TokenType.RPAR, "')'");
        return new Expr.Call(function, args, keywords);
    }

    private Expr parseSubscript() {
        Expr first = parseSliceItem();
        if (!check(TokenType.COMMA)) {
            return first;
        }
        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (match(TokenType.COMMA)) {
            if (check(TokenType.RSQB)) {
                break;
            }
            items.add(parseSliceItem());
        }
        return new Expr.TupleDisplay(items);
    }

    private Expr parseSliceItem() {
        Expr lower = null;
        if (!check(TokenType.COLON)) {
            lower = parseExpression();
            if (!check(TokenType.COLON)) {
                return lower;
            }
        }
        expect(TokenType.COLON, "':'");
        Expr upper = null;
        Expr step = null;
        if (!check(TokenType.COLON) && !check(TokenType.RSQB) && !check(TokenType.COMMA)) {
            upper = parseExpression();
        }
        if (match(TokenType.COLON) && !check(TokenType.RSQB) && !check(TokenType.COMMA)) {
            step = parseExpression();
        }
        return new Expr.Slice(lower, upper, step);
    }

    private Expr parseAtom() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER:
                advance();
                return new Expr.Literal(token.value());
            case STRING:
                StringBuilder text = new StringBuilder();
                while (check(TokenType.STRING)) {
                    text.append((String) advance().value());
                }
                return new Expr.Literal(text.toString());
            case NAME:
                return parseName();
            case LPAR:
                advance();
                return parseParenthesized();
            case LSQB:
                advance();
                return parseList();
            case LBRACE:
                advance();
                return parseBrace();
            default:
                throw error(token.type() == TokenType.END ? "unexpected end of expression" : "unexpected '" + token.text() + "'");
        }
    }

    private Expr parseName() {
        int index = current;
        Token token = advance();
        switch (token.text()) {
            case "True":
                return new Expr.Literal(Boolean.TRUE);
            case "False":
                return new Expr.Literal(Boolean.FALSE);
            case "None":
                return new Expr.Literal(null);
            default:
                break;
        }
        if (RESERVED.contains(token.text())) {
            throw error("unexpected keyword '" + token.text() + "'");
        }
        NameKind kind = kinds[index];
        if (kind == NameKind.KEYWORD_ARGUMENT || kind == NameKind.ATTRIBUTE || kind == NameKind.NONE) {
            kind = NameKind.OPTIONAL;
        }
        return new Expr.Name(token.text(), kind);
    }

    private Expr parseParenthesized() {
        if (match(TokenType.RPAR)) {
            return new Expr.TupleDisplay(List.of());
        }
        Expr first = parseStarredOrExpression();
        if (checkName("for")) {
            Expr generator = parseComprehension(Expr.ComprehensionType.GENERATOR, first, null);
            expect(TokenType.RPAR, "')'");
            return generator;
        }
        if (!check(TokenType.COMMA)) {
            expect(TokenType.RPAR, "')'");
            return first;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA)) {
            if (check(TokenType.RPAR)) {
                break;
            }
            elements.add(parseStarredOrExpression());
        }
        expect(TokenType.RPAR, "')'");
        return new Expr.TupleDisplay(elements);
    }

    private Expr parseList() {
        if (match(TokenType.RSQB)) {
            return new Expr.ListDisplay(new ArrayList<>());
        }
        Expr first = parseStarredOrExpression();
        if (checkName("for")) {
            Expr comprehension = parseComprehension(Expr.ComprehensionType.LIST, first, null);
            expect(TokenType.RSQB, "']'");
            return comprehension;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA)) {
            if (check(TokenType.RSQB)) {
                break;
            }
            elements.add(parseStarredOrExpression());
        }
        expect(TokenType.RSQB, "']'");
        return new Expr.ListDisplay(elements);
    }

    private Expr parseBrace() {
        if (match(TokenType.RBRACE)) {
            return new Expr.DictDisplay(new ArrayList<>(), new ArrayList<>());
        }
        if (checkOperator("**")) {
            return parseDictEntries(null, null);
        }
        Expr first = parseStarredOrExpression();
        if (match(TokenType.COLON)) {
            Expr value = parseExpression();
            if (checkName("for")) {
                Expr comprehension = parseComprehension(Expr.ComprehensionType.DICT, first, value);
                expect(TokenType.RBRACE, "'}'");
                return comprehension;
            }
            return parseDictEntries(first, value);
        }
        if (checkName("for")) {
            Expr comprehension = parseComprehension(Expr.ComprehensionType.SET, first, null);
            expect(TokenType.RBRACE, "'}'");
            return comprehension;
        }
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA)) {
            if (check(TokenType.RBRACE)) {
                break;
            }
            elements.add(parseStarredOrExpression());
        }
        expect(TokenType.RBRACE, "'}'");
        return new Expr.SetDisplay(elements);
    }

    private Expr parseDictEntries(Expr firstKey, Expr firstValue) {
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        boolean more = true;
        if (firstValue != null) {
            keys.add(firstKey);
            values.add(firstValue);
            more = match(TokenType.COMMA);
        }
        while (more && !check(TokenType.RBRACE)) {
            if (checkOperator("**")) {
                advance();
                keys.add(null);
                values.add(parseBinary(0));
            } else {
                keys.add(parseExpression());
                expect(TokenType.COLON, "':'");
                values.add(parseExpression());
            }
            more = match(TokenType.COMMA);
        }
        expect(TokenType.RBRACE, "'}'");
        return new Expr.DictDisplay(keys, values);
    }

    private Expr parseComprehension(Expr.ComprehensionType type, Expr element, Expr value) {
        List<Expr.ForClause> clauses = new ArrayList<>();
        while (checkName("for")) {
            advance();
            Expr.Target target = parseTargetList();
            expectName("in");
            Expr iterable = parseOr();
            List<Expr> conditions = new ArrayList<>();
            while (checkName("if")) {
                advance();
                conditions.add(parseOr());
            }
            clauses.add(new Expr.ForClause(target, iterable, conditions));
        }
        return new Expr.Comprehension(type, element, value, clauses);
    }

    private Expr.Target parseTargetList() {
        Expr.Target first = parseTarget();
        if (!check(TokenType.COMMA)) {
            return first;
        }
        List<Expr.Target> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA)) {
            if (checkName("in")) {
                break;
            }
            elements.add(parseTarget());
        }
        return new Expr.Target(null, elements);
    }

    private Expr.Target parseTarget() {
        if (match(TokenType.LPAR)) {
            Expr.Target inner = parseTargetList();
            expect(TokenType.RPAR, "')'");
            return inner;
        }
        return Expr.Target.name(expect(TokenType.NAME, "loop target").text());
    }

    // === 词法单元游标 ===

    private static boolean contains(String[] operators, String text) {
        for (String operator : operators) {
            if (operator.equals(text)) {
                return true;
            }
        }
        return false;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.END) {
            current++;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkName(String name) {
        return peek().isName(name);
    }

    private boolean checkOperator(String op) {
        return peek().isOperator(op);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String what) {
        if (!check(type)) {
            throw error("expected " + what + " but found '" + peek().text() + "'");
        }
        return advance();
    }

    private void expectName(String name) {
        if (!checkName(name)) {
            throw error("expected '" + name + "' but found '" + peek().text() + "'");
        }
        advance();
    }

    private ExpressionSyntaxException error(String message) {
        return new ExpressionSyntaxException(message + " at position " + peek().position(), source);
    }
}
