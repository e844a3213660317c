package org.cipexpr.expressions;

import org.cipexpr.core.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 中缀表达式解析器：
 * <pre>
 * Expression := ["+" | "-"] Term { ("+" | "-") Term }
 * Term       := Factor { ("*" | "/") Factor }
 * Factor     := Base [ "^" Exponent ]
 * Exponent   := number | "(" ["+" | "-"] number ")"
 * Base       := number | "&lt;" name "&gt;" | "(" Expression ")"
 * </pre>
 * 除法 a/b 解析为 a * b^(-1)。结果未经化简。
 *
 * @author Ayalyt
 */
public final class ExpressionParser {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionParser.class);

    private final ExprEngine engine;
    private final Map<String, Variable> variables;

    private String text;
    private int pos;

    public ExpressionParser(ExprEngine engine, Map<String, Variable> variables) {
        this.engine = engine;
        this.variables = new HashMap<>(variables);
    }

    public ExpressionParser(ExprEngine engine, List<Variable> variables) {
        this.engine = engine;
        this.variables = new HashMap<>();
        for (Variable var : variables) {
            this.variables.put(var.getName(), var);
        }
    }

    /**
     * @return 解析结果，调用方持有一个引用。
     * @throws IllegalArgumentException 如果语法错误或引用了未知变量。
     */
    public Expression parse(String input) {
        this.text = input;
        this.pos = 0;
        Expression result = parseExpression();
        skipWhitespace();
        if (pos < text.length()) {
            engine.release(result);
            throw error("多余的输入");
        }
        logger.debug("解析表达式 '{}' 完成", input);
        return result;
    }

    private Expression parseExpression() {
        skipWhitespace();
        List<Expression> terms = new ArrayList<>();
        List<Double> signs = new ArrayList<>();
        double sign = 1.0;
        if (peek() == '+' || peek() == '-') {
            sign = next() == '-' ? -1.0 : 1.0;
        }
        try {
            terms.add(parseTerm());
            signs.add(sign);
            skipWhitespace();
            while (peek() == '+' || peek() == '-') {
                sign = next() == '-' ? -1.0 : 1.0;
                terms.add(parseTerm());
                signs.add(sign);
                skipWhitespace();
            }
        } catch (IllegalArgumentException e) {
            releaseAll(terms);
            throw e;
        }

        if (terms.size() == 1 && signs.get(0) == 1.0) {
            return terms.get(0);
        }
        if (terms.size() == 1 && engine.isValue(terms.get(0))) {
            // 负常数直接折叠
            Expression negated = engine.createValue(-engine.getValue(terms.get(0)));
            engine.release(terms.get(0));
            return negated;
        }
        double[] coefficients = new double[signs.size()];
        for (int i = 0; i < coefficients.length; i++) {
            coefficients[i] = signs.get(i);
        }
        Expression sum = engine.createSum(terms, coefficients, 0.0);
        releaseAll(terms);
        return sum;
    }

    private Expression parseTerm() {
        List<Expression> factors = new ArrayList<>();
        try {
            factors.add(parseFactor());
            skipWhitespace();
            while (peek() == '*' || peek() == '/') {
                boolean divide = next() == '/';
                Expression factor = parseFactor();
                if (divide) {
                    Expression inverse = engine.createPow(factor, -1.0);
                    engine.release(factor);
                    factor = inverse;
                }
                factors.add(factor);
                skipWhitespace();
            }
        } catch (IllegalArgumentException e) {
            releaseAll(factors);
            throw e;
        }
        if (factors.size() == 1) {
            return factors.get(0);
        }
        Expression product = engine.createProduct(factors, 1.0);
        releaseAll(factors);
        return product;
    }

    private Expression parseFactor() {
        Expression base = parseBase();
        skipWhitespace();
        if (peek() != '^') {
            return base;
        }
        next();
        double exponent;
        try {
            skipWhitespace();
            if (peek() == '(') {
                next();
                skipWhitespace();
                double sign = 1.0;
                if (peek() == '+' || peek() == '-') {
                    sign = next() == '-' ? -1.0 : 1.0;
                }
                exponent = sign * parseNumber();
                expect(')');
            } else {
                exponent = parseNumber();
            }
        } catch (IllegalArgumentException e) {
            engine.release(base);
            throw e;
        }
        Expression pow = engine.createPow(base, exponent);
        engine.release(base);
        return pow;
    }

    private Expression parseBase() {
        skipWhitespace();
        char c = peek();
        if (c == '(') {
            next();
            Expression inner = parseExpression();
            try {
                expect(')');
            } catch (IllegalArgumentException e) {
                engine.release(inner);
                throw e;
            }
            return inner;
        }
        if (c == '<') {
            next();
            int start = pos;
            while (pos < text.length() && text.charAt(pos) != '>') {
                pos++;
            }
            if (pos >= text.length()) {
                throw error("变量名缺少 '>'");
            }
            String name = text.substring(start, pos);
            pos++;
            Variable var = variables.get(name);
            if (var == null) {
                logger.error("ExpressionParser: 未知变量 '{}'", name);
                throw error("未知变量 '" + name + "'");
            }
            return engine.createVariable(var);
        }
        if (Character.isDigit(c) || c == '.') {
            return engine.createValue(parseNumber());
        }
        throw error(c == '\0' ? "意外的输入结束" : "意外的字符 '" + c + "'");
    }

    private double parseNumber() {
        skipWhitespace();
        int start = pos;
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        if (start == pos) {
            throw error("需要一个数字");
        }
        try {
            return Double.parseDouble(text.substring(start, pos));
        } catch (NumberFormatException e) {
            throw error("非法的数字 '" + text.substring(start, pos) + "'");
        }
    }

    private void expect(char expected) {
        skipWhitespace();
        if (peek() != expected) {
            throw error("需要 '" + expected + "'");
        }
        pos++;
    }

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private char next() {
        return text.charAt(pos++);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private void releaseAll(List<Expression> exprs) {
        for (Expression e : exprs) {
            engine.release(e);
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException("解析表达式失败（位置 " + pos + "）: " + message + "，输入: " + text);
    }
}
