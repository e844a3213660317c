package org.cipexpr.expressions.simplify;

import org.cipexpr.core.Variable;
import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.ExpressionParser;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionComparatorTest {

    private static ExprEngine engine;
    // 按期望的升序排列
    private static final List<Expression> ORDERED = new ArrayList<>();

    @BeforeAll
    static void setUp() {
        engine = ExprEngine.create();
        Variable x = Variable.createContinuous("x", 0.0, 1.0);
        Variable y = Variable.createContinuous("y", 0.0, 1.0);
        ExpressionParser parser = new ExpressionParser(engine, List.of(x, y));
        for (String text : List.of("1", "2", "<x>", "<x>+1", "2*<x>", "<x>^2", "<y>", "<x>*<y>")) {
            Expression parsed = parser.parse(text);
            ORDERED.add(engine.simplify(parsed));
            engine.release(parsed);
        }
    }

    @AfterAll
    static void tearDown() {
        for (Expression e : ORDERED) {
            engine.release(e);
        }
        ORDERED.clear();
    }

    @Test
    @DisplayName("规范形式之间的顺序符合预期")
    void testExpectedOrder() {
        for (int i = 0; i < ORDERED.size(); i++) {
            for (int j = i + 1; j < ORDERED.size(); j++) {
                Expression a = ORDERED.get(i);
                Expression b = ORDERED.get(j);
                assertEquals(-1, engine.compare(a, b), a + " 应小于 " + b);
            }
        }
    }

    @Test
    @DisplayName("反对称：compare(a, b) = -compare(b, a)，且只取 -1、0、1")
    void testAntisymmetry() {
        for (Expression a : ORDERED) {
            for (Expression b : ORDERED) {
                int ab = engine.compare(a, b);
                assertTrue(ab >= -1 && ab <= 1);
                assertEquals(-ab, engine.compare(b, a), a + " 与 " + b);
            }
        }
    }

    @Test
    @DisplayName("打乱后排序可以恢复原顺序")
    void testSortRecoversOrder() {
        List<Expression> shuffled = new ArrayList<>(ORDERED);
        Collections.shuffle(shuffled, new java.util.Random(11));
        shuffled.sort(engine.getComparator());
        for (int i = 0; i < ORDERED.size(); i++) {
            assertSame(ORDERED.get(i), shuffled.get(i));
        }
    }

    @Test
    @DisplayName("结构相同的不同节点比较结果为 0")
    void testStructuralEquality() {
        for (Expression e : ORDERED) {
            Expression copy = engine.duplicate(e);
            assertEquals(0, engine.compare(e, copy));
            engine.release(copy);
        }
    }
}
