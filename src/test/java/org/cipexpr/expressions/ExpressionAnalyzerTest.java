package org.cipexpr.expressions;

import org.cipexpr.core.Variable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionAnalyzerTest {

    private ExprEngine engine;
    private ExpressionAnalyzer analyzer;
    private Variable x;
    private Variable y;
    private Variable n;
    private final List<Expression> held = new ArrayList<>();

    @BeforeEach
    void setUp() {
        engine = ExprEngine.create();
        analyzer = new ExpressionAnalyzer(engine);
        x = Variable.createContinuous("x", -1.0, 1.0);
        y = Variable.createContinuous("y", -1.0, 1.0);
        n = Variable.createInteger("n", 0.0, 10.0);
    }

    @AfterEach
    void tearDown() {
        held.forEach(engine::release);
        assertEquals(0, engine.getLiveExpressionCount());
    }

    /**
     * 解析并化简，返回的节点在测试结束时释放。
     */
    private Expression canonical(String text) {
        Expression parsed = new ExpressionParser(engine, List.of(x, y, n)).parse(text);
        Expression simplified = engine.simplify(parsed);
        engine.release(parsed);
        held.add(simplified);
        return simplified;
    }

    @Test
    @DisplayName("曲率：平方为凸，取负后为凹，线性组合为线性")
    void testCurvature() {
        assertAll(
                () -> assertEquals(Curvature.CONVEX, analyzer.computeCurvature(canonical("<x>^2"))),
                () -> assertEquals(Curvature.CONCAVE, analyzer.computeCurvature(canonical("-<x>^2"))),
                () -> assertEquals(Curvature.LINEAR, analyzer.computeCurvature(canonical("2*<x>-<y>+3"))),
                () -> assertEquals(Curvature.CONVEX, analyzer.computeCurvature(canonical("<x>^2+<y>^4-<x>"))),
                () -> assertEquals(Curvature.UNKNOWN, analyzer.computeCurvature(canonical("<x>*<y>"))),
                () -> assertEquals(Curvature.UNKNOWN, analyzer.computeCurvature(canonical("<x>^2-<y>^2")))
        );
    }

    @Test
    @DisplayName("整数性：整数变量的整系数组合为整数")
    void testIntegrality() {
        assertAll(
                () -> assertTrue(analyzer.computeIntegrality(canonical("2*<n>+3"))),
                () -> assertTrue(analyzer.computeIntegrality(canonical("<n>^2"))),
                () -> assertFalse(analyzer.computeIntegrality(canonical("<n>/2"))),
                () -> assertFalse(analyzer.computeIntegrality(canonical("<n>+<x>")))
        );
    }

    @Test
    @DisplayName("和式关于子节点的单调性由系数符号决定")
    void testMonotonicity() {
        Expression sum = canonical("<y>-2*<x>");
        // 规范形式中 y 排在 x 前面
        assertAll(
                () -> assertEquals(Monotonicity.INCREASING, analyzer.monotonicity(sum, 0)),
                () -> assertEquals(Monotonicity.DECREASING, analyzer.monotonicity(sum, 1))
        );
    }
}
