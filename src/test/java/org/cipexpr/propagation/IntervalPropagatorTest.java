package org.cipexpr.propagation;

import org.cipexpr.config.EngineConfig;
import org.cipexpr.core.PointValuation;
import org.cipexpr.core.Variable;
import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.ExpressionEvaluator;
import org.cipexpr.expressions.ExpressionParser;
import org.cipexpr.utils.Interval;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IntervalPropagatorTest {

    private static final LeafIntervalSource EXACT_BOUNDS =
            v -> Interval.of(v.getLowerBound(), v.getUpperBound());

    private ExprEngine engine;
    private IntervalPropagator propagator;
    private Variable x;
    private Variable y;
    private Variable n;
    private Expression root;

    @BeforeEach
    void setUp() {
        engine = ExprEngine.create(EngineConfig.builder().varBoundRelax(VarBoundRelaxation.NONE).build());
        propagator = new IntervalPropagator(engine);
        x = Variable.createContinuous("x", 0.0, 2.0);
        y = Variable.createContinuous("y", 0.0, 3.0);
        n = Variable.createInteger("n", 0.0, 10.0);
    }

    @AfterEach
    void tearDown() {
        if (root != null) {
            engine.release(root);
        }
        assertEquals(0, engine.getLiveExpressionCount());
    }

    private Expression parse(String text) {
        root = new ExpressionParser(engine, List.of(x, y, n)).parse(text);
        return root;
    }

    @Nested
    @DisplayName("正向传播 (Forward)")
    class ForwardTests {

        @Test
        @DisplayName("x + y 的区间为 [0, 5]")
        void testSum() {
            ForwardPropagationResult result = propagator.propagateForward(parse("<x>+<y>"), 1, EXACT_BOUNDS, false);
            assertFalse(result.isInfeasible());
            assertEquals(Interval.of(0.0, 5.0), result.getRootInterval());
        }

        @Test
        @DisplayName("同一标签下复用缓存，强制或换标签后重新计算")
        void testTagCaching() {
            Expression e = parse("<x>+<y>");
            propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            x.tightenLowerBound(1.0);
            assertEquals(Interval.of(0.0, 5.0), propagator.propagateForward(e, 1, EXACT_BOUNDS, false).getRootInterval());
            assertEquals(Interval.of(1.0, 5.0), propagator.propagateForward(e, 1, EXACT_BOUNDS, true).getRootInterval());
            x.tightenUpperBound(1.5);
            assertEquals(Interval.of(1.0, 4.5), propagator.propagateForward(e, 2, EXACT_BOUNDS, false).getRootInterval());
        }

        @Test
        @DisplayName("辅助变量的界参与求交，交为空时不可行")
        void testAuxVariableInfeasible() {
            Expression e = parse("<x>+<y>");
            e.setAuxVariable(Variable.createAuxiliary("aux", 10.0, 20.0));
            ForwardPropagationResult result = propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            assertTrue(result.isInfeasible());
            assertTrue(result.getRootInterval().isEmpty());
            e.setAuxVariable(null);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "<x>*<y>-<x>^2",
                "(<x>-1)^3+2*<y>",
                "<x>/(<y>+1)",
                "<x>^(0.5)*<y>^2-<y>"
        })
        @DisplayName("可靠性：采样点处的值落在根区间内")
        void testSoundness(String text) {
            Expression e = parse(text);
            Interval interval = propagator.propagateForward(e, 1, EXACT_BOUNDS, false).getRootInterval();
            ExpressionEvaluator evaluator = new ExpressionEvaluator(engine);
            Random random = new Random(text.hashCode());
            for (int i = 0; i < 200; i++) {
                PointValuation point = PointValuation.of(Map.of(
                        x, random.nextDouble() * 2.0,
                        y, random.nextDouble() * 3.0,
                        n, (double) random.nextInt(11)));
                double value = evaluator.evaluate(e, point, 0);
                assertTrue(interval.contains(value), value + " 不在 " + interval + " 内");
            }
        }
    }

    @Nested
    @DisplayName("逆向传播 (Reverse)")
    class ReverseTests {

        @Test
        @DisplayName("x + y ∈ [0, 4] 推不出更紧的界")
        void testNoTightening() {
            Expression e = parse("<x>+<y>");
            propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            assertEquals(TighteningOutcome.TIGHTENED, propagator.tightenInterval(e, Interval.of(0.0, 4.0), false, null));
            ReversePropagationResult result = propagator.propagateReverse(List.of(e), false, false);
            assertAll(
                    () -> assertFalse(result.isInfeasible()),
                    () -> assertEquals(0, result.getTighteningCount()),
                    () -> assertEquals(2.0, x.getUpperBound()),
                    () -> assertEquals(3.0, y.getUpperBound()),
                    () -> assertFalse(e.isChanged())
            );
        }

        @Test
        @DisplayName("x + y ≥ 4 抬高两个变量的下界并写回定义域")
        void testTightening() {
            Expression e = parse("<x>+<y>");
            propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            propagator.tightenInterval(e, Interval.of(4.0, Double.POSITIVE_INFINITY), false, null);
            assertEquals(Interval.of(4.0, 5.0), e.getInterval());
            ReversePropagationResult result = propagator.propagateReverse(List.of(e), false, false);
            assertAll(
                    () -> assertFalse(result.isInfeasible()),
                    () -> assertEquals(2, result.getTighteningCount()),
                    () -> assertEquals(1.0, x.getLowerBound()),
                    () -> assertEquals(2.0, y.getLowerBound()),
                    () -> assertEquals(Interval.of(1.0, 2.0), e.getChild(0).getInterval())
            );
        }

        @Test
        @DisplayName("被收紧的内部节点继续向下传播")
        void testPropagatesThroughLevels() {
            // (x + y)^2 ≤ 1
            Expression e = parse("(<x>+<y>)^2");
            propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            propagator.tightenInterval(e, Interval.of(Double.NEGATIVE_INFINITY, 1.0), false, null);
            ReversePropagationResult result = propagator.propagateReverse(List.of(e), false, false);
            assertFalse(result.isInfeasible());
            assertEquals(1.0, x.getUpperBound(), 1e-9);
            assertEquals(1.0, y.getUpperBound(), 1e-9);
        }

        @Test
        @DisplayName("整数变量取整后为空，报告不可行")
        void testIntegerInfeasible() {
            Expression e = parse("2*<n>");
            propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            propagator.tightenInterval(e, Interval.point(3.0), false, null);
            ReversePropagationResult result = propagator.propagateReverse(List.of(e), false, false);
            assertTrue(result.isInfeasible());
            assertFalse(e.isInQueue());
        }

        @Test
        @DisplayName("allNodes 时即使根未被标记也会处理所有内部节点")
        void testAllNodes() {
            Expression e = parse("<x>+<y>");
            propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            e.setInterval(Interval.of(4.0, 5.0), 1);
            assertEquals(0, propagator.propagateReverse(List.of(e), false, false).getTighteningCount());
            assertEquals(2, propagator.propagateReverse(List.of(e), false, true).getTighteningCount());
        }
    }

    @Nested
    @DisplayName("收紧单个节点 (tightenInterval)")
    class TightenTests {

        @Test
        @DisplayName("改进量不足时不采用，强制时采用")
        void testMinimumImprovement() {
            Expression e = parse("<x>+<y>");
            propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            Interval almost = Interval.of(0.0, 5.0 - 1e-12);
            assertEquals(TighteningOutcome.UNCHANGED, propagator.tightenInterval(e, almost, false, null));
            assertEquals(TighteningOutcome.TIGHTENED, propagator.tightenInterval(e, almost, true, null));
        }

        @Test
        @DisplayName("从无穷到有限的收紧总是被采用")
        void testInfiniteToFinite() {
            Expression e = parse("<x>*<y>");
            // 未做正向传播，区间为全集
            assertEquals(TighteningOutcome.TIGHTENED,
                    propagator.tightenInterval(e, Interval.of(Double.NEGATIVE_INFINITY, 1e30), false, null));
            assertTrue(e.isChanged());
        }

        @Test
        @DisplayName("整数变量的界按容差取整并写回")
        void testIntegerRounding() {
            Expression e = parse("<n>");
            propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            assertEquals(TighteningOutcome.TIGHTENED,
                    propagator.tightenInterval(e, Interval.of(1.2, 3.9999999), false, null));
            assertAll(
                    () -> assertEquals(Interval.of(2.0, 4.0), e.getInterval()),
                    () -> assertEquals(2.0, n.getLowerBound()),
                    () -> assertEquals(4.0, n.getUpperBound())
            );
        }

        @Test
        @DisplayName("与当前区间不相交时不可行；被收紧的内部节点入队")
        void testInfeasibleAndQueue() {
            Expression e = parse("<x>+<y>");
            propagator.propagateForward(e, 1, EXACT_BOUNDS, false);
            Deque<Expression> queue = new ArrayDeque<>();
            assertEquals(TighteningOutcome.TIGHTENED, propagator.tightenInterval(e, Interval.of(1.0, 2.0), false, queue));
            assertTrue(e.isInQueue());
            assertSame(e, queue.peek());
            assertEquals(TighteningOutcome.INFEASIBLE, propagator.tightenInterval(e, Interval.of(6.0, 7.0), false, queue));
            assertEquals(1, queue.size());
            e.setInQueue(false);
            e.setChanged(false);
        }
    }
}
