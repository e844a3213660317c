package org.cipexpr.expressions;

import org.cipexpr.core.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExprEngineTest {

    private ExprEngine engine;
    private Variable x;
    private Variable y;

    @BeforeEach
    void setUp() {
        engine = ExprEngine.create();
        x = Variable.createContinuous("x", -1.0, 1.0);
        y = Variable.createContinuous("y", -1.0, 1.0);
    }

    private Expression parse(String text) {
        return new ExpressionParser(engine, List.of(x, y)).parse(text);
    }

    @Nested
    @DisplayName("引用计数 (Reference Counting)")
    class RefCountTests {

        @Test
        @DisplayName("父节点持有每个子节点的引用，释放根节点后全部节点被回收")
        void testCaptureAndRelease() {
            Expression vx = engine.createVariable(x);
            Expression sum = engine.createSum(List.of(vx, vx));
            assertEquals(3, vx.getRefCount());
            engine.release(vx);
            assertEquals(2, engine.getLiveExpressionCount());
            engine.release(sum);
            assertAll(
                    () -> assertTrue(sum.isFreed()),
                    () -> assertTrue(vx.isFreed()),
                    () -> assertEquals(0, engine.getLiveExpressionCount())
            );
        }

        @Test
        @DisplayName("被其他节点共享的子节点不会随父节点释放")
        void testSharedChildSurvives() {
            Expression vx = engine.createVariable(x);
            Expression a = engine.createPow(vx, 2.0);
            Expression b = engine.createSum(List.of(vx));
            engine.release(vx);
            engine.release(a);
            assertFalse(vx.isFreed());
            assertEquals(1, vx.getRefCount());
            engine.release(b);
            assertTrue(vx.isFreed());
        }

        @Test
        @DisplayName("释放未持有的节点、使用已释放的节点或其他引擎的节点都会抛出异常")
        void testContractViolations() {
            Expression value = engine.createValue(1.0);
            engine.release(value);
            ExprEngine other = ExprEngine.create();
            Expression foreign = other.createValue(2.0);
            assertAll(
                    () -> assertThrows(IllegalStateException.class, () -> engine.release(value)),
                    () -> assertThrows(IllegalStateException.class, () -> engine.createPow(value, 2.0)),
                    () -> assertThrows(IllegalArgumentException.class, () -> engine.createPow(foreign, 2.0))
            );
            other.release(foreign);
        }

        @Test
        @DisplayName("很深的链释放时不会栈溢出")
        void testDeepChainRelease() {
            Expression current = engine.createVariable(x);
            for (int i = 0; i < 100_000; i++) {
                Expression next = engine.createSum(List.of(current), new double[]{1.0}, 1.0);
                engine.release(current);
                current = next;
            }
            assertEquals(100_001, engine.getLiveExpressionCount());
            engine.release(current);
            assertEquals(0, engine.getLiveExpressionCount());
        }
    }

    @Nested
    @DisplayName("结构操作 (Structure)")
    class StructureTests {

        @Test
        @DisplayName("replaceChild 替换子节点并释放旧节点")
        void testReplaceChild() {
            Expression sum = parse("<x>+<y>");
            Expression three = engine.createValue(3.0);
            Expression oldChild = sum.getChild(1);
            engine.replaceChild(sum, 1, three);
            engine.release(three);
            assertAll(
                    () -> assertTrue(oldChild.isFreed()),
                    () -> assertEquals("<x>+3", engine.getPrinter().print(sum)),
                    () -> assertThrows(IndexOutOfBoundsException.class, () -> engine.replaceChild(sum, 5, sum.getChild(0)))
            );
            engine.release(sum);
            assertEquals(0, engine.getLiveExpressionCount());
        }

        @Test
        @DisplayName("appendSumChild 追加带系数的加项")
        void testAppendSumChild() {
            Expression sum = parse("<x>");
            Expression wrapped = engine.createSum(List.of(sum));
            Expression vy = engine.createVariable(y);
            engine.appendSumChild(wrapped, vy, -2.0);
            engine.release(vy);
            engine.release(sum);
            assertEquals("<x>-2*<y>", engine.getPrinter().print(wrapped));
            assertThrows(IllegalArgumentException.class, () -> engine.appendSumChild(wrapped.getChild(0), wrapped, 1.0));
            engine.release(wrapped);
            assertEquals(0, engine.getLiveExpressionCount());
        }

        @Test
        @DisplayName("duplicate 产生结构相同的新节点，共享关系保持不变")
        void testDuplicate() {
            Expression vx = engine.createVariable(x);
            Expression square = engine.createPow(vx, 2.0);
            Expression sum = engine.createSum(List.of(square, square), new double[]{1.0, 3.0}, 1.0);
            engine.release(vx);
            engine.release(square);

            Expression copy = engine.duplicate(sum);
            assertAll(
                    () -> assertNotSame(sum, copy),
                    () -> assertNotSame(square, copy.getChild(0)),
                    () -> assertSame(copy.getChild(0), copy.getChild(1)),
                    () -> assertEquals(0, engine.compare(sum, copy)),
                    () -> assertEquals(engine.getPrinter().print(sum), engine.getPrinter().print(copy))
            );
            engine.release(copy);
            engine.release(sum);
            assertEquals(0, engine.getLiveExpressionCount());
        }

        @Test
        @DisplayName("collectVariables 按首次出现的顺序去重")
        void testCollectVariables() {
            Expression expr = parse("<y>*<x>+<y>^2");
            assertEquals(List.of(y, x), engine.collectVariables(expr));
            engine.release(expr);
        }
    }

    @Nested
    @DisplayName("锁 (Locks)")
    class LockTests {

        @Test
        @DisplayName("锁按单调性传递到子节点与变量")
        void testLockPropagation() {
            // -x + y^2 <= 1
            Expression root = parse("-<x>+<y>^2");
            ExprConstraint constraint = ExprConstraint.of("c", root, RelationType.LE, 1.0);
            Expression xNode = root.getChild(0);
            Expression square = root.getChild(1);
            Expression yNode = square.getChild(0);
            assertAll(
                    () -> assertEquals(1, root.getLocksPos()),
                    () -> assertEquals(0, root.getLocksNeg()),
                    () -> assertEquals(0, xNode.getLocksPos()),
                    () -> assertEquals(1, xNode.getLocksNeg()),
                    () -> assertEquals(1, x.getLocksDown()),
                    () -> assertEquals(0, x.getLocksUp()),
                    () -> assertEquals(1, square.getLocksPos()),
                    // y 的区间包含 0，y^2 的单调性未知，两个方向都加锁
                    () -> assertEquals(1, yNode.getLocksPos()),
                    () -> assertEquals(1, yNode.getLocksNeg()),
                    () -> assertEquals(1, y.getLocksDown()),
                    () -> assertEquals(1, y.getLocksUp())
            );
            constraint.release();
            engine.release(root);
            assertAll(
                    () -> assertEquals(0, x.getLocksDown()),
                    () -> assertEquals(0, y.getLocksUp()),
                    () -> assertEquals(0, engine.getLiveExpressionCount()),
                    () -> assertThrows(IllegalStateException.class, constraint::release)
            );
        }
    }

    @Nested
    @DisplayName("分支得分 (Branch Scores)")
    class BranchScoreTests {

        @Test
        @DisplayName("共享的后代只加一次得分，新标签清零")
        void testAddBranchScore() {
            Expression vx = engine.createVariable(x);
            Expression vy = engine.createVariable(y);
            Expression product = engine.createProduct(List.of(vx, vy), 1.0);
            Expression sum = engine.createSum(List.of(vx, product));

            engine.addBranchScore(sum, 1, 2.0);
            engine.addBranchScore(sum, 1, 0.5);
            assertEquals(2.5, vx.getBranchScore());
            assertEquals(2.5, sum.getBranchScore());

            engine.addBranchScore(product, 2, 1.0);
            assertEquals(1.0, vx.getBranchScore());
            assertEquals(2, vx.getBranchScoreTag());

            for (Expression e : List.of(sum, product, vx, vy)) {
                engine.release(e);
            }
            assertEquals(0, engine.getLiveExpressionCount());
        }
    }
}
