package org.cipexpr.expressions.walk;

import org.cipexpr.core.Variable;
import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.Expression;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionWalkerTest {

    private ExprEngine engine;
    private Expression x;
    private Expression y;
    private Expression product;
    private Expression root;
    private List<String> events;

    @BeforeEach
    void setUp() {
        engine = ExprEngine.create();
        x = engine.createVariable(Variable.createContinuous("x", 0.0, 1.0));
        y = engine.createVariable(Variable.createContinuous("y", 0.0, 1.0));
        product = engine.createProduct(List.of(x, y), 1.0);
        // root = x + x*y
        root = engine.createSum(List.of(x, product));
        events = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        engine.release(root);
        engine.release(product);
        engine.release(x);
        engine.release(y);
        assertEquals(0, engine.getLiveExpressionCount());
    }

    private ExprWalkCallback record(String stage, WalkResult result) {
        return frame -> {
            String name = frame.getExpr().getHandler().getName();
            if (stage.startsWith("visit")) {
                events.add(stage + ":" + name + ":" + frame.getCurrentChild());
            } else {
                events.add(stage + ":" + name);
            }
            return result;
        };
    }

    private WalkResult walkAll() {
        return engine.getWalker().walk(root,
                record("enter", WalkResult.CONTINUE),
                record("visiting", WalkResult.CONTINUE),
                record("visited", WalkResult.CONTINUE),
                record("leave", WalkResult.CONTINUE));
    }

    @Test
    @DisplayName("完整遍历按深度优先顺序经过四个阶段")
    void testFullOrder() {
        assertEquals(WalkResult.CONTINUE, walkAll());
        assertEquals(List.of(
                "enter:sum",
                "visiting:sum:0", "enter:var", "leave:var", "visited:sum:0",
                "visiting:sum:1", "enter:prod",
                "visiting:prod:0", "enter:var", "leave:var", "visited:prod:0",
                "visiting:prod:1", "enter:var", "leave:var", "visited:prod:1",
                "leave:prod", "visited:sum:1",
                "leave:sum"), events);
    }

    @Test
    @DisplayName("ENTER_EXPR 返回 SKIP 时跳过子节点但仍然离开节点")
    void testSkipOnEnter() {
        engine.getWalker().walk(root,
                frame -> {
                    events.add("enter:" + frame.getExpr().getHandler().getName());
                    return engine.isProduct(frame.getExpr()) ? WalkResult.SKIP : WalkResult.CONTINUE;
                },
                null, null,
                record("leave", WalkResult.CONTINUE));
        assertEquals(List.of("enter:sum", "enter:var", "leave:var", "enter:prod", "leave:prod", "leave:sum"), events);
    }

    @Test
    @DisplayName("VISITING_CHILD 返回 SKIP 时只跳过该子节点")
    void testSkipOneChild() {
        engine.getWalker().walk(root,
                record("enter", WalkResult.CONTINUE),
                frame -> frame.getCurrentChild() == 0 ? WalkResult.SKIP : WalkResult.CONTINUE,
                null, null);
        // sum 的第 0 个子节点 x 与 prod 的第 0 个子节点 x 都被跳过
        assertEquals(List.of("enter:sum", "enter:prod", "enter:var"), events);
    }

    @Test
    @DisplayName("VISITED_CHILD 返回 SKIP 时跳过剩余的兄弟节点")
    void testSkipSiblings() {
        engine.getWalker().walk(root,
                record("enter", WalkResult.CONTINUE),
                null,
                frame -> WalkResult.SKIP,
                record("leave", WalkResult.CONTINUE));
        assertEquals(List.of("enter:sum", "enter:var", "leave:var", "leave:sum"), events);
    }

    @Test
    @DisplayName("ABORT 立即结束遍历")
    void testAbort() {
        WalkResult result = engine.getWalker().walk(root,
                frame -> {
                    events.add("enter:" + frame.getExpr().getHandler().getName());
                    return engine.isProduct(frame.getExpr()) ? WalkResult.ABORT : WalkResult.CONTINUE;
                },
                null, null,
                record("leave", WalkResult.CONTINUE));
        assertEquals(WalkResult.ABORT, result);
        assertEquals(List.of("enter:sum", "enter:var", "leave:var", "enter:prod"), events);
    }

    @Test
    @DisplayName("遍历结束后根节点的引用计数不变，父帧信息正确")
    void testRootCaptureAndFrames() {
        int before = root.getRefCount();
        List<Integer> depths = new ArrayList<>();
        engine.getWalker().walk(root,
                frame -> {
                    if (frame.isRoot()) {
                        assertNull(frame.getParent());
                        assertEquals(0, frame.getParentPrecedence());
                    } else {
                        assertNotNull(frame.getParent());
                    }
                    depths.add(frame.getDepth());
                    return WalkResult.CONTINUE;
                },
                null, null, null);
        assertEquals(before, root.getRefCount());
        assertEquals(List.of(0, 1, 1, 2, 2), depths);
    }
}
