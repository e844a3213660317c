package org.cipexpr.expressions.hashing;

import org.cipexpr.expressions.ExprCapability;
import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.ExprHandler;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.walk.WalkResult;
import org.cipexpr.utils.HashUtils;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 结构哈希：结构相同（比较结果为 0）的表达式哈希相同。
 * 结果按节点身份记在备忘表中，同一个哈希器上的重复查询不会重新遍历。
 */
public final class StructuralHasher {

    private final ExprEngine engine;
    private final Map<Expression, Long> memo = new IdentityHashMap<>();

    public StructuralHasher(ExprEngine engine) {
        this.engine = engine;
    }

    public long hash(Expression root) {
        Long cached = memo.get(root);
        if (cached != null) {
            return cached;
        }
        engine.getWalker().walk(root,
                frame -> memo.containsKey(frame.getExpr()) ? WalkResult.SKIP : WalkResult.CONTINUE,
                frame -> memo.containsKey(frame.getCurrentChildExpr()) ? WalkResult.SKIP : WalkResult.CONTINUE,
                null,
                frame -> {
                    Expression expr = frame.getExpr();
                    if (memo.containsKey(expr)) {
                        return WalkResult.CONTINUE;
                    }
                    long[] childHashes = new long[expr.getNChildren()];
                    for (int i = 0; i < childHashes.length; i++) {
                        childHashes[i] = memo.get(expr.getChild(i));
                    }
                    memo.put(expr, computeHash(expr, childHashes));
                    return WalkResult.CONTINUE;
                });
        return memo.get(root);
    }

    private static long computeHash(Expression expr, long[] childHashes) {
        ExprHandler handler = expr.getHandler();
        if (handler.hasCapability(ExprCapability.HASH)) {
            return handler.hash(expr, childHashes);
        }
        // 没有哈希回调时只用名称与子节点
        long h = HashUtils.stringHash(handler.getName()) ^ HashUtils.fibHash((long) childHashes.length);
        for (long childHash : childHashes) {
            h = h * 31 + childHash;
        }
        return h;
    }

    /**
     * 丢弃备忘表。节点结构被修改后需要调用。
     */
    public void clear() {
        memo.clear();
    }
}
