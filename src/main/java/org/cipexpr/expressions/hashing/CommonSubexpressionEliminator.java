package org.cipexpr.expressions.hashing;

import org.cipexpr.expressions.ExprEngine;
import org.cipexpr.expressions.Expression;
import org.cipexpr.expressions.walk.WalkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 公共子表达式消除：在一组根之间，把结构相同的子表达式替换为同一个节点。
 * 先出现的节点作为代表，之后遇到的相同节点被替换为代表。
 *
 * @author Ayalyt
 */
public final class CommonSubexpressionEliminator {

    private static final Logger logger = LoggerFactory.getLogger(CommonSubexpressionEliminator.class);

    private final ExprEngine engine;

    public CommonSubexpressionEliminator(ExprEngine engine) {
        this.engine = engine;
    }

    /**
     * 原地处理 roots。被替换的根在列表中换成代表节点（引用随之转移）。
     * @return 替换的次数。
     */
    public int eliminate(List<Expression> roots) {
        StructuralHasher hasher = new StructuralHasher(engine);
        Map<Long, List<Expression>> representatives = new HashMap<>();
        Set<Expression> processed = Collections.newSetFromMap(new IdentityHashMap<>());
        int[] replaced = {0};

        for (int r = 0; r < roots.size(); r++) {
            Expression root = roots.get(r);
            Expression rep = findOrInsert(root, hasher, representatives);
            if (rep != root) {
                engine.capture(rep);
                engine.release(root);
                roots.set(r, rep);
                replaced[0]++;
                continue;
            }
            if (!processed.add(root)) {
                continue;
            }
            engine.getWalker().walk(root, null,
                    frame -> {
                        Expression child = frame.getCurrentChildExpr();
                        Expression childRep = findOrInsert(child, hasher, representatives);
                        if (childRep != child) {
                            engine.replaceChild(frame.getExpr(), frame.getCurrentChild(), childRep);
                            replaced[0]++;
                            return WalkResult.SKIP;
                        }
                        return processed.add(child) ? WalkResult.CONTINUE : WalkResult.SKIP;
                    },
                    null, null);
        }
        logger.debug("公共子表达式消除: 处理 {} 个根，替换 {} 次", roots.size(), replaced[0]);
        return replaced[0];
    }

    private Expression findOrInsert(Expression expr, StructuralHasher hasher, Map<Long, List<Expression>> representatives) {
        List<Expression> bucket = representatives.computeIfAbsent(hasher.hash(expr), k -> new ArrayList<>());
        for (Expression candidate : bucket) {
            if (candidate == expr || engine.compare(candidate, expr) == 0) {
                return candidate;
            }
        }
        bucket.add(expr);
        return expr;
    }
}
