package org.cipexpr.expressions;

import org.cipexpr.expressions.handlers.PowHandler;
import org.cipexpr.expressions.handlers.ProductHandler;
import org.cipexpr.expressions.handlers.SumHandler;
import org.cipexpr.expressions.handlers.ValueHandler;
import org.cipexpr.expressions.handlers.VariableHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 表达式处理器注册表，按名称查找。
 * 化简与比较需要识别内置的常数、变量、和、积、幂五种处理器，通过固定名称取得。
 */
public final class ExprHandlerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ExprHandlerRegistry.class);

    private final Map<String, ExprHandler> handlers = new LinkedHashMap<>();

    /**
     * 创建包含五种内置处理器的注册表。
     */
    public static ExprHandlerRegistry withDefaultHandlers() {
        ExprHandlerRegistry registry = new ExprHandlerRegistry();
        registry.register(new ValueHandler());
        registry.register(new VariableHandler());
        registry.register(new SumHandler());
        registry.register(new ProductHandler());
        registry.register(new PowHandler());
        return registry;
    }

    /**
     * @throws IllegalArgumentException 如果已有同名处理器。
     */
    public void register(ExprHandler handler) {
        if (handlers.containsKey(handler.getName())) {
            logger.error("ExprHandlerRegistry: 处理器 '{}' 已注册", handler.getName());
            throw new IllegalArgumentException("处理器 '" + handler.getName() + "' 已注册");
        }
        handlers.put(handler.getName(), handler);
        logger.debug("注册表达式处理器 {}: {}", handler.getName(), handler.getCapabilities());
    }

    /**
     * @return 同名处理器，不存在时返回 null。
     */
    public ExprHandler find(String name) {
        return handlers.get(name);
    }

    /**
     * @throws IllegalArgumentException 如果不存在同名处理器。
     */
    public ExprHandler require(String name) {
        ExprHandler handler = handlers.get(name);
        if (handler == null) {
            throw new IllegalArgumentException("未注册的表达式处理器: " + name);
        }
        return handler;
    }

    public boolean contains(ExprHandler handler) {
        return handlers.get(handler.getName()) == handler;
    }

    public Collection<ExprHandler> getHandlers() {
        return Collections.unmodifiableCollection(handlers.values());
    }

    public ValueHandler getValueHandler() {
        return (ValueHandler) require(ValueHandler.NAME);
    }

    public VariableHandler getVariableHandler() {
        return (VariableHandler) require(VariableHandler.NAME);
    }

    public SumHandler getSumHandler() {
        return (SumHandler) require(SumHandler.NAME);
    }

    public ProductHandler getProductHandler() {
        return (ProductHandler) require(ProductHandler.NAME);
    }

    public PowHandler getPowHandler() {
        return (PowHandler) require(PowHandler.NAME);
    }
}
