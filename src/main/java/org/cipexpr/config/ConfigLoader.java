package org.cipexpr.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.cipexpr.propagation.VarBoundRelaxation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 从 YAML 加载 {@link EngineConfig}，缺失的键取默认值。
 * 每个键都可以被 CIPEXPR_ 前缀的环境变量覆盖；值为空白的环境变量视为未设置。
 *
 * <pre>
 * numerics:
 *   infinity: 1.0e20
 *   feasibility-tolerance: 1.0e-6
 * propagation:
 *   var-bound-relax: relative
 *   var-bound-relax-amount: 1.0e-9
 *   min-tightening-ratio: 1.0e-9
 *   max-rounds: 10
 * </pre>
 */
public final class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    public static final String DEFAULT_CONFIG_RESOURCE = "cip-expr.yaml";
    private static final String ENV_PREFIX = "CIPEXPR_";

    private ConfigLoader() {
    }

    /**
     * 从文件加载，并应用 {@link System#getenv} 的覆盖。
     * @throws ConfigLoadException 如果文件不存在或内容非法。
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            logger.error("配置文件不存在: {}", configPath);
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return load(in, envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration: " + configPath, e);
        }
    }

    public static EngineConfig load(InputStream in) {
        return load(in, System::getenv);
    }

    public static EngineConfig load(InputStream in, Function<String, String> envLookup) {
        try {
            JsonNode root = YAML_MAPPER.readTree(in);
            EngineConfig config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
            logger.info("加载引擎配置: {}", config);
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration", e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration value: " + e.getMessage(), e);
        }
    }

    /**
     * 从类路径上的 {@value #DEFAULT_CONFIG_RESOURCE} 加载；找不到时使用内置默认值。
     */
    public static EngineConfig loadDefault() {
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE);
        if (in == null) {
            logger.warn("类路径上没有 {}，使用内置默认配置", DEFAULT_CONFIG_RESOURCE);
            return EngineConfig.defaults();
        }
        try (InputStream stream = in) {
            return load(stream, System::getenv);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read classpath resource " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        JsonNode numerics = root.path("numerics");
        if (numerics.has("infinity")) builder.infinity(requireNumber(numerics, "infinity"));
        if (numerics.has("feasibility-tolerance"))
            builder.feasibilityTolerance(requireNumber(numerics, "feasibility-tolerance"));

        JsonNode propagation = root.path("propagation");
        if (propagation.has("var-bound-relax"))
            builder.varBoundRelax(VarBoundRelaxation.parse(propagation.get("var-bound-relax").asText()));
        if (propagation.has("var-bound-relax-amount"))
            builder.varBoundRelaxAmount(requireNumber(propagation, "var-bound-relax-amount"));
        if (propagation.has("min-tightening-ratio"))
            builder.minTighteningRatio(requireNumber(propagation, "min-tightening-ratio"));
        if (propagation.has("max-rounds")) {
            JsonNode rounds = propagation.get("max-rounds");
            if (!rounds.canConvertToInt() || !rounds.isIntegralNumber()) {
                throw new ConfigLoadException("propagation.max-rounds must be an integer, got: " + rounds);
            }
            builder.maxPropagationRounds(rounds.asInt());
        }

        // 环境变量覆盖
        envDouble(envLookup, "INFINITY", builder::infinity);
        envDouble(envLookup, "FEASIBILITY_TOLERANCE", builder::feasibilityTolerance);
        envString(envLookup, "VAR_BOUND_RELAX", v -> builder.varBoundRelax(VarBoundRelaxation.parse(v)));
        envDouble(envLookup, "VAR_BOUND_RELAX_AMOUNT", builder::varBoundRelaxAmount);
        envDouble(envLookup, "MIN_TIGHTENING_RATIO", builder::minTighteningRatio);
        envString(envLookup, "MAX_ROUNDS", v -> builder.maxPropagationRounds(parseInt("MAX_ROUNDS", v)));

        return builder.build();
    }

    private static double requireNumber(JsonNode section, String key) {
        JsonNode node = section.get(key);
        if (!node.isNumber()) {
            throw new ConfigLoadException("Configuration key '" + key + "' must be a number, got: " + node);
        }
        return node.asDouble();
    }

    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        String value = envLookup.apply(ENV_PREFIX + name);
        if (value != null && !value.isBlank()) {
            logger.debug("环境变量 {}{} 覆盖了配置", ENV_PREFIX, name);
            setter.accept(value.trim());
        }
    }

    private static void envDouble(Function<String, String> envLookup, String name, Consumer<Double> setter) {
        envString(envLookup, name, v -> {
            try {
                setter.accept(Double.parseDouble(v));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Environment variable " + ENV_PREFIX + name + " is not a number: " + v, e);
            }
        });
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Environment variable " + ENV_PREFIX + name + " is not an integer: " + value, e);
        }
    }
}
