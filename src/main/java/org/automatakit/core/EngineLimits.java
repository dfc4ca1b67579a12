package org.automatakit.core;

import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * 引擎的资源上限配置。
 * 此类是不可变的。可以通过 {@link #builder()} 构造，也可以通过 {@link #load()}
 * 从类路径上的 {@value #RESOURCE} 以及 JVM 系统属性 {@code automatakit.<key>} 加载。
 */
@Getter
@Builder(toBuilder = true)
public final class EngineLimits {

    private static final Logger logger = LoggerFactory.getLogger(EngineLimits.class);

    public static final String RESOURCE = "automatakit.properties";
    public static final String PREFIX = "automatakit.";

    public static final String MAX_DETERMINIZED_STATES = "maxDeterminizedStates";
    public static final String MAX_ENUMERATION_LENGTH = "maxEnumerationLength";
    public static final String MAX_ENUMERATED_WORDS = "maxEnumeratedWords";
    public static final String MAX_ENUMERATION_FRONTIER = "maxEnumerationFrontier";

    /**
     * 子集构造产生的宏状态数上限。
     */
    @Builder.Default
    private final int maxDeterminizedStates = 100_000;

    /**
     * 词枚举允许的最大长度。
     */
    @Builder.Default
    private final int maxEnumerationLength = 64;

    /**
     * 词枚举返回的最大词数。
     */
    @Builder.Default
    private final int maxEnumeratedWords = 100_000;

    /**
     * 词枚举中单层待扩展前缀数的上限。
     */
    @Builder.Default
    private final int maxEnumerationFrontier = 1_000_000;

    public static EngineLimits defaults() {
        return EngineLimits.builder().build();
    }

    /**
     * 先读取类路径资源（可选），再用系统属性覆盖。
     * @return 加载得到的配置。
     */
    public static EngineLimits load() {
        Properties properties = new Properties();
        try (InputStream in = EngineLimits.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.info("从 {} 加载了引擎配置", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("读取 {} 失败，使用默认配置: {}", RESOURCE, e.getMessage());
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(properties);
    }

    /**
     * 从属性集合构造配置，键名带 {@value #PREFIX} 前缀，缺失的键取默认值。
     */
    public static EngineLimits fromProperties(Properties properties) {
        EngineLimits defaults = defaults();
        return EngineLimits.builder()
                .maxDeterminizedStates(readPositive(properties, MAX_DETERMINIZED_STATES, defaults.maxDeterminizedStates))
                .maxEnumerationLength(readPositive(properties, MAX_ENUMERATION_LENGTH, defaults.maxEnumerationLength))
                .maxEnumeratedWords(readPositive(properties, MAX_ENUMERATED_WORDS, defaults.maxEnumeratedWords))
                .maxEnumerationFrontier(readPositive(properties, MAX_ENUMERATION_FRONTIER, defaults.maxEnumerationFrontier))
                .build();
    }

    private static int readPositive(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(PREFIX + key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                logger.warn("配置项 {} 的值 {} 必须为正整数，使用默认值 {}", key, raw, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 的值 {} 不是整数，使用默认值 {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "EngineLimits{" +
                MAX_DETERMINIZED_STATES + "=" + maxDeterminizedStates +
                ", " + MAX_ENUMERATION_LENGTH + "=" + maxEnumerationLength +
                ", " + MAX_ENUMERATED_WORDS + "=" + maxEnumeratedWords +
                ", " + MAX_ENUMERATION_FRONTIER + "=" + maxEnumerationFrontier +
                '}';
    }
}
