package com.calcbridge.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 工作簿字段目录：源端字段名到 LookML 字段名的映射。
 * <p>
 * 通过 {@link Builder} 构造，构造完成后不可变，可在编译线程之间共享。
 */
public final class FieldNameMapper implements FieldResolver {
    private static final Logger logger = LoggerFactory.getLogger(FieldNameMapper.class);

    private final Map<String, String> originalToClean;
    private final Map<String, String> lowerCaseToClean;
    private final Map<String, String> cleanToOriginal;
    private final Set<String> calculatedClean;

    private FieldNameMapper(Builder builder) {
        this.originalToClean = Map.copyOf(builder.originalToClean);
        this.cleanToOriginal = Map.copyOf(builder.cleanToOriginal);
        this.calculatedClean = Set.copyOf(builder.calculatedClean);
        Map<String, String> lowerCase = new HashMap<>();
        // 大小写不敏感查找时以先注册者为准
        builder.originalToClean.forEach((original, clean) ->
                lowerCase.putIfAbsent(original.toLowerCase(Locale.ROOT), clean));
        this.lowerCaseToClean = Map.copyOf(lowerCase);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 依次尝试精确匹配、去掉方括号、加上方括号与大小写不敏感匹配。
     */
    @Override
    public Optional<String> resolve(String sourceFieldName) {
        if (sourceFieldName == null) {
            return Optional.empty();
        }
        String stripped = stripBrackets(sourceFieldName);
        for (String candidate : new String[]{sourceFieldName, stripped, "[" + stripped + "]"}) {
            String clean = originalToClean.get(candidate);
            if (clean != null) {
                return Optional.of(clean);
            }
        }
        String clean = lowerCaseToClean.get(stripped.toLowerCase(Locale.ROOT));
        if (clean == null) {
            logger.debug("字段 {} 没有目标端映射", sourceFieldName);
        }
        return Optional.ofNullable(clean);
    }

    @Override
    public boolean isCalculated(String sourceFieldName) {
        return resolve(sourceFieldName).map(calculatedClean::contains).orElse(false);
    }

    /**
     * 按 LookML 字段名反查源端字段名。
     */
    public Optional<String> originalName(String cleanName) {
        return Optional.ofNullable(cleanToOriginal.get(cleanName));
    }

    public int size() {
        return cleanToOriginal.size();
    }

    /**
     * 由显示标题生成 LookML 字段名，例如 "Take Rate %" 生成 take_rate_percent。
     */
    public static String cleanNameFromCaption(String caption) {
        String clean = caption.toLowerCase(Locale.ROOT).replace("%", "_percent");
        clean = clean.replaceAll("[^a-z0-9]+", "_");
        clean = clean.replaceAll("_+", "_");
        return clean.replaceAll("^_|_$", "");
    }

    private static String stripBrackets(String name) {
        if (name.length() >= 2 && name.startsWith("[") && name.endsWith("]")) {
            return name.substring(1, name.length() - 1);
        }
        return name;
    }

    public static final class Builder {
        private final Map<String, String> originalToClean = new LinkedHashMap<>();
        private final Map<String, String> cleanToOriginal = new HashMap<>();
        private final Set<String> calculatedClean = new HashSet<>();

        private Builder() {
        }

        /**
         * 注册字段映射，同时登记带方括号与小写下划线化的原名变体。
         */
        public Builder register(String originalName, String cleanName, boolean calculated) {
            String original = stripBrackets(originalName);
            originalToClean.put(original, cleanName);
            originalToClean.put("[" + original + "]", cleanName);
            originalToClean.putIfAbsent(original.toLowerCase(Locale.ROOT).replace(" ", "_"), cleanName);
            cleanToOriginal.put(cleanName, original);
            if (calculated) {
                calculatedClean.add(cleanName);
            }
            return this;
        }

        public Builder register(String originalName, String cleanName) {
            return register(originalName, cleanName, false);
        }

        /**
         * 使用标题生成字段名后注册；标题为空时以原名生成。
         */
        public Builder registerWithCaption(String originalName, String caption, boolean calculated) {
            String source = caption == null || caption.isBlank() ? stripBrackets(originalName) : caption;
            return register(originalName, cleanNameFromCaption(source), calculated);
        }

        public FieldNameMapper build() {
            return new FieldNameMapper(this);
        }
    }
}
