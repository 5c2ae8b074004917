package com.calcbridge.render;

import com.calcbridge.config.Constants;
import com.calcbridge.formula.FunctionRegistry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 函数映射表，键为大写函数名。构造后不可变，解析器与渲染器共享同一实例。
 */
public final class FunctionTable implements FunctionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(FunctionTable.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<FunctionMapping>> MAPPING_LIST = new TypeReference<>() {
    };

    private final Map<String, FunctionMapping> mappings;

    private FunctionTable(Collection<FunctionMapping> entries) {
        this(indexByName(entries));
    }

    private FunctionTable(Map<String, FunctionMapping> byName) {
        this.mappings = Collections.unmodifiableMap(byName);
    }

    /**
     * 同一来源内的重名条目视为配置错误，记录警告，后出现的条目生效。
     */
    private static Map<String, FunctionMapping> indexByName(Collection<FunctionMapping> entries) {
        Map<String, FunctionMapping> byName = new LinkedHashMap<>();
        for (FunctionMapping entry : entries) {
            String key = entry.name().toUpperCase(Locale.ROOT);
            if (byName.put(key, entry) != null) {
                logger.warn("函数 {} 重复定义，后出现的条目生效", key);
            }
        }
        return byName;
    }

    public static FunctionTable of(FunctionMapping... entries) {
        return new FunctionTable(List.of(entries));
    }

    public static FunctionTable of(Collection<FunctionMapping> entries) {
        return new FunctionTable(entries);
    }

    /**
     * 从类路径加载内置映射表。
     *
     * @throws IllegalStateException 资源缺失或格式错误时抛出
     */
    public static FunctionTable loadDefault() {
        try (InputStream input = FunctionTable.class.getResourceAsStream(Constants.FUNCTION_TABLE_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("缺少内置函数映射表: " + Constants.FUNCTION_TABLE_RESOURCE);
            }
            FunctionTable table = new FunctionTable(OBJECT_MAPPER.readValue(input, MAPPING_LIST));
            logger.debug("已加载内置函数映射 {} 条", table.size());
            return table;
        } catch (IOException exception) {
            throw new IllegalStateException("读取内置函数映射表失败", exception);
        }
    }

    /**
     * 从 JSON 文件加载映射表，文件条目覆盖内置表中的同名条目。
     *
     * @param file 映射表文件，内容为映射条目数组
     * @throws IOException 读取或解析失败时抛出
     */
    public static FunctionTable load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("映射表文件不能为空");
        }
        List<FunctionMapping> overrides;
        try (InputStream input = Files.newInputStream(file)) {
            overrides = OBJECT_MAPPER.readValue(input, MAPPING_LIST);
        } catch (IOException exception) {
            throw new IOException("读取函数映射表失败: " + file.toAbsolutePath(), exception);
        }
        logger.info("函数映射表 {} 覆盖 {} 条", file, overrides.size());
        return loadDefault().withOverrides(overrides);
    }

    /**
     * 返回以给定条目覆盖同名函数后的新映射表，当前实例不变。
     */
    public FunctionTable withOverrides(Collection<FunctionMapping> overrides) {
        Map<String, FunctionMapping> merged = new LinkedHashMap<>(mappings);
        indexByName(overrides).forEach((key, entry) -> {
            if (merged.put(key, entry) != null) {
                logger.debug("函数 {} 使用自定义映射", key);
            }
        });
        return new FunctionTable(merged);
    }

    public Optional<FunctionMapping> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mappings.get(name.toUpperCase(Locale.ROOT)));
    }

    /**
     * UNSUPPORTED 条目也视为已知函数：解析得到 FunctionCall，由渲染阶段给出占位符。
     */
    @Override
    public boolean isKnown(String name) {
        return lookup(name).isPresent();
    }

    @Override
    public boolean returnsString(String name) {
        return lookup(name).map(FunctionMapping::returnsString).orElse(false);
    }

    public Collection<FunctionMapping> mappings() {
        return mappings.values();
    }

    public int size() {
        return mappings.size();
    }
}
