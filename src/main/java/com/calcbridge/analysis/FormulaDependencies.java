package com.calcbridge.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 公式的依赖与元数据，集合保持后序遍历中首次出现的顺序。
 */
public record FormulaDependencies(
        Set<FieldReference> fields,
        Set<String> parameters,
        Map<String, Integer> functionsUsed,
        int maxDepth,
        boolean hasUnsupported
) {
    public FormulaDependencies {
        fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
        parameters = Collections.unmodifiableSet(new LinkedHashSet<>(parameters));
        functionsUsed = Collections.unmodifiableMap(new LinkedHashMap<>(functionsUsed));
    }

    /**
     * 去掉聚合信息后的字段名集合。
     */
    public Set<String> fieldNames() {
        return fields.stream()
                .map(FieldReference::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
