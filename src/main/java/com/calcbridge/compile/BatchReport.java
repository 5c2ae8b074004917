package com.calcbridge.compile;

import java.time.Instant;
import java.util.List;

/**
 * 批量编译报告，fields 与输入顺序一致。
 */
public record BatchReport(
    Instant generatedAt,
    int total,
    int succeeded,
    int failed,
    int partial,
    List<FieldCompilation> fields
) {

    public static BatchReport of(List<FieldCompilation> fields) {
        int succeeded = 0;
        int partial = 0;
        for (FieldCompilation field : fields) {
            if (field.isSuccess()) {
                succeeded++;
                if (field.isPartial()) {
                    partial++;
                }
            }
        }
        return new BatchReport(Instant.now(), fields.size(), succeeded, fields.size() - succeeded, partial,
            List.copyOf(fields));
    }
}
