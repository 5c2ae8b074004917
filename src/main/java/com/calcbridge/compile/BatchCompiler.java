package com.calcbridge.compile;

import com.calcbridge.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 在固定大小线程池上并行编译多个字段，字段之间互不影响。
 */
public class BatchCompiler {
    private static final Logger logger = LoggerFactory.getLogger(BatchCompiler.class);

    private final FormulaCompiler compiler;
    private final int threads;

    public BatchCompiler(FormulaCompiler compiler, int threads) {
        if (threads <= 0 || threads > Constants.MAX_COMPILE_THREADS) {
            throw new IllegalArgumentException("线程数必须在 1 到 " + Constants.MAX_COMPILE_THREADS + " 之间: " + threads);
        }
        this.compiler = compiler;
        this.threads = threads;
    }

    /**
     * 编译全部字段，结果顺序与输入一致。
     */
    public BatchReport compile(List<CalculatedField> fields) {
        long start = System.currentTimeMillis();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, fields.size())));
        try {
            List<Future<FieldCompilation>> futures = new ArrayList<>(fields.size());
            for (CalculatedField field : fields) {
                futures.add(executor.submit(() -> compiler.compile(field)));
            }
            List<FieldCompilation> results = new ArrayList<>(fields.size());
            for (int index = 0; index < fields.size(); index++) {
                results.add(await(fields.get(index), futures.get(index)));
            }
            BatchReport report = BatchReport.of(results);
            logger.info("批量编译完成: 共 {} 个字段，成功 {}，失败 {}，部分支持 {}，用时 {}ms",
                report.total(), report.succeeded(), report.failed(), report.partial(),
                System.currentTimeMillis() - start);
            return report;
        } finally {
            executor.shutdownNow();
        }
    }

    private FieldCompilation await(CalculatedField field, Future<FieldCompilation> future) {
        try {
            return future.get();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            logger.warn("字段 {} 等待编译结果时被中断", field.id());
            return FieldCompilation.failure(field.id(), null,
                new FieldError(FieldError.Kind.INTERNAL, "编译被中断"));
        } catch (ExecutionException exception) {
            logger.error("字段 {} 编译任务异常", field.id(), exception.getCause());
            return FieldCompilation.failure(field.id(), null,
                new FieldError(FieldError.Kind.INTERNAL, String.valueOf(exception.getCause())));
        }
    }
}
