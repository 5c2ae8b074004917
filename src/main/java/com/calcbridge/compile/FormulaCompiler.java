package com.calcbridge.compile;

import com.calcbridge.analysis.DependencyExtractor;
import com.calcbridge.analysis.FormulaDependencies;
import com.calcbridge.config.CompilerConfig;
import com.calcbridge.config.Constants;
import com.calcbridge.formula.FormulaLexException;
import com.calcbridge.formula.FormulaNode;
import com.calcbridge.formula.FormulaParseException;
import com.calcbridge.formula.FormulaParser;
import com.calcbridge.render.ExpressionRenderer;
import com.calcbridge.render.FieldResolver;
import com.calcbridge.render.FunctionTable;
import com.calcbridge.render.RenderedExpression;
import com.calcbridge.render.UnresolvedReferenceException;
import com.calcbridge.render.UnsupportedConstructException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 单字段编译流程：解析、依赖抽取、渲染。
 * <p>
 * 所有编译异常都转换为 {@link FieldError}，不会从 {@link #compile(CalculatedField)} 抛出。
 */
public class FormulaCompiler {
    private static final Logger logger = LoggerFactory.getLogger(FormulaCompiler.class);

    private final FunctionTable functions;
    private final FieldResolver resolver;
    private final CompilerConfig config;
    private final DependencyExtractor extractor;
    private final ExpressionRenderer renderer;

    public FormulaCompiler(FunctionTable functions, FieldResolver resolver) {
        this(functions, resolver, CompilerConfig.defaults());
    }

    public FormulaCompiler(FunctionTable functions, FieldResolver resolver, CompilerConfig config) {
        this.functions = functions;
        this.resolver = resolver;
        this.config = config;
        this.extractor = new DependencyExtractor();
        this.renderer = new ExpressionRenderer(functions, config);
    }

    public FieldCompilation compile(CalculatedField field) {
        String formula = field.formula();
        if (formula != null && formula.length() > Constants.MAX_FORMULA_LENGTH) {
            return fail(field, null, new FieldError(FieldError.Kind.SYNTAX,
                "公式长度 " + formula.length() + " 超过限制 " + Constants.MAX_FORMULA_LENGTH,
                Constants.MAX_FORMULA_LENGTH));
        }
        FormulaDependencies dependencies = null;
        try {
            // 解析器持有游标状态，每个字段单独创建
            FormulaParser parser = new FormulaParser(functions, config);
            FormulaNode ast = parser.parse(formula, field.computeUsing());
            dependencies = extractor.extract(ast);
            RenderedExpression rendered = renderer.render(ast, resolver, config.getTableContext(),
                field.viewDimensions());
            if (dependencies.maxDepth() > config.getComplexityWarningDepth()) {
                List<String> warnings = new ArrayList<>(rendered.warnings());
                warnings.add("公式嵌套深度 " + dependencies.maxDepth() + " 超过 "
                    + config.getComplexityWarningDepth() + "，建议拆分为多个计算字段");
                rendered = new RenderedExpression(rendered.text(), warnings);
            }
            logger.debug("字段 {} 编译完成: {}", field.id(), rendered.text());
            return FieldCompilation.success(field.id(), rendered, dependencies);
        } catch (FormulaLexException exception) {
            return fail(field, null, new FieldError(FieldError.Kind.LEX, exception.getMessage(), exception.getOffset()));
        } catch (FormulaParseException exception) {
            return fail(field, null,
                new FieldError(FieldError.Kind.SYNTAX, exception.getMessage(), exception.getOffset()));
        } catch (UnresolvedReferenceException exception) {
            return fail(field, dependencies,
                new FieldError(FieldError.Kind.UNRESOLVED_REFERENCE, exception.getMessage()));
        } catch (UnsupportedConstructException exception) {
            return fail(field, dependencies,
                new FieldError(FieldError.Kind.UNSUPPORTED_CONSTRUCT, exception.getMessage()));
        } catch (RuntimeException exception) {
            logger.error("字段 {} 编译时发生内部错误", field.id(), exception);
            return FieldCompilation.failure(field.id(), dependencies,
                new FieldError(FieldError.Kind.INTERNAL, String.valueOf(exception.getMessage())));
        } catch (StackOverflowError error) {
            // 调用栈耗尽按语法错误报告
            return fail(field, dependencies, new FieldError(FieldError.Kind.SYNTAX,
                "公式嵌套过深，超出调用栈容量，请拆分为多个计算字段"));
        }
    }

    private FieldCompilation fail(CalculatedField field, FormulaDependencies dependencies, FieldError error) {
        logger.warn("字段 {} 编译失败 [{}]: {}", field.id(), error.kind(), error.message());
        return FieldCompilation.failure(field.id(), dependencies, error);
    }
}
