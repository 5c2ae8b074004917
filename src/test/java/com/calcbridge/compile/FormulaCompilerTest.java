package com.calcbridge.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.calcbridge.config.CompilerConfig;
import com.calcbridge.config.Constants;
import com.calcbridge.render.FieldNameMapper;
import com.calcbridge.render.FunctionTable;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FormulaCompilerTest {

    private static FunctionTable functions;
    private static FieldNameMapper resolver;

    @BeforeAll
    static void setUp() {
        functions = FunctionTable.loadDefault();
        resolver = FieldNameMapper.builder()
            .register("Sales", "sales")
            .register("Region", "region")
            .register("Customer", "customer")
            .build();
    }

    private FieldCompilation compile(String formula) {
        return new FormulaCompiler(functions, resolver).compile(new CalculatedField("calc", formula));
    }

    @Test
    void testSuccessfulCompilation() {
        FieldCompilation result = compile("IF [Sales] > 1000 THEN \"High\" ELSE \"Low\" END");

        assertTrue(result.isSuccess());
        assertFalse(result.isPartial());
        assertEquals("calc", result.fieldId());
        assertEquals("CASE WHEN (${TABLE}.sales > 1000) THEN 'High' ELSE 'Low' END", result.expression().text());
        assertEquals(Set.of("Sales"), result.dependencies().fieldNames());
        assertNull(result.error());
    }

    @Test
    void testLexErrorCarriesOffset() {
        FieldCompilation result = compile("[Sales] + \"open");

        assertFalse(result.isSuccess());
        assertEquals(FieldError.Kind.LEX, result.error().kind());
        assertEquals(10, result.error().offset());
        assertNull(result.dependencies());
    }

    @Test
    void testSyntaxErrorCarriesOffset() {
        FieldCompilation result = compile("IF [Sales] THEN 1");

        assertEquals(FieldError.Kind.SYNTAX, result.error().kind());
        assertEquals(17, result.error().offset());
        assertTrue(result.error().message().contains("END"));
    }

    @Test
    void testUnresolvedReferenceKeepsDependencies() {
        FieldCompilation result = compile("[Unmapped Field] * 2");

        assertEquals(FieldError.Kind.UNRESOLVED_REFERENCE, result.error().kind());
        assertEquals(-1, result.error().offset());
        assertNotNull(result.dependencies());
        assertEquals(Set.of("Unmapped Field"), result.dependencies().fieldNames());
        assertNull(result.expression());
    }

    @Test
    void testUnknownFunctionIsPartialSuccess() {
        FieldCompilation result = compile("FOO([Sales]) + 1");

        assertTrue(result.isSuccess());
        assertTrue(result.isPartial());
        assertTrue(result.dependencies().hasUnsupported());
        assertEquals(1, result.expression().warnings().size());
    }

    @Test
    void testFailOnUnsupported() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setFailOnUnsupported(true);

        FieldCompilation result = new FormulaCompiler(functions, resolver, config)
            .compile(new CalculatedField("calc", "DATEDIFF('day', [Sales], [Sales])"));

        assertEquals(FieldError.Kind.UNSUPPORTED_CONSTRUCT, result.error().kind());
        assertTrue(result.error().message().startsWith("DATEDIFF"));
    }

    @Test
    void testStrictModeUnknownFunctionIsSyntaxError() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setPermissive(false);

        FieldCompilation result = new FormulaCompiler(functions, resolver, config)
            .compile(new CalculatedField("calc", "FOO([Sales])"));

        assertEquals(FieldError.Kind.SYNTAX, result.error().kind());
        assertEquals(0, result.error().offset());
    }

    @Test
    void testComplexityWarning() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setComplexityWarningDepth(2);

        FieldCompilation result = new FormulaCompiler(functions, resolver, config)
            .compile(new CalculatedField("calc", "1 + 2 * 3"));

        assertTrue(result.isSuccess());
        assertEquals(1, result.expression().warnings().size());
        assertTrue(result.expression().warnings().get(0).contains("3"));
    }

    @Test
    void testFormulaLengthLimit() {
        String formula = "1+".repeat(Constants.MAX_FORMULA_LENGTH / 2) + "1";

        FieldCompilation result = compile(formula);

        assertEquals(FieldError.Kind.SYNTAX, result.error().kind());
        assertEquals(Constants.MAX_FORMULA_LENGTH, result.error().offset());
    }

    @Test
    void testNullFormulaIsLexError() {
        assertEquals(FieldError.Kind.LEX, compile(null).error().kind());
    }

    @Test
    void testComputeUsingBecomesWindowPartition() {
        FieldCompilation result = new FormulaCompiler(functions, resolver).compile(
            new CalculatedField("running", "Running", "RUNNING_SUM(SUM([Sales]))", "real", List.of("Region")));

        assertTrue(result.expression().text().contains("PARTITION BY ${TABLE}.region"));
        assertEquals(Set.of("Sales", "Region"), result.dependencies().fieldNames());
    }

    @Test
    @DisplayName("长运算链报告为语法错误而不是耗尽调用栈")
    void testFlatOperatorChainIsSyntaxError() {
        String formula = "1" + "+1".repeat(30_000);

        FieldCompilation result = compile(formula);

        assertFalse(result.isSuccess());
        assertEquals(FieldError.Kind.SYNTAX, result.error().kind());
        assertTrue(result.error().message().contains("嵌套深度"));
    }

    @Test
    void testStackExhaustionIsReportedAsSyntaxError() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setMaxNestingDepth(Integer.MAX_VALUE);
        String formula = "(".repeat(30_000) + "1" + ")".repeat(30_000);

        FieldCompilation result = new FormulaCompiler(functions, resolver, config)
            .compile(new CalculatedField("deep", formula));

        assertEquals(FieldError.Kind.SYNTAX, result.error().kind());
        assertTrue(result.error().message().contains("嵌套过深"));
    }

    @Test
    void testIncludeUsesViewDimensions() {
        FieldCompilation result = new FormulaCompiler(functions, resolver).compile(new CalculatedField(
            "include", "Include", "{INCLUDE [Customer] : SUM([Sales])}", null, List.of(), List.of("Region")));

        assertEquals("SUM(${TABLE}.sales) OVER (PARTITION BY ${TABLE}.region, ${TABLE}.customer)",
            result.expression().text());
        assertTrue(result.expression().warnings().isEmpty());
    }

    @Test
    void testExcludeUsesViewDimensions() {
        FieldCompilation result = new FormulaCompiler(functions, resolver).compile(new CalculatedField(
            "exclude", "Exclude", "{EXCLUDE [Customer] : SUM([Sales])}", null, List.of(),
            List.of("Region", "Customer")));

        assertEquals("SUM(${TABLE}.sales) OVER (PARTITION BY ${TABLE}.region)", result.expression().text());
        assertTrue(result.expression().warnings().isEmpty());
    }

    @Test
    void testScopedLodWithoutViewDimensionsWarns() {
        FieldCompilation include = compile("{INCLUDE [Customer] : SUM([Sales])}");
        FieldCompilation fixed = compile("{FIXED [Customer] : SUM([Sales])}");

        assertEquals(fixed.expression().text(), include.expression().text());
        assertTrue(include.isPartial());
        assertFalse(fixed.isPartial());
        assertTrue(include.expression().warnings().get(0).contains("缺少视图维度上下文"));
    }
}
