package com.calcbridge.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.calcbridge.config.CompilerConfig;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FormulaParserTest {

    private static final Set<String> KNOWN = Set.of("SUM", "AVG", "MIN", "MAX", "UPPER", "LEN", "ZN");

    /** 测试用函数注册表，UPPER 返回字符串 */
    private static final FunctionRegistry REGISTRY = new FunctionRegistry() {
        @Override
        public boolean isKnown(String name) {
            return KNOWN.contains(name.toUpperCase(Locale.ROOT));
        }

        @Override
        public boolean returnsString(String name) {
            return "UPPER".equalsIgnoreCase(name);
        }
    };

    private FormulaNode parse(String formula) {
        return new FormulaParser(REGISTRY).parse(formula);
    }

    private static FormulaNode.Literal integer(long value) {
        return new FormulaNode.Literal(value, FormulaNode.DataType.INTEGER);
    }

    private static FormulaNode.Literal string(String value) {
        return new FormulaNode.Literal(value, FormulaNode.DataType.STRING);
    }

    private static FormulaNode sumOf(String field) {
        return new FormulaNode.FunctionCall("SUM", List.of(new FormulaNode.FieldRef(field)));
    }

    @Test
    @DisplayName("乘法优先于加法")
    void testPrecedence() {
        FormulaNode expected = new FormulaNode.Binary(FormulaNode.BinaryOp.ADD, integer(1),
            new FormulaNode.Binary(FormulaNode.BinaryOp.MULTIPLY, integer(2), integer(3)));

        assertEquals(expected, parse("1 + 2 * 3"));
    }

    @Test
    void testLeftAssociativeSubtraction() {
        FormulaNode expected = new FormulaNode.Binary(FormulaNode.BinaryOp.SUBTRACT,
            new FormulaNode.Binary(FormulaNode.BinaryOp.SUBTRACT, integer(10), integer(3)), integer(2));

        assertEquals(expected, parse("10 - 3 - 2"));
    }

    @Test
    void testPowerIsRightAssociativeAndBindsTighterThanNegation() {
        assertEquals(new FormulaNode.Binary(FormulaNode.BinaryOp.POWER, integer(2),
                new FormulaNode.Binary(FormulaNode.BinaryOp.POWER, integer(3), integer(2))),
            parse("2 ^ 3 ^ 2"));
        assertEquals(new FormulaNode.Unary(FormulaNode.UnaryOp.NEGATE,
                new FormulaNode.Binary(FormulaNode.BinaryOp.POWER, integer(2), integer(2))),
            parse("-2 ^ 2"));
    }

    @Test
    void testLogicalPrecedence() {
        FormulaNode node = parse("NOT [a] = 1 OR [b] > 2 AND [c] < 3");

        FormulaNode.Binary or = assertInstanceOf(FormulaNode.Binary.class, node);
        assertEquals(FormulaNode.BinaryOp.OR, or.op());
        assertInstanceOf(FormulaNode.Unary.class, or.left());
        assertEquals(FormulaNode.BinaryOp.AND, assertInstanceOf(FormulaNode.Binary.class, or.right()).op());
    }

    @Test
    @DisplayName("简单条件表达式的语法树")
    void testSimpleConditional() {
        FormulaNode expected = new FormulaNode.Conditional(
            List.of(new FormulaNode.Branch(
                new FormulaNode.Binary(FormulaNode.BinaryOp.GT, new FormulaNode.FieldRef("Sales"), integer(1000)),
                string("High"))),
            string("Low"));

        assertEquals(expected, parse("IF [Sales] > 1000 THEN \"High\" ELSE \"Low\" END"));
    }

    @Test
    void testElseIfChainWithoutElse() {
        FormulaNode.Conditional conditional = assertInstanceOf(FormulaNode.Conditional.class,
            parse("IF [a] > 1 THEN 'x' ELSEIF [a] > 0 THEN 'y' END"));

        assertEquals(2, conditional.branches().size());
        assertNull(conditional.elseResult());
    }

    @Test
    @DisplayName("CASE 脱糖为等值比较，NULL 保持 = 语义")
    void testSimpleCaseDesugarsToEquality() {
        FormulaNode.Conditional conditional = assertInstanceOf(FormulaNode.Conditional.class,
            parse("CASE [Region] WHEN \"East\" THEN 1 WHEN NULL THEN 0 ELSE 2 END"));

        FormulaNode.Literal nullLiteral = new FormulaNode.Literal(null, FormulaNode.DataType.NULL);
        assertEquals(new FormulaNode.Binary(FormulaNode.BinaryOp.EQ, new FormulaNode.FieldRef("Region"),
            string("East")), conditional.branches().get(0).condition());
        assertEquals(new FormulaNode.Binary(FormulaNode.BinaryOp.EQ, new FormulaNode.FieldRef("Region"),
            nullLiteral), conditional.branches().get(1).condition());
        assertEquals(integer(2), conditional.elseResult());

        FormulaNode firstSubject = ((FormulaNode.Binary) conditional.branches().get(0).condition()).left();
        FormulaNode secondSubject = ((FormulaNode.Binary) conditional.branches().get(1).condition()).left();
        assertNotSame(firstSubject, secondSubject);
    }

    @Test
    void testSearchedCase() {
        FormulaNode.Conditional conditional = assertInstanceOf(FormulaNode.Conditional.class,
            parse("CASE WHEN [a] > 1 THEN 'big' WHEN [a] > 0 THEN 'small' END"));

        assertEquals(FormulaNode.BinaryOp.GT,
            assertInstanceOf(FormulaNode.Binary.class, conditional.branches().get(1).condition()).op());
        assertNull(conditional.elseResult());
    }

    @Test
    @DisplayName("LOD 表达式")
    void testFixedLod() {
        FormulaNode expected = new FormulaNode.LodExpression(FormulaNode.LodScope.FIXED, Set.of("Region"),
            sumOf("Sales"));

        assertEquals(expected, parse("{FIXED [Region] : SUM([Sales])}"));
    }

    @Test
    void testLodDimensionsKeepOrder() {
        FormulaNode.LodExpression lod = assertInstanceOf(FormulaNode.LodExpression.class,
            parse("{ include [Category], [Region], [Category] : AVG([Sales]) }"));

        assertEquals(FormulaNode.LodScope.INCLUDE, lod.scope());
        assertEquals(List.of("Category", "Region"), List.copyOf(lod.dimensions()));
    }

    @Test
    void testTableScopedLodIsFixedWithoutDimensions() {
        FormulaNode.LodExpression lod = assertInstanceOf(FormulaNode.LodExpression.class,
            parse("{SUM([Sales])}"));

        assertEquals(FormulaNode.LodScope.FIXED, lod.scope());
        assertTrue(lod.dimensions().isEmpty());
    }

    @Test
    void testLodWithExpressionDimensionIsUnsupported() {
        FormulaNode.Unsupported unsupported = assertInstanceOf(FormulaNode.Unsupported.class,
            parse("{FIXED [a] + [b] : SUM([c])}"));

        assertEquals("{FIXED [a] + [b] : SUM([c])}", unsupported.rawText());
    }

    @Test
    @DisplayName("未知函数在宽松模式下保留为 Unsupported")
    void testUnknownFunctionBecomesUnsupported() {
        FormulaNode expected = new FormulaNode.Binary(FormulaNode.BinaryOp.ADD,
            new FormulaNode.Unsupported("foo([Sales], 2)", "unknown function FOO, references [Sales]"), integer(1));

        assertEquals(expected, parse("foo([Sales], 2) + 1"));
    }

    @Test
    void testUnknownFunctionReasonListsReferencedFields() {
        FormulaNode.Unsupported unsupported = assertInstanceOf(FormulaNode.Unsupported.class,
            parse("FOO([Sales], [sum:Profit:qk], [Sales], 1)"));

        assertEquals("unknown function FOO, references [Sales], [Profit]", unsupported.reason());
        assertEquals("unknown function BAR",
            assertInstanceOf(FormulaNode.Unsupported.class, parse("BAR(1)")).reason());
    }

    @Test
    void testUnknownFunctionIsSyntaxErrorInStrictMode() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setPermissive(false);

        FormulaSyntaxException exception = assertThrows(FormulaSyntaxException.class,
            () -> new FormulaParser(REGISTRY, config).parse("1 + FOO([Sales])"));

        assertEquals("已注册的函数", exception.getExpected());
        assertEquals(4, exception.getOffset());
    }

    @Test
    void testFunctionNamesAreCaseInsensitive() {
        assertEquals(sumOf("Sales"), parse("sum([Sales])"));
    }

    @Test
    void testTrailingCommaIsSyntaxError() {
        FormulaSyntaxException exception = assertThrows(FormulaSyntaxException.class,
            () -> parse("SUM([Sales],)"));

        assertEquals("表达式", exception.getExpected());
        assertEquals(")", exception.getFound());
        assertEquals(12, exception.getOffset());
    }

    @Test
    void testMissingEndReportsEndOfFormula() {
        String formula = "IF [Sales] > 0 THEN 1";
        FormulaSyntaxException exception = assertThrows(FormulaSyntaxException.class, () -> parse(formula));

        assertEquals("END", exception.getExpected());
        assertEquals("", exception.getFound());
        assertEquals(formula.length(), exception.getOffset());
        assertTrue(exception.getMessage().contains("公式结尾"));
    }

    @Test
    void testUnbalancedParentheses() {
        assertEquals("')'", assertThrows(FormulaSyntaxException.class, () -> parse("(1 + 2")).getExpected());
        assertEquals("公式结尾", assertThrows(FormulaSyntaxException.class, () -> parse("1 + 2)")).getExpected());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "// only a comment"})
    void testEmptyFormulaIsSyntaxError(String formula) {
        assertEquals("表达式", assertThrows(FormulaSyntaxException.class, () -> parse(formula)).getExpected());
    }

    @Test
    void testBareIdentifierSuggestsBrackets() {
        FormulaSyntaxException exception = assertThrows(FormulaSyntaxException.class, () -> parse("Sales + 1"));

        assertTrue(exception.getExpected().contains("[Sales]"));
    }

    @Test
    @DisplayName("超过嵌套深度上限时报告语法错误")
    void testNestingDepthCap() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setMaxNestingDepth(10);
        String deep = "(".repeat(11) + "1" + ")".repeat(11);

        assertThrows(FormulaSyntaxException.class, () -> new FormulaParser(REGISTRY, config).parse(deep));
        assertEquals(integer(1), new FormulaParser(REGISTRY, config).parse("(((1)))"));
    }

    @ParameterizedTest
    @DisplayName("长运算链同样受嵌套深度上限约束")
    @ValueSource(strings = {"+1", " OR 1", " AND 1", "*1", " = 1", "-1"})
    void testFlatOperatorChainHitsDepthCap(String link) {
        String chain = "1" + link.repeat(30_000);

        FormulaSyntaxException exception = assertThrows(FormulaSyntaxException.class, () -> parse(chain));

        assertTrue(exception.getExpected().contains("嵌套深度"));
    }

    @Test
    void testOperatorChainWithinDepthCapParses() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setMaxNestingDepth(10);
        FormulaParser parser = new FormulaParser(REGISTRY, config);

        assertInstanceOf(FormulaNode.Binary.class, parser.parse("1" + "+1".repeat(9)));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("1" + "+1".repeat(10)));
    }

    @Test
    void testDefaultDepthCapPreventsStackExhaustion() {
        String deep = "-".repeat(5_000) + "1";

        assertThrows(FormulaSyntaxException.class, () -> parse(deep));
    }

    @Test
    void testStringConcatenationInference() {
        assertEquals(FormulaNode.BinaryOp.CONCAT,
            assertInstanceOf(FormulaNode.Binary.class, parse("\"Region: \" + [Region]")).op());
        assertEquals(FormulaNode.BinaryOp.CONCAT,
            assertInstanceOf(FormulaNode.Binary.class, parse("UPPER([a]) + [b]")).op());
        assertEquals(FormulaNode.BinaryOp.ADD,
            assertInstanceOf(FormulaNode.Binary.class, parse("[a] + [b]")).op());
    }

    @Test
    void testColumnInstanceReference() {
        assertEquals(new FormulaNode.FieldRef("Sales", FormulaNode.Aggregation.SUM), parse("[sum:Sales:qk]"));
        assertEquals(new FormulaNode.FieldRef("Customer", FormulaNode.Aggregation.COUNTD),
            parse("[ctd:Customer:nk]"));
        assertEquals(new FormulaNode.FieldRef("Region"), parse("[none:Region:nk]"));
        assertEquals(new FormulaNode.FieldRef("Sales:Total"), parse("[Sales:Total]"));
    }

    @Test
    void testLiterals() {
        assertEquals(new FormulaNode.Literal(new BigDecimal("1.50"), FormulaNode.DataType.REAL), parse("1.50"));
        assertEquals(new FormulaNode.Literal(Boolean.TRUE, FormulaNode.DataType.BOOLEAN), parse("true"));
        assertEquals(new FormulaNode.Literal(LocalDate.of(2024, 3, 1), FormulaNode.DataType.DATE),
            parse("#2024-03-01#"));
        assertEquals(new FormulaNode.Literal(LocalDateTime.of(2024, 3, 1, 10, 30), FormulaNode.DataType.DATETIME),
            parse("#2024-03-01 10:30:00#"));
        assertEquals(new FormulaNode.ParameterRef("Target"), parse("[Parameters].[Target]"));
    }

    @Test
    void testUnrecognizedDateIsUnsupported() {
        FormulaNode.Unsupported unsupported = assertInstanceOf(FormulaNode.Unsupported.class,
            parse("#March 1, 2024#"));

        assertEquals("#March 1, 2024#", unsupported.rawText());
    }

    @Test
    void testIntegerOverflowIsSyntaxError() {
        assertThrows(FormulaSyntaxException.class, () -> parse("99999999999999999999"));
    }

    @Test
    void testRunningSumCarriesPartitionHint() {
        FormulaNode node = new FormulaParser(REGISTRY).parse("RUNNING_SUM(SUM([Sales]))", List.of("Region"));

        assertEquals(new FormulaNode.WindowFunction(WindowKind.RUNNING_SUM, sumOf("Sales"), List.of("Region"),
            null, null), node);
    }

    @Test
    void testWindowRangeArguments() {
        FormulaNode.WindowFunction relative = assertInstanceOf(FormulaNode.WindowFunction.class,
            parse("WINDOW_AVG(SUM([Sales]), -2, 0)"));
        FormulaNode.WindowFunction anchored = assertInstanceOf(FormulaNode.WindowFunction.class,
            parse("WINDOW_SUM(SUM([Sales]), FIRST(), LAST() - 1)"));

        assertEquals(new WindowRange(WindowBound.relative(-2), WindowBound.relative(0)), relative.range());
        assertEquals(new WindowRange(WindowBound.first(), new WindowBound(WindowBound.Anchor.LAST, -1)),
            anchored.range());
    }

    @Test
    void testRankSortDirection() {
        FormulaNode.WindowFunction rank = assertInstanceOf(FormulaNode.WindowFunction.class,
            parse("RANK_DENSE(SUM([Sales]), 'asc')"));

        assertEquals(FormulaNode.SortDirection.ASC, rank.sortDirection());
        assertNull(assertInstanceOf(FormulaNode.WindowFunction.class, parse("RANK(SUM([Sales]))")).sortDirection());
        assertThrows(FormulaSyntaxException.class, () -> parse("RANK(SUM([Sales]), 'up')"));
    }

    @Test
    void testLookupAndPositionFunctions() {
        FormulaNode.WindowFunction lookup = assertInstanceOf(FormulaNode.WindowFunction.class,
            parse("LOOKUP(SUM([Sales]), -1)"));
        FormulaNode.WindowFunction index = assertInstanceOf(FormulaNode.WindowFunction.class, parse("INDEX()"));

        assertEquals(WindowRange.single(WindowBound.relative(-1)), lookup.range());
        assertEquals(WindowKind.INDEX, index.kind());
        assertNull(index.target());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "INDEX(1)",
        "RUNNING_SUM()",
        "WINDOW_SUM(SUM([a]), 1)",
        "LOOKUP(SUM([a]))",
        "LOOKUP(SUM([a]), [b])",
        "WINDOW_MAX(SUM([a]), INDEX(), 0)"
    })
    void testWindowArityViolations(String formula) {
        assertThrows(FormulaSyntaxException.class, () -> parse(formula));
    }

    @Test
    void testParseClassifiedTokens() {
        String formula = "IF [a] > 1 THEN ZN([b]) ELSE 0 END";
        List<ClassifiedToken> tokens = new TokenClassifier().classify(new FormulaLexer().tokenize(formula));

        assertEquals(parse(formula), new FormulaParser(REGISTRY).parse(tokens));
    }

    @Test
    void testParseIsDeterministic() {
        String formula = "{FIXED [Region] : SUM([Sales])} / TOTAL(SUM([Sales])) + LEN(UPPER([Name]))";

        assertEquals(parse(formula), parse(formula));
    }
}
