package com.calcbridge.formula;

import com.calcbridge.config.CompilerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 递归下降 + 优先级爬升的公式解析器。
 * <p>
 * 实例持有单次解析的状态，不可跨线程共享；每个公式使用新的实例或顺序调用。
 */
public class FormulaParser {
    private static final Logger logger = LoggerFactory.getLogger(FormulaParser.class);

    private static final Set<String> COMPARISON_OPERATORS = Set.of("=", "<>", "<", ">", "<=", ">=");

    /** 列实例引用 [sum:Sales:qk] 的聚合前缀 */
    private static final Pattern COLUMN_INSTANCE = Pattern.compile(
            "^(sum|avg|cnt|ctd|min|max|med|attr|none|usr):(.+):(qk|nk|ok)$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, FormulaNode.Aggregation> AGGREGATION_PREFIXES = Map.of(
            "sum", FormulaNode.Aggregation.SUM,
            "avg", FormulaNode.Aggregation.AVG,
            "cnt", FormulaNode.Aggregation.COUNT,
            "ctd", FormulaNode.Aggregation.COUNTD,
            "min", FormulaNode.Aggregation.MIN,
            "max", FormulaNode.Aggregation.MAX,
            "med", FormulaNode.Aggregation.MEDIAN,
            "attr", FormulaNode.Aggregation.ATTR);

    private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private final FunctionRegistry registry;
    private final boolean permissive;
    private final int maxNestingDepth;

    private List<ClassifiedToken> tokens;
    private int pos;
    private int depth;
    private String source;
    private List<String> partitionHint;

    public FormulaParser(FunctionRegistry registry) {
        this(registry, CompilerConfig.defaults());
    }

    public FormulaParser(FunctionRegistry registry, CompilerConfig config) {
        this.registry = registry;
        this.permissive = config.isPermissive();
        this.maxNestingDepth = config.getMaxNestingDepth();
    }

    /**
     * 对公式文本执行词法分析、分类与解析。
     */
    public FormulaNode parse(String formula) {
        return parse(formula, List.of());
    }

    /**
     * 解析公式，partitionHint 为字段的表计算分区维度，写入其中的窗口函数节点。
     */
    public FormulaNode parse(String formula, List<String> partitionHint) {
        List<LexToken> lexTokens = new FormulaLexer().tokenize(formula);
        List<ClassifiedToken> classified = new TokenClassifier().classify(lexTokens);
        return parseTokens(classified, formula, partitionHint);
    }

    /**
     * 解析已分类的 token 序列，源文本按 token 偏移重建。
     */
    public FormulaNode parse(List<ClassifiedToken> classifiedTokens) {
        return parseTokens(classifiedTokens, rebuildSource(classifiedTokens), List.of());
    }

    private FormulaNode parseTokens(List<ClassifiedToken> classifiedTokens, String formula, List<String> hint) {
        this.tokens = classifiedTokens;
        this.pos = 0;
        this.depth = 0;
        this.source = formula;
        this.partitionHint = List.copyOf(hint);

        if (current().is(TokenType.EOF)) {
            throw syntaxError("表达式", current());
        }
        FormulaNode root = parseExpression();
        if (!current().is(TokenType.EOF)) {
            throw syntaxError("公式结尾", current());
        }
        return root;
    }

    /**
     * 表达式入口，每进入一层嵌套都计入深度。
     */
    private FormulaNode parseExpression() {
        enterNesting();
        try {
            return parseOr();
        } finally {
            depth--;
        }
    }

    /**
     * 解析 OR 层级，优先级最低。
     * <p>
     * 左结合的运算链每多一个运算符，语法树就深一层，循环中的每次迭代同样计入嵌套深度。
     */
    private FormulaNode parseOr() {
        int entered = depth;
        try {
            FormulaNode left = parseAnd();
            while (matchKeyword("OR")) {
                enterNesting();
                FormulaNode right = parseAnd();
                left = new FormulaNode.Binary(FormulaNode.BinaryOp.OR, left, right);
            }
            return left;
        } finally {
            depth = entered;
        }
    }

    private FormulaNode parseAnd() {
        int entered = depth;
        try {
            FormulaNode left = parseNot();
            while (matchKeyword("AND")) {
                enterNesting();
                FormulaNode right = parseNot();
                left = new FormulaNode.Binary(FormulaNode.BinaryOp.AND, left, right);
            }
            return left;
        } finally {
            depth = entered;
        }
    }

    /**
     * 解析前缀 NOT，可连续叠加。
     */
    private FormulaNode parseNot() {
        if (matchKeyword("NOT")) {
            enterNesting();
            try {
                return new FormulaNode.Unary(FormulaNode.UnaryOp.NOT, parseNot());
            } finally {
                depth--;
            }
        }
        return parseComparison();
    }

    private FormulaNode parseComparison() {
        int entered = depth;
        try {
            FormulaNode left = parseAdditive();
            while (current().is(TokenType.OPERATOR) && COMPARISON_OPERATORS.contains(current().text())) {
                FormulaNode.BinaryOp op = comparisonOp(advance().text());
                enterNesting();
                FormulaNode right = parseAdditive();
                left = new FormulaNode.Binary(op, left, right);
            }
            return left;
        } finally {
            depth = entered;
        }
    }

    /**
     * 解析加减层级；任一侧静态可判定为字符串时 + 解析为拼接。
     */
    private FormulaNode parseAdditive() {
        int entered = depth;
        try {
            FormulaNode left = parseMultiplicative();
            while (current().isOperator("+") || current().isOperator("-")) {
                boolean plus = advance().text().equals("+");
                enterNesting();
                FormulaNode right = parseMultiplicative();
                FormulaNode.BinaryOp op;
                if (!plus) {
                    op = FormulaNode.BinaryOp.SUBTRACT;
                } else if (isStringTyped(left) || isStringTyped(right)) {
                    op = FormulaNode.BinaryOp.CONCAT;
                } else {
                    op = FormulaNode.BinaryOp.ADD;
                }
                left = new FormulaNode.Binary(op, left, right);
            }
            return left;
        } finally {
            depth = entered;
        }
    }

    private FormulaNode parseMultiplicative() {
        int entered = depth;
        try {
            FormulaNode left = parseUnary();
            while (true) {
                FormulaNode.BinaryOp op;
                if (current().isOperator("*")) {
                    op = FormulaNode.BinaryOp.MULTIPLY;
                } else if (current().isOperator("/")) {
                    op = FormulaNode.BinaryOp.DIVIDE;
                } else if (current().isOperator("%")) {
                    op = FormulaNode.BinaryOp.MODULO;
                } else {
                    break;
                }
                advance();
                enterNesting();
                FormulaNode right = parseUnary();
                left = new FormulaNode.Binary(op, left, right);
            }
            return left;
        } finally {
            depth = entered;
        }
    }

    private FormulaNode parseUnary() {
        if (current().isOperator("-")) {
            advance();
            enterNesting();
            try {
                return new FormulaNode.Unary(FormulaNode.UnaryOp.NEGATE, parseUnary());
            } finally {
                depth--;
            }
        }
        return parsePower();
    }

    /**
     * 解析 ^ 幂运算，右结合，指数允许带负号。
     */
    private FormulaNode parsePower() {
        FormulaNode base = parsePrimary();
        if (current().isOperator("^")) {
            advance();
            enterNesting();
            try {
                return new FormulaNode.Binary(FormulaNode.BinaryOp.POWER, base, parseUnary());
            } finally {
                depth--;
            }
        }
        return base;
    }

    /**
     * 解析基础表达式：分组、字面量、引用、条件块、LOD 与函数调用。
     */
    private FormulaNode parsePrimary() {
        ClassifiedToken token = current();
        switch (token.type()) {
            case LPAREN -> {
                advance();
                FormulaNode grouped = parseExpression();
                expect(TokenType.RPAREN, "')'");
                return grouped;
            }
            case STRING_LITERAL -> {
                advance();
                return new FormulaNode.Literal(token.text(), FormulaNode.DataType.STRING);
            }
            case INTEGER_LITERAL -> {
                advance();
                return integerLiteral(token);
            }
            case REAL_LITERAL -> {
                advance();
                return new FormulaNode.Literal(new BigDecimal(token.text()), FormulaNode.DataType.REAL);
            }
            case DATE_LITERAL -> {
                advance();
                return dateLiteral(token);
            }
            case BOOLEAN_LITERAL -> {
                advance();
                return new FormulaNode.Literal(Boolean.valueOf(token.text().equals("TRUE")), FormulaNode.DataType.BOOLEAN);
            }
            case NULL_LITERAL -> {
                advance();
                return new FormulaNode.Literal(null, FormulaNode.DataType.NULL);
            }
            case FIELD_REF -> {
                advance();
                return fieldReference(token.text());
            }
            case PARAMETER_REF -> {
                advance();
                return new FormulaNode.ParameterRef(token.text());
            }
            case KEYWORD -> {
                if (token.isKeyword("IF")) {
                    return parseIf();
                }
                if (token.isKeyword("CASE")) {
                    return parseCase();
                }
                throw syntaxError("表达式", token);
            }
            case LBRACE -> {
                return parseLod();
            }
            case FUNCTION_NAME -> {
                return parseFunctionCall();
            }
            case BARE_IDENTIFIER -> throw syntaxError("字段引用 [" + token.text() + "] 或函数调用", token);
            default -> throw syntaxError("表达式", token);
        }
    }

    /**
     * 解析 IF ... THEN ... [ELSEIF ... THEN ...]* [ELSE ...] END。
     */
    private FormulaNode parseIf() {
        advance();
        List<FormulaNode.Branch> branches = new ArrayList<>();
        FormulaNode condition = parseExpression();
        expectKeyword("THEN");
        branches.add(new FormulaNode.Branch(condition, parseExpression()));
        while (matchKeyword("ELSEIF")) {
            FormulaNode elseIfCondition = parseExpression();
            expectKeyword("THEN");
            branches.add(new FormulaNode.Branch(elseIfCondition, parseExpression()));
        }
        FormulaNode elseResult = matchKeyword("ELSE") ? parseExpression() : null;
        expectKeyword("END");
        return new FormulaNode.Conditional(branches, elseResult);
    }

    /**
     * 解析 CASE 块。简单形式 CASE x WHEN v THEN r 脱糖为 x = v 条件分支，搜索形式 CASE WHEN c THEN r 直接作为分支。
     */
    private FormulaNode parseCase() {
        advance();
        List<FormulaNode.Branch> branches = new ArrayList<>();
        if (current().isKeyword("WHEN")) {
            while (matchKeyword("WHEN")) {
                FormulaNode condition = parseExpression();
                expectKeyword("THEN");
                branches.add(new FormulaNode.Branch(condition, parseExpression()));
            }
        } else {
            FormulaNode subject = parseExpression();
            expectKeyword("WHEN");
            do {
                FormulaNode value = parseExpression();
                expectKeyword("THEN");
                FormulaNode result = parseExpression();
                // 每个分支持有主体表达式的独立副本
                FormulaNode branchSubject = branches.isEmpty() ? subject : NodeCopier.copy(subject);
                FormulaNode condition = new FormulaNode.Binary(FormulaNode.BinaryOp.EQ, branchSubject, value);
                branches.add(new FormulaNode.Branch(condition, result));
            } while (matchKeyword("WHEN"));
        }
        FormulaNode elseResult = matchKeyword("ELSE") ? parseExpression() : null;
        expectKeyword("END");
        return new FormulaNode.Conditional(branches, elseResult);
    }

    /**
     * 解析 {SCOPE [d1], [d2] : agg} 与表级 {agg}。
     */
    private FormulaNode parseLod() {
        ClassifiedToken open = advance();
        if (!current().is(TokenType.LOD_SCOPE)) {
            FormulaNode aggregation = parseExpression();
            expect(TokenType.RBRACE, "'}'");
            return new FormulaNode.LodExpression(FormulaNode.LodScope.FIXED, Set.of(), aggregation);
        }

        FormulaNode.LodScope scope = FormulaNode.LodScope.valueOf(advance().text());
        Set<String> dimensions = new LinkedHashSet<>();
        boolean plainDimensions = true;
        if (!current().is(TokenType.COLON)) {
            do {
                FormulaNode dimension = parseExpression();
                if (dimension instanceof FormulaNode.FieldRef fieldRef && fieldRef.aggregation() == null) {
                    dimensions.add(fieldRef.name());
                } else {
                    plainDimensions = false;
                }
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.COLON, "':'");
        FormulaNode aggregation = parseExpression();
        ClassifiedToken close = expect(TokenType.RBRACE, "'}'");

        if (!plainDimensions) {
            return new FormulaNode.Unsupported(sourceBetween(open, close), "LOD dimension is not a plain field reference");
        }
        return new FormulaNode.LodExpression(scope, dimensions, aggregation);
    }

    /**
     * 解析函数调用；未注册函数在宽松模式下按结构解析后包装为 Unsupported。
     */
    private FormulaNode parseFunctionCall() {
        int start = pos;
        ClassifiedToken nameToken = advance();
        String name = nameToken.text();
        Optional<WindowKind> windowKind = WindowKind.fromName(name);
        expect(TokenType.LPAREN, "'('");
        List<FormulaNode> args = parseArguments();
        ClassifiedToken close = previous();

        if (windowKind.isPresent()) {
            return windowFunction(windowKind.get(), nameToken, close, args);
        }
        if (registry.isKnown(name)) {
            return new FormulaNode.FunctionCall(name, args);
        }
        if (!permissive) {
            throw syntaxError("已注册的函数", nameToken);
        }
        Set<String> referenced = new LinkedHashSet<>();
        for (int index = start; index < pos; index++) {
            ClassifiedToken token = tokens.get(index);
            if (token.is(TokenType.FIELD_REF)) {
                referenced.add("[" + fieldReference(token.text()).name() + "]");
            }
        }
        logger.debug("未知函数 {} 位于偏移 {}，保留为 Unsupported 节点，参数引用字段 {}", name, nameToken.offset(), referenced);
        String reason = "unknown function " + name;
        if (!referenced.isEmpty()) {
            reason += ", references " + String.join(", ", referenced);
        }
        return new FormulaNode.Unsupported(sourceBetween(nameToken, close), reason);
    }

    /**
     * 解析左括号之后的逗号分隔参数列表，消费右括号。
     */
    private List<FormulaNode> parseArguments() {
        List<FormulaNode> args = new ArrayList<>();
        if (match(TokenType.RPAREN)) {
            return args;
        }
        while (true) {
            args.add(parseExpression());
            if (match(TokenType.COMMA)) {
                continue;
            }
            expect(TokenType.RPAREN, "',' 或 ')'");
            return args;
        }
    }

    /**
     * 按窗口函数的参数形态校验并构造节点。
     */
    private FormulaNode windowFunction(WindowKind kind, ClassifiedToken nameToken, ClassifiedToken close,
                                       List<FormulaNode> args) {
        String call = sourceBetween(nameToken, close);
        switch (kind.shape()) {
            case POSITION -> {
                requireArity(args, 0, 0, nameToken, call);
                return new FormulaNode.WindowFunction(kind, null, partitionHint, null, null);
            }
            case RUNNING, TOTAL, PREVIOUS -> {
                requireArity(args, 1, 1, nameToken, call);
                return new FormulaNode.WindowFunction(kind, args.get(0), partitionHint, null, null);
            }
            case WINDOW -> {
                if (args.size() != 1 && args.size() != 3) {
                    throw new FormulaSyntaxException("1 个或 3 个参数", call, nameToken.offset(), source);
                }
                WindowRange range = args.size() == 3
                        ? new WindowRange(toBound(args.get(1), nameToken, call), toBound(args.get(2), nameToken, call))
                        : null;
                return new FormulaNode.WindowFunction(kind, args.get(0), partitionHint, null, range);
            }
            case RANK -> {
                requireArity(args, 1, 2, nameToken, call);
                FormulaNode.SortDirection direction = args.size() == 2
                        ? toSortDirection(args.get(1), nameToken, call)
                        : null;
                return new FormulaNode.WindowFunction(kind, args.get(0), partitionHint, direction, null);
            }
            case LOOKUP -> {
                requireArity(args, 2, 2, nameToken, call);
                WindowRange range = WindowRange.single(toBound(args.get(1), nameToken, call));
                return new FormulaNode.WindowFunction(kind, args.get(0), partitionHint, null, range);
            }
            default -> throw new IllegalStateException("未处理的窗口函数形态: " + kind.shape());
        }
    }

    private void requireArity(List<FormulaNode> args, int min, int max, ClassifiedToken nameToken, String call) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? min + " 个参数" : min + " 到 " + max + " 个参数";
            throw new FormulaSyntaxException(expected, call, nameToken.offset(), source);
        }
    }

    /**
     * 将窗口偏移参数转换为边界：整数（可带负号）、FIRST()、LAST() 及其加减整数。
     */
    private WindowBound toBound(FormulaNode node, ClassifiedToken nameToken, String call) {
        Integer offset = integerValue(node);
        if (offset != null) {
            return WindowBound.relative(offset);
        }
        if (node instanceof FormulaNode.WindowFunction anchor) {
            WindowBound bound = anchorBound(anchor, 0);
            if (bound != null) {
                return bound;
            }
        }
        if (node instanceof FormulaNode.Binary binary
                && (binary.op() == FormulaNode.BinaryOp.ADD || binary.op() == FormulaNode.BinaryOp.SUBTRACT)
                && binary.left() instanceof FormulaNode.WindowFunction anchor) {
            Integer delta = integerValue(binary.right());
            if (delta != null) {
                WindowBound bound = anchorBound(anchor, binary.op() == FormulaNode.BinaryOp.ADD ? delta : -delta);
                if (bound != null) {
                    return bound;
                }
            }
        }
        throw new FormulaSyntaxException("整数偏移或 FIRST()/LAST()", call, nameToken.offset(), source);
    }

    private WindowBound anchorBound(FormulaNode.WindowFunction anchor, int offset) {
        if (anchor.kind() == WindowKind.FIRST) {
            return new WindowBound(WindowBound.Anchor.FIRST, offset);
        }
        if (anchor.kind() == WindowKind.LAST) {
            return new WindowBound(WindowBound.Anchor.LAST, offset);
        }
        return null;
    }

    private Integer integerValue(FormulaNode node) {
        if (node instanceof FormulaNode.Literal literal && literal.dataType() == FormulaNode.DataType.INTEGER) {
            long value = (Long) literal.value();
            return value > Integer.MAX_VALUE ? null : (int) value;
        }
        if (node instanceof FormulaNode.Unary unary && unary.op() == FormulaNode.UnaryOp.NEGATE) {
            Integer inner = integerValue(unary.operand());
            return inner == null ? null : -inner;
        }
        return null;
    }

    private FormulaNode.SortDirection toSortDirection(FormulaNode node, ClassifiedToken nameToken, String call) {
        if (node instanceof FormulaNode.Literal literal && literal.dataType() == FormulaNode.DataType.STRING) {
            String direction = ((String) literal.value()).trim().toUpperCase(Locale.ROOT);
            if (direction.equals("ASC") || direction.equals("DESC")) {
                return FormulaNode.SortDirection.valueOf(direction);
            }
        }
        throw new FormulaSyntaxException("'asc' 或 'desc'", call, nameToken.offset(), source);
    }

    /**
     * 解析字段引用，识别 [sum:Sales:qk] 形式的预聚合列实例。
     */
    private FormulaNode.FieldRef fieldReference(String text) {
        Matcher matcher = COLUMN_INSTANCE.matcher(text);
        if (!matcher.matches()) {
            return new FormulaNode.FieldRef(text);
        }
        String prefix = matcher.group(1).toLowerCase(Locale.ROOT);
        return new FormulaNode.FieldRef(matcher.group(2), AGGREGATION_PREFIXES.get(prefix));
    }

    private FormulaNode integerLiteral(ClassifiedToken token) {
        try {
            return new FormulaNode.Literal(Long.parseLong(token.text()), FormulaNode.DataType.INTEGER);
        } catch (NumberFormatException exception) {
            throw new FormulaSyntaxException("64 位范围内的整数", token.lexeme(), token.offset(), source);
        }
    }

    /**
     * 解析 #yyyy-MM-dd# 与 #yyyy-MM-dd HH:mm:ss#，其他日期写法保留为 Unsupported。
     */
    private FormulaNode dateLiteral(ClassifiedToken token) {
        String text = token.text();
        try {
            if (text.length() <= 10) {
                return new FormulaNode.Literal(LocalDate.parse(text), FormulaNode.DataType.DATE);
            }
            return new FormulaNode.Literal(LocalDateTime.parse(text.replace('T', ' '), DATETIME_FORMAT),
                    FormulaNode.DataType.DATETIME);
        } catch (DateTimeParseException exception) {
            logger.debug("无法识别的日期字面量 {}: {}", token.lexeme(), exception.getMessage());
            return new FormulaNode.Unsupported(token.lexeme(), "unrecognized date literal");
        }
    }

    /**
     * 静态判断表达式是否产生字符串。
     */
    private boolean isStringTyped(FormulaNode node) {
        if (node instanceof FormulaNode.Literal literal) {
            return literal.dataType() == FormulaNode.DataType.STRING;
        }
        if (node instanceof FormulaNode.Binary binary) {
            return binary.op() == FormulaNode.BinaryOp.CONCAT;
        }
        if (node instanceof FormulaNode.FunctionCall functionCall) {
            return registry.returnsString(functionCall.name());
        }
        return false;
    }

    private FormulaNode.BinaryOp comparisonOp(String operator) {
        return switch (operator) {
            case "=" -> FormulaNode.BinaryOp.EQ;
            case "<>" -> FormulaNode.BinaryOp.NE;
            case "<" -> FormulaNode.BinaryOp.LT;
            case ">" -> FormulaNode.BinaryOp.GT;
            case "<=" -> FormulaNode.BinaryOp.LE;
            case ">=" -> FormulaNode.BinaryOp.GE;
            default -> throw new IllegalStateException("未知比较运算符: " + operator);
        };
    }

    private void enterNesting() {
        depth++;
        if (depth > maxNestingDepth) {
            throw new FormulaSyntaxException("嵌套深度不超过 " + maxNestingDepth, current().lexeme(),
                    current().offset(), source);
        }
    }

    private String sourceBetween(ClassifiedToken from, ClassifiedToken to) {
        int end = Math.min(to.endOffset(), source.length());
        return source.substring(from.offset(), end);
    }

    /**
     * 按 token 偏移重建源文本，token 之间的空白与注释以空格填充。
     */
    private static String rebuildSource(List<ClassifiedToken> classifiedTokens) {
        StringBuilder builder = new StringBuilder();
        for (ClassifiedToken token : classifiedTokens) {
            while (builder.length() < token.offset()) {
                builder.append(' ');
            }
            builder.append(token.lexeme());
        }
        return builder.toString();
    }

    private FormulaSyntaxException syntaxError(String expected, ClassifiedToken found) {
        return new FormulaSyntaxException(expected, found.lexeme(), found.offset(), source);
    }

    /**
     * 断言当前 token 类型符合预期并消费，否则抛出带位置的语法错误。
     */
    private ClassifiedToken expect(TokenType type, String expected) {
        if (!current().is(type)) {
            throw syntaxError(expected, current());
        }
        return advance();
    }

    private void expectKeyword(String keyword) {
        if (!matchKeyword(keyword)) {
            throw syntaxError(keyword, current());
        }
    }

    private ClassifiedToken current() {
        return tokens.get(pos);
    }

    private ClassifiedToken previous() {
        return tokens.get(pos - 1);
    }

    /**
     * 消费并返回当前位置 token，EOF 不会被越过。
     */
    private ClassifiedToken advance() {
        ClassifiedToken token = tokens.get(pos);
        if (!token.is(TokenType.EOF)) {
            pos++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (current().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (current().isKeyword(keyword)) {
            pos++;
            return true;
        }
        return false;
    }
}
