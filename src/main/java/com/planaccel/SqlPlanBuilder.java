package com.planaccel;

import com.planaccel.ir.Aggregate;
import com.planaccel.ir.AggregateFunction;
import com.planaccel.ir.ColumnRef;
import com.planaccel.ir.Filter;
import com.planaccel.ir.Join;
import com.planaccel.ir.Limit;
import com.planaccel.ir.Literal;
import com.planaccel.ir.PlanNode;
import com.planaccel.ir.Project;
import com.planaccel.ir.ScalarFunction;
import com.planaccel.ir.Scan;
import com.planaccel.ir.Sort;
import com.planaccel.types.DataType;
import com.planaccel.types.DataTypes;
import com.planaccel.types.DecimalType;
import com.planaccel.types.StructType;
import com.planaccel.types.TypeTag;
import com.planaccel.util.SqlStringUtils;
import io.trino.sql.tree.AliasedRelation;
import io.trino.sql.tree.AllColumns;
import io.trino.sql.tree.ArithmeticBinaryExpression;
import io.trino.sql.tree.AstVisitor;
import io.trino.sql.tree.BooleanLiteral;
import io.trino.sql.tree.ComparisonExpression;
import io.trino.sql.tree.DecimalLiteral;
import io.trino.sql.tree.DereferenceExpression;
import io.trino.sql.tree.DoubleLiteral;
import io.trino.sql.tree.Expression;
import io.trino.sql.tree.FunctionCall;
import io.trino.sql.tree.GenericLiteral;
import io.trino.sql.tree.GroupingElement;
import io.trino.sql.tree.Identifier;
import io.trino.sql.tree.IsNotNullPredicate;
import io.trino.sql.tree.IsNullPredicate;
import io.trino.sql.tree.JoinOn;
import io.trino.sql.tree.LogicalExpression;
import io.trino.sql.tree.LongLiteral;
import io.trino.sql.tree.Node;
import io.trino.sql.tree.NotExpression;
import io.trino.sql.tree.NullLiteral;
import io.trino.sql.tree.OrderBy;
import io.trino.sql.tree.QualifiedName;
import io.trino.sql.tree.Query;
import io.trino.sql.tree.QuerySpecification;
import io.trino.sql.tree.Select;
import io.trino.sql.tree.SelectItem;
import io.trino.sql.tree.SingleColumn;
import io.trino.sql.tree.SortItem;
import io.trino.sql.tree.Statement;
import io.trino.sql.tree.StringLiteral;
import io.trino.sql.tree.Table;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts a Trino Statement AST into a typed host plan.
 * Handles {@code SELECT ... FROM t [JOIN u ON ...] [WHERE] [GROUP BY] [ORDER BY] [LIMIT]}.
 * Column types come from the table catalog in {@link Config}; expression types are inferred
 * bottom-up. Anything else raises {@link UnsupportedOperationException}.
 */
public class SqlPlanBuilder extends AstVisitor<SqlPlanBuilder.RelationPlan, Void> {

    private static final Map<String, String> UNARY_MATH = Map.of(
            "acos", "Acos", "asin", "Asin", "atan", "Atan",
            "cos", "Cos", "sin", "Sin", "tan", "Tan",
            "sqrt", "Sqrt", "exp", "Exp", "ln", "Log", "log", "Log");

    private final Config config;

    public SqlPlanBuilder(Config config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public PlanNode build(String sql) {
        return convert(SqlStringUtils.parseSqlStatement(sql));
    }

    /**
     * @throws UnsupportedOperationException if the statement structure is not supported.
     * @throws IllegalArgumentException if a table or column cannot be resolved, or operand types do not fit.
     */
    public PlanNode convert(Statement statement) {
        return process(statement, null).getNode();
    }

    // --- Relations ---

    @Override
    protected RelationPlan visitQuery(Query node, Void context) {
        if (node.getWith().isPresent()) {
            throw new UnsupportedOperationException("WITH clauses are not supported");
        }
        if (!(node.getQueryBody() instanceof QuerySpecification)) {
            throw new UnsupportedOperationException("Unsupported query body type: " + node.getQueryBody().getClass().getSimpleName()
                    + ". Only QuerySpecification is handled.");
        }
        RelationPlan plan = process(node.getQueryBody(), context);
        // ORDER BY / LIMIT normally land in the QuerySpecification; handle the Query level as well
        plan = processOrderBy(node.getOrderBy(), plan);
        return processLimit(node.getLimit(), plan);
    }

    @Override
    protected RelationPlan visitQuerySpecification(QuerySpecification node, Void context) {
        if (node.getFrom().isEmpty()) {
            throw new UnsupportedOperationException("Query without FROM clause is not supported.");
        }
        if (node.getHaving().isPresent()) {
            throw new UnsupportedOperationException("HAVING is not supported");
        }
        if (node.getOffset().isPresent()) {
            throw new UnsupportedOperationException("OFFSET is not supported");
        }
        RelationPlan plan = process(node.getFrom().get(), context);

        if (node.getWhere().isPresent()) {
            PlanNode condition = translate(node.getWhere().get(), plan.getScope(), false);
            plan = new RelationPlan(new Filter(plan.getNode(), condition), plan.getScope());
        }

        if (node.getGroupBy().isPresent() || hasAggregates(node.getSelect())) {
            plan = processAggregation(node, plan);
        } else {
            plan = processSelect(node.getSelect(), plan);
        }

        plan = processOrderBy(node.getOrderBy(), plan);
        return processLimit(node.getLimit(), plan);
    }

    @Override
    protected RelationPlan visitTable(Table node, Void context) {
        String tableName = node.getName().getSuffix();
        Config.TableDefinition table = config.getTable(tableName); // Throws if table not found
        StructType schema = table.toRowType();
        if (schema.getFields().isEmpty()) {
            throw new IllegalArgumentException("Schema found but is empty for table in config: " + tableName);
        }
        return new RelationPlan(new Scan(tableName, schema, table.estimatedSize()), Scope.of(tableName, schema));
    }

    @Override
    protected RelationPlan visitAliasedRelation(AliasedRelation node, Void context) {
        RelationPlan underlying = process(node.getRelation(), context);
        return new RelationPlan(underlying.getNode(), underlying.getScope().requalify(node.getAlias().getValue()));
    }

    @Override
    protected RelationPlan visitJoin(io.trino.sql.tree.Join node, Void context) {
        RelationPlan left = process(node.getLeft(), context);
        RelationPlan right = process(node.getRight(), context);
        Scope scope = left.getScope().concat(right.getScope());

        Join.JoinType joinType;
        switch (node.getType()) {
            case CROSS:
            case IMPLICIT:
                return new RelationPlan(Join.cross(left.getNode(), right.getNode()), scope);
            case INNER:
                joinType = Join.JoinType.INNER;
                break;
            case LEFT:
                joinType = Join.JoinType.LEFT_OUTER;
                break;
            case RIGHT:
                joinType = Join.JoinType.RIGHT_OUTER;
                break;
            case FULL:
                joinType = Join.JoinType.FULL_OUTER;
                break;
            default:
                throw new UnsupportedOperationException("Unsupported JOIN type: " + node.getType());
        }
        if (node.getCriteria().isEmpty() || !(node.getCriteria().get() instanceof JoinOn)) {
            throw new UnsupportedOperationException("Unsupported JOIN criteria: "
                    + node.getCriteria().map(c -> c.getClass().getSimpleName()).orElse("None")
                    + ". Only ON clause is supported.");
        }
        Expression conditionExpr = ((JoinOn) node.getCriteria().get()).getExpression();
        PlanNode condition = translate(conditionExpr, scope, false);
        return new RelationPlan(new Join(left.getNode(), right.getNode(), joinType, condition), scope);
    }

    @Override
    protected RelationPlan visitNode(Node node, Void context) {
        if (node instanceof Statement && !(node instanceof Query)) {
            throw new UnsupportedOperationException("Unsupported SQL statement type: " + node.getClass().getSimpleName());
        }
        throw new UnsupportedOperationException("Unhandled AST node type during conversion: " + node.getClass().getSimpleName());
    }

    // --- Clauses ---

    private RelationPlan processSelect(Select select, RelationPlan input) {
        if (select.isDistinct()) {
            throw new UnsupportedOperationException("SELECT DISTINCT is not supported");
        }
        Scope inputScope = input.getScope();
        List<PlanNode> projections = new ArrayList<>();
        List<String> names = new ArrayList<>();
        boolean onlyAllColumns = true;
        for (SelectItem item : select.getSelectItems()) {
            if (item instanceof AllColumns) {
                if (((AllColumns) item).getTarget().isPresent()) {
                    throw new UnsupportedOperationException("SELECT target.* is not supported");
                }
                for (Scope.Column column : inputScope.getColumns()) {
                    projections.add(new ColumnRef(column.getName(), column.getType()));
                    names.add(column.getName());
                }
            } else if (item instanceof SingleColumn) {
                onlyAllColumns = false;
                SingleColumn column = (SingleColumn) item;
                projections.add(translate(column.getExpression(), inputScope, false));
                names.add(outputName(column, names.size()));
            } else {
                throw new UnsupportedOperationException("Unsupported SELECT item type: " + item.getClass().getSimpleName());
            }
        }
        // SELECT * keeps the input as is
        if (onlyAllColumns) {
            return input;
        }
        return project(input.getNode(), projections, names);
    }

    /**
     * Builds Aggregate(group keys, aggregate calls) followed by a Project restoring the select order.
     * Every select item must be a grouping expression or an aggregate call.
     */
    private RelationPlan processAggregation(QuerySpecification node, RelationPlan input) {
        Select select = node.getSelect();
        if (select.isDistinct()) {
            throw new UnsupportedOperationException("SELECT DISTINCT is not supported");
        }
        Scope inputScope = input.getScope();

        List<Expression> groupExpressions = new ArrayList<>();
        if (node.getGroupBy().isPresent()) {
            if (node.getGroupBy().get().isDistinct()) {
                throw new UnsupportedOperationException("GROUP BY DISTINCT is not supported");
            }
            for (GroupingElement element : node.getGroupBy().get().getGroupingElements()) {
                if (!(element instanceof io.trino.sql.tree.SimpleGroupBy)) {
                    throw new UnsupportedOperationException("Unsupported grouping element: " + element.getClass().getSimpleName());
                }
                groupExpressions.addAll(element.getExpressions());
            }
        }

        List<PlanNode> groupKeys = new ArrayList<>();
        List<String> aggregateNames = new ArrayList<>();
        for (int i = 0; i < groupExpressions.size(); i++) {
            Expression expression = groupExpressions.get(i);
            groupKeys.add(translate(expression, inputScope, false));
            aggregateNames.add(expression instanceof Identifier ? ((Identifier) expression).getValue() : "_g" + i);
        }

        List<PlanNode> aggregates = new ArrayList<>();
        List<PlanNode> projections = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (SelectItem item : select.getSelectItems()) {
            if (!(item instanceof SingleColumn)) {
                throw new UnsupportedOperationException("SELECT * cannot be combined with aggregation");
            }
            SingleColumn column = (SingleColumn) item;
            Expression expression = column.getExpression();
            int groupIndex = groupExpressions.indexOf(expression);
            if (groupIndex >= 0) {
                PlanNode key = groupKeys.get(groupIndex);
                projections.add(new ColumnRef(aggregateNames.get(groupIndex), key.getOutputType()));
            } else if (isAggregateCall(expression)) {
                PlanNode aggregate = translate(expression, inputScope, true);
                String name = "_a" + aggregates.size();
                aggregates.add(aggregate);
                aggregateNames.add(name);
                projections.add(new ColumnRef(name, aggregate.getOutputType()));
            } else {
                throw new UnsupportedOperationException("Select item '" + SqlStringUtils.formatSql(expression)
                        + "' must be a grouping expression or an aggregate call");
            }
            names.add(outputName(column, names.size()));
        }

        Aggregate aggregate = new Aggregate(input.getNode(), groupKeys, aggregates, aggregateNames);
        return project(aggregate, projections, names);
    }

    private RelationPlan processOrderBy(Optional<OrderBy> orderBy, RelationPlan input) {
        if (orderBy.isEmpty()) {
            return input;
        }
        List<PlanNode> keys = new ArrayList<>();
        List<Boolean> ascending = new ArrayList<>();
        for (SortItem item : orderBy.get().getSortItems()) {
            keys.add(translate(item.getSortKey(), input.getScope(), false));
            ascending.add(item.getOrdering() == SortItem.Ordering.ASCENDING);
        }
        return new RelationPlan(new Sort(input.getNode(), keys, ascending), input.getScope());
    }

    private RelationPlan processLimit(Optional<Node> limit, RelationPlan input) {
        if (limit.isEmpty()) {
            return input;
        }
        if (!(limit.get() instanceof io.trino.sql.tree.Limit)) {
            throw new UnsupportedOperationException("Unsupported row limit: " + limit.get().getClass().getSimpleName());
        }
        Expression rowCount = ((io.trino.sql.tree.Limit) limit.get()).getRowCount();
        if (!(rowCount instanceof LongLiteral)) {
            // LIMIT ALL
            return input;
        }
        return new RelationPlan(new Limit(input.getNode(), ((LongLiteral) rowCount).getParsedValue()), input.getScope());
    }

    private static RelationPlan project(PlanNode input, List<PlanNode> projections, List<String> names) {
        Project project = new Project(input, projections, names);
        return new RelationPlan(project, Scope.of(null, (StructType) project.getOutputType()));
    }

    private static String outputName(SingleColumn column, int position) {
        if (column.getAlias().isPresent()) {
            return column.getAlias().get().getValue();
        }
        Expression expression = column.getExpression();
        if (expression instanceof Identifier) {
            return ((Identifier) expression).getValue();
        }
        if (expression instanceof DereferenceExpression) {
            QualifiedName name = DereferenceExpression.getQualifiedName((DereferenceExpression) expression);
            if (name != null) {
                return name.getSuffix();
            }
        }
        return "_col" + position;
    }

    private static boolean hasAggregates(Select select) {
        return select.getSelectItems().stream()
                .filter(SingleColumn.class::isInstance)
                .map(item -> ((SingleColumn) item).getExpression())
                .anyMatch(SqlPlanBuilder::isAggregateCall);
    }

    private static boolean isAggregateCall(Expression expression) {
        return expression instanceof FunctionCall
                && aggregateKind(((FunctionCall) expression).getName().getSuffix()) != null;
    }

    private static String aggregateKind(String functionName) {
        switch (functionName.toLowerCase(Locale.ROOT)) {
            case "sum": return "Sum";
            case "count": return "Count";
            case "avg": return "Average";
            case "min": return "Min";
            case "max": return "Max";
            default: return null;
        }
    }

    // --- Expressions ---

    /**
     * Translates a scalar expression, resolving columns against {@code scope}.
     * @param allowAggregates whether aggregate calls may appear at the top of the expression
     */
    private PlanNode translate(Expression expression, Scope scope, boolean allowAggregates) {
        if (expression instanceof Identifier) {
            return scope.resolve(null, ((Identifier) expression).getValue());
        }
        if (expression instanceof DereferenceExpression) {
            QualifiedName name = DereferenceExpression.getQualifiedName((DereferenceExpression) expression);
            if (name == null || name.getParts().size() != 2) {
                throw new UnsupportedOperationException("Unsupported column reference: " + SqlStringUtils.formatSql(expression));
            }
            return scope.resolve(name.getParts().get(0), name.getParts().get(1));
        }
        if (expression instanceof LongLiteral) {
            long value = ((LongLiteral) expression).getParsedValue();
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return new Literal(DataTypes.INT, (int) value);
            }
            return new Literal(DataTypes.LONG, value);
        }
        if (expression instanceof DoubleLiteral) {
            return new Literal(DataTypes.DOUBLE, ((DoubleLiteral) expression).getValue());
        }
        if (expression instanceof DecimalLiteral) {
            return decimalLiteral(((DecimalLiteral) expression).getValue());
        }
        if (expression instanceof StringLiteral) {
            return new Literal(DataTypes.STRING, ((StringLiteral) expression).getValue());
        }
        if (expression instanceof BooleanLiteral) {
            return new Literal(DataTypes.BOOLEAN, ((BooleanLiteral) expression).getValue());
        }
        if (expression instanceof NullLiteral) {
            return new Literal(DataTypes.NULL, null);
        }
        if (expression instanceof GenericLiteral) {
            GenericLiteral literal = (GenericLiteral) expression;
            switch (literal.getType().toUpperCase(Locale.ROOT)) {
                case "DATE":
                    return new Literal(DataTypes.DATE, literal.getValue());
                case "TIMESTAMP":
                    return new Literal(DataTypes.TIMESTAMP, literal.getValue());
                default:
                    throw new UnsupportedOperationException("Unsupported literal type: " + literal.getType());
            }
        }
        if (expression instanceof ArithmeticBinaryExpression) {
            return translateArithmetic((ArithmeticBinaryExpression) expression, scope);
        }
        if (expression instanceof ComparisonExpression) {
            ComparisonExpression comparison = (ComparisonExpression) expression;
            return new ScalarFunction(comparisonKind(comparison.getOperator()), DataTypes.BOOLEAN, List.of(
                    translate(comparison.getLeft(), scope, false),
                    translate(comparison.getRight(), scope, false)));
        }
        if (expression instanceof LogicalExpression) {
            LogicalExpression logical = (LogicalExpression) expression;
            String kind = logical.getOperator() == LogicalExpression.Operator.AND ? "And" : "Or";
            List<Expression> terms = logical.getTerms();
            PlanNode result = translate(terms.get(0), scope, false);
            for (int i = 1; i < terms.size(); i++) {
                result = new ScalarFunction(kind, DataTypes.BOOLEAN, List.of(result, translate(terms.get(i), scope, false)));
            }
            return result;
        }
        if (expression instanceof NotExpression) {
            return new ScalarFunction("Not", DataTypes.BOOLEAN,
                    List.of(translate(((NotExpression) expression).getValue(), scope, false)));
        }
        if (expression instanceof IsNullPredicate) {
            return new ScalarFunction("IsNull", DataTypes.BOOLEAN,
                    List.of(translate(((IsNullPredicate) expression).getValue(), scope, false)));
        }
        if (expression instanceof IsNotNullPredicate) {
            return new ScalarFunction("IsNotNull", DataTypes.BOOLEAN,
                    List.of(translate(((IsNotNullPredicate) expression).getValue(), scope, false)));
        }
        if (expression instanceof FunctionCall) {
            return translateFunction((FunctionCall) expression, scope, allowAggregates);
        }
        throw new UnsupportedOperationException("Unsupported expression: " + expression.getClass().getSimpleName()
                + " [" + SqlStringUtils.formatSql(expression) + "]");
    }

    /**
     * Types a decimal literal by its digits: {@code 12.50} is DECIMAL(4,2), {@code 1E+3} is DECIMAL(4,0).
     */
    static Literal decimalLiteral(String text) {
        BigDecimal value = new BigDecimal(text);
        if (value.scale() < 0) {
            value = value.setScale(0);
        }
        int scale = value.scale();
        int precision = Math.max(value.precision(), scale);
        return new Literal(DataTypes.decimal(precision, scale), value);
    }

    private PlanNode translateArithmetic(ArithmeticBinaryExpression expression, Scope scope) {
        PlanNode left = translate(expression.getLeft(), scope, false);
        PlanNode right = translate(expression.getRight(), scope, false);
        DataType type = DataTypes.widerNumeric(left.getOutputType(), right.getOutputType());
        String kind;
        switch (expression.getOperator()) {
            case ADD:
                kind = "Add";
                break;
            case SUBTRACT:
                kind = "Subtract";
                break;
            case MULTIPLY:
                kind = "Multiply";
                break;
            case DIVIDE:
                kind = "Divide";
                // non-decimal division always yields a double
                if (type.getTag() != TypeTag.DECIMAL) {
                    type = DataTypes.DOUBLE;
                }
                break;
            case MODULUS:
                kind = "Remainder";
                break;
            default:
                throw new UnsupportedOperationException("Unsupported arithmetic operator: " + expression.getOperator());
        }
        if (type.getTag() == TypeTag.NULL) {
            type = DataTypes.INT;
        }
        return new ScalarFunction(kind, type, List.of(left, right));
    }

    private PlanNode translateFunction(FunctionCall call, Scope scope, boolean allowAggregates) {
        if (call.getWindow().isPresent() || call.getFilter().isPresent() || call.getOrderBy().isPresent()) {
            throw new UnsupportedOperationException("Window, FILTER and ORDER BY clauses on function calls are not supported");
        }
        String functionName = call.getName().getSuffix().toLowerCase(Locale.ROOT);
        List<PlanNode> arguments = new ArrayList<>();
        for (Expression argument : call.getArguments()) {
            arguments.add(translate(argument, scope, false));
        }

        String aggregateKind = aggregateKind(functionName);
        if (aggregateKind != null) {
            if (!allowAggregates) {
                throw new UnsupportedOperationException("Aggregate " + functionName + " is only supported as a select item");
            }
            return new AggregateFunction(aggregateKind, aggregateType(aggregateKind, arguments), arguments, call.isDistinct());
        }
        if (call.isDistinct()) {
            throw new UnsupportedOperationException("DISTINCT is only valid in aggregate calls");
        }

        String mathKind = UNARY_MATH.get(functionName);
        if (mathKind != null) {
            expectArguments(functionName, arguments, 1);
            return new ScalarFunction(mathKind, DataTypes.DOUBLE, arguments);
        }
        switch (functionName) {
            case "abs":
                expectArguments(functionName, arguments, 1);
                return new ScalarFunction("Abs", arguments.get(0).getOutputType(), arguments);
            case "upper":
                expectArguments(functionName, arguments, 1);
                return new ScalarFunction("Upper", DataTypes.STRING, arguments);
            case "lower":
                expectArguments(functionName, arguments, 1);
                return new ScalarFunction("Lower", DataTypes.STRING, arguments);
            case "length":
                expectArguments(functionName, arguments, 1);
                return new ScalarFunction("Length", DataTypes.INT, arguments);
            case "concat":
                return new ScalarFunction("Concat", DataTypes.STRING, arguments);
            default:
                throw new UnsupportedOperationException("Unsupported function: " + call.getName());
        }
    }

    private static DataType aggregateType(String kind, List<PlanNode> arguments) {
        if (kind.equals("Count")) {
            return DataTypes.LONG;
        }
        expectArguments(kind, arguments, 1);
        DataType input = arguments.get(0).getOutputType();
        switch (kind) {
            case "Sum":
                if (input.getTag() == TypeTag.DECIMAL) {
                    DecimalType decimal = (DecimalType) input;
                    return DataTypes.decimal(Math.min(DecimalType.MAX_PRECISION, decimal.getPrecision() + 10), decimal.getScale());
                }
                return input.getTag().isFloatingPoint() ? DataTypes.DOUBLE : DataTypes.LONG;
            case "Average":
                if (input.getTag() == TypeTag.DECIMAL) {
                    DecimalType decimal = (DecimalType) input;
                    return DataTypes.decimal(DecimalType.MAX_PRECISION, Math.max(decimal.getScale(), 4));
                }
                return DataTypes.DOUBLE;
            default:
                // Min, Max
                return input;
        }
    }

    private static void expectArguments(String function, List<PlanNode> arguments, int expected) {
        if (arguments.size() != expected) {
            throw new IllegalArgumentException(function + " expects " + expected + " argument(s), got " + arguments.size());
        }
    }

    private static String comparisonKind(ComparisonExpression.Operator operator) {
        switch (operator) {
            case EQUAL: return "EqualTo";
            case NOT_EQUAL: return "NotEqualTo";
            case LESS_THAN: return "LessThan";
            case LESS_THAN_OR_EQUAL: return "LessThanOrEqual";
            case GREATER_THAN: return "GreaterThan";
            case GREATER_THAN_OR_EQUAL: return "GreaterThanOrEqual";
            default:
                throw new UnsupportedOperationException("Unsupported comparison operator: " + operator);
        }
    }

    // --- Helper types ---

    /**
     * A plan fragment together with the columns visible to the enclosing clauses.
     */
    public static final class RelationPlan {
        private final PlanNode node;
        private final Scope scope;

        RelationPlan(PlanNode node, Scope scope) {
            this.node = node;
            this.scope = scope;
        }

        public PlanNode getNode() {
            return node;
        }

        Scope getScope() {
            return scope;
        }
    }

    static final class Scope {
        private final List<Column> columns;

        private Scope(List<Column> columns) {
            this.columns = columns;
        }

        static Scope of(String qualifier, StructType rowType) {
            return new Scope(rowType.getFields().stream()
                    .map(field -> new Column(qualifier, field.getName(), field.getType()))
                    .collect(Collectors.toList()));
        }

        List<Column> getColumns() {
            return columns;
        }

        Scope requalify(String qualifier) {
            return new Scope(columns.stream()
                    .map(column -> new Column(qualifier, column.getName(), column.getType()))
                    .collect(Collectors.toList()));
        }

        Scope concat(Scope other) {
            List<Column> combined = new ArrayList<>(columns);
            combined.addAll(other.columns);
            return new Scope(combined);
        }

        ColumnRef resolve(String qualifier, String name) {
            List<Column> matches = columns.stream()
                    .filter(column -> column.getName().equalsIgnoreCase(name))
                    .filter(column -> qualifier == null || qualifier.equalsIgnoreCase(column.getQualifier()))
                    .collect(Collectors.toList());
            String display = qualifier == null ? name : qualifier + "." + name;
            if (matches.isEmpty()) {
                throw new IllegalArgumentException("Column '" + display + "' cannot be resolved");
            }
            if (matches.size() > 1) {
                throw new IllegalArgumentException("Column '" + display + "' is ambiguous");
            }
            Column column = matches.get(0);
            return new ColumnRef(column.getName(), column.getType());
        }

        static final class Column {
            private final String qualifier;
            private final String name;
            private final DataType type;

            Column(String qualifier, String name, DataType type) {
                this.qualifier = qualifier;
                this.name = name;
                this.type = type;
            }

            String getQualifier() {
                return qualifier;
            }

            String getName() {
                return name;
            }

            DataType getType() {
                return type;
            }
        }
    }
}
