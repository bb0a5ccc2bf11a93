package com.planaccel.rules;

import com.planaccel.ir.AggregateFunction;
import com.planaccel.ir.PlanNode;
import com.planaccel.types.DataType;
import com.planaccel.types.DecimalType;
import com.planaccel.types.TypeSignature;
import com.planaccel.types.TypeSignatures;
import com.planaccel.types.TypeTag;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in replacement rules for expressions: literals, column references, arithmetic,
 * comparisons, boolean logic, math and string functions, and aggregate calls.
 */
public class ExpressionRules implements RuleProvider {

    private static final TypeSignature ANY_SCALAR = TypeSignatures.COMMON.union(TypeSignature.of(TypeTag.BINARY));
    private static final TypeSignature NUMERIC_INPUT = TypeSignatures.NUMERIC.union(TypeSignatures.NULL);
    private static final TypeSignature BOOLEAN_INPUT = TypeSignatures.BOOLEAN.union(TypeSignatures.NULL);
    private static final TypeSignature STRING_INPUT = TypeSignatures.STRING.union(TypeSignatures.NULL);

    @Override
    public List<ReplacementRule> getRules() {
        List<ReplacementRule> rules = new ArrayList<>();

        rules.add(ReplacementRule.builder("Literal")
                .description("constant value")
                .acceleratedSignature(ANY_SCALAR.nested(TypeTag.ARRAY, TypeTag.STRUCT))
                .build());
        rules.add(ReplacementRule.builder("ColumnRef")
                .description("reference to an input column")
                .acceleratedSignature(TypeSignatures.ALL)
                .build());

        rules.add(arithmetic("Add", "addition").check(decimalOverflowCheck()).build());
        rules.add(arithmetic("Subtract", "subtraction").check(decimalOverflowCheck()).build());
        rules.add(arithmetic("Multiply", "multiplication").check(decimalOverflowCheck()).build());
        rules.add(ReplacementRule.builder("Divide")
                .description("division")
                .acceleratedSignature(TypeSignatures.DOUBLE.union(TypeSignatures.DECIMAL_128))
                .inputSignature(NUMERIC_INPUT)
                .check(decimalOverflowCheck())
                .build());
        rules.add(arithmetic("Remainder", "remainder")
                .check(strictArithmeticUnsupported("division by zero in Remainder cannot be raised as an error"))
                .build());

        for (String kind : List.of("EqualTo", "NotEqualTo")) {
            rules.add(predicate(kind, "equality comparison", ANY_SCALAR.union(TypeSignatures.NULL).nested(TypeTag.ARRAY, TypeTag.STRUCT)));
        }
        for (String kind : List.of("LessThan", "LessThanOrEqual", "GreaterThan", "GreaterThanOrEqual")) {
            rules.add(predicate(kind, "ordering comparison", TypeSignatures.ORDERABLE));
        }
        rules.add(predicate("And", "logical AND", BOOLEAN_INPUT));
        rules.add(predicate("Or", "logical OR", BOOLEAN_INPUT));
        rules.add(predicate("Not", "logical NOT", BOOLEAN_INPUT));
        rules.add(predicate("IsNull", "null check", TypeSignatures.ALL));
        rules.add(predicate("IsNotNull", "non-null check", TypeSignatures.ALL));

        rules.add(unaryMath("Acos", "inverse cosine"));
        rules.add(unaryMath("Asin", "inverse sine"));
        rules.add(unaryMath("Atan", "inverse tangent"));
        rules.add(unaryMath("Cos", "cosine"));
        rules.add(unaryMath("Sin", "sine"));
        rules.add(unaryMath("Tan", "tangent"));
        rules.add(unaryMath("Sqrt", "square root"));
        rules.add(unaryMath("Exp", "exponential"));
        rules.add(unaryMath("Log", "natural logarithm"));
        rules.add(ReplacementRule.builder("Abs")
                .description("absolute value")
                .acceleratedSignature(TypeSignatures.NUMERIC)
                .inputSignature(NUMERIC_INPUT)
                .check(integralOverflowCheck("Abs of the smallest integral value overflows"))
                .build());

        rules.add(ReplacementRule.builder("Upper")
                .description("upper case conversion")
                .acceleratedSignature(TypeSignatures.STRING)
                .inputSignature(STRING_INPUT)
                .incompatible("case mapping of a few multi-character Unicode code points differs from the host")
                .build());
        rules.add(ReplacementRule.builder("Lower")
                .description("lower case conversion")
                .acceleratedSignature(TypeSignatures.STRING)
                .inputSignature(STRING_INPUT)
                .incompatible("case mapping of a few multi-character Unicode code points differs from the host")
                .build());
        rules.add(ReplacementRule.builder("Length")
                .description("character length")
                .acceleratedSignature(TypeSignature.of(TypeTag.INT))
                .inputSignature(STRING_INPUT)
                .build());
        rules.add(ReplacementRule.builder("Concat")
                .description("string concatenation")
                .acceleratedSignature(TypeSignatures.STRING)
                .inputSignature(STRING_INPUT)
                .build());

        rules.add(ReplacementRule.builder("Sum")
                .description("sum aggregate")
                .acceleratedSignature(TypeSignature.of(TypeTag.LONG, TypeTag.DOUBLE).union(TypeSignatures.DECIMAL_128))
                .inputSignature(NUMERIC_INPUT)
                .check(noDistinct())
                .check(sumOverflowCheck())
                .build());
        rules.add(ReplacementRule.builder("Count")
                .description("count aggregate")
                .acceleratedSignature(TypeSignature.of(TypeTag.LONG))
                .build());
        rules.add(ReplacementRule.builder("Average")
                .alias("Avg")
                .description("average aggregate")
                .acceleratedSignature(TypeSignatures.DOUBLE.union(TypeSignatures.DECIMAL_128))
                .inputSignature(NUMERIC_INPUT)
                .check(noDistinct())
                .build());
        rules.add(ReplacementRule.builder("Min")
                .description("minimum aggregate")
                .acceleratedSignature(TypeSignatures.COMMON)
                .inputSignature(TypeSignatures.COMMON)
                .build());
        rules.add(ReplacementRule.builder("Max")
                .description("maximum aggregate")
                .acceleratedSignature(TypeSignatures.COMMON)
                .inputSignature(TypeSignatures.COMMON)
                .build());
        return rules;
    }

    private static ReplacementRule.Builder arithmetic(String kind, String description) {
        return ReplacementRule.builder(kind)
                .description(description)
                .acceleratedSignature(TypeSignatures.NUMERIC)
                .inputSignature(NUMERIC_INPUT);
    }

    private static ReplacementRule predicate(String kind, String description, TypeSignature inputs) {
        return ReplacementRule.builder(kind)
                .description(description)
                .acceleratedSignature(TypeSignatures.BOOLEAN)
                .inputSignature(inputs)
                .build();
    }

    /**
     * Unary floating point functions share the same shape: any numeric input, DOUBLE result.
     */
    static ReplacementRule unaryMath(String kind, String description) {
        return ReplacementRule.builder(kind)
                .description(description)
                .acceleratedSignature(TypeSignatures.DOUBLE)
                .inputSignature(NUMERIC_INPUT)
                .build();
    }

    /**
     * Under strict arithmetic a decimal result above 18 digits needs 128 bit overflow
     * detection, which the accelerated kernels do not provide.
     */
    static TagCheck decimalOverflowCheck() {
        return (node, context) -> {
            DataType type = node.getOutputType();
            if (context.getConfig().isStrictArithmetic() && type.getTag() == TypeTag.DECIMAL
                    && ((DecimalType) type).getPrecision() > 18) {
                context.reject(node.getNodeKind() + " producing " + type
                        + " cannot detect overflow when strict arithmetic is enabled");
            }
        };
    }

    static TagCheck integralOverflowCheck(String problem) {
        return (node, context) -> {
            if (context.getConfig().isStrictArithmetic() && node.getOutputType().getTag().isIntegral()) {
                context.reject(problem + " and strict arithmetic is enabled");
            }
        };
    }

    static TagCheck strictArithmeticUnsupported(String problem) {
        return (node, context) -> {
            if (context.getConfig().isStrictArithmetic()) {
                context.reject(problem + " when strict arithmetic is enabled");
            }
        };
    }

    /**
     * Sums over integral or decimal input can overflow; in strict mode that must raise an error,
     * which the accelerated aggregation cannot do.
     */
    static TagCheck sumOverflowCheck() {
        return (node, context) -> {
            if (!context.getConfig().isStrictArithmetic()) {
                return;
            }
            for (PlanNode argument : node.getChildren()) {
                TypeTag tag = argument.getOutputType().getTag();
                if (tag.isIntegral() || tag == TypeTag.DECIMAL) {
                    context.reject("Sum over " + argument.getOutputType()
                            + " may overflow and strict arithmetic is enabled");
                    return;
                }
            }
        };
    }

    static TagCheck noDistinct() {
        return (node, context) -> {
            if (node instanceof AggregateFunction && ((AggregateFunction) node).isDistinct()) {
                context.reject("DISTINCT " + node.getNodeKind() + " is not supported on the accelerator");
            }
        };
    }
}
