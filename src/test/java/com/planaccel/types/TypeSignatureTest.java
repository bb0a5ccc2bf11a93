package com.planaccel.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeSignatureTest {

    private static final List<TypeSignature> SAMPLES = List.of(
            TypeSignature.none(),
            TypeSignatures.INTEGRAL,
            TypeSignatures.DECIMAL_64,
            TypeSignatures.NUMERIC,
            TypeSignatures.COMMON,
            TypeSignatures.ORDERABLE,
            TypeSignatures.ALL,
            TypeSignatures.DECIMAL_64.union(TypeSignatures.DECIMAL_128),
            TypeSignature.decimal(5, 12, 2, 4).union(TypeSignature.decimal(10, 20, 0, 3)));

    private static final List<DataType> SCALAR_TYPES = List.of(
            DataTypes.BOOLEAN, DataTypes.BYTE, DataTypes.SHORT, DataTypes.INT, DataTypes.LONG,
            DataTypes.FLOAT, DataTypes.DOUBLE, DataTypes.DATE, DataTypes.TIMESTAMP, DataTypes.STRING,
            DataTypes.BINARY, DataTypes.NULL,
            DataTypes.decimal(5, 2), DataTypes.decimal(11, 3), DataTypes.decimal(18, 2), DataTypes.decimal(38, 10));

    private static final List<DataType> CONTAINER_TYPES = List.of(
            DataTypes.arrayOf(DataTypes.INT),
            DataTypes.arrayOf(DataTypes.arrayOf(DataTypes.STRING)),
            DataTypes.mapOf(DataTypes.STRING, DataTypes.decimal(18, 2)),
            DataTypes.structOf(List.of(
                    DataTypes.field("a", DataTypes.LONG),
                    DataTypes.field("b", DataTypes.arrayOf(DataTypes.DOUBLE)))));

    @Test
    @DisplayName("union with the empty signature and self-intersection are identities")
    void identityLaws() {
        for (TypeSignature s : SAMPLES) {
            assertThat(s.union(TypeSignature.none())).as("union(%s, none)", s).isEqualTo(s);
            assertThat(s.intersect(s)).as("intersect(%s, %s)", s, s).isEqualTo(s);
        }
    }

    @Test
    void unionIsCommutative() {
        TypeSignature a = TypeSignatures.INTEGRAL.union(TypeSignatures.DECIMAL_64);
        TypeSignature b = TypeSignatures.STRING.union(TypeSignatures.DECIMAL_128).nested(TypeTag.ARRAY);
        assertThat(a.union(b)).isEqualTo(b.union(a));
        assertThat(a.intersect(b)).isEqualTo(b.intersect(a));
    }

    @Test
    void subsumedDecimalBoundsAreDropped() {
        TypeSignature merged = TypeSignatures.DECIMAL_64.union(TypeSignatures.DECIMAL_128);
        assertThat(merged).isEqualTo(TypeSignatures.DECIMAL_128);
        assertThat(merged.getDecimals()).hasSize(1);
    }

    @Test
    void scalarMembership() {
        assertThat(TypeSignatures.NUMERIC.contains(DataTypes.INT)).isTrue();
        assertThat(TypeSignatures.NUMERIC.contains(DataTypes.STRING)).isFalse();
        assertThat(TypeSignatures.COMMON.contains(DataTypes.NULL)).isTrue();
        assertThat(TypeSignatures.COMMON.contains(DataTypes.BINARY)).isFalse();
        assertThat(TypeSignature.none().contains(DataTypes.BOOLEAN)).isFalse();
    }

    @Test
    @DisplayName("decimals match when both precision and scale are inside the bounds")
    void decimalBounds() {
        TypeSignature bounded = TypeSignature.decimal(10, 12, 2, 4);
        assertThat(bounded.contains(DataTypes.decimal(11, 3))).isTrue();
        assertThat(bounded.contains(DataTypes.decimal(10, 2))).isTrue();
        assertThat(bounded.contains(DataTypes.decimal(12, 4))).isTrue();
        assertThat(bounded.contains(DataTypes.decimal(11, 5))).isFalse();
        assertThat(bounded.contains(DataTypes.decimal(9, 3))).isFalse();
        assertThat(bounded.contains(DataTypes.decimal(13, 3))).isFalse();

        assertThat(TypeSignatures.DECIMAL_64.contains(DataTypes.decimal(18, 2))).isTrue();
        assertThat(TypeSignatures.DECIMAL_64.contains(DataTypes.decimal(20, 2))).isFalse();
        assertThat(TypeSignatures.DECIMAL_128.contains(DataTypes.decimal(38, 10))).isTrue();
    }

    @Test
    void decimalIntersectionNarrowsBounds() {
        TypeSignature overlap = TypeSignature.decimal(5, 12, 0, 4).intersect(TypeSignature.decimal(10, 20, 2, 6));
        assertThat(overlap).isEqualTo(TypeSignature.decimal(10, 12, 2, 4));
        assertThat(TypeSignature.decimal(1, 5, 0, 2).intersect(TypeSignature.decimal(6, 9, 0, 2)).isEmpty()).isTrue();
    }

    @Test
    void nestedTypesRequireContainerSupport() {
        ArrayType ints = DataTypes.arrayOf(DataTypes.INT);
        assertThat(TypeSignatures.INTEGRAL.contains(ints)).isFalse();
        assertThat(TypeSignatures.INTEGRAL.nested().contains(ints)).isTrue();
        assertThat(TypeSignatures.INTEGRAL.nested().contains(DataTypes.arrayOf(DataTypes.STRING))).isFalse();

        MapType map = DataTypes.mapOf(DataTypes.STRING, DataTypes.LONG);
        assertThat(TypeSignatures.ORDERABLE.contains(map)).isFalse();
        assertThat(TypeSignatures.ALL.contains(map)).isTrue();

        StructType struct = DataTypes.structOf(List.of(
                DataTypes.field("a", DataTypes.INT),
                DataTypes.field("b", DataTypes.arrayOf(DataTypes.decimal(10, 2)))));
        assertThat(TypeSignatures.ORDERABLE.contains(struct)).isTrue();
        assertThat(TypeSignatures.INTEGRAL.nested().contains(struct)).isFalse();
    }

    @Test
    @DisplayName("an array is in the nested signature exactly when its element is in the signature")
    void arrayMembershipFollowsElementMembership() {
        for (TypeSignature s : SAMPLES) {
            TypeSignature nested = s.nested();
            for (DataType t : SCALAR_TYPES) {
                assertThat(nested.contains(DataTypes.arrayOf(t)))
                        .as("contains(nested(%s), array<%s>)", s, t)
                        .isEqualTo(s.contains(t));
            }
            // a nested signature is closed under nesting, so container elements follow the same rule
            for (DataType t : CONTAINER_TYPES) {
                assertThat(nested.nested().contains(DataTypes.arrayOf(t)))
                        .as("contains(nested(%s), array<%s>)", nested, t)
                        .isEqualTo(nested.contains(t));
            }
        }
    }

    @Test
    @DisplayName("nesting deeper than the ceiling is treated as unsupported")
    void nestingCeiling() {
        TypeSignature signature = TypeSignatures.INTEGRAL.nested();
        assertThat(signature.contains(nestedArrays(TypeSignature.MAX_NESTING_DEPTH))).isTrue();
        assertThat(signature.contains(nestedArrays(TypeSignature.MAX_NESTING_DEPTH + 1))).isFalse();
        assertThat(signature.contains(nestedArrays(100))).isFalse();
    }

    @Test
    void withoutRemovesTags() {
        TypeSignature noDouble = TypeSignatures.NUMERIC.without(TypeTag.DOUBLE, TypeTag.DECIMAL);
        assertThat(noDouble.contains(DataTypes.DOUBLE)).isFalse();
        assertThat(noDouble.contains(DataTypes.FLOAT)).isTrue();
        assertThat(noDouble.mentions(TypeTag.DECIMAL)).isFalse();
        assertThat(TypeSignatures.NUMERIC.mentions(TypeTag.DECIMAL)).isTrue();
    }

    @Test
    void containerTagsAreRejectedAsScalars() {
        assertThatThrownBy(() -> TypeSignature.of(TypeTag.ARRAY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeSignatures.INTEGRAL.nested(TypeTag.INT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeSignature.decimal(10, 5, 0, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static DataType nestedArrays(int levels) {
        DataType type = DataTypes.INT;
        for (int i = 0; i < levels; i++) {
            type = DataTypes.arrayOf(type);
        }
        return type;
    }
}
