package com.planaccel.types;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An immutable set of supported data types.
 *
 * <p>A signature is made of three parts:
 * <ul>
 *   <li>scalar tags, matched by tag alone;</li>
 *   <li>decimal entries, each matching decimals whose precision and scale fall inside
 *       inclusive bounds;</li>
 *   <li>container tags ({@code ARRAY}, {@code MAP}, {@code STRUCT}); a container type is a
 *       member when its tag is listed and every element type is itself a member of this
 *       signature.</li>
 * </ul>
 * Combinators return new signatures. Decimal entries are kept normalized (entries covered by
 * another entry are dropped) so structurally equal sets compare equal.
 */
public final class TypeSignature {

    private static final Logger LOGGER = LogManager.getLogger(TypeSignature.class);

    /**
     * Nested types deeper than this are treated as unsupported.
     */
    public static final int MAX_NESTING_DEPTH = 16;

    private static final TypeSignature NONE = new TypeSignature(
            EnumSet.noneOf(TypeTag.class), List.of(), EnumSet.noneOf(TypeTag.class));

    private final Set<TypeTag> scalarTags;
    private final List<DecimalBounds> decimals;
    private final Set<TypeTag> containers;

    private TypeSignature(Set<TypeTag> scalarTags, List<DecimalBounds> decimals, Set<TypeTag> containers) {
        EnumSet<TypeTag> scalars = EnumSet.noneOf(TypeTag.class);
        scalars.addAll(scalarTags);
        EnumSet<TypeTag> nested = EnumSet.noneOf(TypeTag.class);
        nested.addAll(containers);
        this.scalarTags = Collections.unmodifiableSet(scalars);
        this.decimals = normalize(decimals);
        this.containers = Collections.unmodifiableSet(nested);
    }

    public static TypeSignature none() {
        return NONE;
    }

    /**
     * Signature of the given scalar tags. {@code DECIMAL} stands for every decimal type.
     * @throws IllegalArgumentException for container tags, use {@link #nested()} instead
     */
    public static TypeSignature of(TypeTag... tags) {
        EnumSet<TypeTag> scalars = EnumSet.noneOf(TypeTag.class);
        List<DecimalBounds> decimals = new ArrayList<>();
        for (TypeTag tag : tags) {
            if (tag.isContainer()) {
                throw new IllegalArgumentException("Container tag " + tag + " must be added with nested()");
            }
            if (tag == TypeTag.DECIMAL) {
                decimals.add(DecimalBounds.upTo(DecimalType.MAX_PRECISION));
            } else {
                scalars.add(tag);
            }
        }
        return new TypeSignature(scalars, decimals, EnumSet.noneOf(TypeTag.class));
    }

    /**
     * Decimals with precision up to {@code maxPrecision} and any valid scale.
     */
    public static TypeSignature decimal(int maxPrecision) {
        return decimal(1, maxPrecision, 0, maxPrecision);
    }

    public static TypeSignature decimal(int minPrecision, int maxPrecision, int minScale, int maxScale) {
        return new TypeSignature(EnumSet.noneOf(TypeTag.class),
                List.of(new DecimalBounds(minPrecision, maxPrecision, minScale, maxScale)),
                EnumSet.noneOf(TypeTag.class));
    }

    public TypeSignature union(TypeSignature other) {
        Objects.requireNonNull(other, "other is null");
        EnumSet<TypeTag> scalars = EnumSet.noneOf(TypeTag.class);
        scalars.addAll(scalarTags);
        scalars.addAll(other.scalarTags);
        List<DecimalBounds> combined = new ArrayList<>(decimals);
        combined.addAll(other.decimals);
        EnumSet<TypeTag> nested = EnumSet.noneOf(TypeTag.class);
        nested.addAll(containers);
        nested.addAll(other.containers);
        return new TypeSignature(scalars, combined, nested);
    }

    public TypeSignature intersect(TypeSignature other) {
        Objects.requireNonNull(other, "other is null");
        EnumSet<TypeTag> scalars = EnumSet.noneOf(TypeTag.class);
        scalars.addAll(scalarTags);
        scalars.retainAll(other.scalarTags);
        List<DecimalBounds> overlap = new ArrayList<>();
        for (DecimalBounds mine : decimals) {
            for (DecimalBounds theirs : other.decimals) {
                DecimalBounds both = mine.intersect(theirs);
                if (both != null) {
                    overlap.add(both);
                }
            }
        }
        EnumSet<TypeTag> nested = EnumSet.noneOf(TypeTag.class);
        nested.addAll(containers);
        nested.retainAll(other.containers);
        return new TypeSignature(scalars, overlap, nested);
    }

    /**
     * Removes scalar tags from this signature.
     */
    public TypeSignature without(TypeTag... tags) {
        EnumSet<TypeTag> scalars = EnumSet.noneOf(TypeTag.class);
        scalars.addAll(scalarTags);
        List<DecimalBounds> remainingDecimals = decimals;
        EnumSet<TypeTag> nested = EnumSet.noneOf(TypeTag.class);
        nested.addAll(containers);
        for (TypeTag tag : tags) {
            scalars.remove(tag);
            nested.remove(tag);
            if (tag == TypeTag.DECIMAL) {
                remainingDecimals = List.of();
            }
        }
        return new TypeSignature(scalars, remainingDecimals, nested);
    }

    /**
     * Returns a signature that also matches arrays, maps and structs whose element types are
     * members of the returned signature, recursively.
     */
    public TypeSignature nested() {
        return nested(TypeTag.ARRAY, TypeTag.MAP, TypeTag.STRUCT);
    }

    /**
     * Like {@link #nested()} but only for the listed container tags.
     */
    public TypeSignature nested(TypeTag... containerTags) {
        EnumSet<TypeTag> nested = EnumSet.noneOf(TypeTag.class);
        nested.addAll(containers);
        for (TypeTag tag : containerTags) {
            if (!tag.isContainer()) {
                throw new IllegalArgumentException("Not a container tag: " + tag);
            }
            nested.add(tag);
        }
        return new TypeSignature(scalarTags, decimals, nested);
    }

    public boolean contains(DataType type) {
        Objects.requireNonNull(type, "type is null");
        return contains(type, 0);
    }

    private boolean contains(DataType type, int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            LOGGER.debug("Type nesting deeper than {} levels, treating {} as unsupported", MAX_NESTING_DEPTH, type);
            return false;
        }
        TypeTag tag = type.getTag();
        if (tag == TypeTag.DECIMAL) {
            DecimalType decimal = (DecimalType) type;
            for (DecimalBounds bounds : decimals) {
                if (bounds.matches(decimal)) {
                    return true;
                }
            }
            return false;
        }
        if (tag.isContainer()) {
            if (!containers.contains(tag)) {
                return false;
            }
            for (DataType element : type.getElementTypes()) {
                if (!contains(element, depth + 1)) {
                    return false;
                }
            }
            return true;
        }
        return scalarTags.contains(tag);
    }

    /**
     * True if any member of the signature has the given tag.
     */
    public boolean mentions(TypeTag tag) {
        if (tag == TypeTag.DECIMAL) {
            return !decimals.isEmpty();
        }
        return scalarTags.contains(tag) || containers.contains(tag);
    }

    public boolean isEmpty() {
        return scalarTags.isEmpty() && decimals.isEmpty() && containers.isEmpty();
    }

    public Set<TypeTag> getScalarTags() {
        return scalarTags;
    }

    public List<DecimalBounds> getDecimals() {
        return decimals;
    }

    public Set<TypeTag> getContainers() {
        return containers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeSignature that = (TypeSignature) o;
        return scalarTags.equals(that.scalarTags)
                && decimals.equals(that.decimals)
                && containers.equals(that.containers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scalarTags, decimals, containers);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        scalarTags.forEach(tag -> parts.add(tag.name()));
        decimals.forEach(bounds -> parts.add(bounds.toString()));
        if (!containers.isEmpty()) {
            parts.add(containers.stream().map(Enum::name).collect(Collectors.joining(", ", "nested[", "]")));
        }
        return parts.stream().collect(Collectors.joining(", ", "{", "}"));
    }

    private static List<DecimalBounds> normalize(List<DecimalBounds> bounds) {
        List<DecimalBounds> distinct = new ArrayList<>(new LinkedHashSet<>(bounds));
        distinct.sort(DecimalBounds.ORDER);
        List<DecimalBounds> kept = new ArrayList<>();
        for (DecimalBounds candidate : distinct) {
            boolean covered = false;
            for (DecimalBounds other : distinct) {
                // distinct entries never cover each other both ways
                if (!other.equals(candidate) && other.covers(candidate)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) {
                kept.add(candidate);
            }
        }
        return Collections.unmodifiableList(kept);
    }

    /**
     * Inclusive precision and scale bounds for decimal members of a signature.
     */
    public static final class DecimalBounds {

        static final Comparator<DecimalBounds> ORDER = Comparator
                .comparingInt((DecimalBounds b) -> b.minPrecision)
                .thenComparingInt(b -> b.maxPrecision)
                .thenComparingInt(b -> b.minScale)
                .thenComparingInt(b -> b.maxScale);

        private final int minPrecision;
        private final int maxPrecision;
        private final int minScale;
        private final int maxScale;

        public DecimalBounds(int minPrecision, int maxPrecision, int minScale, int maxScale) {
            if (minPrecision < 1 || maxPrecision > DecimalType.MAX_PRECISION || minPrecision > maxPrecision) {
                throw new IllegalArgumentException("Invalid precision bounds [" + minPrecision + ", " + maxPrecision + "]");
            }
            if (minScale < 0 || minScale > maxScale) {
                throw new IllegalArgumentException("Invalid scale bounds [" + minScale + ", " + maxScale + "]");
            }
            this.minPrecision = minPrecision;
            this.maxPrecision = maxPrecision;
            this.minScale = minScale;
            this.maxScale = maxScale;
        }

        static DecimalBounds upTo(int maxPrecision) {
            return new DecimalBounds(1, maxPrecision, 0, maxPrecision);
        }

        public int getMinPrecision() {
            return minPrecision;
        }

        public int getMaxPrecision() {
            return maxPrecision;
        }

        public int getMinScale() {
            return minScale;
        }

        public int getMaxScale() {
            return maxScale;
        }

        public boolean matches(DecimalType type) {
            return type.getPrecision() >= minPrecision && type.getPrecision() <= maxPrecision
                    && type.getScale() >= minScale && type.getScale() <= maxScale;
        }

        boolean covers(DecimalBounds other) {
            return minPrecision <= other.minPrecision && maxPrecision >= other.maxPrecision
                    && minScale <= other.minScale && maxScale >= other.maxScale;
        }

        DecimalBounds intersect(DecimalBounds other) {
            int lowP = Math.max(minPrecision, other.minPrecision);
            int highP = Math.min(maxPrecision, other.maxPrecision);
            int lowS = Math.max(minScale, other.minScale);
            int highS = Math.min(maxScale, other.maxScale);
            if (lowP > highP || lowS > highS) {
                return null;
            }
            return new DecimalBounds(lowP, highP, lowS, highS);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            DecimalBounds that = (DecimalBounds) o;
            return minPrecision == that.minPrecision && maxPrecision == that.maxPrecision
                    && minScale == that.minScale && maxScale == that.maxScale;
        }

        @Override
        public int hashCode() {
            return Objects.hash(minPrecision, maxPrecision, minScale, maxScale);
        }

        @Override
        public String toString() {
            return "DECIMAL(" + minPrecision + "-" + maxPrecision + "," + minScale + "-" + maxScale + ")";
        }
    }
}
