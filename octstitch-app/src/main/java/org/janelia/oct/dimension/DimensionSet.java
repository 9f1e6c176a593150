package org.janelia.oct.dimension;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Reader;
import java.io.Serializable;

import org.janelia.oct.json.JsonUtils;

/**
 * Named axes (lambda, x, y, z) and scan geometry describing one acquisition or one
 * reconstructed volume.  The lambda axis is always expressed in nm, the spatial axes
 * may use any {@link LengthUnit}.  The z axis is undefined until a spectral transform
 * has been derived for the data set.  Instances are immutable.
 *
 * @author Eric Trautman
 */
public class DimensionSet
        implements Serializable {

    private DimensionAxis lambda;
    private DimensionAxis x;
    private DimensionAxis y;
    private DimensionAxis z;
    private ScanGeometry aux;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DimensionSet() {
    }

    public DimensionSet(final DimensionAxis lambda,
                        final DimensionAxis x,
                        final DimensionAxis y,
                        final DimensionAxis z,
                        final ScanGeometry aux) {
        if ((lambda != null) && (lambda.getUnits() != LengthUnit.NM)) {
            throw new IllegalArgumentException("lambda axis must be expressed in nm");
        }
        this.lambda = lambda;
        this.x = x;
        this.y = y;
        this.z = z;
        this.aux = aux == null ? new ScanGeometry() : aux;
    }

    public DimensionAxis getLambda() {
        return lambda;
    }

    public DimensionAxis getX() {
        return x;
    }

    public DimensionAxis getY() {
        return y;
    }

    public DimensionAxis getZ() {
        return z;
    }

    public ScanGeometry getAux() {
        return aux == null ? new ScanGeometry() : aux;
    }

    public DimensionSet withLambda(final DimensionAxis newLambda) {
        return new DimensionSet(newLambda, x, y, z, aux);
    }

    public DimensionSet withX(final DimensionAxis newX) {
        return new DimensionSet(lambda, newX, y, z, aux);
    }

    public DimensionSet withY(final DimensionAxis newY) {
        return new DimensionSet(lambda, x, newY, z, aux);
    }

    public DimensionSet withZ(final DimensionAxis newZ) {
        return new DimensionSet(lambda, x, y, newZ, aux);
    }

    /**
     * @return true if x, y, and z axes all have physical values.
     */
    @JsonIgnore
    public boolean hasSpatialValues() {
        return isDefined(x) && isDefined(y) && isDefined(z);
    }

    /**
     * @return copy of this set with all defined spatial axes (x, y, z) converted to the specified units.
     */
    public DimensionSet toSpatialUnits(final LengthUnit units) {
        return new DimensionSet(lambda,
                                x == null ? null : x.toUnits(units),
                                y == null ? null : y.toUnits(units),
                                z == null ? null : z.toUnits(units),
                                aux);
    }

    /**
     * @return true if the two sets order and size their axes identically.
     */
    public boolean hasSameShape(final DimensionSet that) {
        return sameSize(x, that.x) && sameSize(y, that.y) && sameSize(z, that.z) && sameSize(lambda, that.lambda);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static DimensionSet fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    @Override
    public String toString() {
        return "{lambda: " + lambda + ", x: " + x + ", y: " + y + ", z: " + z + ", aux: " + aux + "}";
    }

    private static boolean isDefined(final DimensionAxis axis) {
        return (axis != null) && (! axis.isEmpty());
    }

    private static boolean sameSize(final DimensionAxis a,
                                    final DimensionAxis b) {
        return (a == null) ? (b == null) : ((b != null) && (a.size() == b.size()));
    }

    private static final JsonUtils.Helper<DimensionSet> JSON_HELPER =
            new JsonUtils.Helper<>(DimensionSet.class);
}
