package org.janelia.atlasreg.geometry;

import java.util.Arrays;

import Jama.Matrix;
import com.google.common.base.Preconditions;

/**
 * 3D affine transform held as a homogeneous 4x4 matrix. A new instance is the identity.
 */
public class Affine3D implements InvertibleSpatialTransform {

    private static final int ROW_PACKED_SIZE = 12;

    private Matrix matrix;

    public Affine3D() {
        this(Matrix.identity(4, 4));
    }

    private Affine3D(Matrix matrix) {
        Preconditions.checkArgument(matrix.getRowDimension() == 4 && matrix.getColumnDimension() == 4);
        this.matrix = matrix;
    }

    /**
     * @param rowPacked the first three rows of the matrix: m00, m01, m02, m03, m10, ..., m23
     */
    public static Affine3D fromRowPacked(double... rowPacked) {
        Affine3D affine = new Affine3D();
        affine.set(rowPacked);
        return affine;
    }

    public Affine3D set(double... rowPacked) {
        Preconditions.checkArgument(rowPacked != null && rowPacked.length == ROW_PACKED_SIZE,
                "An affine needs %s values but got %s", ROW_PACKED_SIZE, rowPacked == null ? null : Arrays.toString(rowPacked));
        Matrix m = Matrix.identity(4, 4);
        for (int i = 0; i < ROW_PACKED_SIZE; i++) {
            m.set(i / 4, i % 4, rowPacked[i]);
        }
        matrix = m;
        return this;
    }

    public double get(int row, int column) {
        return matrix.get(row, column);
    }

    public double[] getRowPackedCopy() {
        double[] rowPacked = new double[ROW_PACKED_SIZE];
        for (int i = 0; i < ROW_PACKED_SIZE; i++) {
            rowPacked[i] = matrix.get(i / 4, i % 4);
        }
        return rowPacked;
    }

    /**
     * Apply the given transform after this one.
     */
    public Affine3D preConcatenate(Affine3D after) {
        matrix = after.matrix.times(matrix);
        return this;
    }

    /**
     * Apply the given transform before this one.
     */
    public Affine3D concatenate(Affine3D before) {
        matrix = matrix.times(before.matrix);
        return this;
    }

    public Affine3D translate(double tx, double ty, double tz) {
        return preConcatenate(fromRowPacked(
                1, 0, 0, tx,
                0, 1, 0, ty,
                0, 0, 1, tz));
    }

    public Affine3D scale(double s) {
        return preConcatenate(fromRowPacked(
                s, 0, 0, 0,
                0, s, 0, 0,
                0, 0, s, 0));
    }

    public boolean isInvertible() {
        return matrix.det() != 0;
    }

    @Override
    public void apply(double[] source, double[] target) {
        double[][] m = matrix.getArray();
        double x = source[0];
        double y = source[1];
        double z = source[2];
        for (int r = 0; r < DIMENSIONS; r++) {
            target[r] = m[r][0] * x + m[r][1] * y + m[r][2] * z + m[r][3];
        }
    }

    @Override
    public void applyInverse(double[] source, double[] target) {
        inverse().apply(target, source);
    }

    @Override
    public Affine3D inverse() {
        Preconditions.checkState(isInvertible(), "Affine %s is singular", this);
        return new Affine3D(matrix.inverse());
    }

    @Override
    public Affine3D copy() {
        return new Affine3D(matrix.copy());
    }

    @Override
    public String toString() {
        return "Affine3D" + Arrays.toString(getRowPackedCopy());
    }
}
