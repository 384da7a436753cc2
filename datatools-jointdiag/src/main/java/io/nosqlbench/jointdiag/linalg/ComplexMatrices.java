/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.jointdiag.linalg;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.complex.ComplexField;
import org.apache.commons.math3.linear.Array2DRowFieldMatrix;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.List;
import java.util.Objects;

/// Static helpers over commons-math3 `FieldMatrix<Complex>`.
///
/// Every matrix handled by the joint diagonalization code is a complex field
/// matrix. Real-valued problems are carried with zero imaginary parts; the
/// decompositions in this package detect that case and stay on the real
/// code path so real input produces exactly real output.
///
/// ## Real embedding
///
/// Decompositions commons-math3 only offers for real matrices are reached
/// through the embedding
///
/// ```text
///  φ(A) = [ Re(A)  -Im(A) ]
///         [ Im(A)   Re(A) ]
/// ```
///
/// which maps Hermitian matrices to symmetric ones and unitary matrices to
/// orthogonal ones.
public final class ComplexMatrices {

    private ComplexMatrices() {
        // Utility class
    }

    /// Returns an all-zero rows × cols matrix.
    public static FieldMatrix<Complex> zeros(int rows, int cols) {
        FieldMatrix<Complex> result = new Array2DRowFieldMatrix<>(ComplexField.getInstance(), rows, cols);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                result.setEntry(r, c, Complex.ZERO);
            }
        }
        return result;
    }

    /// Returns the n × n identity.
    public static FieldMatrix<Complex> identity(int n) {
        FieldMatrix<Complex> result = zeros(n, n);
        for (int i = 0; i < n; i++) {
            result.setEntry(i, i, Complex.ONE);
        }
        return result;
    }

    /// Wraps a real array as a complex matrix with zero imaginary parts.
    public static FieldMatrix<Complex> fromReal(double[][] values) {
        Objects.requireNonNull(values, "values");
        int rows = values.length;
        int cols = rows == 0 ? 0 : values[0].length;
        Complex[][] data = new Complex[rows][cols];
        for (int r = 0; r < rows; r++) {
            if (values[r].length != cols) {
                throw new IllegalArgumentException("ragged array at row " + r);
            }
            for (int c = 0; c < cols; c++) {
                data[r][c] = new Complex(values[r][c], 0.0);
            }
        }
        return new Array2DRowFieldMatrix<>(ComplexField.getInstance(), data, false);
    }

    public static FieldMatrix<Complex> fromReal(RealMatrix matrix) {
        return fromReal(matrix.getData());
    }

    /// Builds a complex matrix from separate real and imaginary parts.
    public static FieldMatrix<Complex> fromParts(double[][] re, double[][] im) {
        int rows = re.length;
        int cols = rows == 0 ? 0 : re[0].length;
        if (im.length != rows || (rows > 0 && im[0].length != cols)) {
            throw new IllegalArgumentException("real and imaginary parts differ in shape");
        }
        Complex[][] data = new Complex[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                data[r][c] = new Complex(re[r][c], im[r][c]);
            }
        }
        return new Array2DRowFieldMatrix<>(ComplexField.getInstance(), data, false);
    }

    public static FieldMatrix<Complex> fromComplex(Complex[][] values) {
        return new Array2DRowFieldMatrix<>(ComplexField.getInstance(), values, true);
    }

    /// Real part as a commons-math3 real matrix.
    public static RealMatrix realPart(FieldMatrix<Complex> a) {
        int rows = a.getRowDimension();
        int cols = a.getColumnDimension();
        double[][] data = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                data[r][c] = a.getEntry(r, c).getReal();
            }
        }
        return new Array2DRowRealMatrix(data, false);
    }

    /// Returns true when every imaginary part is exactly zero.
    public static boolean isReal(FieldMatrix<Complex> a) {
        for (int r = 0; r < a.getRowDimension(); r++) {
            for (int c = 0; c < a.getColumnDimension(); c++) {
                if (a.getEntry(r, c).getImaginary() != 0.0) {
                    return false;
                }
            }
        }
        return true;
    }

    /// Conjugate transpose A^H.
    public static FieldMatrix<Complex> conjugateTranspose(FieldMatrix<Complex> a) {
        int rows = a.getRowDimension();
        int cols = a.getColumnDimension();
        Complex[][] data = new Complex[cols][rows];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                data[c][r] = a.getEntry(r, c).conjugate();
            }
        }
        return new Array2DRowFieldMatrix<>(ComplexField.getInstance(), data, false);
    }

    /// A^H · B without materializing A^H.
    public static FieldMatrix<Complex> adjointMultiply(FieldMatrix<Complex> a, FieldMatrix<Complex> b) {
        if (a.getRowDimension() != b.getRowDimension()) {
            throw new IllegalArgumentException("row dimensions differ: " + a.getRowDimension()
                + " vs " + b.getRowDimension());
        }
        int inner = a.getRowDimension();
        int rows = a.getColumnDimension();
        int cols = b.getColumnDimension();
        Complex[][] data = new Complex[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double re = 0.0;
                double im = 0.0;
                for (int x = 0; x < inner; x++) {
                    Complex u = a.getEntry(x, r);
                    Complex v = b.getEntry(x, c);
                    // conj(u) * v
                    re += u.getReal() * v.getReal() + u.getImaginary() * v.getImaginary();
                    im += u.getReal() * v.getImaginary() - u.getImaginary() * v.getReal();
                }
                data[r][c] = new Complex(re, im);
            }
        }
        return new Array2DRowFieldMatrix<>(ComplexField.getInstance(), data, false);
    }

    /// A^H · C · B, the congruence used throughout the solver.
    public static FieldMatrix<Complex> congruence(FieldMatrix<Complex> a, FieldMatrix<Complex> c,
                                                  FieldMatrix<Complex> b) {
        return adjointMultiply(a, c.multiply(b));
    }

    /// (A + A^H) / 2.
    public static FieldMatrix<Complex> hermitianPart(FieldMatrix<Complex> a) {
        requireSquare(a);
        int n = a.getRowDimension();
        Complex[][] data = new Complex[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                data[r][c] = a.getEntry(r, c).add(a.getEntry(c, r).conjugate()).divide(2.0);
            }
        }
        return new Array2DRowFieldMatrix<>(ComplexField.getInstance(), data, false);
    }

    /// Element-wise mean of equally sized matrices.
    public static FieldMatrix<Complex> mean(List<FieldMatrix<Complex>> matrices) {
        if (matrices.isEmpty()) {
            throw new IllegalArgumentException("cannot average an empty list of matrices");
        }
        FieldMatrix<Complex> sum = matrices.get(0).copy();
        for (int i = 1; i < matrices.size(); i++) {
            sum = sum.add(matrices.get(i));
        }
        return sum.scalarMultiply(new Complex(1.0 / matrices.size(), 0.0));
    }

    /// Multiplies every entry by a real scalar.
    public static FieldMatrix<Complex> scale(FieldMatrix<Complex> a, double factor) {
        return a.scalarMultiply(new Complex(factor, 0.0));
    }

    /// Sum of squared moduli of all entries (the squared Frobenius norm).
    public static double sumOfSquares(FieldMatrix<Complex> a) {
        double sum = 0.0;
        for (int r = 0; r < a.getRowDimension(); r++) {
            for (int c = 0; c < a.getColumnDimension(); c++) {
                Complex z = a.getEntry(r, c);
                sum += z.getReal() * z.getReal() + z.getImaginary() * z.getImaginary();
            }
        }
        return sum;
    }

    /// Frobenius norm of the off-diagonal part of a square matrix.
    public static double offDiagonalNorm(FieldMatrix<Complex> a) {
        requireSquare(a);
        double sum = 0.0;
        for (int r = 0; r < a.getRowDimension(); r++) {
            for (int c = 0; c < a.getColumnDimension(); c++) {
                if (r != c) {
                    Complex z = a.getEntry(r, c);
                    sum += z.getReal() * z.getReal() + z.getImaginary() * z.getImaginary();
                }
            }
        }
        return Math.sqrt(sum);
    }

    /// Main diagonal of a square matrix.
    public static Complex[] diagonal(FieldMatrix<Complex> a) {
        requireSquare(a);
        Complex[] d = new Complex[a.getRowDimension()];
        for (int i = 0; i < d.length; i++) {
            d[i] = a.getEntry(i, i);
        }
        return d;
    }

    /// Trace of a square matrix.
    public static Complex trace(FieldMatrix<Complex> a) {
        requireSquare(a);
        Complex t = Complex.ZERO;
        for (int i = 0; i < a.getRowDimension(); i++) {
            t = t.add(a.getEntry(i, i));
        }
        return t;
    }

    /// Multiplies column `column` of `a` in place by `factor`.
    public static void scaleColumn(FieldMatrix<Complex> a, int column, Complex factor) {
        for (int r = 0; r < a.getRowDimension(); r++) {
            a.setEntry(r, column, a.getEntry(r, column).multiply(factor));
        }
    }

    /// Swaps two columns of `a` in place.
    public static void swapColumns(FieldMatrix<Complex> a, int first, int second) {
        if (first == second) {
            return;
        }
        Complex[] tmp = a.getColumn(first);
        a.setColumn(first, a.getColumn(second));
        a.setColumn(second, tmp);
    }

    /// Real embedding φ(A) of a rows × cols complex matrix, 2rows × 2cols.
    public static RealMatrix embed(FieldMatrix<Complex> a) {
        int rows = a.getRowDimension();
        int cols = a.getColumnDimension();
        double[][] data = new double[2 * rows][2 * cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                Complex z = a.getEntry(r, c);
                data[r][c] = z.getReal();
                data[r][c + cols] = -z.getImaginary();
                data[r + rows][c] = z.getImaginary();
                data[r + rows][c + cols] = z.getReal();
            }
        }
        return new Array2DRowRealMatrix(data, false);
    }

    /// Folds a 2rows × 2cols real matrix back onto the complex structure.
    ///
    /// The two copies of each part are averaged, which is the orthogonal
    /// projection onto embedded complex matrices.
    public static FieldMatrix<Complex> unembed(RealMatrix embedded) {
        if (embedded.getRowDimension() % 2 != 0 || embedded.getColumnDimension() % 2 != 0) {
            throw new IllegalArgumentException("embedded matrix must have even dimensions");
        }
        int rows = embedded.getRowDimension() / 2;
        int cols = embedded.getColumnDimension() / 2;
        Complex[][] data = new Complex[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double re = 0.5 * (embedded.getEntry(r, c) + embedded.getEntry(r + rows, c + cols));
                double im = 0.5 * (embedded.getEntry(r + rows, c) - embedded.getEntry(r, c + cols));
                data[r][c] = new Complex(re, im);
            }
        }
        return new Array2DRowFieldMatrix<>(ComplexField.getInstance(), data, false);
    }

    static void requireSquare(FieldMatrix<Complex> a) {
        if (!a.isSquare()) {
            throw new IllegalArgumentException("matrix must be square, got "
                + a.getRowDimension() + "x" + a.getColumnDimension());
        }
    }
}
