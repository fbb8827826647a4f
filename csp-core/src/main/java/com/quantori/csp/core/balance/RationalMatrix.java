package com.quantori.csp.core.balance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable matrix of {@link Fraction}s with the exact row reduction needed to extract a null
 * space. No floating point is involved, so large coefficients never accumulate rounding error.
 */
public final class RationalMatrix {
  private final Fraction[][] cells;
  private final int rows;
  private final int columns;

  private RationalMatrix(Fraction[][] cells, int columns) {
    this.cells = cells;
    this.rows = cells.length;
    this.columns = columns;
  }

  public static RationalMatrix of(long[][] values, int columns) {
    Fraction[][] cells = new Fraction[values.length][columns];
    for (int row = 0; row < values.length; row++) {
      if (values[row].length != columns) {
        throw new IllegalArgumentException("Row " + row + " has " + values[row].length + " columns, expected " + columns);
      }
      for (int column = 0; column < columns; column++) {
        cells[row][column] = Fraction.of(values[row][column]);
      }
    }
    return new RationalMatrix(cells, columns);
  }

  public int rows() {
    return rows;
  }

  public int columns() {
    return columns;
  }

  public Fraction get(int row, int column) {
    return cells[row][column];
  }

  /**
   * Gauss-Jordan elimination to reduced row echelon form.
   *
   * @return the reduced matrix together with its pivot columns
   */
  public Reduction reduce() {
    Fraction[][] m = copyCells();
    List<Integer> pivots = new ArrayList<>();
    int pivotRow = 0;
    for (int column = 0; column < columns && pivotRow < rows; column++) {
      int found = -1;
      for (int row = pivotRow; row < rows; row++) {
        if (!m[row][column].isZero()) {
          found = row;
          break;
        }
      }
      if (found < 0) {
        continue;
      }
      Fraction[] swap = m[pivotRow];
      m[pivotRow] = m[found];
      m[found] = swap;

      Fraction pivot = m[pivotRow][column];
      for (int c = column; c < columns; c++) {
        m[pivotRow][c] = m[pivotRow][c].divide(pivot);
      }
      for (int row = 0; row < rows; row++) {
        Fraction factor = m[row][column];
        if (row == pivotRow || factor.isZero()) {
          continue;
        }
        for (int c = column; c < columns; c++) {
          m[row][c] = m[row][c].subtract(factor.multiply(m[pivotRow][c]));
        }
      }
      pivots.add(column);
      pivotRow++;
    }
    return new Reduction(new RationalMatrix(m, columns), pivots.stream().mapToInt(Integer::intValue).toArray());
  }

  public int rank() {
    return reduce().pivotColumns().length;
  }

  /**
   * Basis of the right null space, one vector per free column. In the vector built for free
   * column {@code f} the entry at {@code f} is one, the other free entries are zero and every
   * pivot entry is the negated reduced coefficient of {@code f} in its pivot row.
   *
   * @return basis vectors, empty when the matrix has full column rank
   */
  public List<Fraction[]> nullSpace() {
    Reduction reduction = reduce();
    int[] pivotColumns = reduction.pivotColumns();
    boolean[] isPivot = new boolean[columns];
    for (int pivotColumn : pivotColumns) {
      isPivot[pivotColumn] = true;
    }
    List<Fraction[]> basis = new ArrayList<>();
    for (int free = 0; free < columns; free++) {
      if (isPivot[free]) {
        continue;
      }
      Fraction[] vector = new Fraction[columns];
      Arrays.fill(vector, Fraction.ZERO);
      vector[free] = Fraction.ONE;
      for (int row = 0; row < pivotColumns.length; row++) {
        vector[pivotColumns[row]] = reduction.matrix().get(row, free).negate();
      }
      basis.add(vector);
    }
    return basis;
  }

  private Fraction[][] copyCells() {
    Fraction[][] copy = new Fraction[rows][];
    for (int row = 0; row < rows; row++) {
      copy[row] = Arrays.copyOf(cells[row], columns);
    }
    return copy;
  }

  @Override
  public String toString() {
    StringBuilder text = new StringBuilder();
    for (Fraction[] row : cells) {
      text.append(Arrays.toString(row)).append('\n');
    }
    return text.toString();
  }

  /**
   * Result of {@link #reduce()}: the reduced matrix and the column of each pivot, by row.
   */
  public record Reduction(RationalMatrix matrix, int[] pivotColumns) {
  }
}
