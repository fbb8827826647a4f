package com.quantori.csp.core.balance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RationalMatrixTest {

  @Test
  void reducesToEchelonForm() {
    var matrix = RationalMatrix.of(new long[][] {{-2, 0, 2}, {0, -2, 1}}, 3);

    var reduction = matrix.reduce();

    assertThat(reduction.pivotColumns()).containsExactly(0, 1);
    assertThat(reduction.matrix().get(0, 2)).isEqualTo(Fraction.of(-1));
    assertThat(reduction.matrix().get(1, 2)).isEqualTo(Fraction.of(-1, 2));
    assertThat(matrix.get(0, 0)).isEqualTo(Fraction.of(-2));
    assertThat(matrix.rank()).isEqualTo(2);
  }

  @Test
  void nullSpaceOfWaterSynthesis() {
    var matrix = RationalMatrix.of(new long[][] {{-2, 0, 2}, {0, -2, 1}}, 3);

    List<Fraction[]> basis = matrix.nullSpace();

    assertThat(basis).hasSize(1);
    assertThat(basis.get(0)).containsExactly(Fraction.ONE, Fraction.of(1, 2), Fraction.ONE);
  }

  @Test
  void dependentRowsDoNotAddPivots() {
    var matrix = RationalMatrix.of(new long[][] {{1, -1, 0}, {2, -2, 0}, {0, 0, 0}}, 3);

    assertThat(matrix.rank()).isEqualTo(1);
    assertThat(matrix.nullSpace()).hasSize(2);
  }

  @Test
  void fullRankHasEmptyNullSpace() {
    var matrix = RationalMatrix.of(new long[][] {{1, 0}, {0, 1}}, 2);

    assertThat(matrix.nullSpace()).isEmpty();
  }

  @Test
  void raggedRowsAreRejected() {
    assertThatThrownBy(() -> RationalMatrix.of(new long[][] {{1, 2}, {1}}, 2))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void everyBasisVectorIsAnnihilated() {
    long[][] values = {{-1, 0, 1, 0}, {-3, -2, 0, 2}, {0, -2, 2, 1}};
    var matrix = RationalMatrix.of(values, 4);

    for (Fraction[] vector : matrix.nullSpace()) {
      for (long[] row : values) {
        Fraction sum = Fraction.ZERO;
        for (int c = 0; c < row.length; c++) {
          sum = sum.add(Fraction.of(row[c]).multiply(vector[c]));
        }
        assertThat(sum.isZero()).isTrue();
      }
    }
  }
}
