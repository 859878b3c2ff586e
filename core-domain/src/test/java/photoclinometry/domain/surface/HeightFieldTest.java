package photoclinometry.domain.surface;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeightFieldTest {

    @Test
    @DisplayName("Aplanado fila a fila: index = y * width + x")
    void of_shouldFlattenRowMajor() {
        HeightField field = HeightField.of(new double[][]{
                {1, 2, 3},
                {4, 5, 6}
        });

        assertThat(field.width()).isEqualTo(3);
        assertThat(field.height()).isEqualTo(2);
        assertThat(field.samples()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(field.get(2, 1)).isEqualTo(6);
        assertThat(field.toGrid()[1]).containsExactly(4, 5, 6);
        assertThat(field.min()).isEqualTo(1);
        assertThat(field.max()).isEqualTo(6);
        assertThat(field.mean()).isEqualTo(3.5);
    }

    @Test
    @DisplayName("Inmutabilidad: ni el array de entrada ni el devuelto alteran el campo")
    void shouldBeImmutable() {
        double[] data = {1, 2, 3, 4};
        HeightField field = new HeightField(2, 2, data);

        data[0] = 100;
        field.samples()[1] = 100;

        assertThat(field.samples()).containsExactly(1, 2, 3, 4);
    }

    @Test
    @DisplayName("Igualdad por contenido")
    void equals_shouldCompareContent() {
        assertThat(new HeightField(2, 1, new double[]{1, 2})).isEqualTo(new HeightField(2, 1, new double[]{1, 2}));
        assertThat(new HeightField(2, 1, new double[]{1, 2})).isNotEqualTo(new HeightField(1, 2, new double[]{1, 2}));
    }

    @Test
    @DisplayName("Dimensiones incoherentes se rechazan")
    void constructor_shouldRejectMismatchedShape() {
        assertThatThrownBy(() -> new HeightField(3, 3, new double[8])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeightField.of(new double[][]{{1, 2}, {3}})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeightField.zeros(4, 4).get(4, 0)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
