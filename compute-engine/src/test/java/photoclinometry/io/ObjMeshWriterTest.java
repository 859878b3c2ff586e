package photoclinometry.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import photoclinometry.domain.surface.HeightField;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ObjMeshWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Rejilla 3x2: 6 vértices en orden fila a fila y 4 triángulos con índices desde 1")
    void write_shouldEmitVerticesAndFaces() throws IOException {
        // --- Arrange ---
        HeightField dem = HeightField.of(new double[][]{
                {0.0, 1.5, -2.25},
                {3.0, 4.125, 5.0}
        });
        Path output = tempDir.resolve("out/dem.obj");

        // --- Act ---
        new ObjMeshWriter().write(dem, output);

        // --- Assert ---
        List<String> lines = Files.readAllLines(output);
        List<String> vertices = lines.stream().filter(l -> l.startsWith("v ")).toList();
        List<String> faces = lines.stream().filter(l -> l.startsWith("f ")).toList();

        assertThat(lines.get(0)).startsWith("#");
        assertThat(vertices).containsExactly(
                "v 0 0 0.000000",
                "v 1 0 1.500000",
                "v 2 0 -2.250000",
                "v 0 1 3.000000",
                "v 1 1 4.125000",
                "v 2 1 5.000000");
        assertThat(faces).containsExactly(
                "f 1 4 2",
                "f 2 4 5",
                "f 2 5 3",
                "f 3 5 6");
    }

    @Test
    @DisplayName("Todos los índices de cara referencian vértices existentes")
    void write_faceIndices_shouldStayInRange() throws IOException {
        HeightField dem = HeightField.zeros(5, 4);
        Path output = tempDir.resolve("flat.obj");

        new ObjMeshWriter().write(dem, output);

        List<String> faces = Files.readAllLines(output).stream().filter(l -> l.startsWith("f ")).toList();
        assertThat(faces).hasSize(2 * 4 * 3);
        for (String face : faces) {
            String[] parts = face.split(" ");
            for (int k = 1; k < parts.length; k++) {
                assertThat(Integer.parseInt(parts[k])).isBetween(1, 20);
            }
        }
    }
}
