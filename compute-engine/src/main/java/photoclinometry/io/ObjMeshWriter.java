package photoclinometry.io;

import lombok.extern.slf4j.Slf4j;
import photoclinometry.domain.surface.HeightField;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Exporta un DEM como malla triangular Wavefront OBJ.
 * <p>
 * Un vértice {@code v x y z} por muestra (x = columna, y = fila, z = altura) y dos
 * triángulos por celda de la rejilla. Los índices de cara empiezan en 1.
 */
@Slf4j
public class ObjMeshWriter {

    public void write(HeightField dem, Path outputPath) throws IOException {
        Path path = outputPath.toAbsolutePath();
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }

        int width = dem.width();
        int height = dem.height();
        double[] z = dem.samples();

        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write("# DEM reconstruido por fotoclinometría: " + width + "x" + height);
            writer.newLine();
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    writer.write(String.format(Locale.ROOT, "v %d %d %.6f", x, y, z[y * width + x]));
                    writer.newLine();
                }
            }
            for (int y = 0; y < height - 1; y++) {
                for (int x = 0; x < width - 1; x++) {
                    int topLeft = y * width + x + 1;
                    int topRight = topLeft + 1;
                    int bottomLeft = topLeft + width;
                    int bottomRight = bottomLeft + 1;
                    writer.write("f " + topLeft + " " + bottomLeft + " " + topRight);
                    writer.newLine();
                    writer.write("f " + topRight + " " + bottomLeft + " " + bottomRight);
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            log.error("Error al escribir la malla OBJ en {}", path, e);
            throw e;
        }
        log.info("Malla OBJ guardada en {} ({} vértices, {} caras)", path,
                width * height, 2 * (width - 1) * (height - 1));
    }
}
