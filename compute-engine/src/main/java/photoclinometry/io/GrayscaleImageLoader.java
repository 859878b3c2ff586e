package photoclinometry.io;

import lombok.extern.slf4j.Slf4j;
import photoclinometry.domain.image.ObservedImage;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Carga una imagen raster (PNG, TIFF sin compresión, ...) y la convierte en una
 * {@link ObservedImage} con brillo en [0, 1].
 * <p>
 * Imágenes de una o dos bandas: se toma la primera banda (la segunda sería alfa).
 * Imágenes en color: luminancia ITU-R BT.601 de las tres primeras bandas.
 * Imágenes con paleta: la banda guarda el índice; se aplica la luminancia al color de la paleta.
 * La normalización divide por el valor máximo representable con la profundidad de bits.
 */
@Slf4j
public class GrayscaleImageLoader {

    private static final double LUMA_R = 0.299;
    private static final double LUMA_G = 0.587;
    private static final double LUMA_B = 0.114;

    public ObservedImage load(Path imagePath) throws IOException {
        Path path = imagePath.toAbsolutePath();
        if (!Files.exists(path)) {
            throw new IOException("Imagen de entrada no encontrada: " + path);
        }

        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("Formato de imagen no soportado: " + path);
        }

        ObservedImage observed = toObservedImage(image);
        log.info("Imagen cargada: {} ({}x{}, {} bandas)", path.getFileName(),
                observed.getWidth(), observed.getHeight(), image.getRaster().getNumBands());
        return observed;
    }

    public ObservedImage toObservedImage(BufferedImage image) {
        if (image.getColorModel() instanceof IndexColorModel) {
            return fromPalette(image, (IndexColorModel) image.getColorModel());
        }
        Raster raster = image.getRaster();
        int width = raster.getWidth();
        int height = raster.getHeight();
        int bands = raster.getNumBands();
        int bits = raster.getSampleModel().getSampleSize(0);
        double maxValue = bits >= 31 ? Integer.MAX_VALUE : (double) ((1L << bits) - 1);

        double[] brightness = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double value;
                if (bands >= 3) {
                    value = LUMA_R * raster.getSample(x, y, 0)
                            + LUMA_G * raster.getSample(x, y, 1)
                            + LUMA_B * raster.getSample(x, y, 2);
                } else {
                    value = raster.getSample(x, y, 0);
                }
                brightness[y * width + x] = value / maxValue;
            }
        }
        return ObservedImage.wrap(width, height, brightness);
    }

    private ObservedImage fromPalette(BufferedImage image, IndexColorModel palette) {
        Raster raster = image.getRaster();
        int width = raster.getWidth();
        int height = raster.getHeight();

        double[] brightness = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int index = raster.getSample(x, y, 0);
                double value = LUMA_R * palette.getRed(index)
                        + LUMA_G * palette.getGreen(index)
                        + LUMA_B * palette.getBlue(index);
                brightness[y * width + x] = value / 255.0;
            }
        }
        return ObservedImage.wrap(width, height, brightness);
    }
}
