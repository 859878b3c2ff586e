package photoclinometry.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import photoclinometry.config.PhotoclinometryConfig;
import photoclinometry.domain.illumination.LightVector;
import photoclinometry.domain.image.ObservedImage;
import photoclinometry.domain.reconstruction.DemStatistics;
import photoclinometry.domain.reconstruction.ReconstructionResult;
import photoclinometry.domain.surface.HeightField;
import photoclinometry.io.GrayscaleImageLoader;
import photoclinometry.io.JsonFileHandler;
import photoclinometry.io.ObjMeshWriter;
import photoclinometry.io.ReconstructionSummary;
import photoclinometry.physics.model.IlluminationGeometry;
import photoclinometry.physics.solver.IterationObserver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Orquesta la reconstrucción fotoclinométrica completa.
 * <p>
 * Geometría de iluminación → optimización SFS → escalado a metros → estadísticas.
 * La variante basada en archivos añade la carga de configuración e imagen y la
 * escritura de la malla OBJ y del resumen JSON.
 */
@Slf4j
public class PhotoclinometryPipeline {

    public static final String DEM_OBJ_FILENAME = "reconstructed_dem.obj";
    public static final String SUMMARY_FILENAME = "reconstruction_summary.json";

    private final ShapeFromShadingOptimizer optimizer;
    private final JsonFileHandler jsonFileHandler;
    private final GrayscaleImageLoader imageLoader;
    private final ObjMeshWriter meshWriter;

    public PhotoclinometryPipeline() {
        this(new ShapeFromShadingOptimizer(), new JsonFileHandler(), new GrayscaleImageLoader(), new ObjMeshWriter());
    }

    public PhotoclinometryPipeline(ShapeFromShadingOptimizer optimizer, JsonFileHandler jsonFileHandler,
                                   GrayscaleImageLoader imageLoader, ObjMeshWriter meshWriter) {
        this.optimizer = optimizer;
        this.jsonFileHandler = jsonFileHandler;
        this.imageLoader = imageLoader;
        this.meshWriter = meshWriter;
    }

    public ReconstructionResult reconstruct(ObservedImage observed, PhotoclinometryConfig config) {
        return reconstruct(observed, config, new LoggingIterationObserver(config.maxIterations()));
    }

    /**
     * Ejecuta la reconstrucción en memoria, sin E/S de archivos.
     */
    public ReconstructionResult reconstruct(ObservedImage observed, PhotoclinometryConfig config,
                                            IterationObserver observer) {
        log.info("--- Iniciando reconstrucción Shape-from-Shading (fotoclinometría) ---");
        long start = System.currentTimeMillis();

        config.validate();
        LightVector light = IlluminationGeometry.lightVector(config.sunAzimuthDeg(), config.sunElevationDeg());
        log.info("Vector de luz calculado (X,Y,Z): {}", Arrays.toString(roundedComponents(light)));

        OptimizedSurface optimized = optimizer.optimize(observed, config, light, observer);
        HeightField scaled = PhysicalScaler.scaleToMeters(optimized.surface(), config);
        DemStatistics statistics = DemStatistics.of(scaled);

        long elapsed = System.currentTimeMillis() - start;
        log.info("Reconstrucción finalizada en {} ms. Altura mínima: {} m, máxima: {} m",
                elapsed, String.format("%.2f", statistics.min()), String.format("%.2f", statistics.max()));

        return ReconstructionResult.builder()
                .relativeDem(optimized.surface())
                .scaledDem(scaled)
                .lightVector(light)
                .pixelScaleMeters(PhysicalScaler.pixelScaleMeters(config))
                .statistics(statistics)
                .convergence(optimized.report())
                .elapsedMillis(elapsed)
                .build();
    }

    /**
     * Carga configuración e imagen desde disco, reconstruye y guarda la malla OBJ y el resumen JSON.
     *
     * @param imagePath  Imagen en escala de grises.
     * @param configPath Configuración JSON (claves snake_case).
     * @param outputDir  Directorio de salida; se crea si no existe.
     * @throws IOException si falla cualquier lectura o escritura.
     */
    public ReconstructionResult runFromFiles(Path imagePath, Path configPath, Path outputDir) throws IOException {
        PhotoclinometryConfig config = jsonFileHandler.readFromFile(configPath, PhotoclinometryConfig.class);
        ObservedImage observed = imageLoader.load(imagePath);

        ReconstructionResult result = reconstruct(observed, config);

        Files.createDirectories(outputDir);
        meshWriter.write(result.scaledDem(), outputDir.resolve(DEM_OBJ_FILENAME));
        jsonFileHandler.writeToFile(ReconstructionSummary.from(result, config), outputDir.resolve(SUMMARY_FILENAME));
        log.info("Salidas guardadas en {}", outputDir.toAbsolutePath());
        return result;
    }

    private static double[] roundedComponents(LightVector light) {
        double[] components = light.toArray();
        for (int i = 0; i < components.length; i++) {
            components[i] = Math.round(components[i] * 1000.0) / 1000.0;
        }
        return components;
    }
}
