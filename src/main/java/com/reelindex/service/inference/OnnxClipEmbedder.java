package com.reelindex.service.inference;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.reelindex.config.AppConfig;
import com.reelindex.util.EmbeddingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.FloatBuffer;
import java.nio.LongBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * CLIP ViT-B/32 image and text encoder on ONNX Runtime.
 *
 * Expects {@code vision_model.onnx}, {@code text_model.onnx} and
 * {@code tokenizer.json} in the model directory (Hugging Face
 * Xenova/clip-vit-base-patch32 layout):
 * vision: pixel_values [1, 3, 224, 224] float32 -> image_embeds [1, 512]
 * text: input_ids [1, 77] int64 -> text_embeds [1, 512]
 *
 * Sessions are created once at startup and shared; ONNX Runtime sessions are
 * safe for concurrent {@code run} calls, so search requests and the worker can
 * use the same instance.
 */
@Component
public class OnnxClipEmbedder implements VisualEmbedder {

    private static final Logger log = LoggerFactory.getLogger(OnnxClipEmbedder.class);

    public static final ModelInfo MODEL = new ModelInfo("clip", "clip-vit-base-patch32", 512);

    private static final float[] MEAN = { 0.48145466f, 0.4578275f, 0.40821073f };
    private static final float[] STD = { 0.26862954f, 0.26130258f, 0.27577711f };
    private static final int INPUT_SIZE = 224;

    private final AppConfig appConfig;

    private OrtEnvironment environment;
    private OrtSession visionSession;
    private OrtSession textSession;
    private ClipTokenizer tokenizer;
    private volatile boolean loaded = false;

    public OnnxClipEmbedder(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    /**
     * Loads the models if they are present. Missing models leave the embedder
     * unavailable without failing startup.
     */
    @PostConstruct
    public void init() {
        Path dir = Paths.get(appConfig.getModelDir());
        Path vision = dir.resolve("vision_model.onnx");
        Path text = dir.resolve("text_model.onnx");
        Path tokenizerJson = dir.resolve("tokenizer.json");
        if (!Files.exists(vision) || !Files.exists(text) || !Files.exists(tokenizerJson)) {
            log.info("CLIP models not found in {}; visual embedding disabled until they are installed", dir);
            return;
        }
        try {
            load(vision, text, tokenizerJson);
        } catch (OrtException | IOException e) {
            log.error("Failed to load CLIP models from {}: {}", dir, e.getMessage());
        }
    }

    private synchronized void load(Path vision, Path text, Path tokenizerJson) throws OrtException, IOException {
        if (loaded) {
            return;
        }
        environment = OrtEnvironment.getEnvironment();
        OrtSession.SessionOptions options = new OrtSession.SessionOptions();
        options.setIntraOpNumThreads(Math.max(1, Runtime.getRuntime().availableProcessors() / 2));
        options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

        visionSession = environment.createSession(vision.toString(), options);
        textSession = environment.createSession(text.toString(), options);
        tokenizer = ClipTokenizer.fromFile(tokenizerJson);
        loaded = true;
        log.info("CLIP vision and text encoders loaded ({})", MODEL.version());
    }

    @Override
    public boolean isAvailable() {
        return loaded;
    }

    @Override
    public ModelInfo modelInfo() {
        return MODEL;
    }

    @Override
    public float[] embedImage(Path image) {
        requireLoaded();
        BufferedImage source;
        try {
            source = ImageIO.read(image.toFile());
        } catch (IOException e) {
            throw new InferenceException("Cannot read image " + image.getFileName(), e);
        }
        if (source == null) {
            throw new InferenceException("Unsupported image format: " + image.getFileName());
        }

        float[] pixels = toNormalizedChw(resize(centerSquare(source), INPUT_SIZE));
        try (OnnxTensor input = OnnxTensor.createTensor(environment, FloatBuffer.wrap(pixels),
                new long[] { 1, 3, INPUT_SIZE, INPUT_SIZE });
                OrtSession.Result result = visionSession.run(Map.of("pixel_values", input))) {
            float[][] output = (float[][]) result.get("image_embeds").get().getValue();
            return EmbeddingUtils.l2Normalize(output[0]);
        } catch (OrtException e) {
            throw new InferenceException("CLIP vision inference failed for " + image.getFileName(), e);
        }
    }

    @Override
    public float[] embedText(String text) {
        requireLoaded();
        long[] ids = tokenizer.encode(text);
        try (OnnxTensor input = OnnxTensor.createTensor(environment, LongBuffer.wrap(ids),
                new long[] { 1, ClipTokenizer.CONTEXT_LENGTH });
                OrtSession.Result result = textSession.run(Map.of("input_ids", input))) {
            float[][] output = (float[][]) result.get("text_embeds").get().getValue();
            return EmbeddingUtils.l2Normalize(output[0]);
        } catch (OrtException e) {
            throw new InferenceException("CLIP text inference failed", e);
        }
    }

    private void requireLoaded() {
        if (!loaded) {
            throw new InferenceException("Visual embedding model not loaded");
        }
    }

    private static BufferedImage centerSquare(BufferedImage img) {
        int side = Math.min(img.getWidth(), img.getHeight());
        return img.getSubimage((img.getWidth() - side) / 2, (img.getHeight() - side) / 2, side, side);
    }

    private static BufferedImage resize(BufferedImage img, int size) {
        BufferedImage out = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g.drawImage(img, 0, 0, size, size, null);
        g.dispose();
        return out;
    }

    /** Planar RGB, each channel scaled to [0,1] then standardized with the CLIP mean/std. */
    private static float[] toNormalizedChw(BufferedImage img) {
        int plane = img.getWidth() * img.getHeight();
        float[] chw = new float[3 * plane];
        for (int y = 0; y < img.getHeight(); y++) {
            for (int x = 0; x < img.getWidth(); x++) {
                int rgb = img.getRGB(x, y);
                int i = y * img.getWidth() + x;
                chw[i] = (((rgb >> 16) & 0xFF) / 255f - MEAN[0]) / STD[0];
                chw[plane + i] = (((rgb >> 8) & 0xFF) / 255f - MEAN[1]) / STD[1];
                chw[2 * plane + i] = ((rgb & 0xFF) / 255f - MEAN[2]) / STD[2];
            }
        }
        return chw;
    }

    @PreDestroy
    public synchronized void shutdown() {
        loaded = false;
        closeQuietly(visionSession, "vision");
        closeQuietly(textSession, "text");
        visionSession = null;
        textSession = null;
    }

    private static void closeQuietly(OrtSession session, String name) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (OrtException e) {
            log.warn("Error closing CLIP {} session: {}", name, e.getMessage());
        }
    }
}
