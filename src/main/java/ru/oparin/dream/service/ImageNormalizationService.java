package ru.oparin.dream.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.dream.config.properties.GenerationProperties;
import ru.oparin.dream.exception.RequestValidationException;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Подготовка исходных изображений для img2img и ControlNet.
 * Изображение приводится к RGB, уменьшается до app.generation.max-source-pixels
 * с сохранением пропорций и кодируется в base64 PNG.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageNormalizationService {

    private final GenerationProperties generationProperties;

    /**
     * Нормализовать изображение.
     *
     * @param imageBytes исходные байты изображения (PNG, JPEG и др.)
     * @return изображение в base64 PNG
     * @throws RequestValidationException если байты не являются изображением
     */
    public String normalize(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new RequestValidationException("Изображение не передано");
        }
        try {
            BufferedImage image = readImage(imageBytes);
            log.debug("Исходные размеры изображения: {}x{}", image.getWidth(), image.getHeight());

            image = ensureRgb(image);
            image = fitToPixelLimit(image, generationProperties.getMaxSourcePixels());

            ByteArrayOutputStream output = new ByteArrayOutputStream();
            ImageIO.write(image, "png", output);
            log.info("Изображение подготовлено: {}x{}, {} байт", image.getWidth(), image.getHeight(), output.size());
            return Base64.getEncoder().encodeToString(output.toByteArray());
        } catch (IOException e) {
            throw new RequestValidationException("Не удалось прочитать изображение", e);
        }
    }

    private BufferedImage readImage(byte[] imageBytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        if (image == null) {
            throw new IOException("Неподдерживаемый формат изображения");
        }
        return image;
    }

    private BufferedImage ensureRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
        g.drawImage(image, 0, 0, null);
        g.dispose();
        return rgb;
    }

    /**
     * Уменьшить изображение так, чтобы ширина × высота не превышала лимит.
     */
    BufferedImage fitToPixelLimit(BufferedImage image, long maxPixels) {
        long pixels = (long) image.getWidth() * image.getHeight();
        if (pixels <= maxPixels) {
            return image;
        }

        double scale = Math.sqrt((double) maxPixels / pixels);
        int newWidth = Math.max(1, (int) (image.getWidth() * scale));
        int newHeight = Math.max(1, (int) (image.getHeight() * scale));
        log.debug("Изображение уменьшается до {}x{}", newWidth, newHeight);

        BufferedImage resized = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.drawImage(image, 0, 0, newWidth, newHeight, null);
        g.dispose();
        return resized;
    }
}
