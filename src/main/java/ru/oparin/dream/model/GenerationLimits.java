package ru.oparin.dream.model;

/**
 * Допустимые диапазоны и значения по умолчанию для параметров генерации.
 * Используются и при валидации входящих запросов, и при ограничении значений в итоговом payload.
 */
public final class GenerationLimits {

    private GenerationLimits() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static final int MIN_STEPS = 1;
    public static final int MAX_STEPS = 150;
    public static final int DEFAULT_STEPS = 20;

    public static final double MIN_CFG_SCALE = 1.0;
    public static final double MAX_CFG_SCALE = 30.0;
    public static final double DEFAULT_CFG_SCALE = 7.0;

    public static final int MIN_DIMENSION = 64;
    public static final int MAX_DIMENSION = 2048;
    public static final int DEFAULT_DIMENSION = 512;

    public static final int MIN_BATCH_COUNT = 1;
    public static final int MAX_BATCH_COUNT = 10;

    public static final int MIN_BATCH_SIZE = 1;
    public static final int MAX_BATCH_SIZE = 4;

    /** -1 означает случайный seed. */
    public static final long MIN_SEED = -1L;

    public static final double MIN_HR_SCALE = 1.0;
    public static final double MAX_HR_SCALE = 4.0;
    public static final double DEFAULT_HR_SCALE = 2.0;

    public static final int MIN_HR_SECOND_PASS_STEPS = 0;
    public static final int MAX_HR_SECOND_PASS_STEPS = 150;

    public static final double MIN_DENOISING = 0.0;
    public static final double MAX_DENOISING = 1.0;
    public static final double DEFAULT_DENOISING = 0.7;

    public static final String DEFAULT_SAMPLER = "DPM++ 2M Karras";

    public static final double MIN_MODIFIER_WEIGHT = 0.1;
    public static final double MAX_MODIFIER_WEIGHT = 2.0;
    public static final double DEFAULT_MODIFIER_WEIGHT = 1.0;

    public static final int MIN_RESIZE_MODE = 0;
    public static final int MAX_RESIZE_MODE = 3;

    public static final int MAX_INPAINT_PADDING = 256;
    public static final int DEFAULT_INPAINT_PADDING = 32;

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
