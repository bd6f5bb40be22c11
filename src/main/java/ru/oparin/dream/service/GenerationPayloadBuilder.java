package ru.oparin.dream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.oparin.dream.model.GenerationLimits;
import ru.oparin.dream.model.dto.ControlNetUnit;
import ru.oparin.dream.model.dto.GenerationRequest;
import ru.oparin.dream.model.dto.RegionalConfig;
import ru.oparin.dream.model.dto.sd.ResolvedPayload;
import ru.oparin.dream.model.entity.UserSession;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.RegionalLayout;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Сборщик запроса к Stable Diffusion API из запроса пользователя и снимка его сессии.
 * <p>
 * Результат зависит только от аргументов: одинаковые запрос, сессия и изображение
 * дают одинаковый документ с одинаковым порядком полей.
 * Числовые параметры повторно ограничиваются допустимыми диапазонами из {@link GenerationLimits}.
 */
@Component
@RequiredArgsConstructor
public class GenerationPayloadBuilder {

    /** Ключевое слово LoRA в промпте Stable Diffusion WebUI. */
    static final String MODIFIER_TAG = "lora";

    static final List<String> MODIFIER_EXTENSIONS = List.of(".safetensors", ".ckpt", ".pt");

    static final String CONTROLNET_SCRIPT = "ControlNet";

    private final ObjectMapper objectMapper;

    /**
     * Собрать запрос к Stable Diffusion.
     *
     * @param request     запрос пользователя
     * @param kind        вид задачи
     * @param session     снимок сессии пользователя, может быть null
     * @param sourceImage исходное изображение в base64 для img2img и ControlNet, может быть null
     * @return готовый запрос
     * @throws IllegalArgumentException если для вида задачи не хватает данных
     */
    public ResolvedPayload build(GenerationRequest request, JobKind kind, UserSession session, String sourceImage) {
        ObjectNode document = JsonNodeFactory.instance.objectNode();

        document.put("prompt", resolvePrompt(request, kind, session));
        document.put("negative_prompt", request.getNegativePrompt() == null ? "" : request.getNegativePrompt());
        document.put("sampler_name", isBlank(request.getSamplerName())
                ? GenerationLimits.DEFAULT_SAMPLER : request.getSamplerName());
        document.put("steps", clampInt(request.getSteps(), GenerationLimits.DEFAULT_STEPS,
                GenerationLimits.MIN_STEPS, GenerationLimits.MAX_STEPS));
        document.put("cfg_scale", clampDouble(request.getCfgScale(), GenerationLimits.DEFAULT_CFG_SCALE,
                GenerationLimits.MIN_CFG_SCALE, GenerationLimits.MAX_CFG_SCALE));
        document.put("width", clampInt(request.getWidth(), GenerationLimits.DEFAULT_DIMENSION,
                GenerationLimits.MIN_DIMENSION, GenerationLimits.MAX_DIMENSION));
        document.put("height", clampInt(request.getHeight(), GenerationLimits.DEFAULT_DIMENSION,
                GenerationLimits.MIN_DIMENSION, GenerationLimits.MAX_DIMENSION));
        document.put("n_iter", clampInt(request.getBatchCount(), GenerationLimits.MIN_BATCH_COUNT,
                GenerationLimits.MIN_BATCH_COUNT, GenerationLimits.MAX_BATCH_COUNT));
        document.put("batch_size", clampInt(request.getBatchSize(), GenerationLimits.MIN_BATCH_SIZE,
                GenerationLimits.MIN_BATCH_SIZE, GenerationLimits.MAX_BATCH_SIZE));
        document.put("seed", request.getSeed() == null
                ? GenerationLimits.MIN_SEED : Math.max(GenerationLimits.MIN_SEED, request.getSeed()));

        boolean enableHr = Boolean.TRUE.equals(request.getEnableHr());
        document.put("enable_hr", enableHr);
        document.put("hr_scale", clampDouble(request.getHrScale(), GenerationLimits.DEFAULT_HR_SCALE,
                GenerationLimits.MIN_HR_SCALE, GenerationLimits.MAX_HR_SCALE));
        if (enableHr && !isBlank(request.getHrUpscaler())) {
            document.put("hr_upscaler", request.getHrUpscaler());
            document.put("hr_second_pass_steps", clampInt(request.getHrSecondPassSteps(),
                    GenerationLimits.MIN_HR_SECOND_PASS_STEPS,
                    GenerationLimits.MIN_HR_SECOND_PASS_STEPS, GenerationLimits.MAX_HR_SECOND_PASS_STEPS));
        }

        addOverrideSettings(document, request);

        if (kind == JobKind.IMG2IMG) {
            addImageConditioning(document, request, sourceImage);
        }
        if (kind == JobKind.CONTROLNET) {
            addControlNet(document, request, session, sourceImage);
        }
        if (kind == JobKind.REGIONAL) {
            addRegionalScript(document, requireRegional(request));
        }

        mergeCustomSettings(document, session);

        return new ResolvedPayload(kind.getEndpoint(), document);
    }

    /**
     * Итоговый промпт: промпт запроса или разметка регионов, затем токены LoRA из сессии.
     */
    String resolvePrompt(GenerationRequest request, JobKind kind, UserSession session) {
        String base = kind == JobKind.REGIONAL
                ? foldRegions(requireRegional(request))
                : request.getPrompt();
        if (base == null) {
            base = "";
        }

        String modifierTokens = modifierTokens(session);
        if (modifierTokens.isEmpty()) {
            return base;
        }
        return (base + " " + modifierTokens).strip();
    }

    /**
     * Промпт с разметкой регионов: общая часть (может быть пустой), ADDCOMM и промпты регионов через разделители схемы.
     * Незаданный регион начиная с третьего повторяет регион на два номера раньше.
     */
    String foldRegions(RegionalConfig regional) {
        RegionalLayout layout = regional.getLayout();
        List<String> regions = resolveRegions(regional);

        // Regional Prompter включен с общим промптом, поэтому ADDCOMM нужен и при пустой общей части
        List<String> parts = new ArrayList<>();
        if (!isBlank(regional.getCommon())) {
            parts.add(regional.getCommon().strip());
        }
        parts.add(RegionalLayout.COMMON_SEPARATOR);
        parts.add(regions.get(0));
        for (int i = 0; i < layout.getSeparators().size(); i++) {
            parts.add(layout.getSeparators().get(i));
            parts.add(regions.get(i + 1));
        }
        return String.join(" ", parts);
    }

    /**
     * Промпты регионов в порядке схемы с подстановкой незаданных.
     */
    List<String> resolveRegions(RegionalConfig regional) {
        List<String> supplied = List.of(
                nullToEmpty(regional.getRegion1()),
                nullToEmpty(regional.getRegion2()),
                nullToEmpty(regional.getRegion3()),
                nullToEmpty(regional.getRegion4()));

        List<String> resolved = new ArrayList<>();
        for (int i = 0; i < regional.getLayout().getRegionCount(); i++) {
            String region = supplied.get(i);
            if (region.isBlank() && i >= 2) {
                region = resolved.get(i - 2);
            }
            resolved.add(region.strip());
        }
        return resolved;
    }

    /**
     * Токены вида &lt;lora:name:weight&gt; в порядке добавления модификаторов.
     */
    String modifierTokens(UserSession session) {
        if (session == null || session.getModifiers() == null || session.getModifiers().isEmpty()) {
            return "";
        }
        List<String> tokens = new ArrayList<>();
        for (Map.Entry<String, Double> modifier : session.getModifiers().entrySet()) {
            double weight = modifier.getValue() == null ? GenerationLimits.DEFAULT_MODIFIER_WEIGHT : modifier.getValue();
            tokens.add("<" + MODIFIER_TAG + ":" + stripExtension(modifier.getKey()) + ":" + weight + ">");
        }
        return String.join(" ", tokens);
    }

    static String stripExtension(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String extension : MODIFIER_EXTENSIONS) {
            if (lower.endsWith(extension)) {
                return name.substring(0, name.length() - extension.length());
            }
        }
        return name;
    }

    private void addOverrideSettings(ObjectNode document, GenerationRequest request) {
        boolean hasCheckpoint = !isBlank(request.getCheckpoint());
        boolean hasVae = !isBlank(request.getVae());
        if (!hasCheckpoint && !hasVae) {
            return;
        }
        ObjectNode overrides = document.putObject("override_settings");
        if (hasCheckpoint) {
            overrides.put("sd_model_checkpoint", request.getCheckpoint());
        }
        if (hasVae) {
            overrides.put("sd_vae", request.getVae());
        }
        document.put("override_settings_restore_afterwards", true);
    }

    private void addImageConditioning(ObjectNode document, GenerationRequest request, String sourceImage) {
        if (isBlank(sourceImage)) {
            throw new IllegalArgumentException("Для img2img требуется исходное изображение");
        }
        document.putArray("init_images").add(sourceImage);
        document.put("denoising_strength", clampDouble(request.getDenoisingStrength(), GenerationLimits.DEFAULT_DENOISING,
                GenerationLimits.MIN_DENOISING, GenerationLimits.MAX_DENOISING));
        document.put("resize_mode", clampInt(request.getResizeMode(), GenerationLimits.MIN_RESIZE_MODE,
                GenerationLimits.MIN_RESIZE_MODE, GenerationLimits.MAX_RESIZE_MODE));
        document.put("inpaint_full_res", Boolean.TRUE.equals(request.getInpaintFullRes()));
        document.put("inpaint_full_res_padding", clampInt(request.getInpaintFullResPadding(),
                GenerationLimits.DEFAULT_INPAINT_PADDING, 0, GenerationLimits.MAX_INPAINT_PADDING));
        document.put("inpainting_mask_invert", clampInt(request.getInpaintingMaskInvert(), 0, 0, 1));
    }

    private void addControlNet(ObjectNode document, GenerationRequest request, UserSession session, String sourceImage) {
        List<ControlNetUnit> units = request.getControlNetUnits() != null && !request.getControlNetUnits().isEmpty()
                ? request.getControlNetUnits()
                : session == null || session.getControlConfigs() == null ? List.of() : session.getControlConfigs();
        if (units.isEmpty()) {
            throw new IllegalArgumentException("Для ControlNet требуется хотя бы один юнит");
        }

        ArrayNode args = scriptsNode(document).putObject(CONTROLNET_SCRIPT).putArray("args");
        for (int i = 0; i < units.size(); i++) {
            ObjectNode unitNode = toControlNetArg(units.get(i));
            if (i == 0 && !isBlank(sourceImage)) {
                unitNode.put("input_image", sourceImage);
            }
            args.add(unitNode);
        }
    }

    private ObjectNode toControlNetArg(ControlNetUnit unit) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("enabled", !Boolean.FALSE.equals(unit.getEnabled()));
        node.put("model", unit.getModel());
        node.put("weight", clampDouble(unit.getWeight(), 1.0, 0.0, 2.0));
        node.put("guidance_start", clampDouble(unit.getGuidanceStart(), 0.0, 0.0, 1.0));
        node.put("guidance_end", clampDouble(unit.getGuidanceEnd(), 1.0, 0.0, 1.0));
        node.put("processor_res", clampInt(unit.getProcessorRes(), GenerationLimits.DEFAULT_DIMENSION,
                GenerationLimits.MIN_DIMENSION, GenerationLimits.MAX_DIMENSION));
        node.put("threshold_a", clampDouble(unit.getThresholdA(), 64.0, 0.0, 255.0));
        node.put("threshold_b", clampDouble(unit.getThresholdB(), 64.0, 0.0, 255.0));
        node.put("control_mode", clampInt(unit.getControlMode(), 0, 0, 2));
        node.put("pixel_perfect", Boolean.TRUE.equals(unit.getPixelPerfect()));
        if (!isBlank(unit.getModule())) {
            node.put("module", unit.getModule());
        }
        return node;
    }

    private void addRegionalScript(ObjectNode document, RegionalConfig regional) {
        ArrayNode args = scriptsNode(document).putObject(RegionalLayout.SCRIPT_NAME).putArray("args");
        for (Object arg : regional.getLayout().scriptArgs()) {
            if (arg instanceof Boolean flag) {
                args.add(flag);
            } else {
                args.add(String.valueOf(arg));
            }
        }
    }

    /**
     * Пользовательские параметры сессии добавляются только если такого поля еще нет в документе.
     */
    private void mergeCustomSettings(ObjectNode document, UserSession session) {
        if (session == null || session.getCustomSettings() == null || session.getCustomSettings().isEmpty()) {
            return;
        }
        session.getCustomSettings().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .filter(setting -> !document.has(setting.getKey()))
                .forEach(setting -> {
                    JsonNode value = objectMapper.valueToTree(setting.getValue());
                    document.set(setting.getKey(), value);
                });
    }

    private ObjectNode scriptsNode(ObjectNode document) {
        JsonNode existing = document.get("alwayson_scripts");
        if (existing instanceof ObjectNode scripts) {
            return scripts;
        }
        return document.putObject("alwayson_scripts");
    }

    private static RegionalConfig requireRegional(GenerationRequest request) {
        if (request.getRegional() == null || request.getRegional().getLayout() == null) {
            throw new IllegalArgumentException("Для регионального промпта требуется схема регионов");
        }
        return request.getRegional();
    }

    private static int clampInt(Integer value, int defaultValue, int min, int max) {
        return GenerationLimits.clamp(value == null ? defaultValue : value, min, max);
    }

    private static double clampDouble(Double value, double defaultValue, double min, double max) {
        return GenerationLimits.clamp(value == null ? defaultValue : value, min, max);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
