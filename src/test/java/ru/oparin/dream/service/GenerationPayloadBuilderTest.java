package ru.oparin.dream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import ru.oparin.dream.model.dto.ControlNetUnit;
import ru.oparin.dream.model.dto.GenerationRequest;
import ru.oparin.dream.model.dto.RegionalConfig;
import ru.oparin.dream.model.dto.sd.ResolvedPayload;
import ru.oparin.dream.model.entity.UserSession;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.RegionalLayout;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationPayloadBuilderTest {

    private final GenerationPayloadBuilder builder = new GenerationPayloadBuilder(new ObjectMapper());

    @Test
    void shouldBuildIdenticalDocumentsForIdenticalInput() {
        GenerationRequest request = request("a castle").toBuilder().seed(42L).build();
        UserSession session = sessionWithModifiers(Map.of("detail", 0.8));

        ResolvedPayload first = builder.build(request, JobKind.TXT2IMG, session, null);
        ResolvedPayload second = builder.build(request, JobKind.TXT2IMG, session, null);

        assertThat(first).isEqualTo(second);
        assertThat(fieldNames(first.getDocument())).isEqualTo(fieldNames(second.getDocument()));
    }

    @Test
    void shouldWriteBaseFieldsInOrder() {
        ResolvedPayload payload = builder.build(request("a castle"), JobKind.TXT2IMG, null, null);

        assertThat(payload.getEndpoint()).isEqualTo("txt2img");
        assertThat(fieldNames(payload.getDocument())).containsExactly(
                "prompt", "negative_prompt", "sampler_name", "steps", "cfg_scale", "width", "height",
                "n_iter", "batch_size", "seed", "enable_hr", "hr_scale");
        assertThat(payload.getDocument().get("seed").asLong()).isEqualTo(-1L);
    }

    @Test
    void shouldClampOutOfRangeNumbers() {
        GenerationRequest request = request("a castle").toBuilder()
                .steps(500)
                .cfgScale(0.1)
                .width(8)
                .height(4096)
                .batchCount(50)
                .batchSize(0)
                .seed(-100L)
                .build();

        ObjectNode document = builder.build(request, JobKind.TXT2IMG, null, null).getDocument();

        assertThat(document.get("steps").asInt()).isEqualTo(150);
        assertThat(document.get("cfg_scale").asDouble()).isEqualTo(1.0);
        assertThat(document.get("width").asInt()).isEqualTo(64);
        assertThat(document.get("height").asInt()).isEqualTo(2048);
        assertThat(document.get("n_iter").asInt()).isEqualTo(10);
        assertThat(document.get("batch_size").asInt()).isEqualTo(1);
        assertThat(document.get("seed").asLong()).isEqualTo(-1L);
    }

    @Test
    void shouldAppendModifierTokensInInsertionOrder() {
        Map<String, Double> modifiers = new LinkedHashMap<>();
        modifiers.put("film_grain.safetensors", 0.6);
        modifiers.put("detail", 1.0);

        ResolvedPayload payload = builder.build(request("portrait"), JobKind.TXT2IMG, sessionWithModifiers(modifiers), null);

        assertThat(payload.getPrompt()).isEqualTo("portrait <lora:film_grain:0.6> <lora:detail:1.0>");
    }

    @Test
    void shouldStripKnownModelExtensions() {
        assertThat(GenerationPayloadBuilder.stripExtension("style.SAFETENSORS")).isEqualTo("style");
        assertThat(GenerationPayloadBuilder.stripExtension("old.ckpt")).isEqualTo("old");
        assertThat(GenerationPayloadBuilder.stripExtension("tiny.pt")).isEqualTo("tiny");
        assertThat(GenerationPayloadBuilder.stripExtension("plain")).isEqualTo("plain");
    }

    @Test
    void shouldFoldQuadrantRegions() {
        RegionalConfig regional = RegionalConfig.builder()
                .layout(RegionalLayout.QUADRANTS)
                .common("sky")
                .region1("cat")
                .region2("dog")
                .build();
        GenerationRequest request = request(null).toBuilder().regional(regional).build();

        ResolvedPayload payload = builder.build(request, JobKind.REGIONAL, null, null);

        assertThat(payload.getPrompt()).isEqualTo("sky ADDCOMM cat ADDCOL dog ADDROW cat ADDCOL dog");
        assertThat(payload.getEndpoint()).isEqualTo("txt2img");
        JsonNode args = payload.getDocument().at("/alwayson_scripts/Regional Prompter/args");
        assertThat(args.size()).isEqualTo(17);
        assertThat(args.get(0).asBoolean()).isTrue();
        assertThat(args.get(2).asText()).isEqualTo("Matrix");
        assertThat(args.get(3).asText()).isEqualTo("Vertical");
        assertThat(args.get(6).asText()).isEqualTo("2,2");
    }

    @Test
    void shouldReuseFirstRegionForMissingThirdColumn() {
        RegionalConfig regional = RegionalConfig.builder()
                .layout(RegionalLayout.THREE_COLUMNS)
                .common("")
                .region1("forest")
                .region2("river")
                .region3("  ")
                .build();

        assertThat(builder.foldRegions(regional)).isEqualTo("ADDCOMM forest ADDCOL river ADDCOL forest");
    }

    @Test
    void shouldKeepCommonSeparatorWhenCommonIsBlank() {
        RegionalConfig regional = RegionalConfig.builder()
                .layout(RegionalLayout.QUADRANTS)
                .region1("cat")
                .region2("dog")
                .build();
        GenerationRequest request = request(null).toBuilder().regional(regional).build();

        ResolvedPayload payload = builder.build(request, JobKind.REGIONAL, null, null);

        assertThat(payload.getPrompt()).isEqualTo("ADDCOMM cat ADDCOL dog ADDROW cat ADDCOL dog");
        JsonNode args = payload.getDocument().at("/alwayson_scripts/Regional Prompter/args");
        assertThat(args.get(9).asBoolean()).isTrue();
    }

    @Test
    void shouldReuseFirstTwoRegionsForMissingFourthColumns() {
        RegionalConfig regional = RegionalConfig.builder()
                .layout(RegionalLayout.FOUR_COLUMNS)
                .common("sky")
                .region1("cat")
                .region2("dog")
                .build();

        assertThat(builder.foldRegions(regional)).isEqualTo("sky ADDCOMM cat ADDCOL dog ADDCOL cat ADDCOL dog");
    }

    @Test
    void shouldIgnoreExtraRegionsForTwoRegionLayout() {
        RegionalConfig regional = RegionalConfig.builder()
                .layout(RegionalLayout.HORIZONTAL)
                .common("night")
                .region1("moon")
                .region2("sea")
                .region3("ignored")
                .build();

        assertThat(builder.foldRegions(regional)).isEqualTo("night ADDCOMM moon ADDROW sea");
    }

    @Test
    void shouldAddOverrideSettingsForCheckpointAndVae() {
        GenerationRequest request = request("a castle").toBuilder()
                .checkpoint("dreamshaper_8")
                .vae("vae-ft-mse")
                .build();

        ObjectNode document = builder.build(request, JobKind.TXT2IMG, null, null).getDocument();

        assertThat(document.at("/override_settings/sd_model_checkpoint").asText()).isEqualTo("dreamshaper_8");
        assertThat(document.at("/override_settings/sd_vae").asText()).isEqualTo("vae-ft-mse");
        assertThat(document.get("override_settings_restore_afterwards").asBoolean()).isTrue();
    }

    @Test
    void shouldAddHighResFieldsOnlyWithUpscaler() {
        GenerationRequest withoutUpscaler = request("a castle").toBuilder().enableHr(true).build();
        GenerationRequest withUpscaler = withoutUpscaler.toBuilder().hrUpscaler("Latent").hrSecondPassSteps(10).build();

        assertThat(builder.build(withoutUpscaler, JobKind.TXT2IMG, null, null).getDocument().has("hr_upscaler")).isFalse();
        ObjectNode document = builder.build(withUpscaler, JobKind.TXT2IMG, null, null).getDocument();
        assertThat(document.get("hr_upscaler").asText()).isEqualTo("Latent");
        assertThat(document.get("hr_second_pass_steps").asInt()).isEqualTo(10);
    }

    @Test
    void shouldAddImageConditioningForImg2Img() {
        GenerationRequest request = request("make it autumn").toBuilder().denoisingStrength(1.5).build();

        ResolvedPayload payload = builder.build(request, JobKind.IMG2IMG, null, "aW1hZ2U=");

        ObjectNode document = payload.getDocument();
        assertThat(payload.getEndpoint()).isEqualTo("img2img");
        assertThat(document.get("init_images").get(0).asText()).isEqualTo("aW1hZ2U=");
        assertThat(document.get("denoising_strength").asDouble()).isEqualTo(1.0);
        assertThat(document.get("inpaint_full_res_padding").asInt()).isEqualTo(32);
    }

    @Test
    void shouldRejectImg2ImgWithoutImage() {
        assertThatThrownBy(() -> builder.build(request("x"), JobKind.IMG2IMG, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldUseSessionControlNetUnitsWhenRequestHasNone() {
        UserSession session = UserSession.builder().userId("alice").build();
        session.getControlConfigs().add(ControlNetUnit.builder().model("control_canny").module("canny").build());
        session.getControlConfigs().add(ControlNetUnit.builder().model("control_depth").weight(5.0).build());

        ObjectNode document = builder.build(request("a house"), JobKind.CONTROLNET, session, "aW1n").getDocument();

        JsonNode args = document.at("/alwayson_scripts/ControlNet/args");
        assertThat(args.size()).isEqualTo(2);
        assertThat(args.get(0).get("model").asText()).isEqualTo("control_canny");
        assertThat(args.get(0).get("module").asText()).isEqualTo("canny");
        assertThat(args.get(0).get("input_image").asText()).isEqualTo("aW1n");
        assertThat(args.get(1).has("input_image")).isFalse();
        assertThat(args.get(1).get("weight").asDouble()).isEqualTo(2.0);
    }

    @Test
    void shouldPreferRequestControlNetUnits() {
        UserSession session = UserSession.builder().userId("alice").build();
        session.getControlConfigs().add(ControlNetUnit.builder().model("from_session").build());
        List<ControlNetUnit> units = new ArrayList<>(List.of(ControlNetUnit.builder().model("from_request").build()));
        GenerationRequest request = request("a house").toBuilder().controlNetUnits(units).build();

        JsonNode args = builder.build(request, JobKind.CONTROLNET, session, null).getDocument()
                .at("/alwayson_scripts/ControlNet/args");

        assertThat(args.size()).isEqualTo(1);
        assertThat(args.get(0).get("model").asText()).isEqualTo("from_request");
    }

    @Test
    void shouldMergeCustomSettingsWithoutOverridingBuiltFields() {
        UserSession session = UserSession.builder().userId("alice").build();
        session.getCustomSettings().put("steps", 99);
        session.getCustomSettings().put("tiling", true);
        session.getCustomSettings().put("clip_skip", 2);

        ObjectNode document = builder.build(request("a castle"), JobKind.TXT2IMG, session, null).getDocument();

        assertThat(document.get("steps").asInt()).isEqualTo(20);
        assertThat(document.get("tiling").asBoolean()).isTrue();
        List<String> names = fieldNames(document);
        assertThat(names.subList(names.size() - 2, names.size())).containsExactly("clip_skip", "tiling");
    }

    @Test
    void shouldNotMutateRequestOrSession() {
        GenerationRequest request = request("a castle");
        UserSession session = sessionWithModifiers(Map.of("detail", 0.5));
        GenerationRequest requestCopy = request.toBuilder().build();

        builder.build(request, JobKind.TXT2IMG, session, null);

        assertThat(request).isEqualTo(requestCopy);
        assertThat(session.getModifiers()).containsExactly(Map.entry("detail", 0.5));
    }

    private static GenerationRequest request(String prompt) {
        return GenerationRequest.builder()
                .userId("alice")
                .prompt(prompt)
                .build();
    }

    private static UserSession sessionWithModifiers(Map<String, Double> modifiers) {
        UserSession session = UserSession.builder().userId("alice").build();
        session.getModifiers().putAll(modifiers);
        return session;
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> iterator = node.fieldNames();
        iterator.forEachRemaining(names::add);
        return names;
    }
}
