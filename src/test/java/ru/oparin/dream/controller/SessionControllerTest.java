package ru.oparin.dream.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import ru.oparin.dream.exception.NotFoundException;
import ru.oparin.dream.model.entity.UserSession;
import ru.oparin.dream.service.UserSessionService;

import java.util.Map;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = SessionController.class)
class SessionControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private UserSessionService userSessionService;

    @Test
    void shouldAddModifierWithDefaultWeight() {
        UserSession session = UserSession.builder().userId("alice").build();
        session.getModifiers().put("detail", 1.0);
        when(userSessionService.addModifier("alice", "detail", 1.0)).thenReturn(session);

        webTestClient.post()
                .uri("/sessions/alice/modifiers")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\": \"detail\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.modifiers.detail").isEqualTo(1.0);
    }

    @Test
    void shouldRejectModifierWeightOutOfRange() {
        webTestClient.post()
                .uri("/sessions/alice/modifiers")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\": \"detail\", \"weight\": 3.0}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_FAILED");

        verify(userSessionService, never()).addModifier(anyString(), anyString(), anyDouble());
    }

    @Test
    void shouldReturnNotFoundForUnknownModifier() {
        when(userSessionService.removeModifier("alice", "missing")).thenThrow(NotFoundException.modifier("missing"));

        webTestClient.delete()
                .uri("/sessions/alice/modifiers/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.code").isEqualTo("MODIFIER_NOT_FOUND");
    }

    @Test
    void shouldPatchCustomSettings() {
        UserSession session = UserSession.builder().userId("alice").build();
        session.getCustomSettings().put("clip_skip", 2);
        when(userSessionService.updateCustomSettings("alice", Map.of("clip_skip", 2))).thenReturn(session);

        webTestClient.patch()
                .uri("/sessions/alice/settings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"clip_skip\": 2}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.customSettings.clip_skip").isEqualTo(2);
    }
}
