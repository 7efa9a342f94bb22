package io.github.drompincen.webdeck.gateway.controller;

import io.github.drompincen.webdeck.gateway.stream.StreamingResponder;
import io.github.drompincen.webdeck.protocol.api.ChatRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    @Mock
    private StreamingResponder responder;

    private ChatController controller;

    @BeforeEach
    void setUp() {
        controller = new ChatController(responder);
    }

    @Test
    void chatStreamsThroughAssistantExecutor() {
        ChatRequest request = new ChatRequest("hello", "r1");
        ResponseEntity<StreamingResponseBody> streamed = ResponseEntity.ok(out -> { });
        when(responder.stream("r1", "assistant", request)).thenReturn(streamed);

        ResponseEntity<?> response = controller.chat(request);

        assertThat(response).isSameAs(streamed);
    }

    @Test
    void chatWithoutMessageIsBadRequest() {
        ResponseEntity<?> response = controller.chat(new ChatRequest(" ", "r1"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        verify(responder, never()).stream(anyString(), anyString(), any());
    }

    @Test
    void chatWithoutRequestIdIsBadRequest() {
        ResponseEntity<?> response = controller.chat(new ChatRequest("hello", null));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat((Map<String, String>) response.getBody()).containsKey("error");
    }

    @Test
    void abortKnownRequest() {
        when(responder.abort("r1")).thenReturn(true);

        ResponseEntity<Map<String, Object>> response = controller.abort("r1");

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).containsEntry("success", true)
                .containsEntry("message", "Request aborted");
    }

    @Test
    void abortUnknownRequestIs404() {
        when(responder.abort("gone")).thenReturn(false);

        ResponseEntity<Map<String, Object>> response = controller.abort("gone");

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody()).containsEntry("error", "Request not found or already completed");
    }
}
