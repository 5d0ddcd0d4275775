package com.speedwatch.isa.service;

import com.speedwatch.isa.config.IsaEngineProperties;
import com.speedwatch.isa.model.AlertStatus;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.NoticePayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NoticeDispatchClientTest {

    private RestTemplate restTemplate;
    private IsaEngineProperties properties;
    private NoticeDispatchClient client;

    private final EnforcementAlert alert = EnforcementAlert.builder()
            .alertId(42)
            .entityKind(EntityKind.VEHICLE)
            .entityKey("ABC1234:NY")
            .status(AlertStatus.NOTICE_SENT)
            .riskScoreAtCreation(71.5)
            .totalAtCreation(17)
            .reason("17 tickets (threshold: 16)")
            .dueDate(LocalDateTime.of(2024, 7, 15, 9, 0))
            .build();

    @BeforeEach
    void setUp() {
        restTemplate = mock(RestTemplate.class);
        properties = new IsaEngineProperties();
        properties.getNotice().setBaseUrl("http://notices.test");
        client = new NoticeDispatchClient(restTemplate, properties);
    }

    @Test
    @DisplayName("should post the notice payload to the notices endpoint")
    void posts() {
        when(restTemplate.postForEntity(eq("http://notices.test/notices"), any(), eq(Void.class)))
                .thenReturn(ResponseEntity.accepted().build());

        client.send(alert);

        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(restTemplate).postForEntity(eq("http://notices.test/notices"), body.capture(), eq(Void.class));
        assertThat(body.getValue()).isEqualTo(new NoticePayload(42L, EntityKind.VEHICLE, "ABC1234:NY",
                AlertStatus.NOTICE_SENT, LocalDateTime.of(2024, 7, 15, 9, 0), 71.5, "17 tickets (threshold: 16)"));
    }

    @Test
    @DisplayName("should rethrow a rejected notice")
    void rejected() {
        when(restTemplate.postForEntity(any(String.class), any(), eq(Void.class)))
                .thenThrow(new HttpClientErrorException(HttpStatus.UNPROCESSABLE_ENTITY));

        assertThatThrownBy(() -> client.send(alert)).isInstanceOf(HttpClientErrorException.class);
    }

    @Test
    @DisplayName("should rethrow I/O failures for the retry to handle")
    void unreachable() {
        when(restTemplate.postForEntity(any(String.class), any(), eq(Void.class)))
                .thenThrow(new ResourceAccessException("connection refused"));

        assertThatThrownBy(() -> client.send(alert)).isInstanceOf(ResourceAccessException.class);
    }

    @Test
    @DisplayName("should be disabled unless configured")
    void disabledByDefault() {
        assertThat(client.isEnabled()).isFalse();
        properties.getNotice().setEnabled(true);
        assertThat(client.isEnabled()).isTrue();
    }
}
