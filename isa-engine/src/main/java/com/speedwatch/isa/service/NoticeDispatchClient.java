package com.speedwatch.isa.service;

import com.speedwatch.isa.config.IsaEngineProperties;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.NoticePayload;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

/**
 * Thin client over the external notice delivery service.
 *
 * The alert already records the decision to notify; this only hands the notice to
 * the mail/SMS side. 5xx and I/O failures trigger the Resilience4j retry; a 4xx is
 * a payload problem and is not retried (see resilience4j config).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NoticeDispatchClient {

    private final RestTemplate restTemplate;
    private final IsaEngineProperties properties;

    public boolean isEnabled() {
        return properties.getNotice().isEnabled();
    }

    /**
     * POST the notice for an alert to {@code {base-url}/notices}.
     */
    @Retry(name = "noticeService")
    public void send(EnforcementAlert alert) {
        String url = properties.getNotice().getBaseUrl() + "/notices";
        log.debug("Posting notice for alert {} to {}", alert.getAlertId(), url);
        try {
            restTemplate.postForEntity(url, NoticePayload.from(alert), Void.class);
            log.info("Notice delivered for alert {} ({} {})",
                    alert.getAlertId(), alert.getEntityKind(), alert.getEntityKey());

        } catch (HttpClientErrorException e) {
            log.error("Notice service rejected alert {}: {}", alert.getAlertId(), e.getStatusCode());
            throw e;

        } catch (Exception e) {
            log.warn("Notice delivery failed for alert {}: {}", alert.getAlertId(), e.getMessage());
            throw e;
        }
    }
}
