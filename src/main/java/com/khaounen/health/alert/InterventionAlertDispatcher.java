package com.khaounen.health.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.health.risk.Recommendation;
import com.khaounen.health.risk.RiskFactor;
import com.khaounen.health.risk.RiskProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers high-risk alerts by webhook and/or mail. Delivery problems are
 * logged and never surface to the assessment that triggered them.
 */
@Slf4j
public class InterventionAlertDispatcher implements InterventionListener {

    private final InterventionAlertProperties properties;
    private final ObjectProvider<ObjectMapper> objectMapperProvider;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;

    public InterventionAlertDispatcher(
            InterventionAlertProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        this.properties = properties;
        this.objectMapperProvider = objectMapperProvider;
        this.mailSenderProvider = mailSenderProvider;
    }

    @Override
    public void onHighRisk(RiskProfile profile) {
        log.info("high-risk customer={} score={} severity={}", profile.customerId(), profile.score(), profile.severityLevel());
        if (properties == null) {
            return;
        }
        sendWebhook(profile);
        sendSmtp(profile);
    }

    private void sendWebhook(RiskProfile profile) {
        InterventionAlertProperties.Webhook webhook = properties.getWebhook();
        if (webhook == null || !webhook.isEnabled() || webhook.getUrl() == null || webhook.getUrl().isBlank()) {
            return;
        }
        try {
            ObjectMapper mapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
            String payload = mapper.writeValueAsString(buildPayload(profile, webhook.isIncludeFactors()));
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofMillis(webhook.getConnectTimeoutMs()))
                    .build();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(webhook.getUrl()))
                    .timeout(Duration.ofMillis(webhook.getTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build();
            client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                    .whenComplete((response, ex) -> {
                        if (ex != null) {
                            log.warn("intervention webhook failed customer={}: {}", profile.customerId(), ex.getMessage());
                        } else if (response.statusCode() >= 400) {
                            log.warn("intervention webhook customer={} answered {}", profile.customerId(), response.statusCode());
                        }
                    });
        } catch (Exception ex) {
            log.warn("intervention webhook alert failed: {}", ex.getMessage());
        }
    }

    private void sendSmtp(RiskProfile profile) {
        InterventionAlertProperties.Smtp smtp = properties.getSmtp();
        if (smtp == null || !smtp.isEnabled()) {
            return;
        }
        JavaMailSender sender = mailSenderProvider.getIfAvailable();
        if (sender == null || smtp.getFrom() == null || smtp.getFrom().isBlank() || smtp.getTo().isEmpty()) {
            return;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(smtp.getFrom());
            message.setTo(smtp.getTo().toArray(new String[0]));
            message.setSubject(smtp.getSubject() + ": " + profile.customerId());
            message.setText(buildMailBody(profile, smtp.isIncludeFactors()));
            sender.send(message);
        } catch (Exception ex) {
            log.warn("intervention smtp alert failed: {}", ex.getMessage());
        }
    }

    Map<String, Object> buildPayload(RiskProfile profile, boolean includeFactors) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.now().toString());
        payload.put("profileId", profile.id() == null ? null : profile.id().toString());
        payload.put("customerId", profile.customerId());
        payload.put("score", profile.score());
        payload.put("severity", profile.severityLevel().name());
        payload.put("assessedAt", profile.assessedAt().toString());
        List<Map<String, Object>> recommendations = new ArrayList<>();
        for (Recommendation recommendation : profile.recommendations()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("factor", recommendation.factor());
            item.put("priority", recommendation.priority().label());
            item.put("timeline", recommendation.timeline());
            item.put("actions", recommendation.suggestedActions());
            recommendations.add(item);
        }
        payload.put("recommendations", recommendations);
        if (includeFactors) {
            List<Map<String, Object>> factors = new ArrayList<>();
            for (RiskFactor factor : profile.factors()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("category", factor.category());
                item.put("impact", factor.impactScore());
                item.put("weight", factor.weight());
                factors.add(item);
            }
            payload.put("factors", factors);
        }
        return payload;
    }

    String buildMailBody(RiskProfile profile, boolean includeFactors) {
        StringBuilder sb = new StringBuilder();
        sb.append("High-risk customer alert\n");
        sb.append("customer: ").append(profile.customerId()).append('\n');
        sb.append("score: ").append(profile.score()).append('\n');
        sb.append("severity: ").append(profile.severityLevel()).append('\n');
        sb.append("assessedAt: ").append(profile.assessedAt()).append('\n');
        for (Recommendation recommendation : profile.recommendations()) {
            sb.append("- [").append(recommendation.priority().label()).append(", ")
                    .append(recommendation.timeline()).append("] ")
                    .append(recommendation.factor()).append(": ")
                    .append(String.join("; ", recommendation.suggestedActions()))
                    .append('\n');
        }
        if (includeFactors) {
            for (RiskFactor factor : profile.factors()) {
                sb.append("factor ").append(factor.category())
                        .append(" impact=").append(factor.impactScore())
                        .append('\n');
            }
        }
        return sb.toString();
    }
}
