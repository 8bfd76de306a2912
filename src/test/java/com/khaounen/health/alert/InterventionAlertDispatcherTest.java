package com.khaounen.health.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.health.risk.FactorSignal;
import com.khaounen.health.risk.RecommendationEngine;
import com.khaounen.health.risk.RiskFactor;
import com.khaounen.health.risk.RiskProfile;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class InterventionAlertDispatcherTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    @Test
    void sendsMailWhenSmtpEnabled() {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        InterventionAlertProperties properties = new InterventionAlertProperties();
        properties.getSmtp().setEnabled(true);
        properties.getSmtp().setFrom("alerts@example.com");
        properties.getSmtp().setTo(List.of("csm@example.com", "vp-cs@example.com"));
        InterventionAlertDispatcher dispatcher = dispatcher(properties, mailSender);

        dispatcher.onHighRisk(highRiskProfile());

        ArgumentCaptor<SimpleMailMessage> message = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(message.capture());
        assertEquals("High-risk customer alert: acme", message.getValue().getSubject());
        assertArrayEquals(new String[]{"csm@example.com", "vp-cs@example.com"}, message.getValue().getTo());
        String body = message.getValue().getText();
        assertTrue(body.contains("customer: acme"));
        assertTrue(body.contains("[high, immediate] usage_decline: Schedule product training session"));
        assertTrue(body.contains("factor usage_decline impact="));
    }

    @Test
    void disabledChannelsSendNothing() {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        InterventionAlertDispatcher dispatcher = dispatcher(new InterventionAlertProperties(), mailSender);

        dispatcher.onHighRisk(highRiskProfile());

        verifyNoInteractions(mailSender);
    }

    @Test
    void smtpWithoutRecipientsSendsNothing() {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        InterventionAlertProperties properties = new InterventionAlertProperties();
        properties.getSmtp().setEnabled(true);
        properties.getSmtp().setFrom("alerts@example.com");
        InterventionAlertDispatcher dispatcher = dispatcher(properties, mailSender);

        dispatcher.onHighRisk(highRiskProfile());

        verifyNoInteractions(mailSender);
    }

    @Test
    void deliveryFailuresAreSwallowed() {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(SimpleMailMessage.class));
        InterventionAlertProperties properties = new InterventionAlertProperties();
        properties.getSmtp().setEnabled(true);
        properties.getSmtp().setFrom("alerts@example.com");
        properties.getSmtp().setTo(List.of("csm@example.com"));
        properties.getWebhook().setEnabled(true);
        properties.getWebhook().setUrl("not a url");
        InterventionAlertDispatcher dispatcher = dispatcher(properties, mailSender);

        assertDoesNotThrow(() -> dispatcher.onHighRisk(highRiskProfile()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void payloadCarriesProfileAndRecommendations() {
        InterventionAlertDispatcher dispatcher = dispatcher(new InterventionAlertProperties(), null);
        RiskProfile profile = highRiskProfile();

        Map<String, Object> payload = dispatcher.buildPayload(profile, true);

        assertEquals("acme", payload.get("customerId"));
        assertEquals(profile.id().toString(), payload.get("profileId"));
        assertEquals(86.0, payload.get("score"));
        assertEquals("HIGH", payload.get("severity"));
        assertEquals(T0.toString(), payload.get("assessedAt"));
        List<Map<String, Object>> recommendations = (List<Map<String, Object>>) payload.get("recommendations");
        assertEquals("usage_decline", recommendations.get(0).get("factor"));
        assertEquals("high", recommendations.get(0).get("priority"));
        assertEquals("immediate", recommendations.get(0).get("timeline"));
        assertEquals(1, ((List<?>) payload.get("factors")).size());

        assertFalse(dispatcher.buildPayload(profile, false).containsKey("factors"));
    }

    private static InterventionAlertDispatcher dispatcher(InterventionAlertProperties properties, JavaMailSender mailSender) {
        return new InterventionAlertDispatcher(
                properties,
                new SimpleObjectProvider<>(new ObjectMapper()),
                new SimpleObjectProvider<>(mailSender)
        );
    }

    private static RiskProfile highRiskProfile() {
        Map<String, FactorSignal> signals = new LinkedHashMap<>();
        signals.put("usage_decline", new FactorSignal(0.9, 0.9));
        signals.put("payment_issues", new FactorSignal(0.8, 0.5));
        List<RiskFactor> factors = List.of(RiskFactor.of("usage_decline", signals.get("usage_decline"), 1.0));
        return RiskProfile.assessed("acme", 86.0, factors, new RecommendationEngine().recommend(signals), T0)
                .withId(UUID.randomUUID());
    }

    private static final class SimpleObjectProvider<T> implements ObjectProvider<T> {
        private final T instance;

        private SimpleObjectProvider(T instance) {
            this.instance = instance;
        }

        @Override
        public T getObject(Object... args) {
            if (instance == null) {
                throw new IllegalStateException("No object available");
            }
            return instance;
        }

        @Override
        public T getObject() {
            return getObject(new Object[0]);
        }

        @Override
        public T getIfAvailable() {
            return instance;
        }

        @Override
        public T getIfAvailable(Supplier<T> supplier) {
            return instance != null ? instance : supplier.get();
        }

        @Override
        public T getIfUnique() {
            return instance;
        }

        @Override
        public T getIfUnique(Supplier<T> supplier) {
            return instance != null ? instance : supplier.get();
        }

        @Override
        public Stream<T> stream() {
            return instance == null ? Stream.empty() : Stream.of(instance);
        }

        @Override
        public Stream<T> orderedStream() {
            return stream();
        }
    }
}
