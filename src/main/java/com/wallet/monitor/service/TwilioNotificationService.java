package com.wallet.monitor.service;

import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import com.wallet.monitor.config.MetricsConfig;
import com.wallet.monitor.config.TwilioNotificationConfig;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.RiskLevel;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-notification")
    public void notifyIfHighRisk(Alert alert) {
        if (!config.isEnabled() || alert.getRiskLevel() != RiskLevel.HIGH) {
            return;
        }

        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    buildMessageBody(alert)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio notification sent for alert={}, sid={}", alert.getId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio notification for alert={}: {}", alert.getId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(Alert alert) {
        return String.format(
                "[WALLET ALERT] %s risk\n" +
                "Chain: %s\n" +
                "Wallet: %s\n" +
                "Type: %s\n" +
                "Tx: %s\n" +
                "%s",
                alert.getRiskLevel(),
                alert.getChain(),
                alert.getWalletAddress(),
                alert.getAlertType(),
                alert.getTransactionHash() != null ? alert.getTransactionHash() : "N/A",
                alert.getMessage()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
