package com.paperless.common.config;

import com.paperless.common.messaging.RabbitMqContext;
import com.paperless.common.messaging.RabbitMqSchema;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the state of the shared broker connection under {@code /actuator/health}.
 */
@Component
public class RabbitMqHealthIndicator implements HealthIndicator {

    @Autowired
    private RabbitMqContext rabbitMqContext;

    @Override
    public Health health() {
        if (rabbitMqContext.isOpen()) {
            return Health.up()
                    .withDetail("exchange", RabbitMqSchema.EXCHANGE)
                    .build();
        }
        return Health.down()
                .withDetail("error", "RabbitMQ connection is closed")
                .build();
    }
}
