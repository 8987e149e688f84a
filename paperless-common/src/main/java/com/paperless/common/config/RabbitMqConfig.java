package com.paperless.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paperless.common.messaging.RabbitMqContext;
import com.paperless.common.messaging.RabbitMqJson;
import com.paperless.common.messaging.consuming.DefaultRabbitMqConsumerFactory;
import com.paperless.common.messaging.consuming.RabbitMqConsumerFactory;
import com.paperless.common.messaging.publishing.DefaultRabbitMqPublisher;
import com.paperless.common.messaging.publishing.RabbitMqPublisher;
import com.paperless.common.messaging.topology.RabbitMqTopologySetup;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Broker wiring shared by every Paperless service.
 * <p>
 * Connection settings come from the standard {@code spring.rabbitmq.*} properties. One raw
 * client connection is opened from them; channels, prefetch and acknowledgements are
 * then driven explicitly by the publisher and consumers.
 */
@Configuration
public class RabbitMqConfig {

    private final ObjectMapper messageMapper = RabbitMqJson.mapper();

    /**
     * Process-wide broker connection. Startup fails if the broker is unreachable.
     */
    @Bean(destroyMethod = "close")
    public RabbitMqContext rabbitMqContext(CachingConnectionFactory connectionFactory,
                                           @Value("${paperless.rabbitmq.connection-name:${spring.application.name:paperless}}")
                                           String connectionName) throws IOException, TimeoutException {
        return RabbitMqContext.connect(connectionFactory.getRabbitConnectionFactory(), connectionName);
    }

    @Bean
    public RabbitMqPublisher rabbitMqPublisher(RabbitMqContext context) {
        return new DefaultRabbitMqPublisher(context, messageMapper);
    }

    @Bean
    public RabbitMqConsumerFactory rabbitMqConsumerFactory(RabbitMqContext context) {
        return new DefaultRabbitMqConsumerFactory(context, messageMapper);
    }

    /**
     * Declares exchange, queues and bindings before lifecycle workers start.
     */
    @Bean
    public RabbitMqTopologySetup rabbitMqTopologySetup(RabbitMqContext context) {
        return new RabbitMqTopologySetup(context);
    }
}
