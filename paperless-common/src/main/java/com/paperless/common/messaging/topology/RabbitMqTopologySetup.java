package com.paperless.common.messaging.topology;

import com.paperless.common.messaging.RabbitMqContext;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Queue;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Declares the pipeline topology once the application context is built and before any
 * worker starts consuming.
 * <p>
 * Every declaration is idempotent on the broker, so redundant or concurrent runs from
 * several instances are harmless. Nothing is deleted on shutdown.
 */
@Slf4j
public class RabbitMqTopologySetup implements SmartInitializingSingleton {

    private final RabbitMqContext context;
    private final Declarables declarables;

    public RabbitMqTopologySetup(RabbitMqContext context) {
        this(context, RabbitMqTopology.declarables());
    }

    public RabbitMqTopologySetup(RabbitMqContext context, Declarables declarables) {
        this.context = context;
        this.declarables = declarables;
    }

    @Override
    public void afterSingletonsInstantiated() {
        try {
            declare();
        } catch (IOException e) {
            throw new UncheckedIOException("RabbitMQ topology setup failed", e);
        }
    }

    public void declare() throws IOException {
        log.info("Setting up RabbitMQ topology...");

        try (Channel channel = context.createChannel()) {
            for (Exchange exchange : declarables.getDeclarablesByType(Exchange.class)) {
                channel.exchangeDeclare(exchange.getName(), exchange.getType(), exchange.isDurable(),
                        exchange.isAutoDelete(), exchange.getArguments());
                log.debug("Declared exchange {} ({})", exchange.getName(), exchange.getType());
            }

            for (Queue queue : declarables.getDeclarablesByType(Queue.class)) {
                channel.queueDeclare(queue.getName(), queue.isDurable(), queue.isExclusive(),
                        queue.isAutoDelete(), queue.getArguments());
                log.debug("Declared queue {}", queue.getName());
            }

            for (Binding binding : declarables.getDeclarablesByType(Binding.class)) {
                channel.queueBind(binding.getDestination(), binding.getExchange(), binding.getRoutingKey(),
                        binding.getArguments());
                log.debug("Bound {} to {} with {}", binding.getDestination(), binding.getExchange(),
                        binding.getRoutingKey());
            }
        } catch (TimeoutException e) {
            throw new IOException("Timed out closing topology channel", e);
        }

        log.info("RabbitMQ topology setup completed");
    }
}
