package com.paperless.common.messaging.topology;

import com.paperless.common.messaging.RabbitMqSchema;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Exchange, queues and bindings of the pipeline, described with the spring-amqp model.
 */
public final class RabbitMqTopology {

    private RabbitMqTopology() {
    }

    /**
     * Durable topic exchange shared by all message types.
     */
    public static TopicExchange exchange() {
        return new TopicExchange(RabbitMqSchema.EXCHANGE, true, false);
    }

    /**
     * The exchange first, then every queue, then one binding per queue.
     */
    public static Declarables declarables() {
        TopicExchange exchange = exchange();
        List<Declarable> queues = new ArrayList<>();
        List<Declarable> bindings = new ArrayList<>();

        for (Map.Entry<String, String> entry : RabbitMqSchema.bindings().entrySet()) {
            Queue queue = QueueBuilder.durable(entry.getKey()).build();
            Binding binding = BindingBuilder.bind(queue).to(exchange).with(entry.getValue());
            queues.add(queue);
            bindings.add(binding);
        }

        List<Declarable> all = new ArrayList<>();
        all.add(exchange);
        all.addAll(queues);
        all.addAll(bindings);
        return new Declarables(all);
    }
}
