package com.paperless.common.messaging;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Owns the single broker connection of the process.
 * <p>
 * Created once at startup and handed to the publisher, the consumer factory and the
 * topology setup. Channel creation is the only operation they perform on it and is safe
 * for concurrent callers. Channels themselves are not shared.
 * <p>
 * A connection lost after startup (broker restart, network drop) is reopened on the next
 * channel request. Until the broker is back, that request fails with an {@link IOException}.
 */
@Slf4j
public class RabbitMqContext implements AutoCloseable {

    private final ConnectionFactory factory;
    private final String connectionName;

    private volatile Connection connection;
    private volatile boolean closed;

    public RabbitMqContext(ConnectionFactory factory, String connectionName, Connection connection) {
        this.factory = factory;
        this.connectionName = connectionName;
        this.connection = connection;
    }

    /**
     * Opens the process-wide connection. A broker that cannot be reached here is fatal:
     * the exception propagates and application startup fails.
     */
    public static RabbitMqContext connect(ConnectionFactory factory, String connectionName)
            throws IOException, TimeoutException {
        log.info("Connecting to RabbitMQ at {}:{}{} as '{}'",
                factory.getHost(), factory.getPort(), factory.getVirtualHost(), connectionName);
        Connection connection = factory.newConnection(connectionName);
        log.info("RabbitMQ connection established");
        return new RabbitMqContext(factory, connectionName, connection);
    }

    /**
     * Opens a new channel on the shared connection, reconnecting first if it was lost.
     *
     * @throws IOException if the broker cannot be reached or refuses a new channel
     */
    public Channel createChannel() throws IOException {
        Connection current = openConnection();
        Channel channel;
        try {
            channel = current.createChannel();
        } catch (ShutdownSignalException e) {
            throw new IOException("RabbitMQ connection is closed", e);
        }
        if (channel == null) {
            throw new IOException("No channel available on RabbitMQ connection");
        }
        return channel;
    }

    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close();
            log.info("RabbitMQ connection closed");
        } catch (IOException e) {
            log.warn("Error closing RabbitMQ connection", e);
        }
    }

    private synchronized Connection openConnection() throws IOException {
        Connection current = connection;
        if (closed || current.isOpen()) {
            return current;
        }

        log.warn("RabbitMQ connection '{}' was lost, reconnecting", connectionName);
        try {
            connection = factory.newConnection(connectionName);
        } catch (TimeoutException e) {
            throw new IOException("Timed out reconnecting to RabbitMQ", e);
        }
        log.info("RabbitMQ connection re-established");
        return connection;
    }
}
