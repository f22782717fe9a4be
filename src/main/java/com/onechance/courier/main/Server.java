package com.onechance.courier.main;

import com.onechance.courier.config.server.QueueConfig;
import com.onechance.courier.config.server.SendGridConfig;
import com.onechance.courier.config.server.ServerConfig;
import com.onechance.courier.config.server.TwilioConfig;
import com.onechance.courier.endpoints.ApiEndpoint;
import com.onechance.courier.metrics.QueueMetrics;
import com.onechance.courier.network.ConnectivityMonitor;
import com.onechance.courier.queue.MessageQueue;
import com.onechance.courier.queue.MessageQueueCron;
import com.onechance.courier.queue.payload.EmailPayload;
import com.onechance.courier.queue.payload.MmsPayload;
import com.onechance.courier.queue.payload.SmsPayload;
import com.onechance.courier.queue.store.QueueStore;
import com.onechance.courier.queue.store.QueueStoreFactory;
import com.onechance.courier.sender.ChannelSender;
import com.onechance.courier.sender.ChannelSenders;
import com.onechance.courier.sender.LoggingChannelSender;
import com.onechance.courier.sender.SendGridEmailSender;
import com.onechance.courier.sender.TwilioClient;
import com.onechance.courier.sender.TwilioMmsSender;
import com.onechance.courier.sender.TwilioSmsSender;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import javax.naming.ConfigurationException;
import java.io.Closeable;
import java.io.IOException;

/**
 * Main service class.
 *
 * <p>This class is responsible for wiring and managing the service lifecycle.
 * <p>It builds the connectivity monitor, the queue store, the channel senders and the queue,
 * then starts the poll cron, metrics and the operations endpoint.
 *
 * <p>The service is started by calling the static {@link #run(String)} method with the path
 * to the configuration directory.
 * <br>Components are closed in reverse order on {@link #close()} or JVM shutdown.
 *
 * @see Foundation
 */
public class Server extends Foundation implements Closeable {

    private final ServerConfig config;
    private final ConnectivityMonitor monitor;
    private final QueueStore store;
    private final MessageQueue queue;
    private final PrometheusMeterRegistry registry;
    private final MessageQueueCron cron;
    private ApiEndpoint endpoint;

    /**
     * Constructs a new Server instance and loads the persisted queue.
     *
     * @param config ServerConfig instance.
     */
    public Server(ServerConfig config) {
        this.config = config;
        QueueConfig queueConfig = config.getQueue();

        this.monitor = new ConnectivityMonitor(config.getNetwork());
        this.store = QueueStoreFactory.create(queueConfig, config.getDataDir());
        this.queue = new MessageQueue(store, senders(config), monitor, queueConfig);
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new QueueMetrics(registry).bind(queue);
        this.cron = new MessageQueueCron(queue, queueConfig.getPollInterval());
    }

    /**
     * Initializes and starts the service.
     *
     * @param path The directory path containing the configuration files.
     * @return Server instance.
     * @throws ConfigurationException If there is an issue with the configuration files.
     */
    public static Server run(String path) throws ConfigurationException {
        init(path);

        Server server = new Server(Config.getServer());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Service is shutting down.");
            server.close();
        }, "courier-shutdown"));

        server.start();
        return server;
    }

    /**
     * Starts background services.
     */
    public void start() {
        log.info("Starting {}: messages={}", config.getName(), queue.getStats().total());

        monitor.start();
        cron.start();

        if (config.getApi().isEnabled()) {
            try {
                endpoint = new ApiEndpoint(queue, monitor, registry);
                endpoint.start(config.getApi());
            } catch (IOException e) {
                log.error("Unable to start API endpoint: {}", e.getMessage());
            }
        }

        queue.processQueue();
    }

    /**
     * Builds channel senders.
     * <p>Channels whose provider is disabled get a dry-run sender.
     *
     * @param config ServerConfig instance.
     * @return ChannelSenders instance.
     */
    static ChannelSenders senders(ServerConfig config) {
        SendGridConfig sendGrid = config.getSendGrid();
        ChannelSender<EmailPayload> email = sendGrid.isEnabled()
                ? new SendGridEmailSender(sendGrid)
                : new LoggingChannelSender<>();

        TwilioConfig twilio = config.getTwilio();
        ChannelSender<SmsPayload> sms;
        ChannelSender<MmsPayload> mms;
        if (twilio.isEnabled()) {
            TwilioClient client = new TwilioClient(twilio);
            sms = new TwilioSmsSender(client);
            mms = new TwilioMmsSender(client);
        } else {
            sms = new LoggingChannelSender<>();
            mms = new LoggingChannelSender<>();
        }

        log.info("Channel senders: email={}, sms={}, mms={}",
                sendGrid.isEnabled() ? "sendgrid" : "dry-run",
                twilio.isEnabled() ? "twilio" : "dry-run",
                twilio.isEnabled() ? "twilio" : "dry-run");
        return new ChannelSenders(email, sms, mms);
    }

    public MessageQueue getQueue() {
        return queue;
    }

    public ConnectivityMonitor getMonitor() {
        return monitor;
    }

    /**
     * Gets the operations endpoint.
     *
     * @return ApiEndpoint instance or null if disabled or not started.
     */
    public ApiEndpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Stops all components in reverse order of creation.
     */
    @Override
    public void close() {
        if (endpoint != null) {
            endpoint.stop();
        }
        cron.close();
        queue.close();
        monitor.close();
        store.close();
        registry.close();
        log.info("Service stopped.");
    }
}
