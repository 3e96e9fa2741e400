package com.sessiongate.gateway;

import com.sessiongate.dispatch.EventConsumer;
import com.sessiongate.dispatch.EventDispatcher;
import com.sessiongate.gateway.ws.EventBroadcastHandler;
import com.sessiongate.observability.GatewayMetrics;
import com.sessiongate.observability.GatewayObservabilitySink;
import com.sessiongate.observability.HealthCheck;
import com.sessiongate.observability.Slf4jObservabilitySink;
import com.sessiongate.outbound.OutboundMessageQueue;
import com.sessiongate.protocol.loopback.LoopbackConnector;
import com.sessiongate.protocol.loopback.PairingService;
import com.sessiongate.registry.SessionRegistry;
import com.sessiongate.sessions.CredentialStore;
import com.sessiongate.sessions.PersistenceSink;
import com.sessiongate.sessions.PostgresPersistenceSink;
import com.sessiongate.sessions.PostgresWebhookConfigProvider;
import com.sessiongate.sessions.WebhookConfigProvider;
import com.sessiongate.shared.config.ConfigLoader;
import com.sessiongate.shared.config.GatewayConfig;
import com.sessiongate.shared.model.Credential;
import com.sessiongate.supervisor.ExponentialBackoffPolicy;
import com.sessiongate.supervisor.SupervisorContext;
import com.sessiongate.webhook.DeliveryJournal;
import com.sessiongate.webhook.HttpWebhookTransport;
import com.sessiongate.webhook.PostgresDeliveryJournal;
import com.sessiongate.webhook.WebhookDeliveryWorker;
import com.sessiongate.webhook.WebhookEventConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;

/**
 * Wires the orchestration core. Everything below the gateway package is plain Java and
 * only meets Spring here.
 */
@Configuration
public class CoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CoreConfiguration.class);

    // webhook retries are spread the same way as reconnects
    private static final double WEBHOOK_JITTER = 0.2;

    @Bean
    public GatewayConfig gatewayConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public GatewayMetrics gatewayMetrics() {
        return new GatewayMetrics();
    }

    @Bean
    public GatewayObservabilitySink observabilitySink() {
        return new Slf4jObservabilitySink();
    }

    @Bean
    public PersistenceSink persistenceSink(DataSource dataSource) {
        return new PostgresPersistenceSink(dataSource);
    }

    @Bean
    public WebhookConfigProvider webhookConfigProvider(DataSource dataSource) {
        return new PostgresWebhookConfigProvider(dataSource);
    }

    @Bean
    public CredentialStore credentialStore(PersistenceSink persistenceSink) {
        return new CredentialStore(persistenceSink);
    }

    @Bean(destroyMethod = "close")
    public LoopbackConnector protocolConnector(GatewayConfig config) {
        if (!"loopback".equals(config.protocolConnector())) {
            throw new IllegalStateException("Unknown protocol connector: " + config.protocolConnector());
        }
        // three heartbeats per liveness window
        var heartbeatMs = Math.max(1, config.supervisor().heartbeatTimeoutMs() / 3);
        log.info("Using loopback protocol connector (heartbeat every {}ms)", heartbeatMs);
        return new LoopbackConnector(new PairingService(), heartbeatMs);
    }

    @Bean
    public DeliveryJournal deliveryJournal(DataSource dataSource) {
        return new PostgresDeliveryJournal(dataSource);
    }

    @Bean(destroyMethod = "close")
    public WebhookDeliveryWorker webhookDeliveryWorker(GatewayConfig config, DeliveryJournal deliveryJournal,
                                                       WebhookConfigProvider webhookConfigProvider,
                                                       GatewayMetrics metrics,
                                                       GatewayObservabilitySink observability) {
        var webhook = config.webhook();
        return new WebhookDeliveryWorker(
                webhook,
                new HttpWebhookTransport(Duration.ofMillis(webhook.timeoutMs())),
                deliveryJournal,
                webhookConfigProvider,
                new ExponentialBackoffPolicy(webhook.baseDelayMs(), webhook.maxDelayMs(), WEBHOOK_JITTER),
                metrics,
                observability);
    }

    @Bean(destroyMethod = "close")
    public EventDispatcher eventDispatcher(GatewayConfig config, GatewayMetrics metrics,
                                           GatewayObservabilitySink observability,
                                           PersistenceSink persistenceSink,
                                           CredentialStore credentialStore,
                                           DeliveryJournal deliveryJournal,
                                           WebhookConfigProvider webhookConfigProvider,
                                           WebhookDeliveryWorker webhookDeliveryWorker,
                                           EventBroadcastHandler broadcaster) {
        var seed = EventDispatcher.highestOf(List.of(
                persistenceSink::lastSequence,
                id -> credentialStore.load(id).map(Credential::version).orElse(0L),
                deliveryJournal::lastSequence));
        var dispatcher = new EventDispatcher(config.dispatch(), metrics, observability, seed);
        dispatcher.register(EventConsumer.of("persistence", e -> persistenceSink.persistEvent(e.sessionId(), e)));
        dispatcher.register(new WebhookEventConsumer(webhookConfigProvider, webhookDeliveryWorker));
        dispatcher.register(EventConsumer.of("broadcast", e -> broadcaster.broadcast(e.sessionId(), e)));
        return dispatcher;
    }

    @Bean
    public OutboundMessageQueue outboundMessageQueue(GatewayConfig config) {
        return new OutboundMessageQueue(config.outbound());
    }

    @Bean
    public SessionRegistry sessionRegistry(GatewayConfig config, LoopbackConnector connector,
                                           CredentialStore credentialStore, EventDispatcher dispatcher,
                                           OutboundMessageQueue outbound, GatewayMetrics metrics,
                                           GatewayObservabilitySink observability) {
        var supervisor = config.supervisor();
        var reconnect = supervisor.reconnect();
        var ctx = new SupervisorContext(
                supervisor,
                config.outbound().ackTimeoutMs(),
                connector,
                credentialStore,
                dispatcher,
                new ExponentialBackoffPolicy(reconnect.baseDelayMs(), reconnect.maxDelayMs(), reconnect.jitter()),
                observability,
                metrics);
        return new SessionRegistry(ctx, outbound);
    }

    @Bean
    public HealthCheck healthCheck(DataSource dataSource, SessionRegistry registry) {
        return new HealthCheck(dataSource, registry::activeCount);
    }

    @Bean
    public GatewayLifecycle gatewayLifecycle(SessionRegistry registry, EventDispatcher dispatcher,
                                             WebhookDeliveryWorker webhookDeliveryWorker, GatewayConfig config) {
        return new GatewayLifecycle(registry, dispatcher, webhookDeliveryWorker, config);
    }
}
