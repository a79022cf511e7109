package com.intteq.universal.pubsub.internal;

import com.intteq.universal.pubsub.DeliveryContext;
import com.intteq.universal.pubsub.DeliveryGuarantee;
import com.intteq.universal.pubsub.DeliveryOutcome;
import com.intteq.universal.pubsub.Deliveries;
import com.intteq.universal.pubsub.OrderEvent;
import com.intteq.universal.pubsub.OutOfStockException;
import com.intteq.universal.pubsub.PubSubAutoConfiguration;
import com.intteq.universal.pubsub.Topic;
import com.intteq.universal.pubsub.annotation.PubSubListener;
import com.intteq.universal.pubsub.annotation.Subscribe;
import com.intteq.universal.pubsub.broker.InMemoryPubSubBroker;
import com.intteq.universal.pubsub.registry.SubscriptionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionListenerProcessorTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PubSubAutoConfiguration.class))
            .withPropertyValues("pubsub.testing=true");

    @Test
    void registersAnnotatedHandlersAndDeliversToThem() {
        runner.withUserConfiguration(TopicConfig.class, FulfilmentListener.class)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    InMemoryPubSubBroker broker = context.getBean(InMemoryPubSubBroker.class);
                    FulfilmentListener listener = context.getBean(FulfilmentListener.class);

                    DeliveryOutcome ok = broker.deliver("orders", "order-events", Deliveries.order("m1", 2));
                    DeliveryOutcome failed = broker.deliver("orders", "order-audit",
                            Deliveries.json("m2", 1, "{\"orderId\":\"out-of-stock\"}"));

                    assertThat(ok.isAcknowledged()).isTrue();
                    assertThat(listener.attempts).containsExactly(2);
                    assertThat(failed.error()).get().isInstanceOf(OutOfStockException.class);
                    assertThat(listener.audited).containsExactly("out-of-stock");
                });
    }

    @Test
    void appliesRetryAttributes() {
        runner.withUserConfiguration(TopicConfig.class, FulfilmentListener.class)
                .run(context -> {
                    SubscriptionRegistry registry = context.getBean(SubscriptionRegistry.class);

                    assertThat(registry.find("orders", "order-events")).hasValueSatisfying(sub -> {
                        assertThat(sub.retryPolicy().getMaxRetries()).isEqualTo(5);
                        assertThat(sub.retryPolicy().getMinBackoff()).isEqualTo(Duration.ofSeconds(1));
                        assertThat(sub.retryPolicy().getMaxBackoff()).isEqualTo(Duration.ofMinutes(1));
                    });
                    assertThat(registry.find("orders", "order-audit")).hasValueSatisfying(sub ->
                            assertThat(sub.retryPolicy().getMaxRetries()).isEqualTo(100));
                });
    }

    @Test
    void unknownTopicFailsStartup() {
        runner.withUserConfiguration(FulfilmentListener.class)
                .run(context -> assertThat(context).getFailure()
                        .hasStackTraceContaining("No Topic bean named 'orders'"));
    }

    @Test
    void invalidSignatureFailsStartup() {
        runner.withUserConfiguration(TopicConfig.class, WrongPayloadListener.class)
                .run(context -> assertThat(context).getFailure()
                        .hasStackTraceContaining("Invalid @Subscribe signature"));
    }

    @Test
    void invalidSubscriptionNameFailsStartup() {
        runner.withUserConfiguration(TopicConfig.class, BadNameListener.class)
                .run(context -> assertThat(context).getFailure()
                        .hasStackTraceContaining("invalid subscription name 'My_Sub'"));
    }

    @Test
    void invalidBackoffFailsStartup() {
        runner.withUserConfiguration(TopicConfig.class, BadBackoffListener.class)
                .run(context -> assertThat(context).getFailure()
                        .hasStackTraceContaining("Invalid @Subscribe minBackoff"));
    }

    @Test
    void proxiedListenerDeliversToTarget() {
        runner.withUserConfiguration(TopicConfig.class, ProxiedListenerConfig.class)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    InMemoryPubSubBroker broker = context.getBean(InMemoryPubSubBroker.class);

                    DeliveryOutcome outcome = broker.deliver("orders", "order-events", Deliveries.order("m1", 1));

                    assertThat(outcome.isAcknowledged()).isTrue();
                    assertThat(context.getBean(OrderLog.class).orderIds).containsExactly("o-1");
                });
    }

    @Test
    void privateHandlerOnProxiedListenerFailsStartup() {
        runner.withUserConfiguration(TopicConfig.class, PrivateProxiedListenerConfig.class)
                .run(context -> assertThat(context).getFailure()
                        .hasStackTraceContaining("cannot be invoked on the listener proxy"));
    }

    @Configuration(proxyBeanMethods = false)
    static class TopicConfig {

        @Bean
        Topic<OrderEvent> ordersTopic() {
            return Topic.create("orders", OrderEvent.class, DeliveryGuarantee.AT_LEAST_ONCE);
        }
    }

    @PubSubListener
    static class FulfilmentListener {

        final List<Integer> attempts = new ArrayList<>();
        final List<String> audited = new ArrayList<>();

        @Subscribe(topic = "orders", name = "order-events", maxRetries = 5, minBackoff = "1s", maxBackoff = "1m")
        void onOrder(DeliveryContext ctx, OrderEvent event) {
            attempts.add(ctx.attempt());
        }

        @Subscribe(topic = "orders", name = "order-audit")
        void audit(OrderEvent event) throws OutOfStockException {
            audited.add(event.getOrderId());
            throw new OutOfStockException("insufficient-stock");
        }
    }

    static class OrderLog {

        final List<String> orderIds = new ArrayList<>();
    }

    @PubSubListener
    static class RecordingListener {

        private final OrderLog log;

        RecordingListener(OrderLog log) {
            this.log = log;
        }

        @Subscribe(topic = "orders", name = "order-events")
        public void onOrder(OrderEvent event) {
            log.orderIds.add(event.getOrderId());
        }
    }

    @PubSubListener
    static class PrivateHandlerListener {

        @Subscribe(topic = "orders", name = "order-events")
        private void onOrder(OrderEvent event) {
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ProxiedListenerConfig {

        @Bean
        OrderLog orderLog() {
            return new OrderLog();
        }

        @Bean
        Object recordingListener(OrderLog orderLog) {
            return classProxy(new RecordingListener(orderLog));
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class PrivateProxiedListenerConfig {

        @Bean
        Object privateHandlerListener() {
            return classProxy(new PrivateHandlerListener());
        }
    }

    private static Object classProxy(Object target) {
        ProxyFactory factory = new ProxyFactory(target);
        factory.setProxyTargetClass(true);
        return factory.getProxy();
    }

    @PubSubListener
    static class WrongPayloadListener {

        @Subscribe(topic = "orders", name = "order-events")
        void onOrder(String event) {
        }
    }

    @PubSubListener
    static class BadNameListener {

        @Subscribe(topic = "orders", name = "My_Sub")
        void onOrder(OrderEvent event) {
        }
    }

    @PubSubListener
    static class BadBackoffListener {

        @Subscribe(topic = "orders", name = "order-events", minBackoff = "soon")
        void onOrder(OrderEvent event) {
        }
    }
}
