package com.intteq.universal.pubsub.internal;

import com.intteq.universal.pubsub.DeliveryContext;
import com.intteq.universal.pubsub.RetryPolicy;
import com.intteq.universal.pubsub.SubscriptionConfig;
import com.intteq.universal.pubsub.SubscriptionHandler;
import com.intteq.universal.pubsub.Topic;
import com.intteq.universal.pubsub.annotation.PubSubListener;
import com.intteq.universal.pubsub.annotation.Subscribe;
import com.intteq.universal.pubsub.exception.PubSubConfigurationException;
import com.intteq.universal.pubsub.registry.SubscriptionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.ApplicationContext;
import org.springframework.core.ResolvableType;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.time.Duration;

/**
 * Discovers all {@link PubSubListener} beans and registers their {@link Subscribe}
 * methods with the {@link SubscriptionRegistry}.
 *
 * <p>Runs once all singletons are instantiated, so every {@link Topic} bean is available.
 * Any invalid declaration aborts the application startup.
 */
@Slf4j
@RequiredArgsConstructor
public class SubscriptionListenerProcessor implements SmartInitializingSingleton {

    private final ApplicationContext context;
    private final SubscriptionRegistry registry;

    // ========================================================================
    //   BEAN DISCOVERY & INITIALIZATION
    // ========================================================================

    @Override
    public void afterSingletonsInstantiated() {
        log.debug("Scanning for @PubSubListener beans...");

        context.getBeansWithAnnotation(PubSubListener.class)
                .values()
                .forEach(this::registerListenerBean);
    }

    private void registerListenerBean(Object bean) {
        Class<?> beanClass = AopUtils.getTargetClass(bean);

        for (Method method : beanClass.getDeclaredMethods()) {
            Subscribe subscribe = method.getAnnotation(Subscribe.class);
            if (subscribe == null) {
                continue;
            }

            Topic<?> topic = findTopic(subscribe.topic(), beanClass, method);
            register(topic, subscribe, bean, invocableMethod(bean, method));
        }
    }

    private <T> void register(Topic<T> topic, Subscribe subscribe, Object bean, Method method) {
        boolean withContext = validateHandlerSignature(topic, method);
        ReflectionUtils.makeAccessible(method);

        SubscriptionHandler<T> handler = (ctx, message) -> invoke(bean, method,
                withContext ? new Object[]{ctx, message} : new Object[]{message});

        registry.register(topic, subscribe.name(), SubscriptionConfig.<T>builder()
                .handler(handler)
                .retryPolicy(retryPolicy(subscribe))
                .build());

        log.debug("Registered @Subscribe handler {}#{} → topic={} subscription={}",
                method.getDeclaringClass().getSimpleName(), method.getName(), topic.name(), subscribe.name());
    }

    // ========================================================================
    //   INVOCATION
    // ========================================================================

    /**
     * Invokes the handler method, rethrowing whatever the method itself threw so the
     * dispatcher can classify it.
     */
    private static void invoke(Object bean, Method method, Object[] args) throws Exception {
        try {
            method.invoke(bean, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    // ========================================================================
    //   VALIDATION
    // ========================================================================

    /**
     * Resolves the method to call on the bean itself, which may be a proxy of the target class.
     */
    private static Method invocableMethod(Object bean, Method method) {
        try {
            return AopUtils.selectInvocableMethod(method, bean.getClass());
        } catch (IllegalStateException e) {
            throw new PubSubConfigurationException(
                    "@Subscribe handler " + method.getDeclaringClass().getName() + "#" + method.getName()
                            + " cannot be invoked on the listener proxy", e);
        }
    }

    private Topic<?> findTopic(String name, Class<?> beanClass, Method method) {
        return context.getBeansOfType(Topic.class).values().stream()
                .filter(topic -> topic.name().equals(name))
                .findFirst()
                .map(topic -> (Topic<?>) topic)
                .orElseThrow(() -> new PubSubConfigurationException(
                        "No Topic bean named '" + name + "' for @Subscribe handler "
                                + beanClass.getName() + "#" + method.getName()));
    }

    /**
     * @return whether the method takes a {@link DeliveryContext} as first parameter
     */
    private boolean validateHandlerSignature(Topic<?> topic, Method method) {
        Class<?>[] params = method.getParameterTypes();
        boolean withContext = params.length == 2 && params[0] == DeliveryContext.class;

        if (params.length != 1 && !withContext) {
            throw invalidSignature(method, "expected (Payload) or (DeliveryContext, Payload)");
        }

        Class<?> payloadType = params[params.length - 1];
        Class<?> messageType = ResolvableType.forType(topic.messageType()).toClass();
        if (!payloadType.isAssignableFrom(messageType)) {
            throw invalidSignature(method,
                    "payload parameter " + payloadType.getName() + " does not accept topic message type "
                            + messageType.getName());
        }
        return withContext;
    }

    private static PubSubConfigurationException invalidSignature(Method method, String detail) {
        return new PubSubConfigurationException(
                "Invalid @Subscribe signature: " + method.getDeclaringClass().getName()
                        + "#" + method.getName() + ": " + detail);
    }

    private static RetryPolicy retryPolicy(Subscribe subscribe) {
        return RetryPolicy.builder()
                .maxRetries(subscribe.maxRetries() >= 0 ? subscribe.maxRetries() : null)
                .minBackoff(parseDuration("minBackoff", subscribe.minBackoff()))
                .maxBackoff(parseDuration("maxBackoff", subscribe.maxBackoff()))
                .build();
    }

    private static Duration parseDuration(String attribute, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return DurationStyle.detectAndParse(value);
        } catch (IllegalArgumentException e) {
            throw new PubSubConfigurationException("Invalid @Subscribe " + attribute + ": '" + value + "'", e);
        }
    }
}
