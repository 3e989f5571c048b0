package com.cgraph.e2ee.client.session;

import com.cgraph.e2ee.client.agreement.X3dhAgreementEngine;
import com.cgraph.e2ee.client.keys.KeyBundleGenerator;
import com.cgraph.e2ee.client.store.InMemorySecureStorage;
import com.cgraph.e2ee.client.store.SecureStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Spring wiring for the client. Applications supply their platform's
 * {@link SecureStorage}; without one, keys live in memory only.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(E2eeClientProperties.class)
public class E2eeClientConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SecureStorage secureStorage() {
        return new InMemorySecureStorage();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock e2eeClock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyBundleGenerator keyBundleGenerator(Clock clock) {
        return new KeyBundleGenerator(KeyBundleGenerator::randomKeyId, clock);
    }

    @Bean
    public X3dhAgreementEngine x3dhAgreementEngine() {
        return new X3dhAgreementEngine();
    }

    @Bean
    public E2eeSessionFactory e2eeSessionFactory(E2eeClientProperties properties,
                                                 SecureStorage storage,
                                                 ObjectProvider<ObjectMapper> mapper,
                                                 ObjectProvider<WebClient.Builder> webClientBuilder,
                                                 KeyBundleGenerator generator,
                                                 X3dhAgreementEngine agreement,
                                                 Clock clock) {
        return new E2eeSessionFactory(properties, storage,
                mapper.getIfAvailable(() -> JsonMapper.builder().build()),
                webClientBuilder.getIfAvailable(WebClient::builder),
                generator, agreement, clock);
    }
}
