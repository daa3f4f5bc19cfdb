package com.pdp.adapter.spring;

import com.pdp.config.PolicyLoader;
import com.pdp.config.document.PolicyParser;
import com.pdp.config.document.RequestReader;
import com.pdp.engine.PolicyEngine;
import com.pdp.expression.DefaultFunctionFactory;
import com.pdp.expression.FunctionFactory;
import com.pdp.session.AttributeResolver;
import com.pdp.store.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the policy decision point.
 */
@Configuration
@ConditionalOnProperty(prefix = "pdp", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PdpProperties.class)
public class PdpAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PdpAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public FunctionFactory pdpFunctionFactory() {
        return new DefaultFunctionFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyParser policyParser(FunctionFactory functionFactory) {
        return new PolicyParser(functionFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public AttributeResolver attributeResolver() {
        log.info("No AttributeResolver bean defined, attributes missing from requests will not be resolved");
        return AttributeResolver.none();
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyStore policyStore(PolicyParser parser, AttributeResolver resolver, PdpProperties properties) {
        PolicyStore store = new PolicyStore(parser, resolver);
        if (properties.getPolicyPath() != null && !properties.getPolicyPath().isBlank()) {
            PolicyLoader.loadInto(store, properties.getPolicyPath(), properties.getFormat());
        } else {
            log.warn("pdp.policy-path is not set, serving NotApplicable until a policy is loaded");
        }
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyEngine policyEngine(PolicyStore store) {
        log.info("Exposing PolicyEngine at generation {}", store.current().getGeneration());
        return store.getEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestReader requestReader() {
        return new RequestReader();
    }
}
