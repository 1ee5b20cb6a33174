package com.bulwark.autoconfigure;

import com.bulwark.core.SecurityReviewEngine;
import com.bulwark.core.config.BulwarkProperties;
import com.bulwark.core.crypto.CredentialVault;
import com.bulwark.core.csrf.CsrfValidator;
import com.bulwark.core.gateway.RequestGateway;
import com.bulwark.core.plugin.Validator;
import com.bulwark.core.plugin.ValidatorRegistry;
import com.bulwark.core.ratelimit.RateLimiter;
import com.bulwark.core.store.JsonFileReportSink;
import com.bulwark.core.store.ReportSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Auto-configuration for Bulwark.
 * Activated when {@code bulwark.enabled=true} (default).
 */
@AutoConfiguration
@EnableConfigurationProperties
@ConditionalOnProperty(name = "bulwark.enabled", havingValue = "true", matchIfMissing = true)
@ComponentScan(basePackages = "com.bulwark.validator")
public class BulwarkAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BulwarkAutoConfiguration.class);

    @Bean
    @ConfigurationProperties(prefix = "bulwark")
    public BulwarkProperties bulwarkProperties() {
        return new BulwarkProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter bulwarkRateLimiter(BulwarkProperties properties) {
        BulwarkProperties.Gateway gateway = properties.getGateway();
        return new RateLimiter(gateway.getRateLimitRequests(), gateway.getRateLimitWindowMs());
    }

    @Bean
    @ConditionalOnMissingBean
    public CsrfValidator bulwarkCsrfValidator(BulwarkProperties properties) {
        BulwarkProperties.Gateway gateway = properties.getGateway();
        return new CsrfValidator(gateway.getCsrfHeaderName(), gateway.getCsrfParameterName(),
                gateway.getCsrfSessionAttribute());
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestGateway requestGateway(BulwarkProperties properties, RateLimiter rateLimiter,
            CsrfValidator csrfValidator) {
        return new RequestGateway(properties.getGateway(), rateLimiter, csrfValidator);
    }

    @Bean
    @ConditionalOnMissingBean(name = "bulwarkExecutor")
    public Executor bulwarkExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("bulwark-async-");
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialVault credentialVault(@Qualifier("bulwarkExecutor") Executor bulwarkExecutor) {
        return new CredentialVault(bulwarkExecutor);
    }

    /**
     * Every {@link Validator} bean, keyed by bean name, minus those disabled with
     * {@code bulwark.validators.<name>.enabled=false}.
     */
    @Bean
    @ConditionalOnMissingBean
    public ValidatorRegistry validatorRegistry(ListableBeanFactory beanFactory, BulwarkProperties properties) {
        Map<String, Validator> enabled = new LinkedHashMap<>();
        beanFactory.getBeansOfType(Validator.class).forEach((name, validator) -> {
            if (properties.isValidatorEnabled(name)) {
                enabled.put(name, validator);
            } else {
                log.info("[Bulwark] Validator '{}' disabled by configuration", name);
            }
        });
        return new ValidatorRegistry(enabled);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "bulwark.review", name = "report-path")
    public ReportSink reportSink(BulwarkProperties properties) {
        log.info("[Bulwark] Review reports will be written to {}", properties.getReview().getReportPath());
        return new JsonFileReportSink(Path.of(properties.getReview().getReportPath()));
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityReviewEngine securityReviewEngine(ValidatorRegistry registry, BulwarkProperties properties,
            @Qualifier("bulwarkExecutor") Executor bulwarkExecutor, ObjectProvider<ReportSink> reportSink) {
        return new SecurityReviewEngine(registry, properties.getReview(), bulwarkExecutor,
                reportSink.getIfAvailable());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "jakarta.servlet.Filter")
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class ServletGatewayConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public BulwarkSecurityFilter bulwarkSecurityFilter(RequestGateway gateway, BulwarkProperties properties,
                ObjectProvider<ObjectMapper> objectMapper) {
            return new BulwarkSecurityFilter(gateway, properties, objectMapper.getIfAvailable(ObjectMapper::new));
        }
    }
}
