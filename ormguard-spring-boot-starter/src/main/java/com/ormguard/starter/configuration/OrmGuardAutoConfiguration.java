package com.ormguard.starter.configuration;

import com.ormguard.api.exception.InvalidPolicyException;
import com.ormguard.api.schema.SchemaMetadata;
import com.ormguard.core.audit.AuditSink;
import com.ormguard.core.audit.LoggingAuditSink;
import com.ormguard.core.cost.CostBudget;
import com.ormguard.core.cost.QueryCostEstimator;
import com.ormguard.core.dev.PolicyFileWatcher;
import com.ormguard.core.loader.PolicyYamlLoader;
import com.ormguard.core.policy.FieldTransformRegistry;
import com.ormguard.core.runtime.PolicyEvaluator;
import com.ormguard.core.runtime.PolicyStore;
import com.ormguard.starter.config.OrmGuardProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

@Slf4j
@Configuration
@EnableConfigurationProperties(OrmGuardProperties.class)
@ConditionalOnProperty(prefix = "ormguard", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OrmGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FieldTransformRegistry fieldTransformRegistry() {
        return FieldTransformRegistry.empty();
    }

    // 1. 成本闸门（可选）
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "ormguard.cost", name = "enabled", havingValue = "true")
    public QueryCostEstimator queryCostEstimator() {
        return new QueryCostEstimator();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "ormguard.cost", name = "enabled", havingValue = "true")
    public CostBudget costBudget(OrmGuardProperties properties) {
        return CostBudget.builder().maxTotalCost(properties.getCost().getMaxTotalCost()).build();
    }

    // 2. 策略仓库：Schema 由应用提供，缺省为空
    @Bean
    @ConditionalOnMissingBean
    public PolicyStore policyStore(OrmGuardProperties properties,
                                   ResourceLoader resourceLoader,
                                   FieldTransformRegistry transforms,
                                   ObjectProvider<SchemaMetadata> schema,
                                   ObjectProvider<QueryCostEstimator> costEstimator,
                                   ObjectProvider<CostBudget> costBudget) {
        PolicyStore store = new PolicyStore(schema.getIfAvailable(SchemaMetadata::empty), transforms,
                costEstimator.getIfAvailable(), costBudget.getIfAvailable());

        String location = properties.getPolicyLocation();
        if (location != null && !location.isBlank()) {
            Resource resource = resourceLoader.getResource(location);
            try (InputStream is = resource.getInputStream()) {
                store.publish(PolicyYamlLoader.load(is));
            } catch (IOException e) {
                throw new InvalidPolicyException("Failed to read policy from " + location, e);
            }
        } else {
            log.info("[PolicyStore] No ormguard.policy-location configured; waiting for programmatic publish");
        }
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink(OrmGuardProperties properties) {
        return new LoggingAuditSink(properties.getAudit().isLogInputs());
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyEvaluator policyEvaluator(PolicyStore store, AuditSink auditSink, OrmGuardProperties properties) {
        return new PolicyEvaluator(store, auditSink, properties.getAudit().isEnabled());
    }

    // 3. 开发模式热加载
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "ormguard", name = "watch", havingValue = "true")
    public PolicyFileWatcher policyFileWatcher(PolicyStore store, OrmGuardProperties properties,
                                               ResourceLoader resourceLoader) throws IOException {
        String location = properties.getPolicyLocation();
        if (location == null || location.isBlank()) {
            throw new InvalidPolicyException("ormguard.policy-location", location,
                    "ormguard.watch requires ormguard.policy-location");
        }
        Path file = resourceLoader.getResource(location).getFile().toPath();
        PolicyFileWatcher watcher = new PolicyFileWatcher(file, store, properties.getWatchDebounce().toMillis());
        watcher.start();
        return watcher;
    }
}
