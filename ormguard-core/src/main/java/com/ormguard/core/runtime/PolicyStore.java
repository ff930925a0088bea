package com.ormguard.core.runtime;

import com.ormguard.api.policy.Policy;
import com.ormguard.api.schema.SchemaMetadata;
import com.ormguard.core.cost.CostBudget;
import com.ormguard.core.cost.QueryCostEstimator;
import com.ormguard.core.loader.PolicyYamlLoader;
import com.ormguard.core.policy.FieldTransformRegistry;
import com.ormguard.core.policy.PolicyEngine;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 当前生效策略的持有者
 * <p>
 * 发布时先校验并构建新引擎，再原子替换引用。正在执行的评估持有旧快照直至结束，
 * 不会观察到半更新的策略。
 * </p>
 */
@Slf4j
public class PolicyStore {

    private final AtomicReference<PolicySnapshot> current = new AtomicReference<>();
    private final AtomicLong revisions = new AtomicLong();

    private final SchemaMetadata schema;
    private final FieldTransformRegistry transforms;
    private final QueryCostEstimator costEstimator;
    private final CostBudget costBudget;

    public PolicyStore(SchemaMetadata schema) {
        this(schema, FieldTransformRegistry.empty(), null, null);
    }

    public PolicyStore(SchemaMetadata schema, FieldTransformRegistry transforms,
            QueryCostEstimator costEstimator, CostBudget costBudget) {
        this.schema = schema == null ? SchemaMetadata.empty() : schema;
        this.transforms = transforms == null ? FieldTransformRegistry.empty() : transforms;
        this.costEstimator = costEstimator;
        this.costBudget = costBudget;
    }

    /**
     * 校验并发布新策略；校验失败时抛出异常，当前策略保持不变
     */
    public PolicySnapshot publish(Policy policy) {
        PolicyEngine engine = new PolicyEngine(policy, schema, transforms, costEstimator, costBudget);
        PolicySnapshot snapshot = new PolicySnapshot(policy, engine, revisions.incrementAndGet(), Instant.now());
        PolicySnapshot previous = current.getAndSet(snapshot);
        log.info("[PolicyStore] Published policy '{}' (revision {}, previous {})", policy.getVersion(),
                snapshot.revision(), previous == null ? "none" : previous.policy().getVersion());
        return snapshot;
    }

    public PolicySnapshot publish(Path file) {
        return publish(PolicyYamlLoader.load(file));
    }

    /**
     * 当前快照
     *
     * @throws IllegalStateException 尚未发布任何策略
     */
    public PolicySnapshot current() {
        PolicySnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("No policy has been published");
        }
        return snapshot;
    }

    public boolean isPublished() {
        return current.get() != null;
    }

    public Policy getPolicy() {
        return current().policy();
    }

    public PolicyEngine getEngine() {
        return current().engine();
    }

    public SchemaMetadata getSchema() {
        return schema;
    }
}
