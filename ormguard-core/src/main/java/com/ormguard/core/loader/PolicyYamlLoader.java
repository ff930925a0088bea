package com.ormguard.core.loader;

import com.ormguard.api.dsl.AggregateOp;
import com.ormguard.api.exception.InvalidPolicyException;
import com.ormguard.api.exception.OrmGuardException;
import com.ormguard.api.policy.Budget;
import com.ormguard.api.policy.FieldAction;
import com.ormguard.api.policy.FieldPolicy;
import com.ormguard.api.policy.ModelPolicy;
import com.ormguard.api.policy.Policy;
import com.ormguard.api.policy.PolicyProfile;
import com.ormguard.api.policy.RelationPolicy;
import com.ormguard.api.policy.RowPolicy;
import com.ormguard.api.policy.WritePolicy;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * YAML 策略文档加载器
 * <p>
 * 使用 SnakeYAML 安全构造器读入通用映射，再逐节转换为不可变的 {@link Policy}。
 * 文档中不允许出现类型标签。返回前会执行 {@link Policy#validate()}。
 * </p>
 *
 * <pre>
 * version: "2024-06"
 * profile: prod
 * global_deny_patterns: ["*password*"]
 * default_row_policy:
 *   tenant_scope_field: tenant_id
 * models:
 *   Order:
 *     fields:
 *       ssn: deny
 *       email: { action: mask, mask_pattern: "***" }
 * </pre>
 */
@Slf4j
public class PolicyYamlLoader {

    private PolicyYamlLoader() {
    }

    public static Policy load(Path file) {
        try (InputStream is = Files.newInputStream(file)) {
            Policy policy = load(is);
            log.info("[Policy] Loaded policy '{}' from {} ({} models)", policy.getVersion(), file,
                    policy.getModels().size());
            return policy;
        } catch (IOException e) {
            throw new InvalidPolicyException("Failed to read policy file: " + file, e);
        }
    }

    public static Policy load(InputStream inputStream) {
        Object document;
        try {
            document = createLoaderYaml().load(inputStream);
        } catch (YAMLException e) {
            throw new InvalidPolicyException("Malformed policy YAML: " + e.getMessage(), e);
        }
        return fromDocument(document);
    }

    public static Policy parse(String yamlText) {
        Object document;
        try {
            document = createLoaderYaml().load(yamlText);
        } catch (YAMLException e) {
            throw new InvalidPolicyException("Malformed policy YAML: " + e.getMessage(), e);
        }
        return fromDocument(document);
    }

    static Yaml createLoaderYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(options));
    }

    private static Policy fromDocument(Object document) {
        if (document == null) {
            throw new InvalidPolicyException("Policy document is empty");
        }
        YamlSection root = YamlSection.of("", document);
        try {
            Policy policy = readPolicy(root);
            policy.validate();
            return policy;
        } catch (OrmGuardException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidPolicyException("Invalid policy document: " + e.getMessage(), e);
        }
    }

    // ==================== 各节解析 ====================

    private static Policy readPolicy(YamlSection root) {
        Policy.PolicyBuilder builder;
        String profile = root.getString("profile");
        if (profile != null) {
            builder = parseProfile(profile).newPolicy();
        } else {
            builder = Policy.builder();
        }

        String version = root.getString("version");
        if (version != null) {
            builder.version(version);
        }
        Boolean requireTenantScope = root.getBoolean("require_tenant_scope");
        if (requireTenantScope != null) {
            builder.requireTenantScope(requireTenantScope);
        }
        Boolean writesEnabled = root.getBoolean("writes_enabled");
        if (writesEnabled != null) {
            builder.writesEnabled(writesEnabled);
        }
        List<String> deny = root.getStringList("global_deny_patterns");
        if (deny != null) {
            builder.globalDenyPatterns(deny);
        }
        List<String> mask = root.getStringList("global_mask_patterns");
        if (mask != null) {
            builder.globalMaskPatterns(mask);
        }

        YamlSection budget = root.getSection("default_budget");
        if (budget != null) {
            Budget base = profile != null ? parseProfile(profile).toBudget() : Budget.defaults();
            builder.defaultBudget(readBudget(budget, base));
        }
        YamlSection rowPolicy = root.getSection("default_row_policy");
        if (rowPolicy != null) {
            builder.defaultRowPolicy(readRowPolicy(rowPolicy));
        }

        YamlSection models = root.getSection("models");
        if (models != null) {
            for (String name : models.keys()) {
                builder.model(name, readModel(models.getSectionOrEmpty(name)));
            }
            models.finish();
        }
        root.finish();
        return builder.build();
    }

    private static ModelPolicy readModel(YamlSection section) {
        ModelPolicy.ModelPolicyBuilder builder = ModelPolicy.builder();
        Boolean allowed = section.getBoolean("allowed");
        if (allowed != null) {
            builder.allowed(allowed);
        }
        Boolean readable = section.getBoolean("readable");
        if (readable != null) {
            builder.readable(readable);
        }
        Boolean writable = section.getBoolean("writable");
        if (writable != null) {
            builder.writable(writable);
        }
        String defaultAction = section.getString("default_field_action");
        if (defaultAction != null) {
            builder.defaultFieldAction(FieldAction.fromValue(defaultAction));
        }

        if (section.has("fields")) {
            Object fieldsNode = section.raw("fields");
            YamlSection fields = YamlSection.of(section.child("fields"), fieldsNode);
            for (String field : fields.keys()) {
                builder.field(field, readField(fields.child(field), fields.raw(field)));
            }
            fields.finish();
        }

        YamlSection relations = section.getSection("relations");
        if (relations != null) {
            for (String relation : relations.keys()) {
                builder.relation(relation, readRelation(relations.getSectionOrEmpty(relation)));
            }
            relations.finish();
        }

        YamlSection rowPolicy = section.getSection("row_policy");
        if (rowPolicy != null) {
            builder.rowPolicy(readRowPolicy(rowPolicy));
        }
        YamlSection budget = section.getSection("budget");
        if (budget != null) {
            builder.budget(readBudget(budget, Budget.defaults()));
        }
        YamlSection writePolicy = section.getSection("write_policy");
        if (writePolicy != null) {
            builder.writePolicy(readWritePolicy(writePolicy));
        }

        List<String> aggregations = section.getStringList("allowed_aggregations");
        if (aggregations != null) {
            Set<AggregateOp> ops = EnumSet.noneOf(AggregateOp.class);
            for (String op : aggregations) {
                try {
                    ops.add(AggregateOp.fromValue(op));
                } catch (OrmGuardException e) {
                    throw new InvalidPolicyException(section.child("allowed_aggregations"), op,
                            "Unknown aggregation: " + op);
                }
            }
            builder.allowedAggregations(Set.copyOf(ops));
        }
        List<String> aggregatable = section.getStringList("aggregatable_fields");
        if (aggregatable != null) {
            builder.aggregatableFields(List.copyOf(aggregatable));
        }
        section.finish();
        return builder.build();
    }

    /**
     * 字段策略支持简写 "ssn: deny" 与完整映射两种形式
     */
    private static FieldPolicy readField(String path, Object node) {
        if (node instanceof String) {
            return FieldPolicy.of(FieldAction.fromValue((String) node));
        }
        YamlSection section = YamlSection.of(path, node);
        FieldPolicy.FieldPolicyBuilder builder = FieldPolicy.builder();
        String action = section.getString("action");
        if (action != null) {
            builder.action(FieldAction.fromValue(action));
        }
        builder.maskPattern(section.getString("mask_pattern"));
        builder.transform(section.getString("transform"));
        section.finish();
        return builder.build();
    }

    private static RelationPolicy readRelation(YamlSection section) {
        RelationPolicy.RelationPolicyBuilder builder = RelationPolicy.builder();
        Boolean allowed = section.getBoolean("allowed");
        if (allowed != null) {
            builder.allowed(allowed);
        }
        Integer maxDepth = section.getInt("max_depth");
        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        }
        List<String> allowedFields = section.getStringList("allowed_fields");
        if (allowedFields != null) {
            builder.allowedFields(List.copyOf(allowedFields));
        }
        section.finish();
        return builder.build();
    }

    private static RowPolicy readRowPolicy(YamlSection section) {
        RowPolicy.RowPolicyBuilder builder = RowPolicy.builder()
                .tenantScopeField(section.getString("tenant_scope_field"))
                .ownershipScopeField(section.getString("ownership_scope_field"))
                .softDeleteField(section.getString("soft_delete_field"));
        Boolean requireScope = section.getBoolean("require_scope");
        if (requireScope != null) {
            builder.requireScope(requireScope);
        }
        Boolean includeSoftDeleted = section.getBoolean("include_soft_deleted");
        if (includeSoftDeleted != null) {
            builder.includeSoftDeleted(includeSoftDeleted);
        }
        section.finish();
        return builder.build();
    }

    private static Budget readBudget(YamlSection section, Budget base) {
        Budget.BudgetBuilder builder = base.toBuilder();
        Integer value;
        if ((value = section.getInt("max_rows")) != null) {
            builder.maxRows(value);
        }
        if ((value = section.getInt("max_includes_depth")) != null) {
            builder.maxIncludesDepth(value);
        }
        if ((value = section.getInt("max_select_fields")) != null) {
            builder.maxSelectFields(value);
        }
        if ((value = section.getInt("statement_timeout_ms")) != null) {
            builder.statementTimeoutMs(value);
        }
        if ((value = section.getInt("max_complexity_score")) != null) {
            builder.maxComplexityScore(value);
        }
        if ((value = section.getInt("min_filters_for_broad_query")) != null) {
            builder.minFiltersForBroadQuery(value);
        }
        Boolean guard = section.getBoolean("broad_query_guard");
        if (guard != null) {
            builder.broadQueryGuard(guard);
        }
        section.finish();
        return builder.build();
    }

    private static WritePolicy readWritePolicy(YamlSection section) {
        WritePolicy.WritePolicyBuilder builder = WritePolicy.builder();
        Boolean flag;
        if ((flag = section.getBoolean("enabled")) != null) {
            builder.enabled(flag);
        }
        if ((flag = section.getBoolean("allow_create")) != null) {
            builder.allowCreate(flag);
        }
        if ((flag = section.getBoolean("allow_update")) != null) {
            builder.allowUpdate(flag);
        }
        if ((flag = section.getBoolean("allow_delete")) != null) {
            builder.allowDelete(flag);
        }
        if ((flag = section.getBoolean("allow_bulk")) != null) {
            builder.allowBulk(flag);
        }
        if ((flag = section.getBoolean("require_primary_key")) != null) {
            builder.requirePrimaryKey(flag);
        }
        if ((flag = section.getBoolean("soft_delete")) != null) {
            builder.softDelete(flag);
        }
        if ((flag = section.getBoolean("require_reason")) != null) {
            builder.requireReason(flag);
        }
        if ((flag = section.getBoolean("require_approval")) != null) {
            builder.requireApproval(flag);
        }
        Integer maxAffectedRows = section.getInt("max_affected_rows");
        if (maxAffectedRows != null) {
            builder.maxAffectedRows(maxAffectedRows);
        }
        List<String> readonly = section.getStringList("readonly_fields");
        if (readonly != null) {
            builder.readonlyFields(readonly);
        }
        section.finish();
        return builder.build();
    }

    private static PolicyProfile parseProfile(String profile) {
        try {
            return PolicyProfile.valueOf(profile.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidPolicyException("profile", profile, "Unknown profile: " + profile);
        }
    }
}
