package com.ormguard.core.policy;

import com.ormguard.api.context.RunContext;
import com.ormguard.api.dsl.FilterClause;
import com.ormguard.api.dsl.GetRequest;
import com.ormguard.api.dsl.IncludeClause;
import com.ormguard.api.dsl.OperationType;
import com.ormguard.api.dsl.QueryRequest;
import com.ormguard.api.dsl.WriteRequest;
import com.ormguard.api.exception.FieldNotAllowedException;
import com.ormguard.api.exception.ModelNotAllowedException;
import com.ormguard.api.exception.QueryBudgetExceededException;
import com.ormguard.api.exception.QueryTooBroadException;
import com.ormguard.api.exception.RelationNotAllowedException;
import com.ormguard.api.exception.TenantScopeRequiredException;
import com.ormguard.api.exception.ValidationException;
import com.ormguard.api.exception.WriteApprovalRequiredException;
import com.ormguard.api.exception.WriteDisabledException;
import com.ormguard.api.policy.Budget;
import com.ormguard.api.policy.FieldAction;
import com.ormguard.api.policy.FieldPolicy;
import com.ormguard.api.policy.ModelPolicy;
import com.ormguard.api.policy.Policy;
import com.ormguard.api.policy.RelationPolicy;
import com.ormguard.api.policy.RowPolicy;
import com.ormguard.api.policy.WritePolicy;
import com.ormguard.api.schema.ModelMetadata;
import com.ormguard.api.schema.RelationMetadata;
import com.ormguard.api.schema.SchemaMetadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 策略校验器
 * <p>
 * 所有方法都是 (policy, schema, 入参) 的纯函数：要么返回派生结果，要么抛出类型化异常。
 * 实例不可变，可被任意多个线程共享。
 * </p>
 */
public class PolicyValidator {

    private final Policy policy;
    private final SchemaMetadata schema;
    private final ComplexityScorer scorer;
    private final GlobMatcher denyMatcher;
    private final GlobMatcher maskMatcher;

    public PolicyValidator(Policy policy, SchemaMetadata schema) {
        this(policy, schema, new ComplexityScorer());
    }

    public PolicyValidator(Policy policy, SchemaMetadata schema, ComplexityScorer scorer) {
        this.policy = policy;
        this.schema = schema == null ? SchemaMetadata.empty() : schema;
        this.scorer = scorer;
        this.denyMatcher = new GlobMatcher(policy.getGlobalDenyPatterns());
        this.maskMatcher = new GlobMatcher(policy.getGlobalMaskPatterns());
    }

    // ==================== 模型与字段 ====================

    /**
     * 校验模型是否可访问，并返回其策略
     *
     * @param readable 是否要求可读
     * @param writable 是否要求可写
     */
    public ModelPolicy validateModelAccess(String model, boolean readable, boolean writable) {
        ModelPolicy modelPolicy = policy.getModelPolicy(model);
        if (modelPolicy == null || !modelPolicy.isAllowed()) {
            throw new ModelNotAllowedException(model, policy.listAllowedModels());
        }
        if (readable && !modelPolicy.isReadable()) {
            throw new ModelNotAllowedException(model, policy.listReadableModels());
        }
        if (writable && !modelPolicy.isWritable()) {
            throw new ModelNotAllowedException(model, policy.listWritableModels());
        }
        return modelPolicy;
    }

    /**
     * 解析字段的生效策略：显式字段策略 → 全局拒绝 glob → 全局遮盖 glob → 模型默认动作
     */
    public FieldPolicy resolveFieldPolicy(ModelPolicy modelPolicy, String field) {
        if (modelPolicy.hasExplicitFieldPolicy(field)) {
            return modelPolicy.getFieldPolicy(field);
        }
        if (denyMatcher.matches(field)) {
            return FieldPolicy.DENY;
        }
        if (maskMatcher.matches(field)) {
            return FieldPolicy.MASK;
        }
        return FieldPolicy.of(modelPolicy.getDefaultFieldAction());
    }

    /**
     * Schema 字段中未被拒绝的部分，保持 Schema 顺序
     */
    public List<String> allowedFieldsOf(ModelPolicy modelPolicy, List<String> allFields) {
        return allFields.stream()
                .filter(f -> !resolveFieldPolicy(modelPolicy, f).isDenied())
                .collect(Collectors.toList());
    }

    /**
     * 校验请求字段，返回允许的字段（保持调用方顺序）
     * <p>
     * MASK / HASH 字段允许选择，遮盖决策由引擎记录在 redactionRules 中。
     * </p>
     */
    public List<String> validateFields(List<String> requested, String model, ModelPolicy modelPolicy,
            List<String> allFields) {
        List<String> allowed = new ArrayList<>(requested.size());
        for (String field : requested) {
            if (!allFields.contains(field)) {
                throw new FieldNotAllowedException(field, model, allFields);
            }
            if (resolveFieldPolicy(modelPolicy, field).isDenied()) {
                throw new FieldNotAllowedException(field, model, allowedFieldsOf(modelPolicy, allFields));
            }
            allowed.add(field);
        }
        return allowed;
    }

    /**
     * 过滤、排序与分组引用的字段必须存在且未被拒绝
     */
    public void validateFilterFields(Collection<String> fields, String model, ModelPolicy modelPolicy,
            List<String> allFields) {
        for (String field : fields) {
            if (!allFields.contains(field) || resolveFieldPolicy(modelPolicy, field).isDenied()) {
                throw new FieldNotAllowedException(field, model, allowedFieldsOf(modelPolicy, allFields));
            }
        }
    }

    // ==================== 关系 ====================

    public void validateIncludes(List<IncludeClause> includes, String model, ModelPolicy modelPolicy,
            Budget budget) {
        if (includes.size() > budget.getMaxIncludesDepth()) {
            throw new QueryBudgetExceededException("includes_depth", budget.getMaxIncludesDepth(),
                    includes.size());
        }

        Optional<ModelMetadata> schemaModel = schema.getModel(model);
        List<String> available = schemaModel
                .map(m -> m.getRelations().stream().map(RelationMetadata::getName).collect(Collectors.toList()))
                .orElse(List.of());

        for (IncludeClause include : includes) {
            String relation = include.getRelation();
            if (schemaModel.isPresent() && !available.contains(relation)) {
                throw new RelationNotAllowedException(relation, model, available);
            }

            RelationPolicy relationPolicy = modelPolicy.getRelationPolicy(relation);
            if (relationPolicy == null || !relationPolicy.isExpandable()) {
                List<String> expandable = modelPolicy.listExpandableRelations();
                throw new RelationNotAllowedException(relation, model,
                        expandable.isEmpty() ? available : expandable);
            }

            List<String> relationFields = relationPolicy.getAllowedFields();
            if (relationFields != null) {
                String target = schemaModel.flatMap(m -> m.getRelation(relation))
                        .map(RelationMetadata::getTargetModel)
                        .orElse(relation);
                for (String field : include.getSelect()) {
                    if (!relationFields.contains(field)) {
                        throw new FieldNotAllowedException(field, target, relationFields);
                    }
                }
            }
        }
    }

    // ==================== 行级作用域 ====================

    /**
     * 校验作用域要求，并返回需注入的过滤条件
     * <p>
     * 顺序固定：租户 → 归属 → 软删除。前置条件满足时无条件注入，不与用户条件去重。
     * </p>
     */
    public List<FilterClause> validateAndGetScopeFilters(String model, RowPolicy rowPolicy, RunContext ctx) {
        List<FilterClause> filters = new ArrayList<>(3);
        String tenantId = ctx == null ? null : ctx.getTenantId();
        String userId = ctx == null ? null : ctx.getUserId();

        if (rowPolicy.hasTenantScope()) {
            boolean hasTenant = tenantId != null && !tenantId.isBlank();
            if (!hasTenant && policy.isRequireTenantScope() && rowPolicy.isRequireScope()) {
                throw new TenantScopeRequiredException(model, rowPolicy.getTenantScopeField());
            }
            if (hasTenant) {
                filters.add(FilterClause.eq(rowPolicy.getTenantScopeField(), tenantId));
            }
        }

        if (rowPolicy.hasOwnershipScope() && userId != null && !userId.isBlank()) {
            filters.add(FilterClause.eq(rowPolicy.getOwnershipScopeField(), userId));
        }

        if (rowPolicy.excludesSoftDeleted()) {
            filters.add(FilterClause.isNull(rowPolicy.getSoftDeleteField()));
        }
        return filters;
    }

    // ==================== 预算 ====================

    /**
     * 校验查询的结构预算，返回复杂度评分
     */
    public int validateBudget(QueryRequest request, Budget budget, ModelPolicy modelPolicy) {
        if (request.getTake() < 1) {
            throw new ValidationException("Take must be at least 1, got " + request.getTake(), "take");
        }
        if (request.getTake() > budget.getMaxRows()) {
            throw new QueryBudgetExceededException("max_rows", budget.getMaxRows(), request.getTake());
        }
        checkSelectAndIncludes(request.getSelect().size(), request.getInclude().size(), budget);

        int score = scorer.score(request);
        if (score > budget.getMaxComplexityScore()) {
            throw new QueryBudgetExceededException("complexity_score", budget.getMaxComplexityScore(), score);
        }
        return score;
    }

    public void validateBudget(GetRequest request, Budget budget) {
        checkSelectAndIncludes(request.getSelect().size(), request.getInclude().size(), budget);
    }

    private static void checkSelectAndIncludes(int selectCount, int includeCount, Budget budget) {
        if (selectCount > budget.getMaxSelectFields()) {
            throw new QueryBudgetExceededException("select_fields", budget.getMaxSelectFields(), selectCount);
        }
        if (includeCount > budget.getMaxIncludesDepth()) {
            throw new QueryBudgetExceededException("includes_depth", budget.getMaxIncludesDepth(), includeCount);
        }
    }

    /**
     * 宽查询防护：注入条件与用户条件合计不少于下限
     */
    public void validateQueryBreadth(QueryRequest request, Budget budget, List<FilterClause> scopeFilters) {
        if (!budget.isBroadQueryGuard()) {
            return;
        }
        int total = scopeFilters.size() + request.getWhere().size();
        if (total < budget.getMinFiltersForBroadQuery()) {
            throw new QueryTooBroadException(request.getModel(), budget.getMinFiltersForBroadQuery(), total);
        }
    }

    // ==================== 写入 ====================

    /**
     * 校验写开关、原因与审批
     */
    public void validateWriteAccess(OperationType operation, ModelPolicy modelPolicy, WriteRequest request) {
        String model = request.getModel();
        String op = operation.getValue();
        WritePolicy writePolicy = modelPolicy.getWritePolicy();

        if (!policy.isWritesEnabled() || writePolicy == null || !writePolicy.isEnabled()) {
            throw new WriteDisabledException(op, model);
        }
        if (!isOperationAllowed(operation, writePolicy)) {
            throw new WriteDisabledException(op, model);
        }
        if (writePolicy.isRequireReason() && (request.getReason() == null || request.getReason().isBlank())) {
            throw new ValidationException("A reason is required for " + op + " on " + model, "reason");
        }
        if (writePolicy.isRequireApproval()
                && (request.getApprovalId() == null || request.getApprovalId().isBlank())) {
            throw new WriteApprovalRequiredException(op, model, null);
        }
    }

    private static boolean isOperationAllowed(OperationType operation, WritePolicy writePolicy) {
        switch (operation) {
            case CREATE:
                return writePolicy.isAllowCreate();
            case UPDATE:
                return writePolicy.isAllowUpdate();
            case DELETE:
                return writePolicy.isAllowDelete();
            case BULK_UPDATE:
                return writePolicy.isAllowUpdate() && writePolicy.isAllowBulk();
            default:
                return false;
        }
    }

    /**
     * 写入数据的键：只读或被拒绝的字段不可写
     */
    public void validateWriteData(Collection<String> keys, String model, ModelPolicy modelPolicy) {
        WritePolicy writePolicy = modelPolicy.getWritePolicy();
        for (String key : keys) {
            if (writePolicy != null && writePolicy.isReadonly(key)) {
                throw new FieldNotAllowedException(key, model);
            }
            if (resolveFieldPolicy(modelPolicy, key).getAction() == FieldAction.DENY) {
                throw new FieldNotAllowedException(key, model);
            }
        }
    }

    public Policy getPolicy() {
        return policy;
    }

    public SchemaMetadata getSchema() {
        return schema;
    }
}
