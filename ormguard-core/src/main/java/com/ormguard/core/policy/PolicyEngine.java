package com.ormguard.core.policy;

import com.ormguard.api.context.RunContext;
import com.ormguard.api.cost.CostBreakdown;
import com.ormguard.api.decision.PolicyDecision;
import com.ormguard.api.dsl.AggregateOp;
import com.ormguard.api.dsl.AggregateRequest;
import com.ormguard.api.dsl.BulkUpdateRequest;
import com.ormguard.api.dsl.CreateRequest;
import com.ormguard.api.dsl.DeleteRequest;
import com.ormguard.api.dsl.FilterClause;
import com.ormguard.api.dsl.FilterOp;
import com.ormguard.api.dsl.GetRequest;
import com.ormguard.api.dsl.OperationRequest;
import com.ormguard.api.dsl.OperationType;
import com.ormguard.api.dsl.OrderClause;
import com.ormguard.api.dsl.QueryRequest;
import com.ormguard.api.dsl.UpdateRequest;
import com.ormguard.api.exception.FieldNotAllowedException;
import com.ormguard.api.exception.InvalidPolicyException;
import com.ormguard.api.exception.MaxAffectedRowsExceededException;
import com.ormguard.api.exception.QueryBudgetExceededException;
import com.ormguard.api.exception.ValidationException;
import com.ormguard.api.policy.Budget;
import com.ormguard.api.policy.FieldPolicy;
import com.ormguard.api.policy.ModelPolicy;
import com.ormguard.api.policy.Policy;
import com.ormguard.api.policy.RowPolicy;
import com.ormguard.api.policy.WritePolicy;
import com.ormguard.api.schema.SchemaMetadata;
import com.ormguard.core.cost.CostBudget;
import com.ormguard.core.cost.QueryCostEstimator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 策略引擎：每种操作一个入口，组合 {@link PolicyValidator} 生成统一的 {@link PolicyDecision}
 * <p>
 * 流程：模型访问 → 预算 → 字段 → 关系（读）→ 作用域注入 → 宽查询防护（查询）→ 遮盖规则。
 * 引擎从不访问存储，除了构造决策之外没有副作用。
 * </p>
 */
@Slf4j
public class PolicyEngine {

    private final Policy policy;
    private final SchemaMetadata schema;
    private final PolicyValidator validator;
    private final FieldTransformRegistry transforms;
    private final QueryCostEstimator costEstimator;
    private final CostBudget costBudget;

    public PolicyEngine(Policy policy, SchemaMetadata schema) {
        this(policy, schema, FieldTransformRegistry.empty());
    }

    public PolicyEngine(Policy policy, SchemaMetadata schema, FieldTransformRegistry transforms) {
        this(policy, schema, transforms, null, null);
    }

    /**
     * @param costEstimator 可选，与 costBudget 同时提供时启用成本闸门
     * @param costBudget    可选
     */
    public PolicyEngine(Policy policy, SchemaMetadata schema, FieldTransformRegistry transforms,
            QueryCostEstimator costEstimator, CostBudget costBudget) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.schema = schema == null ? SchemaMetadata.empty() : schema;
        this.transforms = transforms == null ? FieldTransformRegistry.empty() : transforms;
        this.costEstimator = costEstimator;
        this.costBudget = costBudget;
        policy.validate();
        checkTransforms();
        this.validator = new PolicyValidator(policy, this.schema);
    }

    /**
     * 按操作类型分派
     */
    public PolicyDecision evaluate(OperationRequest request, RunContext ctx) {
        switch (request.getOperationType()) {
            case QUERY:
                return validateQuery((QueryRequest) request, ctx);
            case GET:
                return validateGet((GetRequest) request, ctx);
            case AGGREGATE:
                return validateAggregate((AggregateRequest) request, ctx);
            case CREATE:
                return validateCreate((CreateRequest) request, ctx);
            case UPDATE:
                return validateUpdate((UpdateRequest) request, ctx);
            case DELETE:
                return validateDelete((DeleteRequest) request, ctx);
            case BULK_UPDATE:
                return validateBulkUpdate((BulkUpdateRequest) request, ctx);
            default:
                throw new ValidationException("Unsupported operation: " + request.getOperationType(), "operation");
        }
    }

    // ==================== 读操作 ====================

    public PolicyDecision validateQuery(QueryRequest request, RunContext ctx) {
        String model = request.getModel();
        PolicyDecision.PolicyDecisionBuilder decision = newDecision(model, OperationType.QUERY);

        // 1. 模型访问
        ModelPolicy modelPolicy = validator.validateModelAccess(model, true, false);
        decision.decision("Model '" + model + "' access validated");

        // 2. 预算
        Budget budget = policy.getBudget(model);
        int score = validator.validateBudget(request, budget, modelPolicy);
        decision.budget(budget)
                .statementTimeoutMs(budget.getStatementTimeoutMs())
                .effectiveLimit(budget.effectiveLimit(request.getTake()))
                .decision("Budget validated: max_rows=" + budget.getMaxRows() + ", complexity=" + score);

        // 3. 字段
        List<String> allFields = schema.fieldNames(model);
        List<String> allowedFields = resolveSelect(request.getSelect(), model, modelPolicy, allFields);
        decision.allowedFields(allowedFields)
                .decision("Selected " + allowedFields.size() + " fields");

        Set<String> referenced = new LinkedHashSet<>();
        request.getWhere().forEach(f -> referenced.add(f.field()));
        request.getOrderBy().stream().map(OrderClause::field).forEach(referenced::add);
        validator.validateFilterFields(referenced, model, modelPolicy, allFields);

        // 4. 关系
        if (!request.getInclude().isEmpty()) {
            validator.validateIncludes(request.getInclude(), model, modelPolicy, budget);
            decision.decision("Validated " + request.getInclude().size() + " includes");
        }

        // 5. 作用域
        List<FilterClause> scopeFilters = injectScope(decision, model, ctx);

        // 6. 宽查询防护
        if (budget.isBroadQueryGuard()) {
            validator.validateQueryBreadth(request, budget, scopeFilters);
            decision.decision("Broad query guard passed");
        }

        // 7. 遮盖规则
        collectRedactions(decision, modelPolicy, allowedFields);

        // 8. 成本闸门
        if (isCostGateEnabled()) {
            CostBreakdown cost = costEstimator.estimate(request);
            enforceCostBudget(cost);
            decision.costEstimate(cost)
                    .decision(String.format("Cost estimate %.1f within budget", cost.getTotal()));
        }
        return finish(decision);
    }

    public PolicyDecision validateGet(GetRequest request, RunContext ctx) {
        String model = request.getModel();
        PolicyDecision.PolicyDecisionBuilder decision = newDecision(model, OperationType.GET);

        ModelPolicy modelPolicy = validator.validateModelAccess(model, true, false);
        decision.decision("Model '" + model + "' access validated");

        if (request.getId() == null) {
            throw new ValidationException("An id is required to get a " + model, "id");
        }

        Budget budget = policy.getBudget(model);
        validator.validateBudget(request, budget);
        decision.budget(budget)
                .statementTimeoutMs(budget.getStatementTimeoutMs())
                .effectiveLimit(1);

        List<String> allFields = schema.fieldNames(model);
        List<String> allowedFields = resolveSelect(request.getSelect(), model, modelPolicy, allFields);
        decision.allowedFields(allowedFields)
                .decision("Selected " + allowedFields.size() + " fields");

        if (!request.getInclude().isEmpty()) {
            validator.validateIncludes(request.getInclude(), model, modelPolicy, budget);
            decision.decision("Validated " + request.getInclude().size() + " includes");
        }

        injectScope(decision, model, ctx);
        collectRedactions(decision, modelPolicy, allowedFields);
        return finish(decision);
    }

    public PolicyDecision validateAggregate(AggregateRequest request, RunContext ctx) {
        String model = request.getModel();
        PolicyDecision.PolicyDecisionBuilder decision = newDecision(model, OperationType.AGGREGATE);

        ModelPolicy modelPolicy = validator.validateModelAccess(model, true, false);
        decision.decision("Model '" + model + "' access validated");

        AggregateOp op = request.getOperation();
        if (op == null || !modelPolicy.isAggregationAllowed(op)) {
            List<String> allowedOps = modelPolicy.getAllowedAggregations().stream()
                    .sorted()
                    .map(AggregateOp::getValue)
                    .collect(Collectors.toList());
            throw new FieldNotAllowedException("aggregation:" + (op == null ? null : op.getValue()), model,
                    allowedOps);
        }

        List<String> allFields = schema.fieldNames(model);
        String field = request.getField();
        if (op != AggregateOp.COUNT && (field == null || field.isBlank())) {
            throw new ValidationException("Field is required for " + op.getValue() + " aggregation", "field");
        }
        if (field != null) {
            if (!allFields.contains(field)) {
                throw new FieldNotAllowedException(field, model, allFields);
            }
            // 可聚合字段清单不约束 COUNT
            List<String> aggregatable = modelPolicy.getAggregatableFields();
            if (op != AggregateOp.COUNT && aggregatable != null && !aggregatable.contains(field)) {
                throw new FieldNotAllowedException(field, model, aggregatable);
            }
            if (validator.resolveFieldPolicy(modelPolicy, field).isDenied()) {
                throw new FieldNotAllowedException(field, model);
            }
        }
        decision.decision("Aggregation '" + op.getValue() + "' validated");

        Set<String> referenced = new LinkedHashSet<>();
        request.getWhere().forEach(f -> referenced.add(f.field()));
        referenced.addAll(request.getGroupBy());
        validator.validateFilterFields(referenced, model, modelPolicy, allFields);

        Budget budget = policy.getBudget(model);
        decision.budget(budget).statementTimeoutMs(budget.getStatementTimeoutMs());
        Set<String> resultFields = new LinkedHashSet<>();
        if (field != null) {
            resultFields.add(field);
        }
        resultFields.addAll(request.getGroupBy());
        List<String> allowedFields = new ArrayList<>(resultFields);
        decision.allowedFields(allowedFields);
        collectRedactions(decision, modelPolicy, allowedFields);

        injectScope(decision, model, ctx);

        if (isCostGateEnabled()) {
            CostBreakdown cost = costEstimator.estimateAggregate(request);
            enforceCostBudget(cost);
            decision.costEstimate(cost);
        }
        return finish(decision);
    }

    // ==================== 写操作 ====================

    public PolicyDecision validateCreate(CreateRequest request, RunContext ctx) {
        String model = request.getModel();
        PolicyDecision.PolicyDecisionBuilder decision = newDecision(model, OperationType.CREATE);

        ModelPolicy modelPolicy = validator.validateModelAccess(model, false, true);
        validator.validateWriteAccess(OperationType.CREATE, modelPolicy, request);
        decision.decision("Write access validated for create on '" + model + "'");

        Budget budget = policy.getBudget(model);
        decision.budget(budget).statementTimeoutMs(budget.getStatementTimeoutMs());

        if (request.getData().isEmpty()) {
            throw new ValidationException("Create data cannot be empty", "data");
        }
        validator.validateWriteData(request.getData().keySet(), model, modelPolicy);

        List<FilterClause> scopeFilters = injectScope(decision, model, ctx);
        Map<String, Object> payload = new LinkedHashMap<>(request.getData());
        for (FilterClause scope : scopeFilters) {
            if (scope.op() != FilterOp.EQ) {
                continue;
            }
            Object supplied = payload.get(scope.field());
            if (supplied != null && !Objects.equals(String.valueOf(supplied), String.valueOf(scope.value()))) {
                throw new ValidationException("Field '" + scope.field() + "' must match the caller scope",
                        scope.field());
            }
            payload.put(scope.field(), scope.value());
        }
        decision.writeData(payload)
                .decision("Merged " + scopeFilters.stream().filter(f -> f.op() == FilterOp.EQ).count()
                        + " scope values into payload");

        applyReturnFields(decision, request.getReturnFields(), model, modelPolicy);
        return finish(decision);
    }

    public PolicyDecision validateUpdate(UpdateRequest request, RunContext ctx) {
        String model = request.getModel();
        PolicyDecision.PolicyDecisionBuilder decision = newDecision(model, OperationType.UPDATE);

        ModelPolicy modelPolicy = validator.validateModelAccess(model, false, true);
        validator.validateWriteAccess(OperationType.UPDATE, modelPolicy, request);
        decision.decision("Write access validated for update on '" + model + "'");

        requireId(modelPolicy.getWritePolicy(), request.getId(), model);
        Budget budget = policy.getBudget(model);
        decision.budget(budget).statementTimeoutMs(budget.getStatementTimeoutMs()).effectiveLimit(1);

        validateUpdateData(request.getData(), model, modelPolicy);
        injectScope(decision, model, ctx);
        applyReturnFields(decision, request.getReturnFields(), model, modelPolicy);
        return finish(decision);
    }

    public PolicyDecision validateDelete(DeleteRequest request, RunContext ctx) {
        String model = request.getModel();
        PolicyDecision.PolicyDecisionBuilder decision = newDecision(model, OperationType.DELETE);

        ModelPolicy modelPolicy = validator.validateModelAccess(model, false, true);
        validator.validateWriteAccess(OperationType.DELETE, modelPolicy, request);
        decision.decision("Write access validated for delete on '" + model + "'");

        WritePolicy writePolicy = modelPolicy.getWritePolicy();
        requireId(writePolicy, request.getId(), model);
        if (request.isHard() && writePolicy.isSoftDelete()) {
            throw new ValidationException("Hard delete is not allowed on " + model + "; soft delete is required",
                    "hard");
        }

        Budget budget = policy.getBudget(model);
        decision.budget(budget).statementTimeoutMs(budget.getStatementTimeoutMs()).effectiveLimit(1);

        RowPolicy rowPolicy = policy.getRowPolicy(model);
        boolean soft = !request.isHard() && writePolicy.isSoftDelete() && rowPolicy.getSoftDeleteField() != null;
        decision.softDelete(soft)
                .decision(soft ? "Soft delete via '" + rowPolicy.getSoftDeleteField() + "'" : "Hard delete");

        injectScope(decision, model, ctx);
        return finish(decision);
    }

    /**
     * 批量更新：id 数量先于任何字段校验检查
     */
    public PolicyDecision validateBulkUpdate(BulkUpdateRequest request, RunContext ctx) {
        String model = request.getModel();
        PolicyDecision.PolicyDecisionBuilder decision = newDecision(model, OperationType.BULK_UPDATE);

        ModelPolicy modelPolicy = validator.validateModelAccess(model, false, true);
        validator.validateWriteAccess(OperationType.BULK_UPDATE, modelPolicy, request);

        WritePolicy writePolicy = modelPolicy.getWritePolicy();
        int affected = request.getIds().size();
        if (affected > writePolicy.getMaxAffectedRows()) {
            throw new MaxAffectedRowsExceededException(OperationType.BULK_UPDATE.getValue(),
                    writePolicy.getMaxAffectedRows(), affected);
        }
        if (affected == 0) {
            throw new ValidationException("Bulk update requires at least one id", "ids");
        }
        decision.decision("Bulk update of " + affected + " rows within max_affected_rows="
                + writePolicy.getMaxAffectedRows());

        Budget budget = policy.getBudget(model);
        decision.budget(budget).statementTimeoutMs(budget.getStatementTimeoutMs()).effectiveLimit(affected);

        validateUpdateData(request.getData(), model, modelPolicy);
        injectScope(decision, model, ctx);
        return finish(decision);
    }

    // ==================== 内部步骤 ====================

    private PolicyDecision.PolicyDecisionBuilder newDecision(String model, OperationType operation) {
        return PolicyDecision.builder().model(model).operation(operation);
    }

    private PolicyDecision finish(PolicyDecision.PolicyDecisionBuilder decision) {
        PolicyDecision result = decision.build();
        if (log.isDebugEnabled()) {
            log.debug("[Policy] {} {} allowed: fields={} filters={}", result.getOperation().getValue(),
                    result.getModel(), result.getAllowedFields().size(), result.getInjectedFilters().size());
        }
        return result;
    }

    private List<String> resolveSelect(List<String> select, String model, ModelPolicy modelPolicy,
            List<String> allFields) {
        if (select.isEmpty()) {
            return validator.allowedFieldsOf(modelPolicy, allFields);
        }
        return validator.validateFields(select, model, modelPolicy, allFields);
    }

    private List<FilterClause> injectScope(PolicyDecision.PolicyDecisionBuilder decision, String model,
            RunContext ctx) {
        List<FilterClause> scopeFilters = validator.validateAndGetScopeFilters(model, policy.getRowPolicy(model), ctx);
        decision.injectedFilters(scopeFilters);
        if (!scopeFilters.isEmpty()) {
            decision.decision("Injected " + scopeFilters.size() + " scope filters");
        }
        return scopeFilters;
    }

    private void collectRedactions(PolicyDecision.PolicyDecisionBuilder decision, ModelPolicy modelPolicy,
            List<String> fields) {
        int count = 0;
        for (String field : fields) {
            FieldPolicy fieldPolicy = validator.resolveFieldPolicy(modelPolicy, field);
            switch (fieldPolicy.getAction()) {
                case MASK:
                case HASH:
                    decision.redactionRule(field, fieldPolicy.getAction());
                    count++;
                    break;
                case ALLOW:
                case DENY:
                default:
                    break;
            }
            if (fieldPolicy.hasTransform()) {
                decision.transform(field, fieldPolicy.getTransform());
            }
        }
        if (count > 0) {
            decision.decision("Redaction rules for " + count + " fields");
        }
    }

    private void applyReturnFields(PolicyDecision.PolicyDecisionBuilder decision, List<String> returnFields,
            String model, ModelPolicy modelPolicy) {
        List<String> allFields = schema.fieldNames(model);
        List<String> allowed = resolveSelect(returnFields, model, modelPolicy, allFields);
        decision.allowedFields(allowed);
        collectRedactions(decision, modelPolicy, allowed);
    }

    private void validateUpdateData(Map<String, Object> data, String model, ModelPolicy modelPolicy) {
        if (data.isEmpty()) {
            throw new ValidationException("Update data cannot be empty", "data");
        }
        validator.validateWriteData(data.keySet(), model, modelPolicy);
        RowPolicy rowPolicy = policy.getRowPolicy(model);
        for (String scopeField : scopeFields(rowPolicy)) {
            if (data.containsKey(scopeField)) {
                throw new ValidationException("Scope field '" + scopeField + "' cannot be updated", scopeField);
            }
        }
    }

    private static List<String> scopeFields(RowPolicy rowPolicy) {
        List<String> fields = new ArrayList<>(2);
        if (rowPolicy.hasTenantScope()) {
            fields.add(rowPolicy.getTenantScopeField());
        }
        if (rowPolicy.hasOwnershipScope()) {
            fields.add(rowPolicy.getOwnershipScopeField());
        }
        return fields;
    }

    private static void requireId(WritePolicy writePolicy, Object id, String model) {
        if (writePolicy.isRequirePrimaryKey() && id == null) {
            throw new ValidationException("A primary key is required to modify " + model, "id");
        }
    }

    private boolean isCostGateEnabled() {
        return costEstimator != null && costBudget != null;
    }

    private void enforceCostBudget(CostBreakdown cost) {
        costBudget.firstExceeded(cost).ifPresent(exceeded -> {
            log.debug("[Cost] Budget exceeded: {}", exceeded);
            throw new QueryBudgetExceededException(exceeded.category(), exceeded.limit(), exceeded.actual());
        });
    }

    private void checkTransforms() {
        policy.getModels().forEach((model, modelPolicy) -> modelPolicy.getFields().forEach((field, fp) -> {
            if (fp.hasTransform() && !transforms.contains(fp.getTransform())) {
                throw new InvalidPolicyException("models." + model + ".fields." + field + ".transform",
                        fp.getTransform(), "Unknown field transform: " + fp.getTransform());
            }
        }));
    }

    public Policy getPolicy() {
        return policy;
    }

    public SchemaMetadata getSchema() {
        return schema;
    }

    public PolicyValidator getValidator() {
        return validator;
    }
}
