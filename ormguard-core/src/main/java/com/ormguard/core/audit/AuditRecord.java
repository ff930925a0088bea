package com.ormguard.core.audit;

import com.ormguard.api.dsl.AggregateRequest;
import com.ormguard.api.dsl.BulkUpdateRequest;
import com.ormguard.api.dsl.CreateRequest;
import com.ormguard.api.dsl.DeleteRequest;
import com.ormguard.api.dsl.FilterClause;
import com.ormguard.api.dsl.GetRequest;
import com.ormguard.api.dsl.IncludeClause;
import com.ormguard.api.dsl.OperationRequest;
import com.ormguard.api.dsl.QueryRequest;
import com.ormguard.api.dsl.UpdateRequest;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 单次策略评估的审计记录
 * <p>
 * inputs 是脱敏后的请求：过滤条件只保留字段与操作符，写入数据只保留键。
 * </p>
 */
@Value
@Builder
public class AuditRecord {

    String traceId;
    String requestId;
    String tenantId;
    String userId;
    String model;
    String operation;
    AuditOutcome outcome;

    /** 拒绝时的错误码 */
    String errorCode;
    String errorMessage;

    @Singular
    List<String> decisions;

    @Singular
    Map<String, Object> inputs;

    String policyVersion;

    long durationNanos;

    @Builder.Default
    Instant timestamp = Instant.now();

    /**
     * 请求脱敏：保留结构，不保留过滤值与写入值
     */
    public static Map<String, Object> sanitizeInputs(OperationRequest request) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("model", request.getModel());
        inputs.put("operation", request.getOperationType().getValue());
        switch (request.getOperationType()) {
            case QUERY: {
                QueryRequest q = (QueryRequest) request;
                inputs.put("select", q.getSelect());
                inputs.put("where", describe(q.getWhere()));
                inputs.put("order_by", q.getOrderBy().stream()
                        .map(o -> o.field() + " " + o.direction().name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toList()));
                inputs.put("take", q.getTake());
                inputs.put("include", relations(q.getInclude()));
                break;
            }
            case GET: {
                GetRequest g = (GetRequest) request;
                inputs.put("select", g.getSelect());
                inputs.put("include", relations(g.getInclude()));
                break;
            }
            case AGGREGATE: {
                AggregateRequest a = (AggregateRequest) request;
                inputs.put("aggregate", a.getOperation() == null ? null : a.getOperation().getValue());
                inputs.put("field", a.getField());
                inputs.put("where", describe(a.getWhere()));
                inputs.put("group_by", a.getGroupBy());
                break;
            }
            case CREATE: {
                CreateRequest c = (CreateRequest) request;
                inputs.put("data_keys", new ArrayList<>(c.getData().keySet()));
                inputs.put("reason", c.getReason());
                break;
            }
            case UPDATE: {
                UpdateRequest u = (UpdateRequest) request;
                inputs.put("data_keys", new ArrayList<>(u.getData().keySet()));
                inputs.put("reason", u.getReason());
                break;
            }
            case DELETE: {
                DeleteRequest d = (DeleteRequest) request;
                inputs.put("hard", d.isHard());
                inputs.put("reason", d.getReason());
                break;
            }
            case BULK_UPDATE: {
                BulkUpdateRequest b = (BulkUpdateRequest) request;
                inputs.put("id_count", b.getIds().size());
                inputs.put("data_keys", new ArrayList<>(b.getData().keySet()));
                inputs.put("reason", b.getReason());
                break;
            }
            default:
                break;
        }
        return inputs;
    }

    private static List<String> describe(List<FilterClause> filters) {
        return filters.stream().map(f -> f.field() + " " + f.op().getValue()).collect(Collectors.toList());
    }

    private static List<String> relations(List<IncludeClause> includes) {
        return includes.stream().map(IncludeClause::getRelation).collect(Collectors.toList());
    }
}
