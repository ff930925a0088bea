package com.ormguard.core.runtime;

import com.ormguard.api.policy.Policy;
import com.ormguard.core.policy.PolicyEngine;

import java.time.Instant;

/**
 * 一次发布的策略及其引擎
 *
 * @param revision 单调递增的发布序号
 */
public record PolicySnapshot(Policy policy, PolicyEngine engine, long revision, Instant publishedAt) {
}
