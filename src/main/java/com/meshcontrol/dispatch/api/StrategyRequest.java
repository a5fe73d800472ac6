package com.meshcontrol.dispatch.api;

/**
 * Inbound JSON body for PUT /api/v1/mesh/strategy.
 *
 * @param strategy strategy name, e.g. "round_robin" or "least-connections"
 */
public record StrategyRequest(String strategy) {}
