package com.kiisha.ai.gateway.telemetry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estimated USD cost per 1k tokens by model. Forge models are included in the platform
 * and cost nothing; models missing from the table are charged at a conservative rate.
 */
public final class CostTable {

    public static final class ModelCost {
        private final double inputPer1k;
        private final double outputPer1k;

        public ModelCost(double inputPer1k, double outputPer1k) {
            this.inputPer1k = inputPer1k;
            this.outputPer1k = outputPer1k;
        }

        public double getInputPer1k() {
            return inputPer1k;
        }

        public double getOutputPer1k() {
            return outputPer1k;
        }
    }

    static final ModelCost UNKNOWN_MODEL_COST = new ModelCost(0.01, 0.03);

    private static final CostTable DEFAULT = new CostTable(defaultCosts());

    private final Map<String, ModelCost> costs;

    public CostTable(Map<String, ModelCost> costs) {
        this.costs = Collections.unmodifiableMap(new LinkedHashMap<>(costs));
    }

    public static CostTable defaults() {
        return DEFAULT;
    }

    private static Map<String, ModelCost> defaultCosts() {
        Map<String, ModelCost> costs = new LinkedHashMap<>();
        costs.put("gpt-4o", new ModelCost(0.005, 0.015));
        costs.put("gpt-4o-mini", new ModelCost(0.00015, 0.0006));
        costs.put("gpt-4-turbo", new ModelCost(0.01, 0.03));
        costs.put("gpt-4", new ModelCost(0.03, 0.06));
        costs.put("gpt-3.5-turbo", new ModelCost(0.0005, 0.0015));
        costs.put("claude-3-5-sonnet-20241022", new ModelCost(0.003, 0.015));
        costs.put("claude-3-5-haiku-20241022", new ModelCost(0.001, 0.005));
        costs.put("claude-3-opus-20240229", new ModelCost(0.015, 0.075));
        costs.put("forge-default", new ModelCost(0, 0));
        costs.put("forge-fast", new ModelCost(0, 0));
        return costs;
    }

    public ModelCost costFor(String model) {
        ModelCost cost = model != null ? costs.get(model) : null;
        return cost != null ? cost : UNKNOWN_MODEL_COST;
    }

    public double estimate(String model, int inputTokens, int outputTokens) {
        ModelCost cost = costFor(model);
        return (inputTokens / 1000.0) * cost.getInputPer1k() + (outputTokens / 1000.0) * cost.getOutputPer1k();
    }
}
