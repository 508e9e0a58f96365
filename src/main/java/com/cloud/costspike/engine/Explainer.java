package com.cloud.costspike.engine;

import com.cloud.costspike.model.ExplanationSummary;
import com.cloud.costspike.model.ScoredRecord;
import com.cloud.costspike.model.ServiceCost;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rolls spike rows up into "which services, how much excess spend".
 */
public class Explainer {

    private final int topN;

    public Explainer(int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1, got " + topN);
        }
        this.topN = topN;
    }

    public ExplanationSummary explain(List<ScoredRecord> scored) {
        // Sums run in record order so totals are reproducible to the last bit
        Map<String, Double> costByService = new LinkedHashMap<>();
        double total = 0.0;
        for (ScoredRecord r : scored) {
            if (!r.isAnomaly()) continue;
            costByService.merge(r.getService(), r.getCost(), Double::sum);
            total += r.getCost();
        }

        if (costByService.isEmpty()) {
            return ExplanationSummary.empty();
        }

        List<ServiceCost> ranked = new ArrayList<>(costByService.size());
        costByService.forEach((service, cost) -> ranked.add(ServiceCost.builder()
                .service(service)
                .anomalousCost(cost)
                .build()));
        // List.sort is stable: equal sums stay in first-seen order
        ranked.sort(Comparator.comparingDouble(ServiceCost::getAnomalousCost).reversed());

        return ExplanationSummary.builder()
                .topServices(new ArrayList<>(ranked.subList(0, Math.min(topN, ranked.size()))))
                .totalAnomalousCost(total)
                .build();
    }
}
