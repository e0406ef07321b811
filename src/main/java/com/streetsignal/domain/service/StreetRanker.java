package com.streetsignal.domain.service;

import com.streetsignal.domain.model.Attribution;
import com.streetsignal.domain.model.StreetCount;
import com.streetsignal.domain.model.StreetRanking;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts attributed POIs per street name and orders the streets by count
 * descending, then by name ascending.
 */
@Service
public class StreetRanker {

    static final Comparator<StreetCount> RANKING_ORDER = Comparator
        .comparingInt(StreetCount::getCount).reversed()
        .thenComparing(StreetCount::getName);

    public StreetRanking rank(List<Attribution> attributions, int topN) {
        if (topN <= 0) {
            throw new IllegalArgumentException("topN must be positive");
        }

        Map<String, Integer> counts = new HashMap<>();
        for (Attribution attribution : attributions) {
            if (attribution.isAttributed()) {
                counts.merge(attribution.getStreetName(), 1, Integer::sum);
            }
        }

        List<StreetCount> allStreets = counts.entrySet().stream()
            .map(entry -> new StreetCount(entry.getKey(), entry.getValue()))
            .sorted(RANKING_ORDER)
            .toList();
        List<StreetCount> topStreets = allStreets.subList(0, Math.min(topN, allStreets.size()));

        return new StreetRanking(topStreets, allStreets, attributions.size());
    }
}
