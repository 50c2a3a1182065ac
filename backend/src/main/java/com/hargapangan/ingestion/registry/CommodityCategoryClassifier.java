package com.hargapangan.ingestion.registry;

import com.hargapangan.domain.CommodityCategory;

import java.util.List;
import java.util.Locale;

/**
 * Assigns a category from a commodity name. Rules are evaluated in order; the first rule with a
 * keyword contained in the lower-cased name wins. No match means {@link CommodityCategory#LAINNYA}.
 */
public final class CommodityCategoryClassifier {

    private record Rule(List<String> keywords, CommodityCategory category) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(List.of("beras", "gkp", "gkg"), CommodityCategory.BERAS),
            new Rule(List.of("cabai", "bawang"), CommodityCategory.BUMBU),
            new Rule(List.of("sapi", "ayam", "telur", "daging", "kerbau"), CommodityCategory.DAGING),
            new Rule(List.of("ikan", "tongkol", "kembung", "bandeng"), CommodityCategory.DAGING),
            new Rule(List.of("jagung", "kedelai"), CommodityCategory.SAYURAN),
            new Rule(List.of("gula", "garam", "minyak", "tepung"), CommodityCategory.LAINNYA)
    );

    private CommodityCategoryClassifier() {
    }

    public static CommodityCategory classify(String name) {
        if (name == null || name.isBlank()) {
            return CommodityCategory.LAINNYA;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (lower.contains(keyword)) {
                    return rule.category();
                }
            }
        }
        return CommodityCategory.LAINNYA;
    }
}
