package com.hargapangan.market;

import com.hargapangan.domain.CommodityRef;
import com.hargapangan.domain.CommodityRepository;
import com.hargapangan.domain.CustomCommodityRef;
import com.hargapangan.domain.CustomCommodityRepository;
import com.hargapangan.domain.NationalCommodityRef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Looks up each {@link CommodityRef} variant in its own registry.
 */
@Component
@RequiredArgsConstructor
public class CommodityRefResolver {

    private final CommodityRepository commodityRepository;
    private final CustomCommodityRepository customCommodityRepository;

    public Optional<ResolvedCommodity> resolve(CommodityRef ref) {
        if (ref instanceof NationalCommodityRef national) {
            return commodityRepository.findById(national.commodityId())
                    .map(c -> new ResolvedCommodity(ref, c.getName(), c.getUnit(),
                            c.getCategory() != null ? c.getCategory().getCode() : null));
        }
        if (ref instanceof CustomCommodityRef custom) {
            return customCommodityRepository.findById(custom.customCommodityId())
                    .map(c -> new ResolvedCommodity(ref, c.getName(), c.getUnit(), c.getCategory()));
        }
        return Optional.empty();
    }

    /**
     * An id of unknown origin: the national registry is checked first, then custom commodities.
     */
    public Optional<ResolvedCommodity> resolveAny(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        Optional<ResolvedCommodity> national = resolve(new NationalCommodityRef(id));
        return national.isPresent() ? national : resolve(new CustomCommodityRef(id));
    }
}
