package com.hargapangan.comparison;

import com.hargapangan.domain.Commodity;
import com.hargapangan.domain.CommodityRepository;
import com.hargapangan.domain.PricePoint;
import com.hargapangan.domain.PricePointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CSV export of ledger rows in a date range, newest date first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceExportService {

    static final String[] HEADER = {"Date", "Commodity", "Category", "Unit", "Price", "Source", "Is Override"};

    private final PricePointRepository pricePointRepository;
    private final CommodityRepository commodityRepository;

    /**
     * @throws PriceQueryException INVALID_RANGE when from is after to
     */
    public String exportCsv(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new PriceQueryException(PriceComparisonService.INVALID_RANGE, "from must not be after to");
        }
        List<PricePoint> rows = pricePointRepository.findByDateBetweenOrderByDateDescCommodityIdAsc(from, to);
        Set<String> ids = rows.stream().map(PricePoint::getCommodityId).collect(Collectors.toCollection(HashSet::new));
        Map<String, Commodity> commodities = commodityRepository.findByIdIn(ids).stream()
                .collect(Collectors.toMap(Commodity::getId, Function.identity(), (a, b) -> a));

        StringWriter out = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADER).build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (PricePoint p : rows) {
                Commodity c = commodities.get(p.getCommodityId());
                printer.printRecord(
                        p.getDate(),
                        c != null ? c.getName() : "",
                        c != null && c.getCategory() != null ? c.getCategory().getCode() : "",
                        c != null ? c.getUnit() : "",
                        p.getPrice() != null ? p.getPrice().toPlainString() : "",
                        p.getSource() != null ? p.getSource().getCode() : "",
                        Boolean.toString(p.isOverride()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("CSV export failed", e);
        }
        log.info("Exported {} price rows for {}..{}", rows.size(), from, to);
        return out.toString();
    }
}
