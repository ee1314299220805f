package com.tradejournal.reconstruction;

import com.tradejournal.broker.BrokerDetector;
import com.tradejournal.broker.normalizer.LegNormalizationService;
import com.tradejournal.broker.normalizer.LegNormalizationService.NormalizedBatch;
import com.tradejournal.config.ReconstructionConfig;
import com.tradejournal.domain.enums.BrokerKind;
import com.tradejournal.domain.enums.StrategyType;
import com.tradejournal.domain.model.Leg;
import com.tradejournal.domain.model.OrderGroup;
import com.tradejournal.domain.model.ReconstructionResult;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.exception.UnsupportedBrokerFormatException;
import com.tradejournal.reconstruction.OrderLinkedReconciler.GroupActivity;
import com.tradejournal.reconstruction.OrderLinkedReconciler.Reconciliation;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one broker export through the whole pipeline:
 * normalize, sort, group and classify, match closes, aggregate.
 *
 * <p>Robinhood closes are independent rows, so they go through the FIFO {@link PositionLedger}
 * and produce one trade per matched lot portion. Tastytrade links legs by order number and
 * produces one trade per opening order via the {@link OrderLinkedReconciler}.
 *
 * <p>Stateless: every call works on its own legs, queues and registries.
 */
@Service
public class TradeReconstructionService {

    private static final Logger log = LoggerFactory.getLogger(TradeReconstructionService.class);

    /**
     * Timestamp order only. {@link List#sort} is stable, so legs sharing a timestamp keep their
     * export order (Robinhood dates have no time of day; row order is the intra-day sequence).
     */
    static final Comparator<Leg> CHRONOLOGICAL = Comparator.comparing(Leg::getTimestamp);

    private final BrokerDetector brokerDetector;
    private final LegNormalizationService legNormalizationService;
    private final OrderGroupingService orderGroupingService;
    private final PositionLedger positionLedger;
    private final OrderLinkedReconciler orderLinkedReconciler;
    private final TradeAggregator tradeAggregator;
    private final ReconstructionConfig reconstructionConfig;

    public TradeReconstructionService(
            BrokerDetector brokerDetector,
            LegNormalizationService legNormalizationService,
            OrderGroupingService orderGroupingService,
            PositionLedger positionLedger,
            OrderLinkedReconciler orderLinkedReconciler,
            TradeAggregator tradeAggregator,
            ReconstructionConfig reconstructionConfig) {
        this.brokerDetector = brokerDetector;
        this.legNormalizationService = legNormalizationService;
        this.orderGroupingService = orderGroupingService;
        this.positionLedger = positionLedger;
        this.orderLinkedReconciler = orderLinkedReconciler;
        this.tradeAggregator = tradeAggregator;
        this.reconstructionConfig = reconstructionConfig;
    }

    /** Reconstructs with the broker detected from the rows' headers and the configured account. */
    public ReconstructionResult reconstruct(List<Map<String, String>> rows) {
        return reconstruct(rows, null, null);
    }

    /**
     * Reconstructs trades from raw export rows.
     *
     * @param rows    header-keyed rows as exported, in the broker's own row order
     * @param broker  export format, or null to detect it from the headers of the first row
     * @param account account label for every trade, or null for the configured one
     * @throws UnsupportedBrokerFormatException when the broker is not given and cannot be detected
     */
    public ReconstructionResult reconstruct(List<Map<String, String>> rows, BrokerKind broker, String account) {
        BrokerKind resolvedBroker = broker != null ? broker : detect(rows);
        String resolvedAccount = account != null && !account.isBlank()
                ? account
                : reconstructionConfig.accountFor(resolvedBroker);

        NormalizedBatch batch = legNormalizationService.normalizeAll(rows, resolvedBroker);
        List<Leg> legs = new ArrayList<>(batch.legs());
        if (reconstructionConfig.isSortLegs()) {
            legs.sort(CHRONOLOGICAL);
        }

        List<OrderGroup> groups = orderGroupingService.group(legs);
        List<Trade> trades = resolvedBroker.isOrderLinked()
                ? reconcileOrders(legs, groups, resolvedAccount)
                : matchLots(legs, groups, resolvedAccount);

        Map<StrategyType, Long> strategyCounts = groups.stream()
                .collect(Collectors.groupingBy(
                        OrderGroup::getStrategy, () -> new EnumMap<>(StrategyType.class), Collectors.counting()));

        ReconstructionResult result = ReconstructionResult.builder()
                .broker(resolvedBroker)
                .account(resolvedAccount)
                .trades(trades)
                .skippedRows(batch.skippedRows())
                .strategyCounts(strategyCounts)
                .build();

        log.info("Reconstructed {} export: rows={}, legs={}, skipped={}, groups={}, trades={} "
                        + "(open={}, closed={}, incomplete={}), netPremium={}",
                resolvedBroker, rows.size(), legs.size(), batch.skippedRows(), groups.size(), trades.size(),
                result.getOpenTrades(), result.getClosedTrades(), result.getIncompleteTrades(),
                trades.stream().map(Trade::getNetPremium).reduce(BigDecimal.ZERO, BigDecimal::add));
        return result;
    }

    private List<Trade> matchLots(List<Leg> legs, List<OrderGroup> groups, String account) {
        return positionLedger.process(legs, groups).stream()
                .map(event -> tradeAggregator.aggregate(event, account))
                .toList();
    }

    private List<Trade> reconcileOrders(List<Leg> legs, List<OrderGroup> groups, String account) {
        Reconciliation reconciliation = orderLinkedReconciler.reconcile(legs, groups);
        List<Trade> trades = new ArrayList<>();
        for (GroupActivity activity : reconciliation.groups()) {
            trades.add(tradeAggregator.aggregateGroup(activity, account));
        }
        reconciliation.unmatchedCloses().forEach(event -> trades.add(tradeAggregator.aggregate(event, account)));
        return trades;
    }

    private BrokerKind detect(List<Map<String, String>> rows) {
        if (rows.isEmpty()) {
            throw new UnsupportedBrokerFormatException(List.of());
        }
        return brokerDetector.detect(rows.get(0).keySet());
    }
}
