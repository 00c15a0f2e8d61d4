package com.retailsentinel.core.context;

import com.retailsentinel.core.config.SentinelConfig;
import com.retailsentinel.core.model.CustomerRecord;
import com.retailsentinel.core.model.InventorySnapshot;
import com.retailsentinel.core.model.ProductRecord;
import com.retailsentinel.core.model.QueueSample;
import com.retailsentinel.core.model.RecognitionResult;
import com.retailsentinel.core.model.ReferenceCatalog;
import com.retailsentinel.core.model.SensorRecord;
import com.retailsentinel.core.model.StationStatus;
import com.retailsentinel.core.model.TagRead;
import com.retailsentinel.core.model.Transaction;
import com.retailsentinel.core.window.CorrelationWindow;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns a closed {@link CorrelationWindow} into a {@link CorrelationContext}.
 *
 * <h3>Tag matching</h3>
 * <p>
 * Reads are grouped by tag id, so an item dwelling in the scan zone counts
 * once. Groups are taken in order of first sighting; each claims the unused
 * transaction of the same SKU nearest in time to any of its reads (ties go to
 * the earlier transaction, then to arrival order). A transaction satisfies at
 * most one group. Every read of a matched group is matched; every other read
 * is unscanned.
 * </p>
 *
 * <p>
 * Stateless apart from its configuration and catalog, both read-only.
 * </p>
 *
 * @since 1.0.0
 */
public class ContextBuilder {

    private static final Comparator<SensorRecord> BY_TIME = Comparator.comparing(SensorRecord::getTimestamp);

    private final SentinelConfig config;
    private final ReferenceCatalog catalog;

    public ContextBuilder(SentinelConfig config, ReferenceCatalog catalog) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * @param window a closed window
     * @return the joined view of its records
     */
    public CorrelationContext build(CorrelationWindow window) {
        CorrelationContext.Builder builder = CorrelationContext.builder()
                .scopeId(window.getScopeId())
                .storeScope(window.isStoreScope())
                .window(window.getStart(), window.getEnd());
        if (window.isStoreScope()) {
            buildStoreView(window, builder);
        } else {
            buildStationView(window, builder);
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Station view
    // ---------------------------------------------------------------

    private void buildStationView(CorrelationWindow window, CorrelationContext.Builder builder) {
        List<Transaction> transactions = window.recordsOf(Transaction.class);
        builder.transactions(transactions);

        matchTags(window.recordsOf(TagRead.class), transactions, builder);
        checkTransactions(transactions, window.recordsOf(RecognitionResult.class), builder);

        List<QueueSample> samples = window.recordsOf(QueueSample.class);
        if (!samples.isEmpty()) {
            int maxCount = 0;
            double maxDwell = 0;
            for (QueueSample sample : samples) {
                maxCount = Math.max(maxCount, sample.getCustomerCount());
                maxDwell = Math.max(maxDwell, sample.getAverageDwellSeconds());
            }
            builder.queueSummary(new QueueSummary(samples.size(), maxCount, maxDwell));
        }

        String faultStatus = null;
        String lastStatus = null;
        for (SensorRecord record : sortedByTime(window.getRecords())) {
            String status = record.getStatus();
            if (status == null || status.isBlank()) {
                continue;
            }
            if (faultStatus == null && StationStatus.isFault(status)) {
                faultStatus = status;
            }
            lastStatus = status;
        }
        builder.faultStatus(faultStatus).lastStatus(lastStatus);
    }

    private void matchTags(List<TagRead> reads, List<Transaction> transactions,
                           CorrelationContext.Builder builder) {
        Map<String, List<TagRead>> groups = new LinkedHashMap<>();
        for (TagRead read : sortedByTime(reads)) {
            groups.computeIfAbsent(read.getTagId(), id -> new ArrayList<>()).add(read);
        }

        boolean[] used = new boolean[transactions.size()];
        List<TagRead> matched = new ArrayList<>();
        List<TagRead> unscanned = new ArrayList<>();
        List<UnscannedItem> items = new ArrayList<>();

        for (Map.Entry<String, List<TagRead>> entry : groups.entrySet()) {
            List<TagRead> group = entry.getValue();
            String sku = skuOf(group);
            int match = sku != null ? nearestUnused(group, sku, transactions, used) : -1;
            if (match >= 0) {
                used[match] = true;
                matched.addAll(group);
                continue;
            }
            unscanned.addAll(group);
            items.add(toUnscannedItem(entry.getKey(), sku, group, transactions));
        }

        builder.matchedReads(matched).unscannedReads(unscanned).unscannedItems(items);
    }

    private static int nearestUnused(List<TagRead> group, String sku,
                                     List<Transaction> transactions, boolean[] used) {
        int best = -1;
        long bestDistance = Long.MAX_VALUE;
        for (int i = 0; i < transactions.size(); i++) {
            Transaction tx = transactions.get(i);
            if (used[i] || !sku.equals(tx.getSku())) {
                continue;
            }
            long distance = Long.MAX_VALUE;
            for (TagRead read : group) {
                distance = Math.min(distance, distanceMillis(tx.getTimestamp(), read.getTimestamp()));
            }
            if (best < 0 || distance < bestDistance
                    || (distance == bestDistance
                    && tx.getTimestamp().isBefore(transactions.get(best).getTimestamp()))) {
                best = i;
                bestDistance = distance;
            }
        }
        return best;
    }

    private UnscannedItem toUnscannedItem(String tagId, String sku, List<TagRead> group,
                                          List<Transaction> transactions) {
        Instant firstSeen = group.get(0).getTimestamp();
        Instant lastSeen = group.get(group.size() - 1).getTimestamp();
        boolean inScanArea = group.stream().anyMatch(TagRead::isInScanArea);

        Transaction nearest = null;
        long nearestDistance = Long.MAX_VALUE;
        for (Transaction tx : transactions) {
            if (tx.getCustomerId() == null) {
                continue;
            }
            long distance = distanceMillis(tx.getTimestamp(), firstSeen);
            if (nearest == null || distance < nearestDistance
                    || (distance == nearestDistance && tx.getTimestamp().isBefore(nearest.getTimestamp()))) {
                nearest = tx;
                nearestDistance = distance;
            }
        }
        String customerId = nearest != null ? nearest.getCustomerId() : UnscannedItem.UNKNOWN_CUSTOMER;
        String loyaltyTier = catalog.customer(customerId).map(CustomerRecord::getLoyaltyTier).orElse(null);
        return new UnscannedItem(tagId, sku, firstSeen, lastSeen, group.size(), inScanArea,
                customerId, loyaltyTier);
    }

    private void checkTransactions(List<Transaction> transactions, List<RecognitionResult> recognitions,
                                   CorrelationContext.Builder builder) {
        List<PriceCheck> priceChecks = new ArrayList<>();
        List<WeightCheck> weightChecks = new ArrayList<>();
        List<Transaction> completed = new ArrayList<>();

        for (Transaction tx : sortedByTime(transactions)) {
            Optional<ProductRecord> product = catalog.product(tx.getSku());
            if (product.isEmpty()) {
                continue;
            }
            PriceCheck price = new PriceCheck(tx, product.get().getCatalogPrice(),
                    observedSku(tx, recognitions));
            priceChecks.add(price);

            boolean weightOk = true;
            if (tx.getWeightGrams() != null) {
                WeightCheck weight = new WeightCheck(tx, tx.getWeightGrams(),
                        product.get().getExpectedWeightGrams());
                weightChecks.add(weight);
                weightOk = !weight.exceeds(config.getWeightToleranceGrams());
            }
            if (weightOk && !price.isAtOrBelow(config.getPriceRatioThreshold())) {
                completed.add(tx);
            }
        }
        builder.priceChecks(priceChecks).weightChecks(weightChecks).completedTransactions(completed);
    }

    private String observedSku(Transaction tx, List<RecognitionResult> recognitions) {
        RecognitionResult best = null;
        long bestDistance = Long.MAX_VALUE;
        for (RecognitionResult result : recognitions) {
            if (result.getPredictedSku() == null
                    || result.getConfidence() < config.getRecognitionMinConfidence()) {
                continue;
            }
            long distance = distanceMillis(result.getTimestamp(), tx.getTimestamp());
            if (best == null || distance < bestDistance
                    || (distance == bestDistance && result.getConfidence() > best.getConfidence())) {
                best = result;
                bestDistance = distance;
            }
        }
        if (best == null || best.getPredictedSku().equals(tx.getSku())) {
            return null;
        }
        return best.getPredictedSku();
    }

    // ---------------------------------------------------------------
    // Store view
    // ---------------------------------------------------------------

    private void buildStoreView(CorrelationWindow window, CorrelationContext.Builder builder) {
        List<SensorRecord> records = sortedByTime(window.getRecords());

        Map<String, InventorySnapshot> latest = new TreeMap<>();
        Map<String, String> lastStatus = new LinkedHashMap<>();
        Map<String, Integer> lastQueueCount = new LinkedHashMap<>();
        Map<String, Double> lastDwell = new LinkedHashMap<>();
        for (SensorRecord record : records) {
            if (record instanceof InventorySnapshot snapshot) {
                latest.put(snapshot.getSku(), snapshot);
                continue;
            }
            String stationId = record.getStationId();
            lastStatus.putIfAbsent(stationId, null);
            if (record.getStatus() != null && !record.getStatus().isBlank()) {
                lastStatus.put(stationId, record.getStatus());
            }
            if (record instanceof QueueSample sample) {
                lastQueueCount.put(stationId, sample.getCustomerCount());
                lastDwell.put(stationId, sample.getAverageDwellSeconds());
            }
        }

        List<InventoryVariance> variances = new ArrayList<>();
        for (InventorySnapshot snapshot : latest.values()) {
            catalog.product(snapshot.getSku())
                    .filter(product -> product.getExpectedQuantity() > 0)
                    .ifPresent(product -> variances.add(new InventoryVariance(
                            snapshot.getSku(), product.getExpectedQuantity(), snapshot.getOnHandQuantity())));
        }
        builder.inventoryVariances(variances);

        if (!lastStatus.isEmpty()) {
            int active = 0;
            for (Map.Entry<String, String> entry : lastStatus.entrySet()) {
                boolean operational = StationStatus.parse(entry.getValue()).isOperational();
                if (operational && lastQueueCount.getOrDefault(entry.getKey(), 0) > 0) {
                    active++;
                }
            }
            BigDecimal waitThreshold = BigDecimal.valueOf(config.getWaitTimeThresholdSeconds());
            int highWait = (int) lastDwell.values().stream()
                    .filter(dwell -> BigDecimal.valueOf(dwell).compareTo(waitThreshold) >= 0)
                    .count();
            builder.occupancy(new Occupancy(lastStatus.size(), active, highWait));
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static <T extends SensorRecord> List<T> sortedByTime(List<T> records) {
        List<T> sorted = new ArrayList<>(records);
        sorted.sort(BY_TIME);
        return sorted;
    }

    private static String skuOf(List<TagRead> group) {
        for (TagRead read : group) {
            if (read.getSku() != null && !read.getSku().isBlank()) {
                return read.getSku();
            }
        }
        return null;
    }

    private static long distanceMillis(Instant a, Instant b) {
        return Math.abs(Duration.between(a, b).toMillis());
    }
}
