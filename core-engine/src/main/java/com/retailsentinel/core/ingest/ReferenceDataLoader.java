package com.retailsentinel.core.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.retailsentinel.core.model.CustomerRecord;
import com.retailsentinel.core.model.ProductRecord;
import com.retailsentinel.core.model.ReferenceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Loads the product catalog and customer registry CSV files into a
 * {@link ReferenceCatalog}.
 *
 * <h3>Expected Headers</h3>
 * <ul>
 * <li>{@code products_list.csv}: {@code SKU, product_name, quantity, EPC_range,
 * barcode, weight, price}</li>
 * <li>{@code customer_data.csv}: {@code Customer_ID, Name, ...}, with an
 * optional {@code Loyalty_Tier} column</li>
 * </ul>
 *
 * <p>
 * Rows with a missing key or unparsable number are skipped with a warning. A
 * missing file yields an empty section: rules that need it abstain.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReferenceDataLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceDataLoader.class);

    public static final String PRODUCTS_FILE = "products_list.csv";
    public static final String CUSTOMERS_FILE = "customer_data.csv";

    private static final CsvMapper CSV = new CsvMapper();
    private static final CsvSchema HEADER = CsvSchema.emptySchema().withHeader();

    private ReferenceDataLoader() {
        // utility class
    }

    /**
     * Load both files from a directory.
     *
     * @param directory directory holding the CSV files
     * @return the catalog
     * @throws IllegalStateException if a present file cannot be read
     */
    public static ReferenceCatalog fromDirectory(Path directory) {
        List<ProductRecord> products = Files.exists(directory.resolve(PRODUCTS_FILE))
                ? loadProducts(directory.resolve(PRODUCTS_FILE))
                : missing(directory.resolve(PRODUCTS_FILE));
        List<CustomerRecord> customers = Files.exists(directory.resolve(CUSTOMERS_FILE))
                ? loadCustomers(directory.resolve(CUSTOMERS_FILE))
                : missing(directory.resolve(CUSTOMERS_FILE));
        ReferenceCatalog catalog = new ReferenceCatalog(products, customers);
        LOG.info("Loaded {} product(s) and {} customer(s) from {}",
                catalog.productCount(), catalog.customerCount(), directory);
        return catalog;
    }

    public static List<ProductRecord> loadProducts(Path path) {
        List<ProductRecord> products = new ArrayList<>();
        for (Map<String, String> row : readRows(path)) {
            String sku = value(row, "SKU");
            try {
                if (sku == null) {
                    throw new IllegalArgumentException("missing SKU");
                }
                products.add(new ProductRecord(sku, value(row, "product_name"),
                        Double.parseDouble(value(row, "price")),
                        Double.parseDouble(value(row, "weight")),
                        Long.parseLong(value(row, "quantity"))));
            } catch (RuntimeException e) {
                LOG.warn("Skipping product row {} in {}: {}", row, path, e.getMessage());
            }
        }
        return products;
    }

    public static List<CustomerRecord> loadCustomers(Path path) {
        List<CustomerRecord> customers = new ArrayList<>();
        for (Map<String, String> row : readRows(path)) {
            String id = value(row, "Customer_ID");
            if (id == null) {
                LOG.warn("Skipping customer row without Customer_ID in {}: {}", path, row);
                continue;
            }
            String tier = value(row, "Loyalty_Tier");
            customers.add(new CustomerRecord(id, value(row, "Name"),
                    tier != null ? tier : value(row, "loyalty_tier")));
        }
        return customers;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<Map<String, String>> readRows(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> rows = CSV.readerFor(Map.class).with(HEADER).readValues(reader)) {
            return rows.readAll();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read reference file: " + path, e);
        }
    }

    private static <T> List<T> missing(Path path) {
        LOG.warn("Reference file {} not found; dependent rules will abstain", path);
        return Collections.emptyList();
    }

    private static String value(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
